/**
 * Process lifecycle: orderly termination on operating system signals.
 */
package io.qzss.dcragent.infrastructure.exec;
