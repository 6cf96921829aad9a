/**
 * Wall-clock adapter.
 */
package io.qzss.dcragent.infrastructure.time;
