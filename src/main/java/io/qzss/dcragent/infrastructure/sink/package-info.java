/**
 * Report file and console notification channels.
 */
package io.qzss.dcragent.infrastructure.sink;
