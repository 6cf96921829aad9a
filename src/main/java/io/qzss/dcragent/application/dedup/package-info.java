/**
 * Duplicate suppression for rebroadcast reports.
 */
package io.qzss.dcragent.application.dedup;
