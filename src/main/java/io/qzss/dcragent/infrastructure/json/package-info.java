/**
 * JSON representation of reports shared by the {@code jsonl} source and the cache dump.
 */
package io.qzss.dcragent.infrastructure.json;
