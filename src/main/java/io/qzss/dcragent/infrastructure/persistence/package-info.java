/**
 * Duplicate cache persistence.
 */
package io.qzss.dcragent.infrastructure.persistence;
