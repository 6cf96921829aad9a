/**
 * Report domain model: categories, decoded reports, cache entries and filter dispositions.
 * <p><strong>Concurrency:</strong> Every type is immutable and safe to share.</p>
 * <p><strong>Equality:</strong> {@link io.qzss.dcragent.domain.report.Report} equality is structural and serves as
 * the duplicate-suppression key.</p>
 */
package io.qzss.dcragent.domain.report;
