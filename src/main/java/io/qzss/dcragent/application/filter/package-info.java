/**
 * Category policy: the table-driven filter engine and the partial keyword matcher shared with configuration
 * validation.
 */
package io.qzss.dcragent.application.filter;
