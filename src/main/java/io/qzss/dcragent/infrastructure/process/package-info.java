/**
 * Producer subprocess management on top of {@link java.lang.ProcessBuilder}.
 */
package io.qzss.dcragent.infrastructure.process;
