/**
 * Input validation helpers for CLI arguments and configuration values.
 * <p><strong>Contract:</strong> Every helper throws {@link java.lang.IllegalArgumentException} with a message naming
 * the offending option; the CLI maps it to a configuration error exit code.</p>
 */
package io.qzss.dcragent.validation;
