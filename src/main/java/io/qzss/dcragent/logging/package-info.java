/**
 * Logging helpers layered on SLF4J and Logback.
 * <p><strong>Role:</strong> Runtime level control for the CLI and hygiene utilities for payload dumps and
 * credentials.</p>
 */
package io.qzss.dcragent.logging;
