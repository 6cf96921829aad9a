/**
 * Command-line entry point.
 * <p>{@link io.qzss.dcragent.api.Main} delegates to {@link io.qzss.dcragent.api.AgentCli}, which returns an
 * {@link io.qzss.dcragent.api.ExitCode} instead of exiting so the flow stays testable.</p>
 */
package io.qzss.dcragent.api;
