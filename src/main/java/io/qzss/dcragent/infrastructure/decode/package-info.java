/**
 * Producer stream decoding.
 * <p><strong>Formats:</strong> {@code gpsmon -a} output with u-blox hex packets, and one JSON report per line.
 * The L1S payload decoder itself is an external {@link java.util.ServiceLoader} provider of
 * {@link io.qzss.dcragent.application.port.DcrPayloadDecoder}.</p>
 */
package io.qzss.dcragent.infrastructure.decode;
