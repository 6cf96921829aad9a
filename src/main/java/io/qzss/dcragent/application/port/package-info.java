/**
 * Ports connecting the agent pipeline to the outside world.
 * <p><strong>Role:</strong> Interfaces for producer processes, decoders, cache storage, mail submission, clocks and
 * metrics. Infrastructure adapters implement them; tests substitute hand-written fakes.</p>
 */
package io.qzss.dcragent.application.port;
