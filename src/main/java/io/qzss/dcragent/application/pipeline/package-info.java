/**
 * Agent runtime: producer supervision, the per-report pipeline and cache checkpointing.
 * <p><strong>Threading:</strong> The supervisor loop and pipeline share one thread; only
 * {@link io.qzss.dcragent.application.pipeline.ProcessSupervisor#requestStop()} and the cache dump run on the
 * shutdown hook thread.</p>
 */
package io.qzss.dcragent.application.pipeline;
