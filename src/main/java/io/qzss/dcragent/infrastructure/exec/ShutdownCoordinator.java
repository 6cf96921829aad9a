package io.qzss.dcragent.infrastructure.exec;

import io.qzss.dcragent.application.pipeline.CacheCheckpoint;
import io.qzss.dcragent.application.pipeline.ProcessSupervisor;
import io.qzss.dcragent.logging.LoggingConfigurator;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> JVM shutdown hook turning SIGTERM/SIGINT into an orderly agent stop.
 * <p><strong>Sequence:</strong> stop the supervisor (kills the producer, interrupts blocked reads and mail sends),
 * wait a bounded time, dump the duplicate cache, close resources, flush logs and halt with a fixed status.</p>
 * <p><strong>Thread-safety:</strong> {@link #disarm()} may race with the hook; at most one of them wins.</p>
 *
 * @since 0.1.0
 */
public final class ShutdownCoordinator {
  private static final Logger log = LoggerFactory.getLogger(ShutdownCoordinator.class);

  private final ProcessSupervisor supervisor;
  private final Optional<CacheCheckpoint> checkpoint;
  private final List<? extends AutoCloseable> resources;
  private final Duration stopTimeout;
  private final int exitStatus;
  private final IntConsumer halter;
  private final Runnable logFlusher;
  private final AtomicBoolean armed = new AtomicBoolean(true);

  /**
   * Creates a coordinator.
   *
   * @param supervisor running supervisor
   * @param checkpoint cache dump to write; empty when dumping is disabled
   * @param resources closed after the dump, in order
   * @param stopTimeout how long to wait for the supervisor loop
   * @param exitStatus status passed to {@code halter}
   * @param halter terminates the JVM; {@code Runtime.getRuntime()::halt} in production
   */
  public ShutdownCoordinator(
      ProcessSupervisor supervisor,
      Optional<CacheCheckpoint> checkpoint,
      List<? extends AutoCloseable> resources,
      Duration stopTimeout,
      int exitStatus,
      IntConsumer halter) {
    this(supervisor, checkpoint, resources, stopTimeout, exitStatus, halter, LoggingConfigurator::shutdown);
  }

  ShutdownCoordinator(
      ProcessSupervisor supervisor,
      Optional<CacheCheckpoint> checkpoint,
      List<? extends AutoCloseable> resources,
      Duration stopTimeout,
      int exitStatus,
      IntConsumer halter,
      Runnable logFlusher) {
    this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
    this.checkpoint = Objects.requireNonNull(checkpoint, "checkpoint");
    this.resources = List.copyOf(Objects.requireNonNull(resources, "resources"));
    this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout");
    this.exitStatus = exitStatus;
    this.halter = Objects.requireNonNull(halter, "halter");
    this.logFlusher = Objects.requireNonNull(logFlusher, "logFlusher");
  }

  /** Registers the hook with the runtime. */
  public void install() {
    Runtime.getRuntime().addShutdownHook(new Thread(this::runHook, "qzss-shutdown"));
  }

  /**
   * Turns the hook into a no-op so a normal {@code System.exit} keeps its own status.
   *
   * @return {@code true} if the hook had not run yet
   */
  public boolean disarm() {
    return armed.compareAndSet(true, false);
  }

  void runHook() {
    if (!armed.compareAndSet(true, false)) {
      return;
    }
    log.warn("Termination requested; stopping agent");
    supervisor.requestStop();
    try {
      if (!supervisor.awaitStopped(stopTimeout)) {
        log.warn("Supervisor did not stop within {} ms", stopTimeout.toMillis());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for supervisor");
    }
    checkpoint.ifPresent(CacheCheckpoint::dump);
    for (AutoCloseable resource : resources) {
      try {
        resource.close();
      } catch (Exception ex) {
        log.warn("Failed to close {}", resource, ex);
      }
    }
    log.error("Terminate...");
    logFlusher.run();
    halter.accept(exitStatus);
  }
}
