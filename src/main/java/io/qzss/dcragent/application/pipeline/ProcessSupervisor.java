package io.qzss.dcragent.application.pipeline;

import io.qzss.dcragent.application.port.DecodeException;
import io.qzss.dcragent.application.port.MetricsPort;
import io.qzss.dcragent.application.port.ProducerLauncher;
import io.qzss.dcragent.application.port.ProducerProcess;
import io.qzss.dcragent.application.port.ReportDecoder;
import io.qzss.dcragent.application.port.ReportHandler;
import io.qzss.dcragent.application.port.Sleeper;
import io.qzss.dcragent.domain.report.SourceType;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Keeps the producer subprocess running and streams its output through the decoder.
 * <p><strong>Why:</strong> {@code gpsmon} exits when the receiver disappears or the stream hiccups; the agent must
 * recover without operator action.</p>
 * <p><strong>Role:</strong> Outermost loop of the agent, run on the main thread.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Spawn the producer and hand its stdout to the {@link ReportDecoder}.</li>
 *   <li>Restart after the producer exits or the stream fails, waiting a fixed back-off first.</li>
 *   <li>Fail fast with {@link ProducerSpawnException} when the very first spawn fails.</li>
 *   <li>Stop promptly when {@link #requestStop()} is called from the shutdown hook.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #run()} is single-threaded; {@link #requestStop()} and
 * {@link #awaitStopped(Duration)} may be called from any thread.</p>
 * <p><strong>Observability:</strong> Emits {@code agent.supervisor.restart} and {@code agent.supervisor.decode.error};
 * tags logs with MDC {@code pipeline=agent}.</p>
 *
 * @since 0.1.0
 */
public final class ProcessSupervisor {
  private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);

  private final ProducerLauncher launcher;
  private final List<String> command;
  private final SourceType sourceType;
  private final ReportDecoder decoder;
  private final ReportHandler handler;
  private final Duration restartDelay;
  private final Sleeper sleeper;
  private final MetricsPort metrics;

  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private final AtomicReference<ProducerProcess> current = new AtomicReference<>();
  private final CountDownLatch stopped = new CountDownLatch(1);
  private volatile Thread runner;

  public ProcessSupervisor(
      ProducerLauncher launcher,
      List<String> command,
      SourceType sourceType,
      ReportDecoder decoder,
      ReportHandler handler,
      Duration restartDelay,
      Sleeper sleeper,
      MetricsPort metrics) {
    this.launcher = Objects.requireNonNull(launcher, "launcher");
    this.command = List.copyOf(Objects.requireNonNull(command, "command"));
    if (this.command.isEmpty()) {
      throw new IllegalArgumentException("command must not be empty");
    }
    this.sourceType = Objects.requireNonNull(sourceType, "sourceType");
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.handler = Objects.requireNonNull(handler, "handler");
    this.restartDelay = Objects.requireNonNull(restartDelay, "restartDelay");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs the supervision loop until {@link #requestStop()} is called.
   *
   * @throws ProducerSpawnException if the first spawn attempt fails
   */
  public void run() throws ProducerSpawnException {
    runner = Thread.currentThread();
    MDC.put("pipeline", "agent");
    String commandLine = String.join(" ", command);
    boolean firstSpawn = true;
    try {
      while (!stopRequested.get()) {
        ProducerProcess process;
        try {
          log.info("Starting producer: {}", commandLine);
          process = launcher.start(command);
        } catch (IOException ex) {
          if (firstSpawn) {
            throw new ProducerSpawnException("Unable to start producer: " + commandLine, ex);
          }
          log.error("Producer restart failed: {}", commandLine, ex);
          if (!backoff()) {
            break;
          }
          continue;
        }
        firstSpawn = false;
        current.set(process);
        if (stopRequested.get()) {
          process.close();
          current.set(null);
          break;
        }
        log.info("Producer started; waiting for messages");
        try (process) {
          decoder.decodeStream(process.stdout(), sourceType, handler);
          if (!stopRequested.get()) {
            log.warn("Producer output ended; restarting in {}s", restartDelay.toSeconds());
          }
        } catch (DecodeException ex) {
          if (!stopRequested.get()) {
            metrics.increment("agent.supervisor.decode.error");
            log.error("Decode failed; terminating producer", ex);
          }
        } catch (IOException ex) {
          if (!stopRequested.get()) {
            log.error("Producer stream failed; terminating producer", ex);
          }
        } catch (RuntimeException ex) {
          log.error("Report handling failed; terminating producer", ex);
        } finally {
          current.set(null);
        }
        if (stopRequested.get()) {
          break;
        }
        metrics.increment("agent.supervisor.restart");
        if (!backoff()) {
          break;
        }
      }
      log.info("Supervisor stopped");
    } finally {
      MDC.remove("pipeline");
      runner = null;
      stopped.countDown();
    }
  }

  private boolean backoff() {
    try {
      sleeper.sleep(restartDelay);
      return !stopRequested.get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /**
   * Asks the loop to stop: terminates the running producer and interrupts the supervisor thread.
   */
  public void requestStop() {
    if (!stopRequested.compareAndSet(false, true)) {
      return;
    }
    ProducerProcess process = current.get();
    if (process != null) {
      process.destroy();
    }
    Thread thread = runner;
    if (thread != null && thread != Thread.currentThread()) {
      thread.interrupt();
    }
  }

  /**
   * Waits for {@link #run()} to return.
   *
   * @param timeout upper bound
   * @return {@code true} if the loop ended within {@code timeout}
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitStopped(Duration timeout) throws InterruptedException {
    return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  public boolean stopRequested() {
    return stopRequested.get();
  }
}
