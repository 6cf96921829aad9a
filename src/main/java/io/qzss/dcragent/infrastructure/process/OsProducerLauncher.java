package io.qzss.dcragent.infrastructure.process;

import io.qzss.dcragent.application.port.ProducerLauncher;
import io.qzss.dcragent.application.port.ProducerProcess;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ProducerLauncher} spawning an operating system process with stdout piped and stderr discarded.
 *
 * @since 0.1.0
 */
public final class OsProducerLauncher implements ProducerLauncher {
  private static final Logger log = LoggerFactory.getLogger(OsProducerLauncher.class);

  private final Duration destroyGrace;

  public OsProducerLauncher() {
    this(Duration.ofSeconds(2));
  }

  /**
   * Creates a launcher.
   *
   * @param destroyGrace time allowed for a graceful exit before the process is killed
   */
  public OsProducerLauncher(Duration destroyGrace) {
    this.destroyGrace = Objects.requireNonNull(destroyGrace, "destroyGrace");
  }

  @Override
  public ProducerProcess start(List<String> command) throws IOException {
    ProcessBuilder builder = new ProcessBuilder(command);
    builder.redirectError(ProcessBuilder.Redirect.DISCARD);
    Process process = builder.start();
    process.getOutputStream().close();
    log.debug("Producer pid {}", process.pid());
    return new OsProducerProcess(process, destroyGrace);
  }

  private static final class OsProducerProcess implements ProducerProcess {
    private final Process process;
    private final Duration destroyGrace;

    private OsProducerProcess(Process process, Duration destroyGrace) {
      this.process = process;
      this.destroyGrace = destroyGrace;
    }

    @Override
    public InputStream stdout() {
      return process.getInputStream();
    }

    @Override
    public boolean isAlive() {
      return process.isAlive();
    }

    @Override
    public void destroy() {
      if (!process.isAlive()) {
        return;
      }
      process.destroy();
      try {
        if (!process.waitFor(destroyGrace.toMillis(), TimeUnit.MILLISECONDS)) {
          log.warn("Producer pid {} ignored SIGTERM; killing", process.pid());
          process.destroyForcibly();
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        process.destroyForcibly();
      }
    }

    @Override
    public void close() {
      destroy();
      try {
        process.getInputStream().close();
      } catch (IOException ex) {
        log.debug("Closing producer stdout failed", ex);
      }
    }
  }
}
