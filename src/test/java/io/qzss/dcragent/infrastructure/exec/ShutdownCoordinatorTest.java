package io.qzss.dcragent.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import io.qzss.dcragent.application.dedup.DedupCache;
import io.qzss.dcragent.application.pipeline.CacheCheckpoint;
import io.qzss.dcragent.application.pipeline.ProcessSupervisor;
import io.qzss.dcragent.application.port.CacheStore;
import io.qzss.dcragent.application.port.ProducerProcess;
import io.qzss.dcragent.domain.report.CacheEntry;
import io.qzss.dcragent.domain.report.SourceType;
import io.qzss.dcragent.testutil.MutableClock;
import io.qzss.dcragent.testutil.RecordingMetrics;
import io.qzss.dcragent.testutil.Reports;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ShutdownCoordinatorTest {
  private static final List<Logger> NOISY = List.of(
      (Logger) LoggerFactory.getLogger(ShutdownCoordinator.class),
      (Logger) LoggerFactory.getLogger(ProcessSupervisor.class),
      (Logger) LoggerFactory.getLogger(CacheCheckpoint.class));
  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

  @BeforeAll
  static void silence() {
    NOISY.forEach(logger -> logger.setLevel(Level.OFF));
  }

  @AfterAll
  static void restore() {
    NOISY.forEach(logger -> logger.setLevel(null));
  }

  @Test
  void hookStopsSupervisorDumpsCacheAndHalts() throws Exception {
    CountDownLatch decoding = new CountDownLatch(1);
    ProcessSupervisor supervisor = new ProcessSupervisor(
        command -> new IdleProcess(),
        List.of("gpsmon"),
        SourceType.JSONL,
        (in, type, handler) -> {
          decoding.countDown();
          try {
            Thread.sleep(10_000);
          } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
          }
        },
        report -> { },
        Duration.ZERO,
        duration -> { },
        new RecordingMetrics());
    Thread runner = new Thread(() -> {
      try {
        supervisor.run();
      } catch (Exception ex) {
        throw new IllegalStateException(ex);
      }
    });
    runner.start();
    assertTrue(decoding.await(5, TimeUnit.SECONDS));

    DedupCache cache = new DedupCache(Duration.ofHours(24));
    cache.lookupOrInsert(Reports.tsunami("伊勢・三河湾"), NOW);
    List<List<CacheEntry>> dumps = new ArrayList<>();
    CacheStore store = new CacheStore() {
      @Override
      public Optional<List<CacheEntry>> load() {
        return Optional.empty();
      }

      @Override
      public void save(List<CacheEntry> entries) {
        dumps.add(entries);
      }
    };
    List<String> events = new ArrayList<>();
    AutoCloseable resource = () -> events.add("closed");
    List<Integer> statuses = new ArrayList<>();
    ShutdownCoordinator coordinator = new ShutdownCoordinator(
        supervisor,
        Optional.of(new CacheCheckpoint(store, cache, new MutableClock(NOW), new RecordingMetrics())),
        List.of(resource),
        Duration.ofSeconds(5),
        143,
        statuses::add,
        () -> events.add("flushed"));

    coordinator.runHook();
    runner.join(5_000);

    assertFalse(runner.isAlive());
    assertEquals(1, dumps.size());
    assertEquals(cache.snapshot(), dumps.get(0));
    assertEquals(List.of("closed", "flushed"), events);
    assertEquals(List.of(143), statuses);
    assertFalse(coordinator.disarm(), "hook runs once");
  }

  @Test
  void disarmedHookDoesNothing() {
    ProcessSupervisor supervisor = new ProcessSupervisor(
        command -> new IdleProcess(), List.of("gpsmon"), SourceType.JSONL, (in, type, handler) -> { },
        report -> { }, Duration.ZERO, duration -> { }, new RecordingMetrics());
    List<Integer> statuses = new ArrayList<>();
    ShutdownCoordinator coordinator = new ShutdownCoordinator(
        supervisor, Optional.empty(), List.of(), Duration.ofSeconds(1), 143, statuses::add, () -> { });

    assertTrue(coordinator.disarm());
    coordinator.runHook();

    assertTrue(statuses.isEmpty());
    assertFalse(supervisor.stopRequested());
  }

  private static final class IdleProcess implements ProducerProcess {
    @Override
    public InputStream stdout() {
      return new ByteArrayInputStream(new byte[0]);
    }

    @Override
    public boolean isAlive() {
      return true;
    }

    @Override
    public void destroy() {}

    @Override
    public void close() {}
  }
}
