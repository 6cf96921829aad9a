package io.qzss.dcragent.testutil;

import io.qzss.dcragent.application.port.MetricsPort;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/** Counts increments and keeps observations in memory. */
public final class RecordingMetrics implements MetricsPort {
  private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();
  private final Map<String, List<Long>> observations = new ConcurrentHashMap<>();

  @Override
  public void increment(String key) {
    counters.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
  }

  @Override
  public void observe(String key, long value) {
    observations.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(value);
  }

  public long count(String key) {
    AtomicLong value = counters.get(key);
    return value == null ? 0 : value.get();
  }

  public List<Long> observed(String key) {
    return observations.getOrDefault(key, List.of());
  }
}
