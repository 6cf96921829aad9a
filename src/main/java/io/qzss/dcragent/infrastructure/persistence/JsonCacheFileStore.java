package io.qzss.dcragent.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonGenerator;
import io.qzss.dcragent.application.port.CacheStore;
import io.qzss.dcragent.domain.report.CacheEntry;
import io.qzss.dcragent.domain.report.Report;
import io.qzss.dcragent.infrastructure.json.JsonReportCodec;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CacheStore} writing the duplicate cache as a versioned JSON document.
 * <p><strong>Why:</strong> The dump must survive decoder upgrades, so it stores report fields rather than decoder
 * objects.</p>
 * <p><strong>Format:</strong> {@code {"schemaVersion":1,"entries":[{"arrival":"<ISO-8601>", <report fields>}]}}.</p>
 * <p><strong>Durability:</strong> Writes go to {@code <path>.tmp} and are moved into place atomically where the
 * filesystem allows; a failed write removes the temp file and leaves the previous dump untouched.</p>
 *
 * @since 0.1.0
 */
public final class JsonCacheFileStore implements CacheStore {
  private static final Logger log = LoggerFactory.getLogger(JsonCacheFileStore.class);
  static final int SCHEMA_VERSION = 1;

  private final Path path;
  private final JsonReportCodec codec;

  public JsonCacheFileStore(Path path, JsonReportCodec codec) {
    this.path = Objects.requireNonNull(path, "path");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  public Path path() {
    return path;
  }

  @Override
  public Optional<List<CacheEntry>> load() throws IOException {
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    String json = Files.readString(path, StandardCharsets.UTF_8);
    try {
      return Optional.of(parseDocument(codec.parse(json)));
    } catch (IllegalArgumentException ex) {
      throw new IOException("Invalid cache dump " + path + ": " + ex.getMessage(), ex);
    }
  }

  private List<CacheEntry> parseDocument(Object document) {
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("root must be an object");
    }
    Object version = root.get("schemaVersion");
    if (!(version instanceof Number n) || n.intValue() != SCHEMA_VERSION) {
      throw new IllegalArgumentException("unsupported schemaVersion " + version);
    }
    Object rawEntries = root.get("entries");
    if (!(rawEntries instanceof List<?> items)) {
      throw new IllegalArgumentException("entries must be an array");
    }
    List<CacheEntry> entries = new ArrayList<>(items.size());
    for (Object item : items) {
      if (!(item instanceof Map<?, ?> fields)) {
        throw new IllegalArgumentException("entry must be an object");
      }
      entries.add(new CacheEntry(arrival(fields.get("arrival")), codec.toReport(fields, true)));
    }
    return entries;
  }

  private static Instant arrival(Object value) {
    if (!(value instanceof String text)) {
      throw new IllegalArgumentException("arrival is required");
    }
    try {
      return Instant.parse(text);
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException("arrival must be an ISO-8601 instant", ex);
    }
  }

  @Override
  public void save(List<CacheEntry> entries) throws IOException {
    Objects.requireNonNull(entries, "entries");
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
    try {
      try (OutputStream out = Files.newOutputStream(tmp);
          JsonGenerator gen = codec.factory().createGenerator(out)) {
        gen.useDefaultPrettyPrinter();
        gen.writeStartObject();
        gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
        gen.writeArrayFieldStart("entries");
        for (CacheEntry entry : entries) {
          gen.writeStartObject();
          gen.writeStringField("arrival", entry.arrival().toString());
          Report report = entry.report();
          codec.writeFields(gen, report);
          gen.writeEndObject();
        }
        gen.writeEndArray();
        gen.writeEndObject();
      }
      move(tmp);
    } catch (IOException | RuntimeException ex) {
      try {
        Files.deleteIfExists(tmp);
      } catch (IOException cleanup) {
        ex.addSuppressed(cleanup);
      }
      throw ex;
    }
  }

  private void move(Path tmp) throws IOException {
    try {
      Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported for {}; replacing non-atomically", path);
      Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
