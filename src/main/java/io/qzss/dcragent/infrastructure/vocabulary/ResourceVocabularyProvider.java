package io.qzss.dcragent.infrastructure.vocabulary;

import io.qzss.dcragent.application.port.DcrPayloadDecoder;
import io.qzss.dcragent.application.port.VocabularyProvider;
import io.qzss.dcragent.domain.report.LocalityField;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link VocabularyProvider} reading {@code <name>.txt} files, one value per line with {@code #} comments.
 *
 * <p>Lookup order: a file in the override directory, the installed {@link DcrPayloadDecoder}'s code table, then
 * the bundled classpath resource {@code vocabulary/<name>.txt}.</p>
 *
 * @since 0.1.0
 */
public final class ResourceVocabularyProvider implements VocabularyProvider {
  private static final Logger log = LoggerFactory.getLogger(ResourceVocabularyProvider.class);
  private static final String RESOURCE_DIR = "vocabulary/";

  private final Path overrideDirectory;
  private final DcrPayloadDecoder payloadDecoder;
  private final ClassLoader classLoader;

  /**
   * Creates a provider.
   *
   * @param overrideDirectory directory searched before the classpath; may be {@code null}
   */
  public ResourceVocabularyProvider(Path overrideDirectory) {
    this(overrideDirectory, Optional.empty());
  }

  /**
   * Creates a provider that consults the payload decoder's code tables before the bundled files.
   *
   * @param overrideDirectory directory searched first; may be {@code null}
   * @param payloadDecoder installed L1S decoder, if any
   */
  public ResourceVocabularyProvider(Path overrideDirectory, Optional<DcrPayloadDecoder> payloadDecoder) {
    this(overrideDirectory, payloadDecoder, ResourceVocabularyProvider.class.getClassLoader());
  }

  ResourceVocabularyProvider(
      Path overrideDirectory, Optional<DcrPayloadDecoder> payloadDecoder, ClassLoader classLoader) {
    this.overrideDirectory = overrideDirectory;
    this.payloadDecoder = Objects.requireNonNull(payloadDecoder, "payloadDecoder").orElse(null);
    this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
  }

  @Override
  public Optional<List<String>> values(LocalityField field) throws IOException {
    if (!field.present()) {
      return Optional.empty();
    }
    String fileName = field.vocabularyName() + ".txt";
    if (overrideDirectory != null) {
      Path candidate = overrideDirectory.resolve(fileName);
      if (Files.isRegularFile(candidate)) {
        log.debug("Loading {} vocabulary from {}", field, candidate);
        try (InputStream in = Files.newInputStream(candidate)) {
          return Optional.of(read(in));
        }
      }
    }
    if (payloadDecoder != null) {
      Optional<List<String>> published = payloadDecoder.vocabulary(field);
      if (published.isPresent() && !published.get().isEmpty()) {
        log.debug("Using {} vocabulary from {}", field, payloadDecoder.getClass().getName());
        return Optional.of(List.copyOf(published.get()));
      }
    }
    try (InputStream in = classLoader.getResourceAsStream(RESOURCE_DIR + fileName)) {
      if (in == null) {
        return Optional.empty();
      }
      return Optional.of(read(in));
    }
  }

  private static List<String> read(InputStream in) throws IOException {
    List<String> values = new ArrayList<>();
    BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    String line;
    while ((line = reader.readLine()) != null) {
      String value = line.strip();
      if (!value.isEmpty() && !value.startsWith("#")) {
        values.add(value);
      }
    }
    return List.copyOf(values);
  }
}
