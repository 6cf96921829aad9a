package io.qzss.dcragent.config;

import io.qzss.dcragent.application.dispatch.DeliveryPolicy;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Report file channel settings.
 *
 * @param path active report file
 * @param fileNamePattern Logback rollover pattern for archived files
 * @param maxHistory number of archives kept
 * @param rawPackets also record every raw QZSS packet
 * @param policy delivery policy
 * @since 0.1.0
 */
public record FileSinkSettings(
    Path path, String fileNamePattern, int maxHistory, boolean rawPackets, DeliveryPolicy policy) {
  public FileSinkSettings {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(fileNamePattern, "fileNamePattern");
    Objects.requireNonNull(policy, "policy");
  }
}
