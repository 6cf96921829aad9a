package io.qzss.dcragent.config;

import io.qzss.dcragent.domain.report.SourceType;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Producer subprocess settings.
 *
 * @param command command line, split on whitespace with single and double quotes honoured
 * @param type output format of the producer
 * @param restartDelay back-off before respawning the producer
 * @since 0.1.0
 */
public record SourceSettings(String command, SourceType type, Duration restartDelay) {
  public SourceSettings {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(restartDelay, "restartDelay");
    if (splitCommand(command).isEmpty()) {
      throw new IllegalArgumentException("source.command must not be blank");
    }
  }

  /**
   * Returns the command split into program and arguments.
   *
   * @return non-empty argument vector
   */
  public List<String> argv() {
    return splitCommand(command);
  }

  static List<String> splitCommand(String command) {
    List<String> out = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    boolean inToken = false;
    char quote = 0;
    for (int i = 0; i < command.length(); i++) {
      char c = command.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        } else {
          current.append(c);
        }
      } else if (c == '"' || c == '\'') {
        quote = c;
        inToken = true;
      } else if (Character.isWhitespace(c)) {
        if (inToken) {
          out.add(current.toString());
          current.setLength(0);
          inToken = false;
        }
      } else {
        current.append(c);
        inToken = true;
      }
    }
    if (quote != 0) {
      throw new IllegalArgumentException("source.command has an unterminated quote: " + command);
    }
    if (inToken) {
      out.add(current.toString());
    }
    return List.copyOf(out);
  }
}
