package io.qzss.dcragent.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class SourceSettingsTest {

  @Test
  void splitsOnWhitespace() {
    assertEquals(List.of("stdbuf", "-oL", "gpsmon", "-a"), SourceSettings.splitCommand("  stdbuf  -oL gpsmon\t-a "));
  }

  @Test
  void quotesGroupArguments() {
    assertEquals(List.of("sh", "-c", "gpspipe -R | decode --jsonl"),
        SourceSettings.splitCommand("sh -c 'gpspipe -R | decode --jsonl'"));
    assertEquals(List.of("tool", ""), SourceSettings.splitCommand("tool \"\""));
  }

  @Test
  void unterminatedQuoteIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> SourceSettings.splitCommand("sh -c 'oops"));
  }
}
