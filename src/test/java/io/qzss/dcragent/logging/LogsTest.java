package io.qzss.dcragent.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateKeepsShortValues() {
    assertEquals("津波警報", Logs.truncate("津波警報", 10));
    assertEquals("<null>", Logs.truncate(null, 10));
  }

  @Test
  void truncateNotesOriginalLength() {
    assertEquals("abc... (truncated, 6 chars)", Logs.truncate("abcdef", 3));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("abc", 0));
  }

  @Test
  void hexRendersLowercase() {
    assertEquals("9aaf", Logs.hex(new byte[] {(byte) 0x9A, (byte) 0xAF}, 16));
    assertEquals("9a... (truncated, 4 chars)", Logs.hex(new byte[] {(byte) 0x9A, (byte) 0xAF}, 2));
  }

  @Test
  void redactHidesSecrets() {
    assertEquals("[REDACTED]", Logs.redact("hunter2"));
    assertEquals("<unset>", Logs.redact(""));
  }
}
