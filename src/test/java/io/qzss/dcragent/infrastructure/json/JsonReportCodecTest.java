package io.qzss.dcragent.infrastructure.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.qzss.dcragent.domain.report.Category;
import io.qzss.dcragent.domain.report.Report;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonReportCodecTest {
  private final JsonReportCodec codec = new JsonReportCodec();

  @Test
  void parsesAllFields() {
    Report report = codec.parseReport("""
        {"category":"NANKAI_TROUGH_EARTHQUAKE","timestamp":"2024-01-01T07:10:00Z","header":"h","text":"t",
         "classification":7,"trainingFlag":false,"completed":false,"localities":["a","b"]}
        """, true);

    assertEquals(Category.NANKAI_TROUGH_EARTHQUAKE, report.category());
    assertEquals(Instant.parse("2024-01-01T07:10:00Z"), report.timestamp());
    assertEquals(Boolean.FALSE, report.completed());
    assertEquals(List.of("a", "b"), report.localities());
    assertEquals(true, report.training());
  }

  @Test
  void missingOptionalFieldsDefault() {
    Report report = codec.parseReport("{\"category\":\"HYPOCENTER\"}", true);

    assertNull(report.timestamp());
    assertNull(report.completed());
    assertEquals("", report.header());
    assertEquals(List.of(), report.localities());
  }

  @Test
  void strictModeRejectsUnknownCategory() {
    assertThrows(IllegalArgumentException.class, () -> codec.parseReport("{\"category\":\"X\"}", true));
    assertEquals(Category.UNKNOWN, codec.parseReport("{\"category\":\"X\"}", false).category());
  }

  @Test
  void wrongFieldTypesAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> codec.parseReport("{\"category\":\"TSUNAMI\",\"localities\":\"a\"}", true));
    assertThrows(IllegalArgumentException.class,
        () -> codec.parseReport("{\"category\":\"TSUNAMI\",\"timestamp\":\"yesterday\"}", true));
    assertThrows(IllegalArgumentException.class, () -> codec.parseReport("[1,2]", true));
  }

  @Test
  void parseReturnsNestedStructures() {
    Object value = codec.parse("{\"class\":\"SKY\",\"satellites\":[{\"PRN\":193}]}");

    Map<?, ?> map = (Map<?, ?>) value;
    assertEquals("SKY", map.get("class"));
    assertEquals(193, ((Map<?, ?>) ((List<?>) map.get("satellites")).get(0)).get("PRN"));
  }

  @Test
  void malformedJsonCarriesParserMessage() {
    IllegalArgumentException truncated =
        assertThrows(IllegalArgumentException.class, () -> codec.parse("{\"category\":"));
    IllegalArgumentException trailing =
        assertThrows(IllegalArgumentException.class, () -> codec.parse("{} {}"));

    assertTrue(truncated.getMessage().startsWith("Invalid JSON: "));
    assertInstanceOf(JsonProcessingException.class, truncated.getCause());
    assertEquals("JSON document contains trailing content", trailing.getMessage());
  }
}
