package io.qzss.dcragent.infrastructure.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import io.qzss.dcragent.domain.report.Category;
import io.qzss.dcragent.domain.report.Report;
import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Jackson streaming codec for the JSON form of a {@link Report}.
 * <p><strong>Why:</strong> The cache dump and the {@code jsonl} producer format share one field layout, independent
 * of any decoder library's classes.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the thread-safe {@link JsonFactory}.</p>
 *
 * @since 0.1.0
 */
public final class JsonReportCodec {
  private final JsonFactory factory;

  public JsonReportCodec() {
    this(new JsonFactory());
  }

  public JsonReportCodec(JsonFactory factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  public JsonFactory factory() {
    return factory;
  }

  /**
   * Writes the report fields into the object currently open on {@code gen}.
   *
   * @param gen generator positioned inside an object
   * @param report report to write
   * @throws IOException if the generator fails
   */
  public void writeFields(JsonGenerator gen, Report report) throws IOException {
    gen.writeStringField("category", report.category().name());
    if (report.timestamp() == null) {
      gen.writeNullField("timestamp");
    } else {
      gen.writeStringField("timestamp", report.timestamp().toString());
    }
    gen.writeStringField("header", report.header());
    gen.writeStringField("text", report.text());
    gen.writeNumberField("classification", report.classification());
    gen.writeBooleanField("trainingFlag", report.trainingFlag());
    if (report.completed() == null) {
      gen.writeNullField("completed");
    } else {
      gen.writeBooleanField("completed", report.completed());
    }
    gen.writeArrayFieldStart("localities");
    for (String locality : report.localities()) {
      gen.writeString(locality);
    }
    gen.writeEndArray();
  }

  /**
   * Parses one JSON object as produced by {@link #writeFields}.
   *
   * @param json single JSON object
   * @param strictCategory reject category names that are not {@link Category} constants instead of mapping them to
   *     {@link Category#UNKNOWN}
   * @return decoded report
   * @throws IllegalArgumentException if the text is not a JSON object or a field has the wrong type
   */
  public Report parseReport(String json, boolean strictCategory) {
    Object value = parse(json);
    if (!(value instanceof Map<?, ?> map)) {
      throw new IllegalArgumentException("Expected a JSON object");
    }
    return toReport(map, strictCategory);
  }

  /**
   * Converts a parsed JSON object into a report.
   *
   * @param fields parsed object
   * @param strictCategory see {@link #parseReport(String, boolean)}
   * @return decoded report
   * @throws IllegalArgumentException if a field has the wrong type
   */
  public Report toReport(Map<?, ?> fields, boolean strictCategory) {
    String categoryName = string(fields, "category");
    Category category;
    if (strictCategory) {
      if (categoryName == null) {
        throw new IllegalArgumentException("category is required");
      }
      try {
        category = Category.valueOf(categoryName);
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException("Unknown category: " + categoryName, ex);
      }
    } else {
      category = Category.fromName(categoryName);
    }
    return new Report(
        category,
        instant(fields, "timestamp"),
        string(fields, "header"),
        string(fields, "text"),
        integer(fields, "classification"),
        Boolean.TRUE.equals(bool(fields, "trainingFlag")),
        bool(fields, "completed"),
        strings(fields, "localities"));
  }

  /**
   * Parses a JSON document into maps, lists and scalars.
   *
   * @param json JSON text
   * @return parsed value; an empty document yields an empty map
   * @throws IllegalArgumentException if the text is not valid JSON
   */
  public Object parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        return Map.of();
      }
      Object value = readValue(parser, token);
      if (parser.nextToken() != null) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return value;
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Invalid JSON: " + ex.getOriginalMessage(), ex);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON: " + ex.getMessage(), ex);
    }
  }

  /**
   * Reads the value starting at {@code token}.
   *
   * @param parser parser positioned on {@code token}
   * @param token current token
   * @return map, list, string, number, boolean or {@code null}
   * @throws IOException if the parser fails
   */
  public Object readValue(JsonParser parser, JsonToken token) throws IOException {
    if (token == null) {
      throw new IllegalArgumentException("Unexpected end of JSON input");
    }
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String name = parser.currentName();
      map.put(name, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      list.add(readValue(parser, token));
    }
    return list;
  }

  private static String string(Map<?, ?> fields, String name) {
    Object value = fields.get(name);
    if (value == null) {
      return null;
    }
    if (value instanceof String s) {
      return s;
    }
    throw new IllegalArgumentException(name + " must be a string");
  }

  private static Instant instant(Map<?, ?> fields, String name) {
    String value = string(fields, name);
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException(name + " must be an ISO-8601 instant", ex);
    }
  }

  private static int integer(Map<?, ?> fields, String name) {
    Object value = fields.get(name);
    if (value == null) {
      return 0;
    }
    if (value instanceof Number n) {
      return n.intValue();
    }
    throw new IllegalArgumentException(name + " must be a number");
  }

  private static Boolean bool(Map<?, ?> fields, String name) {
    Object value = fields.get(name);
    if (value == null) {
      return null;
    }
    if (value instanceof Boolean b) {
      return b;
    }
    throw new IllegalArgumentException(name + " must be a boolean");
  }

  private static List<String> strings(Map<?, ?> fields, String name) {
    Object value = fields.get(name);
    if (value == null) {
      return List.of();
    }
    if (!(value instanceof List<?> list)) {
      throw new IllegalArgumentException(name + " must be an array");
    }
    List<String> out = new ArrayList<>(list.size());
    for (Object item : list) {
      if (!(item instanceof String s)) {
        throw new IllegalArgumentException(name + " must contain strings");
      }
      out.add(s);
    }
    return out;
  }
}
