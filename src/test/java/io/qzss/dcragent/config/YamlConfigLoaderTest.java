package io.qzss.dcragent.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void flattensSectionsAndJoinsLists() throws IOException {
    Path yaml = tempDir.resolve("agent.yaml");
    Files.writeString(yaml, """
        cache:
          validPeriodHours: 12
        seismicIntensity:
          use: true
          prefectures: [東京都, 神奈川県]
        tsunami:
          regions: 伊勢・三河湾,大阪府
        mail:
          password:
        """, StandardCharsets.UTF_8);

    Map<String, String> map = YamlConfigLoader.load(yaml).orElseThrow();

    assertEquals("12", map.get("cache.validPeriodHours"));
    assertEquals("true", map.get("seismicIntensity.use"));
    assertEquals("東京都,神奈川県", map.get("seismicIntensity.prefectures"));
    assertEquals("伊勢・三河湾,大阪府", map.get("tsunami.regions"));
    assertEquals("", map.get("mail.password"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("missing.yaml")).isPresent());
  }

  @Test
  void emptyFileYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(Map.of(), YamlConfigLoader.load(yaml).orElseThrow());
  }

  @Test
  void nonMappingRootIsRejected() throws IOException {
    Path yaml = tempDir.resolve("list.yaml");
    Files.writeString(yaml, "- tsunami\n- volcano\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml));
  }

  @Test
  void malformedYamlIsRejected() throws IOException {
    Path yaml = tempDir.resolve("bad.yaml");
    Files.writeString(yaml, "mail: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml));
  }
}
