package io.qzss.dcragent.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.of(Map.of("report.path", "/srv/yaml.log", "mail.host", "smtp.example.com")),
        Map.of("report.path", "/srv/cli.log"),
        AgentConfig.defaults(),
        warnings::add);

    assertEquals("/srv/cli.log", merged.get("report.path"));
    assertEquals("smtp.example.com", merged.get("mail.host"));
    assertEquals("24", merged.get("cache.validPeriodHours"));
    assertEquals(List.of("CLI overrides YAML for key: report.path"), warnings);
  }

  @Test
  void legacyKeyIsAliased() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.of(Map.of("cache.validPeriodHour", "6")), Map.of(), AgentConfig.defaults(), msg -> { });

    assertEquals("6", merged.get("cache.validPeriodHours"));
  }

  @Test
  void unknownKeysAreReported() {
    List<String> warnings = new ArrayList<>();

    ConfigMerger.buildEffectiveConfig(
        Optional.empty(), Map.of("tsunami.region", "x"), AgentConfig.defaults(), warnings::add);

    assertTrue(warnings.contains("Ignoring unrecognised configuration key: tsunami.region"));
  }
}
