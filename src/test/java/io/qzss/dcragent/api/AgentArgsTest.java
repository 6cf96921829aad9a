package io.qzss.dcragent.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class AgentArgsTest {

  @Test
  void separatesSwitchesFromKeyValues() {
    AgentArgs input = AgentArgs.parse(new String[] {"--No-Report", "cache=/tmp/c.json", "-v", "--dry-run"});

    assertTrue(input.noReport());
    assertTrue(input.dryRun());
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertFalse(input.noLoadCache());
    assertEquals(List.of("cache=/tmp/c.json"), input.keyValueArgs());
  }

  @Test
  void shortOptionsTakeTheNextArgument() {
    AgentArgs input = AgentArgs.parse(new String[] {
        "-c", "/etc/qzss.yaml", "-r", "/var/log/dcr.log", "-l", "debug", "-n", "--no-dump-cache"});

    assertEquals(List.of("config=/etc/qzss.yaml", "report=/var/log/dcr.log", "logLevel=debug"),
        input.keyValueArgs());
    assertTrue(input.noReport());
    assertTrue(input.noDumpCache());
  }

  @Test
  void shortOptionWithoutValueIsRejected() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> AgentArgs.parse(new String[] {"-c"}));

    assertEquals("-c requires a value", ex.getMessage());
  }

  @Test
  void unknownSwitchIsRejected() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> AgentArgs.parse(new String[] {"--daemon"}));

    assertEquals("unknown option: --daemon", ex.getMessage());
  }

  @Test
  void bareWordsAreLeftForTheKeyValueParser() {
    assertEquals(List.of("report"), AgentArgs.parse(new String[] {"report", " "}).keyValueArgs());
  }

  @Test
  void recognisesHelpAliases() {
    assertTrue(AgentArgs.parse(new String[] {"help"}).help());
    assertTrue(AgentArgs.parse(new String[] {"-h"}).help());
    assertTrue(AgentArgs.parse(new String[] {"--HELP"}).help());
    assertFalse(AgentArgs.parse(null).help());
    assertTrue(AgentArgs.parse(null).keyValueArgs().isEmpty());
  }
}
