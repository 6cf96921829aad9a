package io.qzss.dcragent.infrastructure.process;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.qzss.dcragent.application.port.ProducerProcess;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

@EnabledOnOs({OS.LINUX, OS.MAC})
class OsProducerLauncherTest {

  @Test
  void pipesStdoutAndDiscardsStderr() throws IOException {
    OsProducerLauncher launcher = new OsProducerLauncher(Duration.ofMillis(500));

    try (ProducerProcess process = launcher.start(List.of("sh", "-c", "echo '(1) b562'; echo noise 1>&2"))) {
      String out = new String(process.stdout().readAllBytes(), StandardCharsets.UTF_8);
      assertEquals("(1) b562\n", out);
    }
  }

  @Test
  void destroyStopsLongRunningProducer() throws IOException {
    OsProducerLauncher launcher = new OsProducerLauncher(Duration.ofMillis(500));
    ProducerProcess process = launcher.start(List.of("sleep", "30"));

    process.close();

    assertFalse(process.isAlive());
  }

  @Test
  void missingExecutableFailsToStart() {
    OsProducerLauncher launcher = new OsProducerLauncher();

    assertThrows(IOException.class, () -> launcher.start(List.of("/nonexistent/gpsmon", "-a")));
  }
}
