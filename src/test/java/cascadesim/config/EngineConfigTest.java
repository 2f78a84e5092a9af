package cascadesim.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EngineConfigTest {

  @TempDir
  Path dir;

  @Test
  void missingFileGivesDefaults() throws IOException {
    EngineConfig config = EngineConfig.load(dir.resolve("absent.properties"));
    assertEquals(4_000L, config.basePacingMs());
    assertEquals(500L, config.tickMs());
    assertEquals(4_000L, config.directorSettings().pacing().baseMs());
    assertTrue(config.simulatedAudience());
  }

  @Test
  void simulatedAudienceCanBeTurnedOff() throws IOException {
    Path file = dir.resolve("quiet.properties");
    Files.writeString(file, "audience.simulated=false\n");
    EngineConfig config = EngineConfig.load(file);
    assertFalse(config.simulatedAudience());
    assertNull(EngineFactory.buildAudience(config, null, () -> 0L));
  }

  @Test
  void propertiesOverrideDefaults() throws IOException {
    Path file = dir.resolve("cascade.properties");
    Files.writeString(file, "seed=42\npacing.base_ms=6000\nintents.question=false\n");
    EngineConfig config = EngineConfig.load(file);
    assertEquals(42L, config.seed());
    assertTrue(config.hasFixedSeed());
    assertFalse(config.questionIntentEnabled());
    assertEquals(6_000L, config.directorSettings().pacing().baseMs());
  }

  @Test
  void invalidValuesAreRejected() throws IOException {
    Path tick = dir.resolve("tick.properties");
    Files.writeString(tick, "tick.ms=0\n");
    assertThrows(IllegalArgumentException.class, () -> EngineConfig.load(tick));

    Path pacing = dir.resolve("pacing.properties");
    Files.writeString(pacing, "pacing.base_ms=20000\n");
    assertThrows(IllegalArgumentException.class, () -> EngineConfig.load(pacing));

    Path garbage = dir.resolve("garbage.properties");
    Files.writeString(garbage, "seed=lots\n");
    assertThrows(IllegalArgumentException.class, () -> EngineConfig.load(garbage));
  }
}
