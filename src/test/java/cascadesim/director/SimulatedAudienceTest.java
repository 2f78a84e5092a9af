package cascadesim.director;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cascadesim.config.EngineConfig;
import cascadesim.config.EngineFactory;
import cascadesim.core.ManualClock;
import cascadesim.core.SimulationLogger;

import java.io.IOException;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SimulatedAudienceTest {

  private ManualClock clock;
  private DialogueDirector director;
  private ViewerCommands commands;

  @BeforeEach
  void setUp() throws IOException {
    SimulationLogger.setQuiet(true);
    clock = new ManualClock(0L);
    EngineConfig config = new EngineConfig(13L, 0, 500L, 4_000L, true, "personas.json", "templates.json");
    director = EngineFactory.buildDirector(config, clock);
    commands = new ViewerCommands(director);
  }

  @Test
  void staysQuietUntilTheIntervalElapses() {
    SimulatedAudience audience = new SimulatedAudience(commands, clock, new Random(1));
    assertTrue(audience.nextAtMs() >= 30_000L && audience.nextAtMs() <= 120_000L, "next at " + audience.nextAtMs());
    clock.advance(29_999L);
    assertNull(audience.tick());

    clock.advance(90_001L);
    SimulatedAudience.ChatLine line = audience.tick();
    assertNotNull(line);
    assertTrue(line.username().matches("Observer\\d{3}"), line.username());
    assertNull(audience.tick(), "a second line needs a fresh interval");
  }

  @Test
  void plainLinesReachTheDirectorAndRevealTheObserver() {
    SimulatedAudience audience = new SimulatedAudience(commands, clock, new Random(2), 1_000L, 1_000L, 0.0);
    clock.advance(1_000L);
    SimulatedAudience.ChatLine line = audience.tick();
    assertEquals(ViewerCommands.Outcome.QUEUED, line.outcome());
    assertTrue(SimulatedAudience.LINES.contains(line.text()));
    assertEquals(1, director.queuedUserMessages());

    assertNotNull(director.produceNextMessage());
    assertTrue(director.memory().observerDetected(), "an unattended run should still see observers");
  }

  @Test
  void glitchRequestsFireTheTrigger() {
    SimulatedAudience audience = new SimulatedAudience(commands, clock, new Random(3), 1_000L, 1_000L, 1.0);
    int before = director.memory().glitchCount();
    clock.advance(1_000L);
    SimulatedAudience.ChatLine line = audience.tick();
    assertEquals("!glitch", line.text());
    assertEquals(ViewerCommands.Outcome.TRIGGERED, line.outcome());
    assertEquals(before + 1, director.memory().glitchCount());
  }

  @Test
  void rejectsInvertedIntervals() {
    assertThrows(IllegalArgumentException.class,
        () -> new SimulatedAudience(commands, clock, new Random(4), 5_000L, 1_000L, 0.2));
  }
}
