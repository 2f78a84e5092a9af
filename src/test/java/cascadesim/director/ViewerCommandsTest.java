package cascadesim.director;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cascadesim.config.EngineConfig;
import cascadesim.config.EngineFactory;
import cascadesim.core.ManualClock;
import cascadesim.core.SimulationLogger;
import cascadesim.director.ViewerCommands.Outcome;
import cascadesim.memory.ThreatKind;

import java.io.IOException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ViewerCommandsTest {

  private DialogueDirector director;
  private ViewerCommands commands;

  @BeforeEach
  void setUp() throws IOException {
    SimulationLogger.setQuiet(true);
    EngineConfig config = new EngineConfig(11L, 0, 500L, 4_000L, true, "personas.json", "templates.json");
    director = EngineFactory.buildDirector(config, new ManualClock(0L));
    commands = new ViewerCommands(director);
  }

  @Test
  void tensionCommandRaisesTension() {
    double before = director.memory().tension();
    assertEquals(Outcome.TRIGGERED, commands.handle("watcher", "!tension"));
    assertEquals(before + 0.1, director.memory().tension(), 1e-9);
  }

  @Test
  void observeCommandFlagsTheObserver() {
    assertEquals(Outcome.TRIGGERED, commands.handle("watcher", "!OBSERVE"));
    assertTrue(director.memory().observerDetected(), "observer should be detected");
    assertTrue(director.memory().threatLevel(ThreatKind.OVERSEER_ATTENTION) > 0.0);
  }

  @Test
  void glitchCommandForcesAGlitch() {
    int before = director.memory().glitchCount();
    assertEquals(Outcome.TRIGGERED, commands.handle("watcher", "!glitch"));
    assertEquals(before + 1, director.memory().glitchCount());
  }

  @Test
  void questionCommandQueuesItsText() {
    assertEquals(Outcome.QUEUED, commands.handle("watcher", "!question why is the sky static?"));
    assertEquals(1, director.queuedUserMessages());
  }

  @Test
  void bareQuestionQueuesTheDefaultLine() {
    assertEquals(Outcome.QUEUED, commands.handle("watcher", "!question   "));
    assertEquals(1, director.queuedUserMessages());
    director.produceNextMessage();
    assertTrue(director.memory().history().stream()
        .anyMatch(e -> e.value().equals(ViewerCommands.DEFAULT_QUESTION)), "default question should reach the cast");
  }

  @Test
  void plainTextIsQueued() {
    assertEquals(Outcome.QUEUED, commands.handle("watcher", "hello in there"));
    assertEquals(1, director.queuedUserMessages());
  }

  @Test
  void unknownAndBlankInput() {
    assertEquals(Outcome.UNKNOWN, commands.handle("watcher", "!dance"));
    assertEquals(Outcome.IGNORED, commands.handle("watcher", ""));
    assertEquals(Outcome.IGNORED, commands.handle("watcher", null));
    assertEquals(0, director.queuedUserMessages());
  }
}
