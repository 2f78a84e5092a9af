package cascadesim.director;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cascadesim.TestCast;
import cascadesim.core.ManualClock;
import cascadesim.dialogue.ConversationThread;
import cascadesim.dialogue.Intent;
import cascadesim.dialogue.IntentTaxonomy;
import cascadesim.dialogue.Message;
import cascadesim.dialogue.MessageSource;
import cascadesim.memory.NarrativeMemory;
import cascadesim.topics.TopicGraph;

import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

class ConversationDynamicsTest {

  private final ManualClock clock = new ManualClock(0L);
  private final NarrativeMemory memory = new NarrativeMemory(NarrativeMemory.Settings.defaults(), clock, new Random(1));
  private final ConversationThread thread = new ConversationThread("t", new TopicGraph(new Random(1), clock).getRandom(),
      List.of(TestCast.orion(), TestCast.nova()), IntentTaxonomy.withQuestions(), 5, false, 0L);
  private final ConversationDynamics dynamics = new ConversationDynamics();

  private static Message says(String text) {
    return new Message("Nova", text, Intent.CHALLENGE, MessageSource.PERSONA, "t", 0L, false, 1.0);
  }

  @Test
  void disagreementHeatsTheThread() {
    dynamics.apply(says("No, that is wrong."), thread, memory);
    assertEquals(0.08, thread.localTension(), 1e-9);
    assertEquals(0.44, thread.localCohesion(), 1e-9);
    assertTrue(memory.tension() > 0.0);
    assertTrue(memory.cohesion() < 0.5);
  }

  @Test
  void agreementCoolsTheThread() {
    thread.adjustLocalTension(0.5);
    dynamics.apply(says("Yes, exactly."), thread, memory);
    assertEquals(0.46, thread.localTension(), 1e-9);
    assertEquals(0.56, thread.localCohesion(), 1e-9);
  }

  @Test
  void metaVocabularyMarksDeepDiscussion() {
    assertFalse(memory.deepDiscussion());
    dynamics.apply(says("What if this is a simulation?"), thread, memory);
    assertTrue(memory.deepDiscussion());
    assertEquals(0.02, memory.metaAwareness(), 1e-9);
  }

  @Test
  void exclamationsRaiseTension() {
    dynamics.apply(says("Look at the window!"), thread, memory);
    assertEquals(0.05, thread.localTension(), 1e-9);
  }

  @Test
  void globalTensionDriftsTowardBaselineWhenQuiet() {
    memory.setTension(0.3);
    thread.adjustLocalTension(0.3);
    for (int i = 0; i < 20; i++) {
      dynamics.apply(says("The lights hum softly."), thread, memory);
    }
    assertEquals(0.3, memory.tension(), 1e-6);
  }
}
