package cascadesim.director;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cascadesim.TestCast;
import cascadesim.agents.Persona;
import cascadesim.core.ManualClock;
import cascadesim.dialogue.ConversationThread;
import cascadesim.dialogue.Intent;
import cascadesim.dialogue.IntentTaxonomy;
import cascadesim.dialogue.Message;
import cascadesim.dialogue.MessageSource;
import cascadesim.dialogue.TemplateLibrary;
import cascadesim.dialogue.ThreadRegistry;
import cascadesim.topics.Topic;
import cascadesim.topics.TopicGraph;

import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SpeakerSelectorTest {

  private SpeakerSelector selector;
  private ThreadRegistry registry;
  private Topic topic;

  @BeforeEach
  void setUp() {
    TemplateLibrary empty = new TemplateLibrary(Map.of(), Map.of(), Map.of(), List.of(), List.of());
    selector = new SpeakerSelector(empty, new Random(9));
    registry = new ThreadRegistry(IntentTaxonomy.withQuestions(), 5, 30);
    topic = new TopicGraph(new Random(9), new ManualClock(0L)).getOrCreate("the archive");
  }

  @Test
  void recencyRampsBackUp() {
    assertEquals(1.0, selector.recencyFactor("Orion", 0L), 1e-9);
    selector.recordSpoke("Orion", 0L);
    assertEquals(0.1, selector.recencyFactor("Orion", 1_000L), 1e-9);
    assertEquals(0.55, selector.recencyFactor("Orion", 9_500L), 1e-9);
    assertEquals(1.0, selector.recencyFactor("Orion", 20_000L), 1e-9);
  }

  @Test
  void lastSpeakerIsHeavilyPenalised() {
    Persona orion = TestCast.orion();
    Persona nova = TestCast.nova();
    ConversationThread quiet = registry.start(List.of(orion, nova), topic, false, 0L);
    double baseline = selector.weights(quiet, null, 0L).get(orion);

    ConversationThread spoken = registry.start(List.of(orion, nova), topic, false, 0L);
    spoken.registerMessage(new Message("Orion", "first words", Intent.STATEMENT, MessageSource.PERSONA,
        spoken.id(), 0L, false, 1.0), 0L);
    double penalised = selector.weights(spoken, null, 0L).get(orion);
    assertEquals(0.05, penalised / baseline, 1e-9);
  }

  @Test
  void interruptibleThreadsPenaliseLess() {
    Persona orion = TestCast.orion();
    ConversationThread quiet = registry.start(List.of(orion, TestCast.nova()), topic, true, 0L);
    double baseline = selector.weights(quiet, null, 0L).get(orion);
    ConversationThread spoken = registry.start(List.of(orion, TestCast.nova()), topic, true, 0L);
    spoken.registerMessage(new Message("Orion", "first words", Intent.STATEMENT, MessageSource.PERSONA,
        spoken.id(), 0L, false, 1.0), 0L);
    assertEquals(0.3, selector.weights(spoken, null, 0L).get(orion) / baseline, 1e-9);
  }

  @Test
  void selectionAvoidsRepeatingTheSpeaker() {
    Persona orion = TestCast.orion();
    Persona nova = TestCast.nova();
    ConversationThread thread = registry.start(List.of(orion, nova), topic, false, 0L);
    thread.registerMessage(new Message("Orion", "first words", Intent.STATEMENT, MessageSource.PERSONA,
        thread.id(), 0L, false, 1.0), 0L);
    selector.recordSpoke("Orion", 0L);
    int novaPicks = 0;
    for (int i = 0; i < 200; i++) {
      if (selector.select(thread, null, 1_000L) == nova) novaPicks++;
    }
    assertTrue(novaPicks > 190, "Nova picked " + novaPicks + " times");
  }

  @Test
  void emptyThreadHasNoSpeaker() {
    assertNull(selector.select(null, null, 0L));
  }
}
