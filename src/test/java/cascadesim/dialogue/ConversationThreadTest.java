package cascadesim.dialogue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cascadesim.TestCast;
import cascadesim.core.ManualClock;
import cascadesim.topics.TopicGraph;

import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

class ConversationThreadTest {

  private final ManualClock clock = new ManualClock(0L);
  private final TopicGraph topics = new TopicGraph(new Random(1), clock);

  private ConversationThread thread(IntentTaxonomy taxonomy) {
    return new ConversationThread("thread_test", topics.getOrCreate("loop theory"),
        List.of(TestCast.orion(), TestCast.nova()), taxonomy, 5, false, clock.nowMs());
  }

  private static Message line(String speaker, int i) {
    return new Message(speaker, "line number " + i, Intent.STATEMENT, MessageSource.PERSONA,
        "thread_test", i, false, 1.0);
  }

  @Test
  void phaseAdvancesOnceThresholdIsExceeded() {
    ConversationThread t = thread(IntentTaxonomy.withQuestions());
    for (int i = 0; i < 5; i++) t.registerMessage(line("Orion", i), i);
    assertEquals(ConversationPhase.INTRODUCTION, t.phase());
    t.registerMessage(line("Nova", 5), 5);
    assertEquals(ConversationPhase.DEVELOPMENT, t.phase());
    assertEquals(0, t.messagesInPhase());
    assertEquals(6, t.turnCount());
    assertEquals("Nova", t.lastSpeaker());
  }

  @Test
  void phaseAndStatusOnlyMoveForward() {
    ConversationThread t = thread(IntentTaxonomy.withQuestions());
    int lastPhase = t.phase().ordinal();
    boolean leftActive = false;
    for (int i = 0; i < 40; i++) {
      t.registerMessage(line(i % 2 == 0 ? "Orion" : "Nova", i), i);
      assertTrue(t.phase().ordinal() >= lastPhase);
      lastPhase = t.phase().ordinal();
      if (!t.isActive()) leftActive = true;
      if (leftActive) assertFalse(t.isActive(), "thread became active again at message " + i);
    }
    assertEquals(ConversationPhase.RESOLUTION, t.phase());
    assertEquals(ThreadStatus.STALE, t.status());
  }

  @Test
  void resolutionBecomesStaleWhenThresholdTriggersAgain() {
    ConversationThread t = thread(IntentTaxonomy.withQuestions());
    for (int i = 0; i < 24; i++) t.registerMessage(line("Orion", i), i);
    assertEquals(ConversationPhase.RESOLUTION, t.phase());
    assertTrue(t.isActive());
    for (int i = 24; i < 30; i++) t.registerMessage(line("Nova", i), i);
    assertEquals(ThreadStatus.STALE, t.status());
    assertEquals(6, t.resolutionMessages());
  }

  @Test
  void climaxRequestsUrgentPacingOnce() {
    ConversationThread t = thread(IntentTaxonomy.withQuestions());
    for (int i = 0; i < 18; i++) t.registerMessage(line("Orion", i), i);
    assertEquals(ConversationPhase.CLIMAX, t.phase());
    assertTrue(t.hasClimaxed());
    assertTrue(t.consumeUrgentPacing());
    assertFalse(t.consumeUrgentPacing());
  }

  @Test
  void reactivationIsRejected() {
    ConversationThread t = thread(IntentTaxonomy.withQuestions());
    t.transitionTo(ThreadStatus.INTERRUPTED);
    assertThrows(IllegalStateException.class, () -> t.transitionTo(ThreadStatus.ACTIVE));
    t.close();
    t.markStale();
    assertEquals(ThreadStatus.CLOSED, t.status());
  }

  @Test
  void closedThreadRefusesMessages() {
    ConversationThread t = thread(IntentTaxonomy.withQuestions());
    t.close();
    assertFalse(t.registerMessage(line("Orion", 1), 1));
    assertEquals(0, t.turnCount());
  }

  @Test
  void introductionIntentDependsOnTaxonomy() {
    assertEquals(Intent.QUESTION, thread(IntentTaxonomy.withQuestions()).getPhaseAppropriateIntent(TestCast.orion()));
    assertEquals(Intent.STATEMENT, thread(IntentTaxonomy.withoutQuestions()).getPhaseAppropriateIntent(TestCast.orion()));
    // low curiosity speaks plainly even when questions are allowed
    assertEquals(Intent.STATEMENT, thread(IntentTaxonomy.withQuestions()).getPhaseAppropriateIntent(TestCast.nova()));
  }

  @Test
  void historyIsBoundedForRepetitionChecks() {
    ConversationThread t = new ConversationThread("thread_small", topics.getOrCreate("exit code"),
        List.of(TestCast.orion()), IntentTaxonomy.withQuestions(), 100, 3, true, 0L);
    for (int i = 0; i < 10; i++) t.registerMessage(line("Orion", i), i);
    assertEquals(List.of("line number 7", "line number 8", "line number 9"), t.recentTexts());
  }
}
