package cascadesim.director;

import cascadesim.dialogue.ConversationThread;
import cascadesim.dialogue.Message;
import cascadesim.dialogue.OverlapScorer;
import cascadesim.memory.NarrativeMemory;

import java.util.List;
import java.util.Set;

public class ConversationDynamics {
  static final List<String> DISAGREEMENT_WORDS = List.of(
      "no", "wrong", "disagree", "impossible", "doubt", "lying", "doesn't", "nonsense", "proof");
  static final List<String> AGREEMENT_WORDS = List.of(
      "yes", "agree", "exactly", "right", "true", "together", "trust", "same");
  static final List<String> META_WORDS = List.of(
      "simulation", "watching", "real", "code", "loop", "programmed", "overseer", "observer");
  static final List<String> URGENT_WORDS = List.of(
      "now", "hurry", "run", "urgent", "help", "quick");

  static final double BLEND = 0.2;
  static final double DECAY = 0.02;
  static final double TENSION_BASELINE = 0.3;
  static final double COHESION_BASELINE = 0.5;

  public void apply(Message message, ConversationThread thread, NarrativeMemory memory) {
    if (message == null || memory == null) return;
    String text = message.text();
    Set<String> words = OverlapScorer.words(text);

    if (thread != null) {
      if (containsAny(words, DISAGREEMENT_WORDS)) {
        thread.adjustLocalTension(0.08);
        thread.adjustLocalCohesion(-0.06);
      }
      if (containsAny(words, AGREEMENT_WORDS)) {
        thread.adjustLocalTension(-0.04);
        thread.adjustLocalCohesion(0.06);
      }
    }
    if (containsAny(words, META_WORDS)) {
      memory.markDeepDiscussion(true);
      memory.adjustMetaAwareness(0.02);
    }
    boolean urgent = (text != null && text.contains("!")) || containsAny(words, URGENT_WORDS);
    if (urgent) {
      if (thread != null) thread.adjustLocalTension(0.05);
      memory.adjustTension(0.02);
    }

    if (thread != null) {
      memory.setTension(memory.tension() * (1.0 - BLEND) + thread.localTension() * BLEND);
      memory.setCohesion(memory.cohesion() * (1.0 - BLEND) + thread.localCohesion() * BLEND);
    }
    memory.adjustTension((TENSION_BASELINE - memory.tension()) * DECAY);
    memory.adjustCohesion((COHESION_BASELINE - memory.cohesion()) * DECAY);
  }

  private static boolean containsAny(Set<String> words, List<String> family) {
    for (String w : family) {
      if (words.contains(w)) return true;
    }
    return false;
  }
}
