package cascadesim.director;

import cascadesim.agents.Persona;
import cascadesim.core.Lottery;
import cascadesim.dialogue.ConversationThread;
import cascadesim.dialogue.Intent;
import cascadesim.dialogue.TemplateLibrary;
import cascadesim.memory.NarrativeMemory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

public class SpeakerSelector {
  static final long RECENT_MS = 4_000L;
  static final long RELAXED_MS = 15_000L;

  private final TemplateLibrary library;
  private final Random rng;
  private final Map<String, Long> lastSpokeAt = new LinkedHashMap<>();

  public SpeakerSelector(TemplateLibrary library, Random rng) {
    this.library = library;
    this.rng = rng;
  }

  public void recordSpoke(String name, long nowMs) {
    lastSpokeAt.put(name, nowMs);
  }

  public void clear() {
    lastSpokeAt.clear();
  }

  public Persona select(ConversationThread thread, NarrativeMemory memory, long nowMs) {
    if (thread == null || thread.participants().isEmpty()) return null;
    Map<Persona, Double> weights = weights(thread, memory, nowMs);
    return Lottery.draw(weights, rng);
  }

  Map<Persona, Double> weights(ConversationThread thread, NarrativeMemory memory, long nowMs) {
    Map<Persona, Double> weights = new LinkedHashMap<>();
    for (Persona p : thread.participants()) {
      double w = recencyFactor(p.name(), nowMs);
      w *= p.profile().speakerBias;

      Intent phaseIntent = thread.getPhaseAppropriateIntent(p);
      if (library.voiceFor(p.name()).favors(phaseIntent, 3)) w *= 1.5;

      w *= roleBonus(p, memory);

      if (p.name().equals(thread.lastSpeaker())) {
        w *= thread.allowsInterruption() ? 0.3 : 0.05;
      }
      w *= p.playfulness() + p.curiosity() + 0.5;
      weights.put(p, w);
    }
    return weights;
  }

  double recencyFactor(String name, long nowMs) {
    Long last = lastSpokeAt.get(name);
    if (last == null) return 1.0;
    long elapsed = nowMs - last;
    if (elapsed < RECENT_MS) return 0.1;
    if (elapsed >= RELAXED_MS) return 1.0;
    return 0.1 + 0.9 * (elapsed - RECENT_MS) / (double) (RELAXED_MS - RECENT_MS);
  }

  private static double roleBonus(Persona p, NarrativeMemory memory) {
    if (memory == null) return 1.0;
    return switch (p.role()) {
      case ANXIOUS -> memory.overseerWarnings() >= 3 ? 1.6 : 1.0;
      case SKEPTIC -> memory.tension() > 0.6 ? 1.3 : 1.0;
      case VISIONARY -> memory.metaAwareness() > 0.5 ? 1.4 : 1.0;
      case LEAD -> memory.observerDetected() ? 1.2 : 1.0;
      default -> 1.0;
    };
  }
}
