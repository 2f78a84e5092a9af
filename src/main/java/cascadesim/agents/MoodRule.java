package cascadesim.agents;

import java.util.List;
import java.util.function.Predicate;

public record MoodRule(String label, Predicate<Persona> when, Mood mood) {

  public static final List<MoodRule> DEFAULT_RULES = List.of(
      new MoodRule("stress", p -> p.stress() > 0.7, Mood.PARANOID),
      new MoodRule("fear", p -> p.fear() > 0.5 && p.traits().neuroticism() > 0.6, Mood.SCARED),
      new MoodRule("suspicion", p -> p.suspicion() > 0.6, Mood.SUSPICIOUS),
      new MoodRule("inspiration", p -> p.intellectualEngagement() > 0.7 && p.playfulness() > 0.55, Mood.INSPIRED),
      new MoodRule("engagement", p -> p.intellectualEngagement() > 0.7, Mood.CURIOUS),
      new MoodRule("play", p -> p.playfulness() > 0.7 && p.perceivedTension() < 0.4, Mood.PLAYFUL),
      new MoodRule("pressure", p -> p.perceivedTension() > 0.8
          || (p.traits().agreeableness() < 0.3 && p.suspicion() > 0.45), Mood.FRUSTRATED)
  );

  public boolean matches(Persona persona) {
    return when.test(persona);
  }
}
