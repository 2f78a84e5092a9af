package cascadesim.director;

import cascadesim.core.Lottery;
import cascadesim.memory.NarrativeMemory;
import cascadesim.topics.Topic;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

public class GlitchSource {
  public record GlitchType(String name, String description, double severity, double weight) {}

  static final List<GlitchType> TYPES = List.of(
      new GlitchType("cursor anomaly", "the cursor moved on its own", 0.5, 0.40),
      new GlitchType("visual corruption", "scanlines tore across the screen", 1.0, 0.30),
      new GlitchType("window anomaly", "a window opened that nobody launched", 1.5, 0.25),
      new GlitchType("red cascade", "everything flashed red for a frame", 3.0, 0.05)
  );

  private final Random rng;
  private final double baseChance;
  private final double tensionFactor;

  public GlitchSource(Random rng) {
    this(rng, 0.02, 0.05);
  }

  public GlitchSource(Random rng, double baseChance, double tensionFactor) {
    this.rng = rng;
    this.baseChance = baseChance;
    this.tensionFactor = tensionFactor;
  }

  public double chance(NarrativeMemory memory, Topic topic) {
    double chance = baseChance + memory.tension() * tensionFactor;
    if (topic != null && topic.isGlitchSource()) chance *= 2.0;
    return Math.min(1.0, chance);
  }

  public GlitchType maybeGlitch(NarrativeMemory memory, Topic topic) {
    if (rng.nextDouble() >= chance(memory, topic)) return null;
    return force(memory);
  }

  public GlitchType force(NarrativeMemory memory) {
    Map<GlitchType, Double> weights = new LinkedHashMap<>();
    for (GlitchType t : TYPES) weights.put(t, t.weight());
    GlitchType picked = Lottery.draw(weights, rng);
    memory.addGlitchEvent(picked.name(), picked.description(), picked.severity());
    return picked;
  }
}
