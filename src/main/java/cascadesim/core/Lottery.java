package cascadesim.core;

import java.util.List;
import java.util.Map;
import java.util.Random;

public final class Lottery {
  private Lottery() {}

  public static <T> T draw(Map<T, Double> weights, Random rng) {
    if (weights == null || weights.isEmpty()) return null;
    double total = 0.0;
    for (double w : weights.values()) {
      if (w > 0) total += w;
    }
    if (total <= 0) {
      return pickUniform(List.copyOf(weights.keySet()), rng);
    }
    double roll = rng.nextDouble() * total;
    double cumulative = 0.0;
    T last = null;
    for (var entry : weights.entrySet()) {
      double w = entry.getValue();
      if (w <= 0) continue;
      cumulative += w;
      last = entry.getKey();
      if (roll < cumulative) return last;
    }
    return last;
  }

  public static <T> T pickUniform(List<T> items, Random rng) {
    if (items == null || items.isEmpty()) return null;
    return items.get(rng.nextInt(items.size()));
  }

  public static double clamp01(double value) {
    if (Double.isNaN(value)) return 0.0;
    return Math.max(0.0, Math.min(1.0, value));
  }
}
