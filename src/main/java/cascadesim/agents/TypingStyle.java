package cascadesim.agents;

public record TypingStyle(double speedMultiplier, double typoRate, double hesitationRate) {
  public TypingStyle {
    if (speedMultiplier <= 0) speedMultiplier = 1.0;
    typoRate = Math.max(0.0, Math.min(1.0, typoRate));
    hesitationRate = Math.max(0.0, Math.min(1.0, hesitationRate));
  }

  public static TypingStyle defaults() {
    return new TypingStyle(1.0, 0.03, 0.1);
  }
}
