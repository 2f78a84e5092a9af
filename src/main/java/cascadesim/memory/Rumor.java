package cascadesim.memory;

public final class Rumor {
  private final String text;
  private final String origin;
  private final long createdAtMs;
  private double strength;
  private double credibility;

  Rumor(String text, String origin, double credibility, long createdAtMs) {
    this.text = text;
    this.origin = origin == null ? "SYSTEM" : origin;
    this.createdAtMs = createdAtMs;
    this.strength = 1.0;
    this.credibility = Math.max(0.0, Math.min(1.0, credibility));
  }

  public String text() { return text; }
  public String origin() { return origin; }
  public long createdAtMs() { return createdAtMs; }
  public double strength() { return strength; }
  public double credibility() { return credibility; }

  void reinforce(double credibilityDelta) {
    strength = 1.0;
    credibility = Math.max(0.0, Math.min(1.0, credibility + credibilityDelta));
  }

  void decay(double rate) {
    // credible rumors fade more slowly
    strength = Math.max(0.0, strength * (1.0 - rate * (1.0 - 0.5 * credibility)));
  }
}
