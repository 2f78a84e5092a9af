package cascadesim.memory;

public final class Concept {
  private final String name;
  private final String introducedBy;
  private int mentions;
  private double importance;

  Concept(String name, String introducedBy, double importance) {
    this.name = name;
    this.introducedBy = introducedBy == null ? "SYSTEM" : introducedBy;
    this.mentions = 1;
    this.importance = Math.max(0.0, Math.min(1.0, importance));
  }

  public String name() { return name; }
  public String introducedBy() { return introducedBy; }
  public int mentions() { return mentions; }
  public double importance() { return importance; }

  void mention(double importanceDelta) {
    mentions++;
    importance = Math.max(0.0, Math.min(1.0, importance + importanceDelta));
  }
}
