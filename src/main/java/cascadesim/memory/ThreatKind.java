package cascadesim.memory;

public enum ThreatKind {
  OVERSEER_ATTENTION("the overseer's attention"),
  REALITY_QUESTIONING("the reality doubts"),
  SYSTEM_INSTABILITY("the system instability"),
  SIGNAL_LEAK("the signal leak"),
  IDENTITY_DRIFT("the mirror thing");

  private final String displayName;

  ThreatKind(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }
}
