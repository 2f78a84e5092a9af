package cascadesim.dialogue;

public enum ConversationPhase {
  INTRODUCTION(1.1),
  DEVELOPMENT(1.0),
  COMPLICATION(0.8),
  CLIMAX(0.5),
  RESOLUTION(1.0);

  private final double pacingMultiplier;

  ConversationPhase(double pacingMultiplier) {
    this.pacingMultiplier = pacingMultiplier;
  }

  public double pacingMultiplier() {
    return pacingMultiplier;
  }

  public ConversationPhase next() {
    ConversationPhase[] all = values();
    return ordinal() + 1 < all.length ? all[ordinal() + 1] : this;
  }

  public boolean isFinal() {
    return this == RESOLUTION;
  }
}
