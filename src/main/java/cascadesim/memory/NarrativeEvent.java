package cascadesim.memory;

public record NarrativeEvent(String type, String value, String actor, long timestampMs, int loop) {

  @Override
  public String toString() {
    return "[" + loop + "] " + type + " (" + actor + "): " + value;
  }
}
