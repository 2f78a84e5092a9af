package cascadesim.dialogue;

public enum ThreadStatus {
  ACTIVE,
  ESCALATING,
  INTERRUPTED,
  STALE,
  CLOSED
}
