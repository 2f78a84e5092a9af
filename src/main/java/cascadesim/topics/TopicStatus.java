package cascadesim.topics;

public enum TopicStatus {
  NEUTRAL,
  CONTROVERSIAL,
  FORBIDDEN,
  SOLVED,
  MUTATING
}
