package cascadesim.director;

import cascadesim.agents.Mood;

public enum Ambience {
  CALM,
  CURIOUS,
  PARANOID;

  public static Ambience from(Mood mood) {
    if (mood == null) return CALM;
    return switch (mood) {
      case PARANOID, SCARED, SUSPICIOUS -> PARANOID;
      case CURIOUS, INSPIRED -> CURIOUS;
      default -> CALM;
    };
  }
}
