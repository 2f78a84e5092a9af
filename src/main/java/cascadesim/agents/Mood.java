package cascadesim.agents;

public enum Mood {
  NEUTRAL,
  CURIOUS,
  INSPIRED,
  SUSPICIOUS,
  PARANOID,
  SCARED,
  FRUSTRATED,
  PLAYFUL
}
