package cascadesim.agents;

public enum PersonaRole {
  LEAD,
  SKEPTIC,
  ANXIOUS,
  VISIONARY,
  SUPPORTING
}
