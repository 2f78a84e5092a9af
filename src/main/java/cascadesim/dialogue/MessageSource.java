package cascadesim.dialogue;

public enum MessageSource {
  PERSONA,
  OVERSEER,
  VIEWER
}
