package cascadesim.agents;

public enum InteractionKind {
  CONVERSATION,
  DISAGREEMENT,
  SUPPORT,
  SHARED_INFORMATION
}
