package cascadesim.dialogue;

import cascadesim.agents.InteractionKind;

public enum Intent {
  STATEMENT,
  THEORY,
  CHALLENGE,
  FEAR,
  OBSERVATION,
  META,
  QUESTION,
  AGREEMENT,
  REPLY;

  public boolean isQuestionLike() {
    return this == QUESTION;
  }

  public InteractionKind interactionKind() {
    return switch (this) {
      case CHALLENGE -> InteractionKind.DISAGREEMENT;
      case AGREEMENT -> InteractionKind.SUPPORT;
      case THEORY, OBSERVATION -> InteractionKind.SHARED_INFORMATION;
      default -> InteractionKind.CONVERSATION;
    };
  }
}
