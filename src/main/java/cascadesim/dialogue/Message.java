package cascadesim.dialogue;

public record Message(String speaker,
                      String text,
                      Intent intent,
                      MessageSource source,
                      String threadId,
                      long timestampMs,
                      boolean hesitate,
                      double typingSpeed) {

  public static Message viewer(String username, String text, String threadId, long nowMs) {
    return new Message(username, text, Intent.REPLY, MessageSource.VIEWER, threadId, nowMs, false, 1.0);
  }

  public boolean fromPersona() {
    return source == MessageSource.PERSONA;
  }

  @Override
  public String toString() {
    return speaker + ": " + text;
  }
}
