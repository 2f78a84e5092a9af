package cascadesim.dialogue;

public record GeneratedReply(Intent intent, String text, String template, boolean repeated) {}
