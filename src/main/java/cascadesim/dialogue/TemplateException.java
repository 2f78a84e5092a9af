package cascadesim.dialogue;

public class TemplateException extends RuntimeException {
  public TemplateException(String message) {
    super(message);
  }
}
