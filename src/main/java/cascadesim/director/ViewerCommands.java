package cascadesim.director;

import cascadesim.core.SimulationLogger;

import java.util.Locale;

public class ViewerCommands {
  static final String DEFAULT_QUESTION = "Are you really real?";

  public enum Outcome { QUEUED, TRIGGERED, IGNORED, UNKNOWN }

  private final DialogueDirector director;

  public ViewerCommands(DialogueDirector director) {
    this.director = director;
  }

  public Outcome handle(String username, String text) {
    if (text == null || text.isBlank()) return Outcome.IGNORED;
    String trimmed = text.trim();
    if (!trimmed.startsWith("!")) {
      director.enqueueUserMessage(username, trimmed);
      return Outcome.QUEUED;
    }

    int space = trimmed.indexOf(' ');
    String command = (space < 0 ? trimmed : trimmed.substring(0, space)).toLowerCase(Locale.ROOT);
    String rest = space < 0 ? "" : trimmed.substring(space + 1).trim();
    SimulationLogger.log("[Viewer] " + (username == null ? "anonymous" : username) + " sent " + command);
    switch (command) {
      case "!glitch" -> director.fireTrigger(NarrativeTriggers.Trigger.VIEWER_GLITCH_REQUEST);
      case "!tension" -> director.fireTrigger(NarrativeTriggers.Trigger.VIEWER_TENSION_UP);
      case "!observe" -> director.fireTrigger(NarrativeTriggers.Trigger.VIEWER_OBSERVE);
      case "!question" -> {
        director.enqueueUserMessage(username, rest.isEmpty() ? DEFAULT_QUESTION : rest);
        return Outcome.QUEUED;
      }
      default -> {
        return Outcome.UNKNOWN;
      }
    }
    return Outcome.TRIGGERED;
  }
}
