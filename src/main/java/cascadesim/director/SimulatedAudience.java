package cascadesim.director;

import cascadesim.core.Lottery;
import cascadesim.core.SimClock;
import cascadesim.core.SimulationLogger;

import java.util.List;
import java.util.Random;

/**
 * Stand-in chat for unattended runs: an anonymous observer speaks every 30 to 120 seconds,
 * and one in five of those lines is a glitch request.
 */
public class SimulatedAudience {
  static final List<String> LINES = List.of(
      "What is this place?",
      "Can he see us?",
      "Look at the files!",
      "He seems nervous.",
      "Try running solitaire."
  );
  static final String GLITCH_COMMAND = "!glitch";

  public record ChatLine(String username, String text, ViewerCommands.Outcome outcome) {}

  private final ViewerCommands commands;
  private final SimClock clock;
  private final Random rng;
  private final long minIntervalMs;
  private final long maxIntervalMs;
  private final double glitchChance;
  private long nextAtMs;

  public SimulatedAudience(ViewerCommands commands, SimClock clock, Random rng) {
    this(commands, clock, rng, 30_000L, 120_000L, 0.2);
  }

  public SimulatedAudience(ViewerCommands commands, SimClock clock, Random rng,
                           long minIntervalMs, long maxIntervalMs, double glitchChance) {
    if (minIntervalMs <= 0 || maxIntervalMs < minIntervalMs) {
      throw new IllegalArgumentException("Invalid audience interval [" + minIntervalMs + ", " + maxIntervalMs + "]");
    }
    this.commands = commands;
    this.clock = clock;
    this.rng = rng;
    this.minIntervalMs = minIntervalMs;
    this.maxIntervalMs = maxIntervalMs;
    this.glitchChance = glitchChance;
    this.nextAtMs = clock.nowMs() + nextInterval();
  }

  public long nextAtMs() {
    return nextAtMs;
  }

  // null until the interval has elapsed
  public ChatLine tick() {
    long now = clock.nowMs();
    if (now < nextAtMs) return null;
    nextAtMs = now + nextInterval();

    String username = "Observer" + (100 + rng.nextInt(899));
    String text = rng.nextDouble() < glitchChance ? GLITCH_COMMAND : Lottery.pickUniform(LINES, rng);
    ViewerCommands.Outcome outcome = commands.handle(username, text);
    SimulationLogger.log("[Audience] " + username + ": " + text + " (" + outcome + ")");
    return new ChatLine(username, text, outcome);
  }

  private long nextInterval() {
    return minIntervalMs + (long) (rng.nextDouble() * (maxIntervalMs - minIntervalMs));
  }
}
