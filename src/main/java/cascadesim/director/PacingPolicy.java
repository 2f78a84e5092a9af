package cascadesim.director;

import cascadesim.dialogue.ConversationPhase;

import java.util.Random;

public record PacingPolicy(long baseMs, long minMs, long maxMs, double jitter) {

  public static PacingPolicy defaults() {
    return new PacingPolicy(4_000L, 1_500L, 9_000L, 0.15);
  }

  public PacingPolicy {
    if (minMs <= 0 || maxMs < minMs) {
      throw new IllegalArgumentException("Pacing bounds must satisfy 0 < min <= max");
    }
  }

  public long nextDelayMs(ConversationPhase phase, double tension, boolean crisisMode, Random rng) {
    double delay = baseMs * (phase == null ? 1.0 : phase.pacingMultiplier());
    if (tension > 0.7) {
      delay *= 0.75;
    } else if (tension < 0.3) {
      delay *= 1.25;
    }
    if (crisisMode) delay *= 0.5;
    if (jitter > 0 && rng != null) {
      delay *= 1.0 + (rng.nextDouble() * 2.0 - 1.0) * jitter;
    }
    return Math.max(minMs, Math.min(maxMs, Math.round(delay)));
  }
}
