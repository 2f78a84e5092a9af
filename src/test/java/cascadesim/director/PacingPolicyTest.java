package cascadesim.director;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cascadesim.dialogue.ConversationPhase;

import java.util.Random;

import org.junit.jupiter.api.Test;

class PacingPolicyTest {

  private final PacingPolicy steady = new PacingPolicy(4_000L, 1_500L, 9_000L, 0.0);

  @Test
  void phaseMultiplierScalesTheBaseInterval() {
    assertEquals(4_400L, steady.nextDelayMs(ConversationPhase.INTRODUCTION, 0.5, false, null));
    assertEquals(4_000L, steady.nextDelayMs(ConversationPhase.DEVELOPMENT, 0.5, false, null));
    assertEquals(3_200L, steady.nextDelayMs(ConversationPhase.COMPLICATION, 0.5, false, null));
    assertEquals(2_000L, steady.nextDelayMs(ConversationPhase.CLIMAX, 0.5, false, null));
  }

  @Test
  void tensionAndCrisisShortenTheWait() {
    assertEquals(5_500L, steady.nextDelayMs(ConversationPhase.INTRODUCTION, 0.1, false, null));
    assertEquals(3_000L, steady.nextDelayMs(ConversationPhase.DEVELOPMENT, 0.8, false, null));
    assertEquals(2_200L, steady.nextDelayMs(ConversationPhase.INTRODUCTION, 0.5, true, null));
  }

  @Test
  void resultIsClampedToBounds() {
    assertEquals(1_500L, steady.nextDelayMs(ConversationPhase.CLIMAX, 0.9, true, null));
    PacingPolicy slow = new PacingPolicy(9_000L, 1_500L, 9_000L, 0.0);
    assertEquals(9_000L, slow.nextDelayMs(ConversationPhase.INTRODUCTION, 0.0, false, null));
  }

  @Test
  void jitterStaysInsideBounds() {
    PacingPolicy policy = PacingPolicy.defaults();
    Random rng = new Random(17);
    for (int i = 0; i < 500; i++) {
      long d = policy.nextDelayMs(ConversationPhase.DEVELOPMENT, 0.5, false, rng);
      assertTrue(d >= 3_400L && d <= 4_600L, "delay " + d);
    }
  }

  @Test
  void invalidBoundsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> new PacingPolicy(4_000L, 5_000L, 1_000L, 0.1));
  }
}
