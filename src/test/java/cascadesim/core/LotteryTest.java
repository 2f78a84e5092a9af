package cascadesim.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.HashSet;

import org.junit.jupiter.api.Test;

class LotteryTest {

  @Test
  void zeroWeightEntriesNeverWin() {
    Map<String, Double> weights = new LinkedHashMap<>();
    weights.put("never", 0.0);
    weights.put("always", 2.0);
    weights.put("negative", -1.0);
    Random rng = new Random(1);
    for (int i = 0; i < 500; i++) {
      assertEquals("always", Lottery.draw(weights, rng));
    }
  }

  @Test
  void allNonPositiveWeightsFallBackToUniform() {
    Map<String, Double> weights = new LinkedHashMap<>();
    weights.put("a", 0.0);
    weights.put("b", 0.0);
    Random rng = new Random(5);
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < 100; i++) {
      seen.add(Lottery.draw(weights, rng));
    }
    assertEquals(Set.of("a", "b"), seen);
  }

  @Test
  void emptyInputsYieldNull() {
    assertNull(Lottery.draw(Map.of(), new Random()));
    assertNull(Lottery.pickUniform(java.util.List.of(), new Random()));
  }

  @Test
  void heavierWeightWinsMoreOften() {
    Map<String, Double> weights = new LinkedHashMap<>();
    weights.put("light", 1.0);
    weights.put("heavy", 9.0);
    Random rng = new Random(11);
    int heavy = 0;
    for (int i = 0; i < 2_000; i++) {
      if ("heavy".equals(Lottery.draw(weights, rng))) heavy++;
    }
    assertTrue(heavy > 1_600, "heavy won only " + heavy + " times");
  }

  @Test
  void clampHandlesOutOfRangeAndNaN() {
    assertEquals(0.0, Lottery.clamp01(-3.0));
    assertEquals(1.0, Lottery.clamp01(7.0));
    assertEquals(0.0, Lottery.clamp01(Double.NaN));
    assertEquals(0.25, Lottery.clamp01(0.25));
  }
}
