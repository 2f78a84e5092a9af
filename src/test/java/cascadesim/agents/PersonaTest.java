package cascadesim.agents;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cascadesim.TestCast;

import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

class PersonaTest {

  @Test
  void curiousLeadStaysCuriousAboutLoopTheory() {
    Persona orion = TestCast.orion();
    orion.considerTopic("loop theory");
    Mood mood = orion.updateMood();
    assertTrue(mood == Mood.CURIOUS || mood == Mood.INSPIRED, "got " + mood);
    assertNotEquals(Mood.SCARED, mood);
  }

  @Test
  void ruleOrderDecidesBetweenMatchingMoods() {
    Persona echo = TestCast.echo();
    for (int i = 0; i < 20; i++) {
      echo.adjustFear(0.1);
      echo.adjustParanoia(0.1);
    }
    // both the stress and the fear rule match; stress comes first
    assertEquals(Mood.PARANOID, echo.updateMood());
  }

  @Test
  void scalarsStayClampedUnderAnyInteractionSequence() {
    List<Persona> cast = TestCast.all();
    Random rng = new Random(99);
    InteractionKind[] kinds = InteractionKind.values();
    for (int i = 0; i < 2_000; i++) {
      Persona a = cast.get(rng.nextInt(cast.size()));
      Persona b = cast.get(rng.nextInt(cast.size()));
      a.updateRelationship(b.name(), kinds[rng.nextInt(kinds.length)], "event " + rng.nextInt(30));
      a.adjustFear(rng.nextGaussian());
      a.adjustSuspicion(rng.nextGaussian());
      a.adjustCuriosity(rng.nextGaussian());
      a.absorbTension(rng.nextGaussian() * 2);
      a.updateMood();
    }
    for (Persona p : cast) {
      assertUnit(p.curiosity());
      assertUnit(p.suspicion());
      assertUnit(p.paranoia());
      assertUnit(p.fear());
      assertUnit(p.playfulness());
      assertUnit(p.perceivedTension());
      for (Relationship r : p.relationships()) {
        assertUnit(r.trust());
        assertUnit(r.respect());
        assertUnit(r.intimacy());
        assertUnit(r.tension());
        assertUnit(r.emotionalBond());
        assertTrue(r.sharedMemories().size() <= 20);
      }
    }
  }

  @Test
  void disagreementRaisesTensionAndLowersTrust() {
    Persona nova = TestCast.nova();
    Relationship rel = nova.updateRelationship("Orion", InteractionKind.DISAGREEMENT, "argued about the mirror test");
    assertTrue(rel.tension() > 0.0);
    assertTrue(rel.trust() < 0.5);
    assertEquals(1, rel.conflicts().size());
    assertEquals(1, rel.interactionCount());
  }

  @Test
  void sharedInformationIsDeduplicated() {
    Persona lumen = TestCast.lumen();
    lumen.updateRelationship("Echo", InteractionKind.SHARED_INFORMATION, "the door in the code");
    lumen.updateRelationship("Echo", InteractionKind.SHARED_INFORMATION, "the door in the code");
    assertEquals(1, lumen.relationshipWith("Echo").sharedMemories().size());
    assertEquals(2, lumen.relationshipWith("Echo").interactionCount());
  }

  @Test
  void selfInteractionIsIgnored() {
    Persona orion = TestCast.orion();
    assertNull(orion.updateRelationship("Orion", InteractionKind.SUPPORT, "talking to myself"));
    assertTrue(orion.relationships().isEmpty());
  }

  @Test
  void anxiousPersonaHesitatesOnSensitiveTerms() {
    assertTrue(TestCast.echo().shouldHesitateOnTopic("the overseer is here"));
    assertFalse(TestCast.orion().shouldHesitateOnTopic("the overseer is here"));
    assertTrue(TestCast.nova().shouldHesitateOnTopic("we are trapped"), "phobia should trigger hesitation");
  }

  @Test
  void typingSpeedStaysWithinBounds() {
    for (Persona p : TestCast.all()) {
      for (String text : List.of("", "hello!", "the overseer is watching, reset now")) {
        double m = p.getTypingSpeedMultiplier(text);
        assertTrue(m >= 0.3 && m <= 2.5, p.name() + " -> " + m);
      }
    }
  }

  private static void assertUnit(double value) {
    assertTrue(value >= 0.0 && value <= 1.0, "out of range: " + value);
  }
}
