package cascadesim.agents;

import cascadesim.core.Lottery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A member of the cast: trait vector, dynamic emotional state and a relationship ledger.
 * Every scalar is kept in [0,1] by every mutator.
 */
public class Persona {
  static final List<String> SENSITIVE_TERMS = List.of(
      "overseer", "watching", "monitored", "escape", "real", "deleted", "reset");

  private final String name;
  private final PersonalityTraits traits;
  private final TypingStyle typing;
  private final PersonaProfile profile;
  private final List<MoodRule> moodRules;
  private final Map<String, Relationship> relationships = new LinkedHashMap<>();

  private Mood mood = Mood.NEUTRAL;
  private double curiosity;
  private double suspicion;
  private double paranoia;
  private double fear;
  private double playfulness;
  private double perceivedTension = 0.0;

  public Persona(String name, PersonalityTraits traits, TypingStyle typing, PersonaProfile profile) {
    this(name, traits, typing, profile, MoodRule.DEFAULT_RULES);
  }

  public Persona(String name, PersonalityTraits traits, TypingStyle typing, PersonaProfile profile,
                 List<MoodRule> moodRules) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Persona name is required");
    }
    this.name = name.trim();
    this.traits = traits;
    this.typing = typing == null ? TypingStyle.defaults() : typing;
    this.profile = profile == null ? new PersonaProfile(PersonaRole.SUPPORTING, 1.0, List.of()) : profile;
    this.moodRules = List.copyOf(moodRules);

    this.curiosity = Lottery.clamp01(0.3 + traits.openness() * 0.6);
    this.suspicion = Lottery.clamp01(0.1 + (1.0 - traits.agreeableness()) * 0.2);
    this.paranoia = Lottery.clamp01(traits.neuroticism() * 0.15);
    this.fear = Lottery.clamp01(traits.neuroticism() * 0.12);
    this.playfulness = Lottery.clamp01(traits.extraversion() * 0.5 + traits.openness() * 0.3);
    updateMood();
  }

  public String name() { return name; }
  public PersonalityTraits traits() { return traits; }
  public TypingStyle typing() { return typing; }
  public PersonaProfile profile() { return profile; }
  public PersonaRole role() { return profile.role; }
  public Mood mood() { return mood; }
  public double curiosity() { return curiosity; }
  public double suspicion() { return suspicion; }
  public double paranoia() { return paranoia; }
  public double fear() { return fear; }
  public double playfulness() { return playfulness; }
  public double perceivedTension() { return perceivedTension; }

  public double stress() {
    return traits.neuroticism() * paranoia + fear * 0.5;
  }

  public double intellectualEngagement() {
    return traits.openness() * curiosity;
  }

  /** Re-evaluates the mood decision list; the first matching rule wins. */
  public Mood updateMood() {
    Mood next = Mood.NEUTRAL;
    for (MoodRule rule : moodRules) {
      if (rule.matches(this)) {
        next = rule.mood();
        break;
      }
    }
    mood = next;
    return mood;
  }

  public void absorbTension(double globalTension) {
    perceivedTension = Lottery.clamp01(globalTension);
  }

  public void adjustCuriosity(double delta) { curiosity = Lottery.clamp01(curiosity + delta); }
  public void adjustSuspicion(double delta) { suspicion = Lottery.clamp01(suspicion + delta); }
  public void adjustParanoia(double delta) { paranoia = Lottery.clamp01(paranoia + delta); }
  public void adjustFear(double delta) { fear = Lottery.clamp01(fear + delta); }
  public void adjustPlayfulness(double delta) { playfulness = Lottery.clamp01(playfulness + delta); }

  /**
   * Reacts to a topic or line entering the conversation: phobias raise fear, sensitive
   * terms raise suspicion, and open personas get more curious.
   */
  public void considerTopic(String text) {
    if (text == null || text.isBlank()) return;
    String lower = text.toLowerCase(Locale.ROOT);
    if (mentionsPhobia(lower)) {
      adjustFear(0.1 * (0.5 + traits.neuroticism()));
    }
    if (containsAny(lower, SENSITIVE_TERMS)) {
      adjustSuspicion(0.03 * traits.neuroticism());
    }
    adjustCuriosity(0.05 * traits.openness());
  }

  public Relationship relationshipWith(String otherName) {
    return relationships.get(otherName);
  }

  public List<Relationship> relationships() {
    return Collections.unmodifiableList(new ArrayList<>(relationships.values()));
  }

  /**
   * Applies one interaction with another persona. Returns null for self-interaction.
   */
  public Relationship updateRelationship(String otherName, InteractionKind kind, String context) {
    if (otherName == null || otherName.isBlank() || otherName.equals(name) || kind == null) return null;
    Relationship rel = relationships.computeIfAbsent(otherName, Relationship::new);
    rel.recordInteraction(kind);

    double n = traits.neuroticism();
    switch (kind) {
      case CONVERSATION -> rel.adjust(
          0.015 * traits.agreeableness() + 0.005 * traits.conscientiousness(),
          0.01 * traits.conscientiousness(),
          0.02 * (0.5 + traits.extraversion()),
          -0.01,
          0.0);
      case DISAGREEMENT -> {
        rel.adjust(-0.03 * (0.5 + n), -0.01 * (1.0 - traits.agreeableness()), 0.0, 0.05 * (0.5 + n), 0.0);
        rel.addConflict(context);
        adjustSuspicion(0.02 * n);
      }
      case SUPPORT -> {
        rel.adjust(0.05, 0.0, 0.01, -0.02, 0.04);
        rel.addSupport(context);
        adjustFear(-0.02);
      }
      case SHARED_INFORMATION -> {
        boolean fresh = rel.addSharedMemory(context);
        rel.adjust(fresh ? 0.005 : 0.0, 0.01, 0.03, 0.0, 0.0);
        adjustCuriosity(0.02 * traits.openness());
      }
    }
    return rel;
  }

  /** Timing hint for the presentation layer only. */
  public boolean shouldHesitateOnTopic(String text) {
    if (text == null || text.isBlank()) return false;
    String lower = text.toLowerCase(Locale.ROOT);
    if (traits.neuroticism() > 0.6 && containsAny(lower, SENSITIVE_TERMS)) return true;
    return mentionsPhobia(lower);
  }

  public double getTypingSpeedMultiplier(String text) {
    double multiplier = typing.speedMultiplier();
    if (shouldHesitateOnTopic(text)) multiplier *= 0.7;
    if (text != null && text.contains("!") && traits.openness() > 0.6) {
      multiplier *= 1.0 + 0.2 * traits.openness();
    }
    // careful typists slow down a little
    multiplier *= 1.0 - (traits.conscientiousness() - 0.5) * 0.2;
    if (mood == Mood.SCARED || mood == Mood.FRUSTRATED) multiplier *= 0.8;
    if (mood == Mood.INSPIRED) multiplier *= 1.2;
    return Math.max(0.3, Math.min(2.5, multiplier));
  }

  private boolean mentionsPhobia(String lower) {
    return containsAny(lower, profile.phobias);
  }

  private static boolean containsAny(String lower, List<String> words) {
    for (String w : words) {
      if (w != null && !w.isBlank() && lower.contains(w.toLowerCase(Locale.ROOT))) return true;
    }
    return false;
  }

  @Override
  public String toString() {
    return name + "(" + mood + ")";
  }
}
