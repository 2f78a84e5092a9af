package cascadesim.memory;

import cascadesim.core.Lottery;
import cascadesim.core.SimClock;
import cascadesim.core.SimulationLogger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * NarrativeMemory is the one shared mutable story state: emotional scalars, lore flags,
 * threat levels, rolling event history, concepts and rumors. It is handed to every
 * collaborator explicitly.
 */
public class NarrativeMemory {
  public static final String EVENT_DIALOGUE = "Dialogue";
  public static final String EVENT_GLITCH = "Glitch";
  public static final String EVENT_OVERSEER = "OverseerInjection";
  public static final String EVENT_THREAT = "ThreatThreshold";
  public static final String EVENT_RESET = "System Reset";
  public static final String EVENT_OBSERVER = "Observer";

  /** Tuning constants; {@link #defaults()} holds the shipped values. */
  public record Settings(int historyCapacity,
                         int conceptCapacity,
                         int rumorCapacity,
                         double tensionPerSeverity,
                         double redGlitchSeverity,
                         double threatResponseThreshold,
                         double overseerBaseChance,
                         long overseerMinIntervalMs,
                         double overseerLoadFactor,
                         double overseerMaxChance,
                         double redGlitchBump,
                         double metaAwarenessBump,
                         double observerBump,
                         double rumorDecayRate,
                         double conceptKeepImportance) {
    public static Settings defaults() {
      return new Settings(100, 50, 10, 0.05, 2.5, 0.7,
          0.02, 45_000L, 0.05, 0.6, 0.05, 0.03, 0.02, 0.05, 0.6);
    }
  }

  private final Settings settings;
  private final SimClock clock;
  private final Random rng;

  private int loopCount = 1;
  private int glitchCount = 0;
  private int overseerWarnings = 0;

  private double tension = 0.0;
  private double paranoia = 0.0;
  private double metaAwareness = 0.0;
  private double cohesion = 0.5;

  private boolean observerDetected = false;
  private boolean systemIntegrityCompromised = false;
  private boolean rareRedGlitchOccurred = false;
  private boolean charactersSuspectSimulation = false;
  private boolean protocolLeaked = false;
  private boolean overseerDirectPing = false;
  private boolean deepDiscussion = false;
  private boolean sawOtherSelf = false;

  private final Map<ThreatKind, Double> threatLevels = new EnumMap<>(ThreatKind.class);
  private final Set<ThreatKind> respondedThreats = EnumSet.noneOf(ThreatKind.class);
  private final Deque<NarrativeEvent> history = new ArrayDeque<>();
  private final Map<String, Concept> concepts = new LinkedHashMap<>();
  private final List<Rumor> rumors = new ArrayList<>();
  private final Set<String> observers = new LinkedHashSet<>();
  private long lastOverseerAtMs;
  private String notableEvent;

  public NarrativeMemory(Settings settings, SimClock clock, Random rng) {
    this.settings = settings == null ? Settings.defaults() : settings;
    this.clock = clock;
    this.rng = rng;
    this.lastOverseerAtMs = clock.nowMs();
  }

  public Settings settings() { return settings; }

  public int loopCount() { return loopCount; }
  public int glitchCount() { return glitchCount; }
  public int overseerWarnings() { return overseerWarnings; }
  public double tension() { return tension; }
  public double paranoia() { return paranoia; }
  public double metaAwareness() { return metaAwareness; }
  public double cohesion() { return cohesion; }

  public boolean observerDetected() { return observerDetected; }
  public boolean systemIntegrityCompromised() { return systemIntegrityCompromised; }
  public boolean rareRedGlitchOccurred() { return rareRedGlitchOccurred; }
  public boolean charactersSuspectSimulation() { return charactersSuspectSimulation; }
  public boolean protocolLeaked() { return protocolLeaked; }
  public boolean overseerDirectPing() { return overseerDirectPing; }
  public boolean deepDiscussion() { return deepDiscussion; }
  public boolean sawOtherSelf() { return sawOtherSelf; }
  public int observerCount() { return observers.size(); }
  public long lastOverseerAtMs() { return lastOverseerAtMs; }

  public void setTension(double value) { tension = Lottery.clamp01(value); }
  public void setParanoia(double value) { paranoia = Lottery.clamp01(value); }
  public void setMetaAwareness(double value) { metaAwareness = Lottery.clamp01(value); }
  public void setCohesion(double value) { cohesion = Lottery.clamp01(value); }

  public void adjustTension(double delta) { setTension(tension + delta); }
  public void adjustParanoia(double delta) { setParanoia(paranoia + delta); }
  public void adjustMetaAwareness(double delta) { setMetaAwareness(metaAwareness + delta); }
  public void adjustCohesion(double delta) { setCohesion(cohesion + delta); }

  public void markDeepDiscussion(boolean value) { deepDiscussion = value; }

  public void markObserverDetected() {
    if (!observerDetected) {
      addToHistory(EVENT_OBSERVER, "Observer presence detected", "SYSTEM");
    }
    observerDetected = true;
  }

  /** Registers a viewer; repeated names count once per loop. */
  public void registerObserver(String username) {
    String key = username == null || username.isBlank() ? "anonymous" : username.trim();
    if (observers.add(key)) {
      addToHistory(EVENT_OBSERVER, key + " is watching", key);
    }
    observerDetected = true;
  }

  public void addToHistory(String type, String value, String actor) {
    history.addLast(new NarrativeEvent(type, value == null ? "" : value,
        actor == null ? "SYSTEM" : actor, clock.nowMs(), loopCount));
    while (history.size() > settings.historyCapacity()) {
      history.removeFirst();
    }
  }

  public List<NarrativeEvent> history() {
    return List.copyOf(history);
  }

  public List<NarrativeEvent> recentEvents(int limit) {
    List<NarrativeEvent> all = new ArrayList<>(history);
    int from = Math.max(0, all.size() - Math.max(0, limit));
    return List.copyOf(all.subList(from, all.size()));
  }

  /**
   * Short display name of the latest glitch, threat crossing or trigger, or null when
   * nothing notable has happened this loop. Viewer and overseer lines never set it.
   */
  public String lastNotableEvent() {
    return notableEvent;
  }

  public void recordNotableEvent(String name) {
    if (name == null || name.isBlank()) return;
    notableEvent = name.trim();
  }

  public void addGlitchEvent(String glitchType, String description, double severity) {
    String type = glitchType == null ? "unknown" : glitchType;
    glitchCount++;
    addToHistory(EVENT_GLITCH, type + ": " + (description == null ? "" : description), "GLITCH_SOURCE");
    recordNotableEvent("the " + type);
    setTension(tension + Math.max(0.0, severity) * settings.tensionPerSeverity());

    if (type.toLowerCase(Locale.ROOT).contains("red") || severity > settings.redGlitchSeverity()) {
      rareRedGlitchOccurred = true;
      adjustParanoia(0.1);
      SimulationLogger.log("[Memory] Red glitch recorded: " + type);
    }
  }

  public double threatLevel(ThreatKind kind) {
    return threatLevels.getOrDefault(kind, 0.0);
  }

  public double threatSum() {
    double sum = 0.0;
    for (double v : threatLevels.values()) sum += v;
    return sum;
  }

  public Map<ThreatKind, Double> threatLevels() {
    Map<ThreatKind, Double> copy = new EnumMap<>(ThreatKind.class);
    copy.putAll(threatLevels);
    return Collections.unmodifiableMap(copy);
  }

  /**
   * Clamped accumulation. The first upward crossing of the response threshold in a loop
   * fires that threat's response.
   */
  public double updateThreatLevel(ThreatKind kind, double delta) {
    if (kind == null) return 0.0;
    double before = threatLevel(kind);
    double after = Lottery.clamp01(before + delta);
    threatLevels.put(kind, after);
    double threshold = settings.threatResponseThreshold();
    if (before < threshold && after >= threshold && respondedThreats.add(kind)) {
      respondToThreat(kind);
    }
    return after;
  }

  private void respondToThreat(ThreatKind kind) {
    switch (kind) {
      case REALITY_QUESTIONING -> charactersSuspectSimulation = true;
      case OVERSEER_ATTENTION -> overseerDirectPing = true;
      case SYSTEM_INSTABILITY -> systemIntegrityCompromised = true;
      case SIGNAL_LEAK -> {
        protocolLeaked = true;
        spreadRumor("protocol leak", "SYSTEM", 0.6);
      }
      case IDENTITY_DRIFT -> sawOtherSelf = true;
    }
    addToHistory(EVENT_THREAT, kind.name(), "SYSTEM");
    recordNotableEvent(kind.displayName());
    SimulationLogger.log("[Memory] Threat " + kind + " crossed " + settings.threatResponseThreshold());
  }

  /**
   * Probability that an overseer interruption fires right now, ignoring the cooldown.
   * Non-decreasing in every threat level and in the loop/glitch/warning load.
   */
  public double overseerChance() {
    double load = loopCount + glitchCount + overseerWarnings;
    double chance = settings.overseerBaseChance()
        * (1.0 + threatSum())
        * (1.0 + settings.overseerLoadFactor() * load);
    if (rareRedGlitchOccurred) chance += settings.redGlitchBump();
    if (metaAwareness > 0.7) chance += settings.metaAwarenessBump();
    if (observerDetected) chance += settings.observerBump();
    return Math.min(settings.overseerMaxChance(), chance);
  }

  public boolean overseerCoolingDown() {
    return clock.nowMs() - lastOverseerAtMs < settings.overseerMinIntervalMs();
  }

  /** Cooldown-gated Bernoulli trial; a success is recorded and restarts the cooldown. */
  public boolean shouldInjectOverseer() {
    if (overseerCoolingDown()) return false;
    double chance = overseerChance();
    if (rng.nextDouble() >= chance) return false;

    lastOverseerAtMs = clock.nowMs();
    overseerWarnings++;
    if (overseerWarnings > 4) overseerDirectPing = true;
    addToHistory(EVENT_OVERSEER, String.format(Locale.ROOT, "warning %d (p=%.3f)", overseerWarnings, chance), "OVERSEER");
    SimulationLogger.log("[Memory] Overseer interrupts (warning " + overseerWarnings + ")");
    return true;
  }

  public Concept rememberConcept(String name, String introducedBy, double importanceDelta) {
    if (name == null || name.isBlank()) return null;
    String key = name.trim().toLowerCase(Locale.ROOT);
    Concept existing = concepts.get(key);
    if (existing != null) {
      existing.mention(importanceDelta);
      return existing;
    }
    Concept created = new Concept(key, introducedBy, 0.2 + importanceDelta);
    concepts.put(key, created);
    if (concepts.size() > settings.conceptCapacity()) {
      evictLeastImportantConcept(key);
    }
    return created;
  }

  private void evictLeastImportantConcept(String keep) {
    concepts.values().stream()
        .filter(c -> !c.name().equals(keep))
        .min(Comparator.comparingDouble(Concept::importance).thenComparingInt(Concept::mentions))
        .ifPresent(c -> concepts.remove(c.name()));
  }

  public boolean hasConcept(String name) {
    return name != null && concepts.containsKey(name.trim().toLowerCase(Locale.ROOT));
  }

  public Concept concept(String name) {
    return name == null ? null : concepts.get(name.trim().toLowerCase(Locale.ROOT));
  }

  public List<Concept> concepts() {
    return List.copyOf(concepts.values());
  }

  public Rumor spreadRumor(String text, String origin, double credibility) {
    if (text == null || text.isBlank()) return null;
    String key = text.trim().toLowerCase(Locale.ROOT);
    for (Rumor r : rumors) {
      if (r.text().equals(key)) {
        r.reinforce(0.05);
        return r;
      }
    }
    Rumor rumor = new Rumor(key, origin, credibility, clock.nowMs());
    rumors.add(rumor);
    if (rumors.size() > settings.rumorCapacity()) {
      rumors.stream().min(Comparator.comparingDouble(Rumor::strength))
          .ifPresent(rumors::remove);
    }
    addToHistory("Rumor", key, origin);
    return rumor;
  }

  public void decayRumors() {
    for (Rumor r : rumors) r.decay(settings.rumorDecayRate());
    rumors.removeIf(r -> r.strength() < 0.05);
  }

  public boolean isRumorActive(String keyword) {
    if (keyword == null || keyword.isBlank()) return false;
    String k = keyword.toLowerCase(Locale.ROOT);
    for (Rumor r : rumors) {
      if (r.text().contains(k)) return true;
    }
    return false;
  }

  public List<Rumor> activeRumors() {
    return List.copyOf(rumors);
  }

  /**
   * Starts the next loop. Emotional state decays instead of clearing; per-loop flags,
   * rumors and observers are dropped; important concepts survive.
   */
  public void reset() {
    addToHistory(EVENT_RESET, "Ending Loop " + loopCount, "SYSTEM");
    loopCount++;
    addToHistory(EVENT_RESET, "Beginning Loop " + loopCount, "SYSTEM");

    glitchCount = 0;
    overseerWarnings = 0;
    rareRedGlitchOccurred = false;
    systemIntegrityCompromised = false;
    observerDetected = false;
    protocolLeaked = false;
    overseerDirectPing = false;
    deepDiscussion = false;
    sawOtherSelf = false;

    tension = Lottery.clamp01(tension * 0.3);
    paranoia = Lottery.clamp01(paranoia * 0.5);
    metaAwareness = Lottery.clamp01(metaAwareness * 0.9 + 0.05);
    cohesion = Lottery.clamp01(cohesion + (0.5 - cohesion) * 0.5);

    threatLevels.replaceAll((k, v) -> v * 0.5);
    respondedThreats.clear();
    rumors.clear();
    observers.clear();
    notableEvent = null;
    concepts.values().removeIf(c -> c.importance() < settings.conceptKeepImportance());
    lastOverseerAtMs = clock.nowMs();
    SimulationLogger.log("[Memory] Loop " + loopCount + " begins (meta-awareness " + fmt(metaAwareness) + ")");
  }

  public Map<String, Object> snapshot() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("loopCount", loopCount);
    out.put("glitchCount", glitchCount);
    out.put("overseerWarnings", overseerWarnings);
    out.put("tension", round(tension));
    out.put("paranoia", round(paranoia));
    out.put("metaAwareness", round(metaAwareness));
    out.put("cohesion", round(cohesion));
    out.put("observerCount", observers.size());

    Map<String, Object> flags = new LinkedHashMap<>();
    flags.put("observerDetected", observerDetected);
    flags.put("systemIntegrityCompromised", systemIntegrityCompromised);
    flags.put("rareRedGlitchOccurred", rareRedGlitchOccurred);
    flags.put("charactersSuspectSimulation", charactersSuspectSimulation);
    flags.put("protocolLeaked", protocolLeaked);
    flags.put("overseerDirectPing", overseerDirectPing);
    flags.put("deepDiscussion", deepDiscussion);
    flags.put("sawOtherSelf", sawOtherSelf);
    out.put("flags", flags);

    Map<String, Object> threats = new LinkedHashMap<>();
    threatLevels.forEach((k, v) -> threats.put(k.name(), round(v)));
    out.put("threats", threats);

    List<Object> conceptList = new ArrayList<>();
    for (Concept c : concepts.values()) {
      Map<String, Object> m = new LinkedHashMap<>();
      m.put("name", c.name());
      m.put("mentions", c.mentions());
      m.put("importance", round(c.importance()));
      m.put("introducedBy", c.introducedBy());
      conceptList.add(m);
    }
    out.put("concepts", conceptList);

    List<Object> rumorList = new ArrayList<>();
    for (Rumor r : rumors) {
      Map<String, Object> m = new LinkedHashMap<>();
      m.put("text", r.text());
      m.put("origin", r.origin());
      m.put("strength", round(r.strength()));
      m.put("credibility", round(r.credibility()));
      rumorList.add(m);
    }
    out.put("rumors", rumorList);
    out.put("recentEvents", recentEvents(10).stream().map(NarrativeEvent::toString).toList());
    return out;
  }

  public String describe() {
    StringBuilder sb = new StringBuilder();
    sb.append("Loop ").append(loopCount)
        .append(" | glitches ").append(glitchCount)
        .append(" | warnings ").append(overseerWarnings).append('\n');
    sb.append("Tension ").append(fmt(tension))
        .append(" | Paranoia ").append(fmt(paranoia))
        .append(" | Awareness ").append(fmt(metaAwareness))
        .append(" | Cohesion ").append(fmt(cohesion)).append('\n');
    if (!threatLevels.isEmpty()) {
      sb.append("Threats:");
      threatLevels.forEach((k, v) -> sb.append(' ').append(k).append('=').append(fmt(v)));
      sb.append('\n');
    }
    sb.append("Observers ").append(observers.size())
        .append(observerDetected ? " (detected)" : "")
        .append(rareRedGlitchOccurred ? " | RED GLITCH" : "")
        .append(charactersSuspectSimulation ? " | suspects simulation" : "");
    return sb.toString();
  }

  private static double round(double v) {
    return Math.round(v * 1000.0) / 1000.0;
  }

  private static String fmt(double v) {
    return String.format(Locale.ROOT, "%.2f", v);
  }
}
