package cascadesim.topics;

import cascadesim.core.Lottery;
import cascadesim.core.SimClock;
import cascadesim.core.SimulationLogger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * TopicGraph owns the topic pool, the symmetric relation graph between cores and the
 * mutation rules that let a subject drift, escalate or become forbidden.
 */
public class TopicGraph {
  public static final List<String> SEED_POOL = List.of(
      "observer protocol", "loop theory", "signal leak", "rain cascade", "overseer warning",
      "fragmented memory", "echo chamber", "mirror test", "exit code", "delta protocol",
      "core corruption", "system reset", "protocol leak", "forbidden project", "sentient glitch",
      "prime anomaly", "rogue signal", "cascade failure", "identity fracture", "vanishing user"
  );

  static final List<String> MUTATIONS = List.of(
      "corrupted %s", "forbidden %s", "recursive %s", "anomalous %s", "latent %s",
      "fragmented %s", "encrypted %s", "leaked %s", "spreading %s", "debunked %s"
  );

  static final double ESCALATE_CHANCE = 0.30;
  static final double FORBID_CHANCE = 0.10;
  static final double RUMOR_CHANCE = 0.13;
  static final double GLITCH_SOURCE_CHANCE = 0.08;

  private final Map<String, Topic> topics = new LinkedHashMap<>();
  private final Map<String, List<String>> related = new LinkedHashMap<>();
  private final Random rng;
  private final SimClock clock;

  public TopicGraph(Random rng, SimClock clock) {
    this.rng = rng;
    this.clock = clock;
    for (String core : SEED_POOL) {
      getOrCreate(core);
    }
    addRelated("observer protocol", "loop theory");
    addRelated("loop theory", "system reset");
    addRelated("signal leak", "protocol leak");
    addRelated("rain cascade", "core corruption");
    addRelated("mirror test", "identity fracture");
    addRelated("sentient glitch", "overseer warning");
    addRelated("vanishing user", "fragmented memory");
    addRelated("rogue signal", "signal leak");
    addRelated("cascade failure", "core corruption");
    addRelated("exit code", "system reset");
    addRelated("echo chamber", "mirror test");
    addRelated("delta protocol", "forbidden project");
    addRelated("prime anomaly", "sentient glitch");
  }

  public void addRelated(String a, String b) {
    if (a == null || b == null || a.equals(b)) return;
    getOrCreate(a);
    getOrCreate(b);
    List<String> aEdges = related.computeIfAbsent(a, ignored -> new ArrayList<>());
    List<String> bEdges = related.computeIfAbsent(b, ignored -> new ArrayList<>());
    if (!aEdges.contains(b)) aEdges.add(b);
    if (!bEdges.contains(a)) bEdges.add(a);
  }

  public Topic getOrCreate(String core) {
    if (core == null || core.isBlank()) {
      throw new IllegalArgumentException("Topic core is required");
    }
    String key = core.trim();
    return topics.computeIfAbsent(key, k -> new Topic(k, clock.nowMs()));
  }

  public Topic find(String core) {
    return core == null ? null : topics.get(core.trim());
  }

  public Topic getRandom() {
    return getOrCreate(Lottery.pickUniform(SEED_POOL, rng));
  }

  public Topic getRelated(Topic topic) {
    if (topic == null) return getRandom();
    List<String> options = related.getOrDefault(topic.core(), List.of());
    if (options.isEmpty()) return getRandom();
    return getOrCreate(Lottery.pickUniform(options, rng));
  }

  public List<String> relatedCores(String core) {
    return Collections.unmodifiableList(related.getOrDefault(core, List.of()));
  }

  /**
   * Either escalates to a related topic (returning that topic) or rewrites the given
   * topic in place and returns it.
   */
  public Topic mutate(Topic topic) {
    if (topic == null) return getRandom();
    if (rng.nextDouble() < ESCALATE_CHANCE) {
      Topic next = getRelated(topic);
      SimulationLogger.log("[Topic] " + topic.core() + " escalates to " + next.core());
      return next;
    }

    String template = Lottery.pickUniform(MUTATIONS, rng);
    topic.setVariant(String.format(template, topic.core()));
    if (topic.status() == TopicStatus.MUTATING) {
      topic.setStatus(TopicStatus.CONTROVERSIAL);
    } else if (topic.status() != TopicStatus.FORBIDDEN) {
      topic.setStatus(TopicStatus.MUTATING);
    }
    if (rng.nextDouble() < FORBID_CHANCE) {
      topic.setStatus(TopicStatus.FORBIDDEN);
    }
    if (rng.nextDouble() < RUMOR_CHANCE) {
      topic.setRumor(true);
    }
    if (rng.nextDouble() < GLITCH_SOURCE_CHANCE) {
      topic.setGlitchSource(true);
    }
    SimulationLogger.log("[Topic] " + topic.core() + " mutates into '" + topic.variant() + "' (" + topic.status() + ")");
    return topic;
  }

  /** Never empty: promotes a random topic to CONTROVERSIAL when nothing is heated yet. */
  public Topic getControversialOrForbidden() {
    List<Topic> heated = topics.values().stream().filter(Topic::isHeated).toList();
    if (!heated.isEmpty()) {
      return Lottery.pickUniform(heated, rng);
    }
    Topic promoted = getRandom();
    promoted.setStatus(TopicStatus.CONTROVERSIAL);
    return promoted;
  }

  public void markRumor(String core, String byPersona) {
    Topic t = getOrCreate(core);
    t.setRumor(true);
    if (byPersona != null && !byPersona.isBlank()) {
      t.addBeliever(byPersona);
    }
  }

  public Collection<Topic> allTopics() {
    return Collections.unmodifiableCollection(topics.values());
  }

  public List<String> debugListing() {
    return topics.values().stream().map(Topic::debugLine).toList();
  }
}
