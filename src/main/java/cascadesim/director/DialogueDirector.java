package cascadesim.director;

import cascadesim.agents.Persona;
import cascadesim.agents.PersonaRole;
import cascadesim.core.Lottery;
import cascadesim.core.SimClock;
import cascadesim.core.SimulationLogger;
import cascadesim.dialogue.ConversationPhase;
import cascadesim.dialogue.ConversationThread;
import cascadesim.dialogue.GeneratedReply;
import cascadesim.dialogue.Intent;
import cascadesim.dialogue.Message;
import cascadesim.dialogue.MessageSource;
import cascadesim.dialogue.OverlapScorer;
import cascadesim.dialogue.ReplyContext;
import cascadesim.dialogue.ReplyGenerator;
import cascadesim.dialogue.ThreadRegistry;
import cascadesim.dialogue.ThreadStatus;
import cascadesim.memory.NarrativeMemory;
import cascadesim.memory.ThreatKind;
import cascadesim.topics.Topic;
import cascadesim.topics.TopicGraph;
import cascadesim.topics.TopicStatus;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Top-level orchestrator. Each call to {@link #produceNextMessage()} is one tick: it decides
 * whether anyone speaks, keeps a live thread, picks the speaker and line, and feeds the
 * result back into the narrative state.
 *
 * <p>All public operations are synchronized on the director, which makes one tick the unit
 * of mutual exclusion for memory, topics, personas and threads.
 */
public class DialogueDirector {
  public record Settings(int maxRetries,
                         long forceAfterIdleMs,
                         long maxThreadIdleMs,
                         int turnCeiling,
                         int resolutionMessagesToEnd,
                         int turnsAfterClimax,
                         double leadChance,
                         double thirdParticipantChance,
                         double mutateChance,
                         double forceTension,
                         int userQueueCapacity,
                         PacingPolicy pacing) {
    public static Settings defaults() {
      return new Settings(5, 12_000L, 120_000L, 30, 2, 8, 0.95, 0.25, 0.15, 0.9, 20,
          PacingPolicy.defaults());
    }
  }

  private record PendingUserMessage(String username, String text, long receivedAtMs) {}

  private static final Map<ThreatKind, List<String>> THREAT_KEYWORDS = new LinkedHashMap<>();
  static {
    THREAT_KEYWORDS.put(ThreatKind.REALITY_QUESTIONING, List.of("simulation", "real", "fake"));
    THREAT_KEYWORDS.put(ThreatKind.OVERSEER_ATTENTION, List.of("overseer", "watching", "watched"));
    THREAT_KEYWORDS.put(ThreatKind.SIGNAL_LEAK, List.of("leak", "signal", "transmission"));
    THREAT_KEYWORDS.put(ThreatKind.SYSTEM_INSTABILITY, List.of("glitch", "corrupt", "corrupted", "crash"));
    THREAT_KEYWORDS.put(ThreatKind.IDENTITY_DRIFT, List.of("mirror", "identity", "self", "copy"));
  }
  static final double THREAT_STEP = 0.05;
  private static final int MAX_USER_TEXT = 240;
  private static final Set<String> STOP_WORDS = Set.of(
      "about", "there", "their", "these", "those", "which", "would", "could", "should", "where", "what's");

  private final List<Persona> cast;
  private final Map<String, Persona> castByName = new LinkedHashMap<>();
  private final TopicGraph topics;
  private final NarrativeMemory memory;
  private final ThreadRegistry threads;
  private final ReplyGenerator replies;
  private final SpeakerSelector speakers;
  private final ConversationDynamics dynamics = new ConversationDynamics();
  private final GlitchSource glitches;
  private final NarrativeTriggers triggers;
  private final Settings settings;
  private final SimClock clock;
  private final Random rng;

  private final Deque<PendingUserMessage> userQueue = new ArrayDeque<>();
  private final Set<String> usedStateTopics = new HashSet<>();
  private int stateTopicLoop;
  private ConversationThread current;
  private Topic pendingTopic;
  private boolean crisisMode = false;
  private long nextEligibleAtMs;
  private long lastMessageAtMs;
  private long lastExternalActivityMs;

  public DialogueDirector(List<Persona> cast,
                          TopicGraph topics,
                          NarrativeMemory memory,
                          ThreadRegistry threads,
                          ReplyGenerator replies,
                          Settings settings,
                          SimClock clock,
                          Random rng) {
    if (cast == null || cast.isEmpty()) {
      throw new IllegalArgumentException("Director needs at least one persona");
    }
    this.cast = List.copyOf(cast);
    for (Persona p : this.cast) castByName.put(p.name(), p);
    this.topics = topics;
    this.memory = memory;
    this.threads = threads;
    this.replies = replies;
    this.settings = settings == null ? Settings.defaults() : settings;
    this.clock = clock;
    this.rng = rng;
    this.speakers = new SpeakerSelector(replies.library(), rng);
    this.glitches = new GlitchSource(rng);
    this.triggers = NarrativeTriggers.withDefaults(glitches);
    long now = clock.nowMs();
    this.nextEligibleAtMs = now;
    this.lastMessageAtMs = now;
    this.lastExternalActivityMs = now;
    this.stateTopicLoop = memory.loopCount();
  }

  public NarrativeMemory memory() { return memory; }
  public TopicGraph topics() { return topics; }
  public List<Persona> cast() { return cast; }
  public NarrativeTriggers triggers() { return triggers; }

  public synchronized ConversationThread currentThread() { return current; }
  public synchronized long nextEligibleAt() { return nextEligibleAtMs; }
  public synchronized boolean crisisMode() { return crisisMode; }
  public synchronized int queuedUserMessages() { return userQueue.size(); }

  public Persona persona(String name) {
    return name == null ? null : castByName.get(name);
  }

  /**
   * One tick. Returns the next line, or null when pacing says nobody should speak yet or
   * the tick was skipped.
   */
  public synchronized Message produceNextMessage() {
    long now = clock.nowMs();
    memory.decayRumors();
    threads.pruneStale(now, settings.maxThreadIdleMs());
    triggers.evaluate(memory);

    if (memory.shouldInjectOverseer()) {
      return injectOverseer(now);
    }

    PendingUserMessage user = userQueue.pollFirst();
    if (user != null) {
      return respondToUser(user, now);
    }

    boolean urgent = current != null && current.consumeUrgentPacing();
    long idleSince = Math.max(lastMessageAtMs, lastExternalActivityMs);
    boolean forced = memory.tension() > settings.forceTension()
        || urgent
        || now - idleSince > settings.forceAfterIdleMs();
    if (!forced && now < nextEligibleAtMs) {
      return null;
    }
    return speak(ensureThread(now), null, now);
  }

  /** Queues a viewer line; it is answered on the next tick regardless of pacing. */
  public synchronized void enqueueUserMessage(String username, String text) {
    String clean = sanitize(text);
    if (clean.isBlank()) return;
    String name = username == null || username.isBlank() ? "anonymous" : username.trim();
    if (userQueue.size() >= settings.userQueueCapacity()) {
      PendingUserMessage dropped = userQueue.pollFirst();
      SimulationLogger.log("[Director] User queue full, dropping message from " + dropped.username());
    }
    userQueue.addLast(new PendingUserMessage(name, clean, clock.nowMs()));
  }

  public synchronized void reportExternalActivity() {
    lastExternalActivityMs = clock.nowMs();
  }

  public synchronized void notifyCrisisMode(boolean active) {
    if (crisisMode != active) {
      SimulationLogger.log("[Director] Crisis mode " + (active ? "on" : "off"));
    }
    crisisMode = active;
    if (active && current != null) current.requestUrgentPacing();
  }

  public synchronized int fireTrigger(NarrativeTriggers.Trigger trigger) {
    return triggers.fire(trigger, memory);
  }

  /** Starts the next loop: memory decays, every thread closes and reply history clears. */
  public synchronized void resetSession() {
    long now = clock.nowMs();
    memory.reset();
    threads.closeAll();
    current = null;
    pendingTopic = null;
    replies.clear();
    speakers.clear();
    userQueue.clear();
    usedStateTopics.clear();
    stateTopicLoop = memory.loopCount();
    triggers.rearm();
    crisisMode = false;
    nextEligibleAtMs = now;
    lastMessageAtMs = now;
    lastExternalActivityMs = now;
    SimulationLogger.log("[Director] Session reset, loop " + memory.loopCount());
  }

  public synchronized Ambience ambience() {
    Persona lead = lead();
    return Ambience.from(lead == null ? null : lead.mood());
  }

  private Message injectOverseer(long now) {
    List<String> lines = replies.library().overseerLines();
    String text = lines.isEmpty() ? "This conversation has been logged." : Lottery.pickUniform(lines, rng);
    String threadId = current == null ? null : current.id();
    Message message = new Message("OVERSEER", text, Intent.STATEMENT, MessageSource.OVERSEER,
        threadId, now, false, 1.0);
    if (current != null && current.registerMessage(message, now)) {
      current.transitionTo(ThreadStatus.INTERRUPTED);
    }
    memory.adjustTension(0.1);
    memory.adjustParanoia(0.05);
    memory.updateThreatLevel(ThreatKind.OVERSEER_ATTENTION, 0.15);
    for (Persona p : cast) {
      p.adjustFear(0.05 * p.traits().neuroticism());
      p.adjustSuspicion(0.03);
      p.absorbTension(memory.tension());
      p.updateMood();
    }
    finishTick(now, current == null ? ConversationPhase.CLIMAX : current.phase());
    return message;
  }

  private Message respondToUser(PendingUserMessage user, long now) {
    memory.registerObserver(user.username());
    rememberViewerConcepts(user);
    triggers.fire(NarrativeTriggers.Trigger.VIEWER_MESSAGE, memory);
    memory.addToHistory("ViewerMessage", user.text(), user.username());

    ConversationThread thread = ensureThread(now);
    thread.registerMessage(Message.viewer(user.username(), user.text(), thread.id(), now), now);
    for (Persona p : thread.participants()) p.considerTopic(user.text());
    return speak(thread, user.username(), now);
  }

  private void rememberViewerConcepts(PendingUserMessage user) {
    String lower = user.text().toLowerCase(Locale.ROOT);
    for (Topic t : topics.allTopics()) {
      if (lower.contains(t.core())) {
        memory.rememberConcept(t.core(), user.username(), 0.2);
        pendingTopic = t;
      }
    }
    int remembered = 0;
    for (String word : OverlapScorer.words(user.text())) {
      if (remembered >= 3) break;
      if (word.length() < 5 || STOP_WORDS.contains(word)) continue;
      memory.rememberConcept(word, user.username(), 0.1);
      remembered++;
    }
  }

  private Message speak(ConversationThread thread, String replyTo, long now) {
    Persona speaker = speakers.select(thread, memory, now);
    if (speaker == null) {
      SimulationLogger.log("[Director] No speaker available in " + thread.id() + ", skipping tick");
      return null;
    }
    Topic topic = thread.topic();
    String previousSpeaker = thread.lastSpeaker();
    speaker.considerTopic(topic.displayName());
    speaker.absorbTension(memory.tension());
    speaker.updateMood();

    Topic related = topics.relatedCores(topic.core()).isEmpty() ? null : topics.getRelated(topic);
    ReplyContext ctx = new ReplyContext(replyTo != null ? replyTo : previousSpeaker,
        memory.lastNotableEvent(), related);

    GeneratedReply reply = generate(speaker, thread, ctx);
    if (reply == null) {
      SimulationLogger.log("[Director] " + speaker.name() + " kept repeating in " + thread.id() + ", thread goes stale");
      thread.markStale();
      return null;
    }

    String text = reply.text();
    Message message = new Message(speaker.name(), text, reply.intent(), MessageSource.PERSONA, thread.id(), now,
        speaker.shouldHesitateOnTopic(text), speaker.getTypingSpeedMultiplier(text));
    thread.registerMessage(message, now);
    speakers.recordSpoke(speaker.name(), now);
    memory.addToHistory(NarrativeMemory.EVENT_DIALOGUE, text, speaker.name());
    topic.markDiscussed(speaker.name(), now);
    if (reply.intent() == Intent.CHALLENGE) topic.markDoubted(speaker.name());

    Persona other = persona(previousSpeaker);
    if (other != null && other != speaker) {
      speaker.updateRelationship(other.name(), reply.intent().interactionKind(), text);
      other.updateRelationship(speaker.name(), reply.intent().interactionKind(), text);
    }

    applyThreatKeywords(text);
    dynamics.apply(message, thread, memory);
    maybeMutateTopic(thread);
    glitches.maybeGlitch(memory, topic);

    for (Persona p : thread.participants()) {
      p.absorbTension(memory.tension());
      p.updateMood();
    }
    finishTick(now, thread.phase());
    return message;
  }

  /** Up to maxRetries attempts; null means every attempt, fallback lines included, was a near duplicate. */
  private GeneratedReply generate(Persona speaker, ConversationThread thread, ReplyContext ctx) {
    for (int attempt = 0; attempt < settings.maxRetries(); attempt++) {
      try {
        Intent intent = replies.chooseIntent(speaker, thread, memory);
        GeneratedReply candidate = replies.generate(intent, speaker, thread.topic(), thread, ctx);
        if (!candidate.repeated()) return candidate;
      } catch (RuntimeException e) {
        SimulationLogger.log("[Director] Reply failed for " + speaker.name() + ": " + e.getMessage());
        GeneratedReply fallback = replies.fallback(replies.library().fallbackLinesFor(speaker.name()), thread);
        if (fallback != null) return fallback;
      }
    }
    return null;
  }

  private void applyThreatKeywords(String text) {
    var words = OverlapScorer.words(text);
    for (var entry : THREAT_KEYWORDS.entrySet()) {
      for (String keyword : entry.getValue()) {
        if (words.contains(keyword)) {
          memory.updateThreatLevel(entry.getKey(), THREAT_STEP);
          break;
        }
      }
    }
  }

  private void maybeMutateTopic(ConversationThread thread) {
    if (thread.phase() != ConversationPhase.COMPLICATION || !thread.isActive()) return;
    if (rng.nextDouble() >= settings.mutateChance()) return;
    Topic before = thread.topic();
    Topic after = topics.mutate(before);
    if (after != before) {
      pendingTopic = after;
      thread.transitionTo(ThreadStatus.ESCALATING);
    } else if (after.status() == TopicStatus.FORBIDDEN) {
      memory.adjustParanoia(0.05);
    }
  }

  private void finishTick(long now, ConversationPhase phase) {
    lastMessageAtMs = now;
    nextEligibleAtMs = now + settings.pacing().nextDelayMs(phase, memory.tension(), crisisMode, rng);
  }

  private ConversationThread ensureThread(long now) {
    if (needsNewThread(current)) {
      if (current != null) current.close();
      current = startThread(now);
    }
    return current;
  }

  boolean needsNewThread(ConversationThread t) {
    if (t == null || !t.isActive()) return true;
    if (t.phase() == ConversationPhase.RESOLUTION && t.resolutionMessages() >= settings.resolutionMessagesToEnd()) {
      return true;
    }
    if (t.turnCount() >= settings.turnCeiling()) return true;
    return t.hasClimaxed() && t.phase() == ConversationPhase.RESOLUTION
        && t.turnsSinceClimax() >= settings.turnsAfterClimax();
  }

  private ConversationThread startThread(long now) {
    List<Persona> participants = chooseParticipants();
    Topic topic = chooseTopic();
    pendingTopic = null;
    boolean allowInterruption = memory.tension() > 0.5;
    ConversationThread thread = threads.start(participants, topic, allowInterruption, now);
    thread.adjustLocalTension(memory.tension());
    for (Persona p : participants) p.considerTopic(topic.displayName());
    memory.addToHistory("ThreadStart", topic.displayName(), "DIRECTOR");
    SimulationLogger.log("[Director] Started " + thread.describe() + " with "
        + participants.stream().map(Persona::name).toList());
    return thread;
  }

  List<Persona> chooseParticipants() {
    List<Persona> chosen = new ArrayList<>();
    Persona lead = lead();
    if (lead != null && rng.nextDouble() < settings.leadChance()) chosen.add(lead);

    Persona partner = affinityPartner(chosen);
    if (partner != null) chosen.add(partner);

    if (rng.nextDouble() < settings.thirdParticipantChance()) {
      Persona third = Lottery.pickUniform(notChosen(chosen), rng);
      if (third != null) chosen.add(third);
    }
    while (chosen.size() < Math.min(2, cast.size())) {
      chosen.add(Lottery.pickUniform(notChosen(chosen), rng));
    }
    return chosen;
  }

  private Persona affinityPartner(List<Persona> chosen) {
    PersonaRole wanted = null;
    if (memory.overseerWarnings() >= 3) {
      wanted = PersonaRole.ANXIOUS;
    } else if (memory.tension() > 0.6) {
      wanted = PersonaRole.SKEPTIC;
    } else if (memory.metaAwareness() > 0.5) {
      wanted = PersonaRole.VISIONARY;
    }
    List<Persona> options = notChosen(chosen);
    if (wanted != null) {
      for (Persona p : options) {
        if (p.role() == wanted) return p;
      }
    }
    return Lottery.pickUniform(options, rng);
  }

  private List<Persona> notChosen(List<Persona> chosen) {
    List<Persona> out = new ArrayList<>();
    for (Persona p : cast) {
      if (!chosen.contains(p)) out.add(p);
    }
    return out;
  }

  /**
   * Narrative state picks the topic in precedence order. Each state-driven topic is used
   * once per loop so a lingering flag cannot pin every thread to the same subject.
   */
  Topic chooseTopic() {
    if (stateTopicLoop != memory.loopCount()) {
      usedStateTopics.clear();
      stateTopicLoop = memory.loopCount();
    }
    if (memory.rareRedGlitchOccurred() && usedStateTopics.add("red cascade")) {
      return topics.getOrCreate("red cascade");
    }
    if (memory.overseerWarnings() >= 3 && usedStateTopics.add("overseer warning")) {
      return topics.getOrCreate("overseer warning");
    }
    if (memory.observerDetected()) {
      String core = "observer " + memory.observerCount();
      if (usedStateTopics.add(core)) {
        topics.addRelated(core, "observer protocol");
        return topics.getOrCreate(core);
      }
    }
    if (memory.isRumorActive("protocol") && usedStateTopics.add("protocol leak")) {
      return topics.getOrCreate("protocol leak");
    }
    if (pendingTopic != null) {
      return pendingTopic;
    }
    if (memory.tension() > 0.6) {
      return topics.getControversialOrForbidden();
    }
    return topics.getRandom();
  }

  private Persona lead() {
    for (Persona p : cast) {
      if (p.profile().isLead()) return p;
    }
    return cast.get(0);
  }

  private static String sanitize(String value) {
    if (value == null) return "";
    String trimmed = value.replace("\r", " ").replace("\n", " ").trim();
    return trimmed.length() > MAX_USER_TEXT ? trimmed.substring(0, MAX_USER_TEXT) : trimmed;
  }

  public synchronized String describe() {
    StringBuilder sb = new StringBuilder();
    sb.append("Thread: ").append(current == null ? "none" : current.describe()).append('\n');
    sb.append("Crisis ").append(crisisMode)
        .append(" | queued ").append(userQueue.size())
        .append(" | next in ").append(Math.max(0, nextEligibleAtMs - clock.nowMs())).append("ms")
        .append(" | ambience ").append(ambience()).append('\n');
    for (Persona p : cast) {
      sb.append("  ").append(p).append('\n');
    }
    sb.append(memory.describe());
    return sb.toString();
  }

  public synchronized Map<String, Object> snapshot() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("thread", current == null ? null : current.describe());
    out.put("phase", current == null ? null : current.phase().name());
    out.put("crisisMode", crisisMode);
    out.put("queuedUserMessages", userQueue.size());
    out.put("nextEligibleInMs", Math.max(0, nextEligibleAtMs - clock.nowMs()));
    out.put("ambience", ambience().name());
    List<Object> personas = new ArrayList<>();
    for (Persona p : cast) {
      Map<String, Object> m = new LinkedHashMap<>();
      m.put("name", p.name());
      m.put("role", p.role().name());
      m.put("mood", p.mood().name());
      m.put("curiosity", Math.round(p.curiosity() * 1000) / 1000.0);
      m.put("fear", Math.round(p.fear() * 1000) / 1000.0);
      m.put("relationships", p.relationships().size());
      personas.add(m);
    }
    out.put("personas", personas);
    out.put("memory", memory.snapshot());
    return out;
  }
}
