package cascadesim.dialogue;

import cascadesim.agents.Persona;
import cascadesim.core.Lottery;
import cascadesim.core.SimulationLogger;
import cascadesim.topics.Topic;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * A bounded conversational episode: one topic, a few participants and a phase state
 * machine that only moves forward. Once the status leaves ACTIVE the thread is never
 * reactivated; the director starts a new one instead.
 */
public class ConversationThread {
  public static final int DEFAULT_MESSAGES_PER_PHASE = 5;
  static final int DEFAULT_HISTORY = 30;

  private final String id;
  private final Topic topic;
  private final List<Persona> participants;
  private final IntentTaxonomy taxonomy;
  private final int messagesPerPhase;
  private final int historyCapacity;
  private final boolean allowInterruption;
  private final long createdAtMs;
  private final Deque<String> history = new ArrayDeque<>();

  private String lastSpeaker;
  private int turnCount = 0;
  private int messagesInPhase = 0;
  private int resolutionMessages = 0;
  private int turnsSinceClimax = 0;
  private boolean climaxed = false;
  private boolean urgent = false;
  private ConversationPhase phase = ConversationPhase.INTRODUCTION;
  private ThreadStatus status = ThreadStatus.ACTIVE;
  private long lastActivityMs;
  private double localTension = 0.0;
  private double localCohesion = 0.5;

  public ConversationThread(String id, Topic topic, List<Persona> participants, IntentTaxonomy taxonomy,
                            int messagesPerPhase, boolean allowInterruption, long nowMs) {
    this(id, topic, participants, taxonomy, messagesPerPhase, DEFAULT_HISTORY, allowInterruption, nowMs);
  }

  public ConversationThread(String id, Topic topic, List<Persona> participants, IntentTaxonomy taxonomy,
                            int messagesPerPhase, int historyCapacity, boolean allowInterruption, long nowMs) {
    if (participants == null || participants.isEmpty()) {
      throw new IllegalArgumentException("Thread " + id + " needs at least one participant");
    }
    this.id = id;
    this.topic = topic;
    this.participants = List.copyOf(participants);
    this.taxonomy = taxonomy == null ? IntentTaxonomy.withQuestions() : taxonomy;
    this.messagesPerPhase = messagesPerPhase > 0 ? messagesPerPhase : DEFAULT_MESSAGES_PER_PHASE;
    this.historyCapacity = Math.max(1, historyCapacity);
    this.allowInterruption = allowInterruption;
    this.createdAtMs = nowMs;
    this.lastActivityMs = nowMs;
  }

  public String id() { return id; }
  public Topic topic() { return topic; }
  public List<Persona> participants() { return participants; }
  public String lastSpeaker() { return lastSpeaker; }
  public int turnCount() { return turnCount; }
  public int messagesInPhase() { return messagesInPhase; }
  public int resolutionMessages() { return resolutionMessages; }
  public int turnsSinceClimax() { return turnsSinceClimax; }
  public boolean hasClimaxed() { return climaxed; }
  public ConversationPhase phase() { return phase; }
  public ThreadStatus status() { return status; }
  public long createdAtMs() { return createdAtMs; }
  public long lastActivityMs() { return lastActivityMs; }
  public boolean allowsInterruption() { return allowInterruption; }
  public double localTension() { return localTension; }
  public double localCohesion() { return localCohesion; }

  public boolean isActive() {
    return status == ThreadStatus.ACTIVE;
  }

  public boolean hasParticipant(String name) {
    for (Persona p : participants) {
      if (p.name().equals(name)) return true;
    }
    return false;
  }

  /**
   * Records a message and advances the phase once the per-phase threshold is exceeded.
   * A closed thread refuses the message.
   */
  public boolean registerMessage(Message message, long nowMs) {
    if (message == null || status == ThreadStatus.CLOSED) return false;
    lastSpeaker = message.speaker();
    turnCount++;
    messagesInPhase++;
    lastActivityMs = nowMs;
    if (phase == ConversationPhase.RESOLUTION) resolutionMessages++;
    if (climaxed) turnsSinceClimax++;
    history.addLast(message.text());
    while (history.size() > historyCapacity) history.removeFirst();
    updatePhase();
    return true;
  }

  private void updatePhase() {
    if (messagesInPhase <= messagesPerPhase) return;
    messagesInPhase = 0;
    if (!phase.isFinal()) {
      phase = phase.next();
      if (phase == ConversationPhase.CLIMAX) {
        climaxed = true;
        urgent = true;
      }
      SimulationLogger.log("[Thread] " + id + " advanced to " + phase);
    } else {
      transitionTo(ThreadStatus.STALE);
    }
  }

  /**
   * Moves the status. Returning to ACTIVE is illegal, and CLOSED is terminal.
   */
  public void transitionTo(ThreadStatus next) {
    if (next == null || next == status) return;
    if (next == ThreadStatus.ACTIVE) {
      throw new IllegalStateException("Thread " + id + " cannot be reactivated from " + status);
    }
    if (status == ThreadStatus.CLOSED) return;
    SimulationLogger.log("[Thread] " + id + " " + status + " -> " + next);
    status = next;
  }

  public void markStale() { transitionTo(ThreadStatus.STALE); }
  public void close() { transitionTo(ThreadStatus.CLOSED); }

  public Intent getPhaseAppropriateIntent(Persona persona) {
    return switch (phase) {
      case INTRODUCTION -> taxonomy.allows(Intent.QUESTION) && persona != null && persona.curiosity() >= 0.5
          ? Intent.QUESTION
          : Intent.STATEMENT;
      case DEVELOPMENT -> Intent.THEORY;
      case COMPLICATION -> Intent.CHALLENGE;
      case CLIMAX -> Intent.FEAR;
      case RESOLUTION -> Intent.STATEMENT;
    };
  }

  public void requestUrgentPacing() {
    urgent = true;
  }

  /** True once per request: reading the flag clears it. */
  public boolean consumeUrgentPacing() {
    boolean was = urgent;
    urgent = false;
    return was;
  }

  public void adjustLocalTension(double delta) { localTension = Lottery.clamp01(localTension + delta); }
  public void adjustLocalCohesion(double delta) { localCohesion = Lottery.clamp01(localCohesion + delta); }

  public List<String> recentTexts() {
    return Collections.unmodifiableList(List.copyOf(history));
  }

  public String describe() {
    return id + " [" + status + "/" + phase + "] topic=" + (topic == null ? "?" : topic.displayName())
        + " turns=" + turnCount + " last=" + (lastSpeaker == null ? "-" : lastSpeaker);
  }
}
