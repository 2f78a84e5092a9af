package cascadesim.dialogue;

import cascadesim.agents.Persona;
import cascadesim.topics.Topic;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns every thread created in this process and hands out sequential ids.
 * Closed threads are dropped once the registry grows past its retention limit.
 */
public class ThreadRegistry {
  private static final int MAX_RETAINED = 50;

  private final Map<String, ConversationThread> threads = new LinkedHashMap<>();
  private final IntentTaxonomy taxonomy;
  private final int messagesPerPhase;
  private final int historyCapacity;
  private int counter = 0;

  public ThreadRegistry(IntentTaxonomy taxonomy, int messagesPerPhase, int historyCapacity) {
    this.taxonomy = taxonomy;
    this.messagesPerPhase = messagesPerPhase;
    this.historyCapacity = historyCapacity;
  }

  public ConversationThread start(List<Persona> participants, Topic topic, boolean allowInterruption, long nowMs) {
    String id = "thread_" + counter++;
    ConversationThread thread = new ConversationThread(id, topic, participants, taxonomy,
        messagesPerPhase, historyCapacity, allowInterruption, nowMs);
    threads.put(id, thread);
    trim();
    return thread;
  }

  public ConversationThread byId(String id) {
    return id == null ? null : threads.get(id);
  }

  public void close(String id) {
    ConversationThread t = threads.get(id);
    if (t != null) t.close();
  }

  public void closeAll() {
    for (ConversationThread t : threads.values()) t.close();
  }

  /** Marks ACTIVE threads idle for longer than {@code maxIdleMs} as STALE. */
  public int pruneStale(long nowMs, long maxIdleMs) {
    int pruned = 0;
    for (ConversationThread t : threads.values()) {
      if (t.isActive() && nowMs - t.lastActivityMs() > maxIdleMs) {
        t.markStale();
        pruned++;
      }
    }
    return pruned;
  }

  /** Newest ACTIVE thread, or null. */
  public ConversationThread activeThread() {
    ConversationThread found = null;
    for (ConversationThread t : threads.values()) {
      if (t.isActive()) found = t;
    }
    return found;
  }

  /** Newest thread that is not yet closed, whatever its status. */
  public ConversationThread currentThread() {
    ConversationThread found = null;
    for (ConversationThread t : threads.values()) {
      if (t.status() != ThreadStatus.CLOSED) found = t;
    }
    return found;
  }

  public List<ConversationThread> allActive() {
    List<ConversationThread> out = new ArrayList<>();
    for (ConversationThread t : threads.values()) {
      if (t.isActive()) out.add(t);
    }
    return out;
  }

  public int size() {
    return threads.size();
  }

  private void trim() {
    if (threads.size() <= MAX_RETAINED) return;
    threads.values().removeIf(t -> t.status() == ThreadStatus.CLOSED && threads.size() > MAX_RETAINED);
  }
}
