package cascadesim.agents;

import cascadesim.core.Lottery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Relationship {
  static final int MAX_LOG_ENTRIES = 20;

  private final String otherName;
  private double trust = 0.5;
  private double respect = 0.5;
  private double intimacy = 0.1;
  private double tension = 0.0;
  private double emotionalBond = 0.2;
  private int interactionCount = 0;
  private InteractionKind lastInteraction;
  private final List<String> sharedMemories = new ArrayList<>();
  private final List<String> conflicts = new ArrayList<>();
  private final List<String> supportEvents = new ArrayList<>();

  Relationship(String otherName) {
    this.otherName = otherName;
  }

  public String otherName() { return otherName; }
  public double trust() { return trust; }
  public double respect() { return respect; }
  public double intimacy() { return intimacy; }
  public double tension() { return tension; }
  public double emotionalBond() { return emotionalBond; }
  public int interactionCount() { return interactionCount; }
  public InteractionKind lastInteraction() { return lastInteraction; }
  public List<String> sharedMemories() { return Collections.unmodifiableList(sharedMemories); }
  public List<String> conflicts() { return Collections.unmodifiableList(conflicts); }
  public List<String> supportEvents() { return Collections.unmodifiableList(supportEvents); }

  void recordInteraction(InteractionKind kind) {
    interactionCount++;
    lastInteraction = kind;
  }

  void adjust(double dTrust, double dRespect, double dIntimacy, double dTension, double dBond) {
    trust = Lottery.clamp01(trust + dTrust);
    respect = Lottery.clamp01(respect + dRespect);
    intimacy = Lottery.clamp01(intimacy + dIntimacy);
    tension = Lottery.clamp01(tension + dTension);
    emotionalBond = Lottery.clamp01(emotionalBond + dBond);
  }

  boolean addSharedMemory(String memory) {
    if (memory == null || memory.isBlank() || sharedMemories.contains(memory)) return false;
    append(sharedMemories, memory);
    return true;
  }

  void addConflict(String note) {
    if (note == null || note.isBlank()) return;
    append(conflicts, note);
  }

  void addSupport(String note) {
    if (note == null || note.isBlank()) return;
    append(supportEvents, note);
  }

  private static void append(List<String> log, String entry) {
    log.add(entry.trim());
    while (log.size() > MAX_LOG_ENTRIES) log.remove(0);
  }
}
