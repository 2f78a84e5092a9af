package cascadesim.topics;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public class Topic {
  private final String core;
  private final long createdAtMs;
  private String variant;
  private TopicStatus status = TopicStatus.NEUTRAL;
  private int timesDiscussed = 0;
  private long lastDiscussedMs;
  private boolean rumor = false;
  private boolean glitchSource = false;
  private final Set<String> believers = new LinkedHashSet<>();
  private final Set<String> doubters = new LinkedHashSet<>();
  private final Set<String> forbiddenBy = new LinkedHashSet<>();

  Topic(String core, long nowMs) {
    this.core = core;
    this.variant = core;
    this.createdAtMs = nowMs;
    this.lastDiscussedMs = nowMs;
  }

  public String core() { return core; }
  public String variant() { return variant; }
  public TopicStatus status() { return status; }
  public int timesDiscussed() { return timesDiscussed; }
  public long createdAtMs() { return createdAtMs; }
  public long lastDiscussedMs() { return lastDiscussedMs; }
  public boolean isRumor() { return rumor; }
  public boolean isGlitchSource() { return glitchSource; }
  public Set<String> believers() { return Collections.unmodifiableSet(believers); }
  public Set<String> doubters() { return Collections.unmodifiableSet(doubters); }
  public Set<String> forbiddenBy() { return Collections.unmodifiableSet(forbiddenBy); }

  public boolean isMutated() {
    return !variant.equals(core);
  }

  public boolean isHeated() {
    return status == TopicStatus.CONTROVERSIAL || status == TopicStatus.FORBIDDEN;
  }

  public String displayName() {
    if (status == TopicStatus.FORBIDDEN) return "[REDACTED]";
    return variant;
  }

  public void markDiscussed(String persona, long nowMs) {
    timesDiscussed++;
    lastDiscussedMs = nowMs;
    if (persona != null && !persona.isBlank()) {
      doubters.remove(persona);
      believers.add(persona);
    }
  }

  public void markDoubted(String persona) {
    if (persona == null || persona.isBlank()) return;
    believers.remove(persona);
    doubters.add(persona);
  }

  public void markForbidden(String persona) {
    if (persona != null && !persona.isBlank()) forbiddenBy.add(persona);
    status = TopicStatus.FORBIDDEN;
  }

  public void markSolved() {
    if (status != TopicStatus.FORBIDDEN) status = TopicStatus.SOLVED;
  }

  void addBeliever(String persona) {
    believers.add(persona);
  }

  void setStatus(TopicStatus status) {
    this.status = status;
  }

  void setVariant(String variant) {
    this.variant = variant == null || variant.isBlank() ? core : variant;
  }

  void setRumor(boolean rumor) { this.rumor = rumor; }
  void setGlitchSource(boolean glitchSource) { this.glitchSource = glitchSource; }

  public String debugLine() {
    return displayName() + " | " + status + " | rumor=" + rumor + " | glitch=" + glitchSource
        + " | discussed=" + timesDiscussed;
  }

  @Override
  public String toString() {
    return "Topic{" + core + (isMutated() ? " as '" + variant + "'" : "") + ", " + status + "}";
  }
}
