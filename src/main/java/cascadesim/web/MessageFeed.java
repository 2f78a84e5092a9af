package cascadesim.web;

import cascadesim.dialogue.Message;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class MessageFeed {
  private static final int MAX_ENTRIES = 1_000;
  private static final List<String> HANDLES = List.of(
      "Static", "Cipher", "Ghost", "Relay", "Pixel", "Vector", "Null", "Packet", "Shard", "Beacon",
      "Glyph", "Kernel", "Sector", "Signal", "Daemon", "Pulse", "Vertex", "Socket", "Prism", "Buffer"
  );

  private final List<FeedEntry> entries = new ArrayList<>();
  private final Map<String, String> viewerNames = new HashMap<>();
  private long dropped = 0L;

  public synchronized void publish(Message message) {
    if (message == null) return;
    append(new FeedEntry(message.speaker(), message.text(), message.source().name(),
        message.intent() == null ? null : message.intent().name(), message.threadId(),
        message.timestampMs(), message.hesitate(), message.typingSpeed()));
  }

  public synchronized void publishViewer(String displayName, String text, long timestampMs) {
    append(new FeedEntry(displayName, text, "VIEWER", null, null, timestampMs, false, 1.0));
  }

  private void append(FeedEntry entry) {
    entries.add(entry);
    if (entries.size() > MAX_ENTRIES) {
      entries.remove(0);
      dropped++;
    }
  }

  public synchronized FeedSnapshot snapshotFrom(long startIndex) {
    long total = dropped + entries.size();
    long safeStart = Math.max(dropped, Math.min(startIndex, total));
    List<FeedEntry> slice = new ArrayList<>(entries.subList((int) (safeStart - dropped), entries.size()));
    return new FeedSnapshot(Collections.unmodifiableList(slice), total);
  }

  public synchronized String displayNameFor(String viewerId) {
    String key = viewerId == null ? "" : viewerId.trim();
    if (key.isBlank()) {
      return "anonymous";
    }
    String existing = viewerNames.get(key);
    if (existing != null) return existing;
    int index = Math.abs(key.hashCode() % HANDLES.size());
    String base = HANDLES.get(index);
    String name = base;
    int suffix = 2;
    while (viewerNames.containsValue(name)) {
      name = base + suffix;
      suffix++;
    }
    viewerNames.put(key, name);
    return name;
  }

  public static class FeedEntry {
    public final String speaker;
    public final String text;
    public final String source;
    public final String intent;
    public final String threadId;
    public final long timestamp;
    public final boolean hesitate;
    public final double typingSpeed;

    public FeedEntry(String speaker, String text, String source, String intent, String threadId,
                     long timestamp, boolean hesitate, double typingSpeed) {
      this.speaker = speaker;
      this.text = text;
      this.source = source;
      this.intent = intent;
      this.threadId = threadId;
      this.timestamp = timestamp;
      this.hesitate = hesitate;
      this.typingSpeed = typingSpeed;
    }
  }

  public static class FeedSnapshot {
    public final List<FeedEntry> messages;
    public final long nextIndex;

    public FeedSnapshot(List<FeedEntry> messages, long nextIndex) {
      this.messages = messages;
      this.nextIndex = nextIndex;
    }
  }
}
