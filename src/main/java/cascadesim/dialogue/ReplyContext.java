package cascadesim.dialogue;

import cascadesim.topics.Topic;

public record ReplyContext(String lastSpeaker, String recentEvent, Topic relatedTopic) {

  public static ReplyContext empty() {
    return new ReplyContext(null, null, null);
  }
}
