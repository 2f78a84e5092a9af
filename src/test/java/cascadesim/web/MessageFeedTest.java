package cascadesim.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import cascadesim.dialogue.Intent;
import cascadesim.dialogue.Message;
import cascadesim.dialogue.MessageSource;

import org.junit.jupiter.api.Test;

class MessageFeedTest {

  @Test
  void snapshotReturnsEntriesFromIndex() {
    MessageFeed feed = new MessageFeed();
    feed.publish(new Message("Orion", "first", Intent.STATEMENT, MessageSource.PERSONA, "thread_0", 1L, false, 1.0));
    feed.publishViewer("Static", "hello", 2L);
    feed.publish(new Message("Nova", "third", Intent.CHALLENGE, MessageSource.PERSONA, "thread_0", 3L, true, 0.8));

    MessageFeed.FeedSnapshot all = feed.snapshotFrom(0);
    assertEquals(3, all.messages.size());
    assertEquals(3L, all.nextIndex);
    assertEquals("VIEWER", all.messages.get(1).source);

    MessageFeed.FeedSnapshot tail = feed.snapshotFrom(2);
    assertEquals(1, tail.messages.size());
    assertEquals("CHALLENGE", tail.messages.get(0).intent);
    assertEquals(0, feed.snapshotFrom(99).messages.size());
  }

  @Test
  void oldEntriesAreDroppedPastCapacity() {
    MessageFeed feed = new MessageFeed();
    for (int i = 0; i < 1_005; i++) {
      feed.publishViewer("Static", "line " + i, i);
    }
    MessageFeed.FeedSnapshot snap = feed.snapshotFrom(0);
    assertEquals(1_000, snap.messages.size());
    assertEquals(1_005L, snap.nextIndex);
    assertEquals("line 5", snap.messages.get(0).text);
  }

  @Test
  void viewerNamesAreStableAndUnique() {
    MessageFeed feed = new MessageFeed();
    String a = feed.displayNameFor("viewer-a");
    assertEquals(a, feed.displayNameFor("viewer-a"));
    assertNotEquals(a, feed.displayNameFor("viewer-b"));
    assertEquals("anonymous", feed.displayNameFor(" "));
  }
}
