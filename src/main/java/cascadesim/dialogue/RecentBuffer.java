package cascadesim.dialogue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public final class RecentBuffer<T> {
  private final int capacity;
  private final Deque<T> items = new ArrayDeque<>();

  public RecentBuffer(int capacity) {
    this.capacity = Math.max(1, capacity);
  }

  public void push(T item) {
    if (item == null) return;
    items.addLast(item);
    while (items.size() > capacity) items.removeFirst();
  }

  public List<T> items() {
    return List.copyOf(items);
  }

  public List<T> latest(int n) {
    List<T> out = new ArrayList<>();
    var it = items.descendingIterator();
    while (it.hasNext() && out.size() < n) out.add(it.next());
    return out;
  }

  public int size() { return items.size(); }
  public int capacity() { return capacity; }
  public void clear() { items.clear(); }
}
