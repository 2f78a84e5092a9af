package cascadesim.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * SimulationLogger writes tagged lines to stdout and keeps a short tail in memory
 * so the diagnostics feed can serve recent log output.
 */
public final class SimulationLogger {
  private static final int MAX_TAIL = 500;
  private static final Deque<String> tail = new ArrayDeque<>();
  private static long written = 0L;
  private static volatile boolean quiet = false;

  private SimulationLogger() {}

  public static void log(String line) {
    if (line == null) return;
    synchronized (tail) {
      tail.addLast(line);
      while (tail.size() > MAX_TAIL) tail.removeFirst();
      written++;
    }
    if (!quiet) {
      System.out.println(line);
    }
  }

  /** Suppresses stdout echo; the in-memory tail is still kept. */
  public static void setQuiet(boolean value) {
    quiet = value;
  }

  /**
   * Returns lines written after the given absolute index, plus the index to poll from next.
   */
  public static LogSnapshot snapshotFrom(long since) {
    synchronized (tail) {
      long firstIndex = written - tail.size();
      long start = Math.max(firstIndex, Math.min(since, written));
      List<String> lines = new ArrayList<>();
      long i = firstIndex;
      for (String line : tail) {
        if (i >= start) lines.add(line);
        i++;
      }
      return new LogSnapshot(List.copyOf(lines), written);
    }
  }

  public static final class LogSnapshot {
    public final List<String> lines;
    public final long nextIndex;

    public LogSnapshot(List<String> lines, long nextIndex) {
      this.lines = lines;
      this.nextIndex = nextIndex;
    }
  }
}
