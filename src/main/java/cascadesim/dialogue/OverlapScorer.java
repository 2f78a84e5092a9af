package cascadesim.dialogue;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

public final class OverlapScorer {
  private OverlapScorer() {}

  public static Set<String> words(String text) {
    Set<String> out = new LinkedHashSet<>();
    if (text == null || text.isBlank()) return out;
    String s = text.toLowerCase(Locale.ROOT);
    StringBuilder b = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (Character.isLetterOrDigit(c) || c == '\'') b.append(c);
      else b.append(' ');
    }
    for (String p : b.toString().trim().split("\\s+")) {
      if (!p.isBlank()) out.add(p);
    }
    return out;
  }

  public static double overlap(String a, String b) {
    Set<String> wa = words(a);
    Set<String> wb = words(b);
    if (wa.isEmpty() || wb.isEmpty()) return 0.0;
    int shared = 0;
    for (String w : wa) {
      if (wb.contains(w)) shared++;
    }
    return (double) shared / Math.min(wa.size(), wb.size());
  }

  public static boolean isNearDuplicate(String candidate, Collection<String> recent, double threshold) {
    if (recent == null) return false;
    for (String line : recent) {
      if (overlap(candidate, line) > threshold) return true;
    }
    return false;
  }
}
