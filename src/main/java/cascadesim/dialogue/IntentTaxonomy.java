package cascadesim.dialogue;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public final class IntentTaxonomy {
  private final Set<Intent> selectable;

  private IntentTaxonomy(Set<Intent> selectable) {
    this.selectable = EnumSet.copyOf(selectable);
    this.selectable.remove(Intent.REPLY);
  }

  public static IntentTaxonomy withQuestions() {
    return new IntentTaxonomy(EnumSet.allOf(Intent.class));
  }

  public static IntentTaxonomy withoutQuestions() {
    Set<Intent> set = EnumSet.allOf(Intent.class);
    set.remove(Intent.QUESTION);
    return new IntentTaxonomy(set);
  }

  public static IntentTaxonomy of(boolean questionsEnabled) {
    return questionsEnabled ? withQuestions() : withoutQuestions();
  }

  public boolean allows(Intent intent) {
    return intent != null && selectable.contains(intent);
  }

  public boolean questionsEnabled() {
    return selectable.contains(Intent.QUESTION);
  }

  public List<Intent> selectable() {
    return List.copyOf(selectable);
  }
}
