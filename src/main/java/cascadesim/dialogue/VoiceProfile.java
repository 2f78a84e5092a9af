package cascadesim.dialogue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class VoiceProfile {
  public final Map<Intent, Double> intentWeights;
  public final Map<String, Double> keywordBonuses;
  public final List<String> hesitationPhrases;
  public final List<String> catchphrases;
  public final List<String> fallbackLines;

  public VoiceProfile(Map<Intent, Double> intentWeights,
                      Map<String, Double> keywordBonuses,
                      List<String> hesitationPhrases,
                      List<String> catchphrases,
                      List<String> fallbackLines) {
    Map<Intent, Double> weights = new EnumMap<>(Intent.class);
    if (intentWeights != null) weights.putAll(intentWeights);
    this.intentWeights = Collections.unmodifiableMap(weights);
    this.keywordBonuses = keywordBonuses == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(keywordBonuses));
    this.hesitationPhrases = hesitationPhrases == null ? List.of() : List.copyOf(hesitationPhrases);
    this.catchphrases = catchphrases == null ? List.of() : List.copyOf(catchphrases);
    this.fallbackLines = fallbackLines == null ? List.of() : List.copyOf(fallbackLines);
  }

  public static VoiceProfile neutral() {
    return new VoiceProfile(Map.of(), Map.of(), List.of(), List.of(), List.of());
  }

  public double weightFor(Intent intent) {
    return intentWeights.getOrDefault(intent, 1.0);
  }

  public Intent preferredNonQuestion(IntentTaxonomy taxonomy) {
    Intent best = Intent.STATEMENT;
    double bestWeight = -1.0;
    for (Intent intent : taxonomy.selectable()) {
      if (intent.isQuestionLike()) continue;
      double w = weightFor(intent);
      if (w > bestWeight) {
        best = intent;
        bestWeight = w;
      }
    }
    return best;
  }

  public boolean favors(Intent intent, int n) {
    double w = weightFor(intent);
    int heavier = 0;
    for (double other : intentWeights.values()) {
      if (other > w) heavier++;
    }
    return heavier < n && intentWeights.containsKey(intent);
  }
}
