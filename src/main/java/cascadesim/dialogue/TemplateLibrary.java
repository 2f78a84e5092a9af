package cascadesim.dialogue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class TemplateLibrary {
  private final Map<Intent, List<String>> shared;
  private final Map<String, Map<Intent, List<String>>> personaPools;
  private final Map<String, VoiceProfile> voices;
  private final List<String> overseerLines;
  private final List<String> genericFallbackLines;

  public TemplateLibrary(Map<Intent, List<String>> shared,
                         Map<String, Map<Intent, List<String>>> personaPools,
                         Map<String, VoiceProfile> voices,
                         List<String> overseerLines,
                         List<String> genericFallbackLines) {
    this.shared = copyPools(shared);
    Map<String, Map<Intent, List<String>>> pools = new LinkedHashMap<>();
    if (personaPools != null) {
      personaPools.forEach((name, p) -> pools.put(name, copyPools(p)));
    }
    this.personaPools = Collections.unmodifiableMap(pools);
    this.voices = voices == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(voices));
    this.overseerLines = overseerLines == null ? List.of() : List.copyOf(overseerLines);
    this.genericFallbackLines = genericFallbackLines == null || genericFallbackLines.isEmpty()
        ? List.of("...")
        : List.copyOf(genericFallbackLines);
  }

  private static Map<Intent, List<String>> copyPools(Map<Intent, List<String>> source) {
    Map<Intent, List<String>> out = new EnumMap<>(Intent.class);
    if (source != null) {
      source.forEach((intent, lines) -> {
        if (intent != null && lines != null) out.put(intent, List.copyOf(lines));
      });
    }
    return Collections.unmodifiableMap(out);
  }

  public List<String> poolFor(String persona, Intent intent) {
    Map<Intent, List<String>> own = persona == null ? null : personaPools.get(persona);
    if (own != null) {
      List<String> lines = own.get(intent);
      if (lines != null && !lines.isEmpty()) return lines;
    }
    List<String> common = shared.get(intent);
    if (common != null && !common.isEmpty()) return common;
    return shared.getOrDefault(Intent.REPLY, List.of());
  }

  public VoiceProfile voiceFor(String persona) {
    VoiceProfile v = persona == null ? null : voices.get(persona);
    return v == null ? VoiceProfile.neutral() : v;
  }

  public List<String> overseerLines() {
    return overseerLines;
  }

  public List<String> fallbackLinesFor(String persona) {
    VoiceProfile v = persona == null ? null : voices.get(persona);
    if (v != null && !v.fallbackLines.isEmpty()) return v.fallbackLines;
    return genericFallbackLines;
  }

  public int sharedPoolSize(Intent intent) {
    return shared.getOrDefault(intent, List.of()).size();
  }
}
