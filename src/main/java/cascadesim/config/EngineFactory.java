package cascadesim.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import cascadesim.agents.Persona;
import cascadesim.agents.PersonaProfile;
import cascadesim.agents.PersonaRole;
import cascadesim.agents.PersonalityTraits;
import cascadesim.agents.TypingStyle;
import cascadesim.core.SimClock;
import cascadesim.core.SimulationLogger;
import cascadesim.dialogue.Intent;
import cascadesim.dialogue.IntentTaxonomy;
import cascadesim.dialogue.ReplyGenerator;
import cascadesim.dialogue.TemplateLibrary;
import cascadesim.dialogue.ThreadRegistry;
import cascadesim.dialogue.VoiceProfile;
import cascadesim.director.DialogueDirector;
import cascadesim.director.SimulatedAudience;
import cascadesim.director.ViewerCommands;
import cascadesim.memory.NarrativeMemory;
import cascadesim.topics.TopicGraph;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Builds the cast and template library from JSON and wires a complete engine.
 * Paths are tried on the filesystem first, then on the classpath.
 */
public class EngineFactory {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  public static PersonaRegistry buildCast(EngineConfig config) throws IOException {
    List<PersonaConfig> configs = Arrays.asList(MAPPER.readValue(read(config.personasPath()), PersonaConfig[].class));
    if (configs.isEmpty()) {
      throw new IllegalArgumentException("No personas defined in " + config.personasPath());
    }
    List<Persona> cast = new ArrayList<>();
    for (PersonaConfig pc : configs) {
      if (pc.name == null || pc.name.isBlank()) {
        throw new IllegalArgumentException("Persona without a name in " + config.personasPath());
      }
      TraitsConfig t = pc.traits == null ? new TraitsConfig() : pc.traits;
      PersonalityTraits traits = new PersonalityTraits(t.openness, t.conscientiousness, t.extraversion,
          t.agreeableness, t.neuroticism);
      TypingStyle typing = pc.typing == null
          ? TypingStyle.defaults()
          : new TypingStyle(pc.typing.speedMultiplier, pc.typing.typoRate, pc.typing.hesitationRate);
      PersonaProfile profile = new PersonaProfile(
          parseRole(pc.role, pc.name),
          pc.speakerBias <= 0 ? 1.0 : pc.speakerBias,
          pc.phobias == null ? List.of() : pc.phobias);
      cast.add(new Persona(pc.name, traits, typing, profile));
    }
    SimulationLogger.log("[Config] Loaded " + cast.size() + " personas");
    return new PersonaRegistry(cast);
  }

  public static TemplateLibrary loadTemplates(EngineConfig config) throws IOException {
    TemplatesConfig tc = MAPPER.readValue(read(config.templatesPath()), TemplatesConfig.class);
    if (tc.shared == null || tc.shared.getOrDefault(Intent.REPLY, List.of()).isEmpty()) {
      throw new IllegalArgumentException("Template file " + config.templatesPath() + " needs a shared REPLY pool");
    }
    Map<String, VoiceProfile> voices = new LinkedHashMap<>();
    if (tc.voices != null) {
      tc.voices.forEach((name, v) -> voices.put(name, new VoiceProfile(
          v.intentWeights, v.keywordBonuses, v.hesitationPhrases, v.catchphrases, v.fallbackLines)));
    }
    return new TemplateLibrary(tc.shared, tc.personas, voices, tc.overseer, tc.fallback);
  }

  public static DialogueDirector buildDirector(EngineConfig config, SimClock clock) throws IOException {
    return buildDirector(config, buildCast(config), loadTemplates(config), clock);
  }

  public static DialogueDirector buildDirector(EngineConfig config, PersonaRegistry cast,
                                               TemplateLibrary templates, SimClock clock) {
    Random rng = config.hasFixedSeed() ? new Random(config.seed()) : new Random();
    IntentTaxonomy taxonomy = IntentTaxonomy.of(config.questionIntentEnabled());
    TopicGraph topics = new TopicGraph(rng, clock);
    NarrativeMemory memory = new NarrativeMemory(config.memorySettings(), clock, rng);
    ThreadRegistry threads = new ThreadRegistry(taxonomy, config.messagesPerPhase(), config.threadHistoryCapacity());
    ReplyGenerator replies = new ReplyGenerator(templates, taxonomy, config.replySettings(), rng);
    return new DialogueDirector(cast.asList(), topics, memory, threads, replies,
        config.directorSettings(), clock, rng);
  }

  /** The stand-in audience, or null when the config turns it off. */
  public static SimulatedAudience buildAudience(EngineConfig config, ViewerCommands commands, SimClock clock) {
    if (!config.simulatedAudience()) return null;
    Random rng = config.hasFixedSeed() ? new Random(config.seed() + 1) : new Random();
    return new SimulatedAudience(commands, clock, rng);
  }

  private static PersonaRole parseRole(String raw, String persona) {
    if (raw == null || raw.isBlank()) return PersonaRole.SUPPORTING;
    try {
      return PersonaRole.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown role '" + raw + "' for persona " + persona, e);
    }
  }

  private static String read(String location) throws IOException {
    Path path = Path.of(location);
    if (Files.exists(path)) {
      return Files.readString(path);
    }
    String resource = location.startsWith("/") ? location.substring(1) : location;
    try (InputStream in = EngineFactory.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IOException("Config not found on filesystem or classpath: " + location);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  private static class PersonaConfig {
    public String name;
    public String role;
    public double speakerBias;
    public TraitsConfig traits;
    public TypingConfig typing;
    public List<String> phobias;
  }

  private static class TraitsConfig {
    public double openness = 0.5;
    public double conscientiousness = 0.5;
    public double extraversion = 0.5;
    public double agreeableness = 0.5;
    public double neuroticism = 0.5;
  }

  private static class TypingConfig {
    public double speedMultiplier = 1.0;
    public double typoRate = 0.03;
    public double hesitationRate = 0.1;
  }

  private static class VoiceConfig {
    public Map<Intent, Double> intentWeights;
    public Map<String, Double> keywordBonuses;
    public List<String> hesitationPhrases;
    public List<String> catchphrases;
    public List<String> fallbackLines;
  }

  private static class TemplatesConfig {
    public Map<Intent, List<String>> shared;
    public Map<String, Map<Intent, List<String>>> personas;
    public Map<String, VoiceConfig> voices;
    public List<String> overseer;
    public List<String> fallback;
  }
}
