package cascadesim.config;

import cascadesim.dialogue.ConversationThread;
import cascadesim.dialogue.ReplyGenerator;
import cascadesim.director.DialogueDirector;
import cascadesim.director.PacingPolicy;
import cascadesim.memory.NarrativeMemory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Engine configuration. Numeric tuning is compiled in; only a few host knobs can be
 * overridden from {@code cascade.properties} or {@code SIM_*} environment variables.
 */
public class EngineConfig {
  private final long seed;
  private final int serverPort;
  private final long tickMs;
  private final long basePacingMs;
  private final boolean questionIntentEnabled;
  private final String personasPath;
  private final String templatesPath;
  private final boolean simulatedAudience;

  public EngineConfig(long seed, int serverPort, long tickMs, long basePacingMs, boolean questionIntentEnabled,
                      String personasPath, String templatesPath) {
    this(seed, serverPort, tickMs, basePacingMs, questionIntentEnabled, personasPath, templatesPath, false);
  }

  public EngineConfig(long seed, int serverPort, long tickMs, long basePacingMs, boolean questionIntentEnabled,
                      String personasPath, String templatesPath, boolean simulatedAudience) {
    this.seed = seed;
    this.serverPort = serverPort;
    this.tickMs = tickMs;
    this.basePacingMs = basePacingMs;
    this.questionIntentEnabled = questionIntentEnabled;
    this.personasPath = personasPath;
    this.templatesPath = templatesPath;
    this.simulatedAudience = simulatedAudience;
  }

  public static EngineConfig defaults() {
    return new EngineConfig(-1L, 8080, 500L, 4_000L, true, "personas.json", "templates.json", true);
  }

  public long seed() { return seed; }
  public int serverPort() { return serverPort; }
  public long tickMs() { return tickMs; }
  public long basePacingMs() { return basePacingMs; }
  public boolean questionIntentEnabled() { return questionIntentEnabled; }
  public String personasPath() { return personasPath; }
  public String templatesPath() { return templatesPath; }
  public boolean simulatedAudience() { return simulatedAudience; }

  /** Negative seeds mean "seed from the clock". */
  public boolean hasFixedSeed() {
    return seed >= 0;
  }

  public int messagesPerPhase() {
    return ConversationThread.DEFAULT_MESSAGES_PER_PHASE;
  }

  public int threadHistoryCapacity() {
    return 30;
  }

  public NarrativeMemory.Settings memorySettings() {
    return NarrativeMemory.Settings.defaults();
  }

  public ReplyGenerator.Settings replySettings() {
    return ReplyGenerator.Settings.defaults();
  }

  public DialogueDirector.Settings directorSettings() {
    DialogueDirector.Settings d = DialogueDirector.Settings.defaults();
    PacingPolicy p = d.pacing();
    PacingPolicy pacing = new PacingPolicy(basePacingMs, p.minMs(), p.maxMs(), p.jitter());
    return new DialogueDirector.Settings(d.maxRetries(), d.forceAfterIdleMs(), d.maxThreadIdleMs(),
        d.turnCeiling(), d.resolutionMessagesToEnd(), d.turnsAfterClimax(), d.leadChance(),
        d.thirdParticipantChance(), d.mutateChance(), d.forceTension(), d.userQueueCapacity(), pacing);
  }

  public static EngineConfig load() throws IOException {
    return load(Path.of("cascade.properties"));
  }

  public static EngineConfig load(Path path) throws IOException {
    Properties props = new Properties();
    if (path != null && Files.exists(path)) {
      try (InputStream in = Files.newInputStream(path)) {
        props.load(in);
      }
    }
    EngineConfig d = defaults();
    long seed = getLongValue(props, "seed", "SIM_SEED", d.seed());
    int serverPort = (int) getLongValue(props, "server.port", "SIM_SERVER_PORT", d.serverPort());
    long tickMs = getLongValue(props, "tick.ms", "SIM_TICK_MS", d.tickMs());
    long basePacingMs = getLongValue(props, "pacing.base_ms", "SIM_PACING_BASE_MS", d.basePacingMs());
    boolean questions = getBoolValue(props, "intents.question", "SIM_QUESTION_INTENT", d.questionIntentEnabled());
    String personasPath = getValue(props, "personas.path", "SIM_PERSONAS_PATH", d.personasPath());
    String templatesPath = getValue(props, "templates.path", "SIM_TEMPLATES_PATH", d.templatesPath());
    boolean audience = getBoolValue(props, "audience.simulated", "SIM_AUDIENCE_SIMULATED", d.simulatedAudience());

    if (tickMs <= 0) {
      throw new IllegalArgumentException("tick.ms must be positive, got " + tickMs);
    }
    PacingPolicy bounds = PacingPolicy.defaults();
    if (basePacingMs < bounds.minMs() || basePacingMs > bounds.maxMs()) {
      throw new IllegalArgumentException("pacing.base_ms must be within [" + bounds.minMs() + ", "
          + bounds.maxMs() + "], got " + basePacingMs);
    }
    return new EngineConfig(seed, serverPort, tickMs, basePacingMs, questions, personasPath, templatesPath,
        audience);
  }

  private static String getValue(Properties props, String key, String envKey, String defaultValue) {
    String env = System.getenv(envKey);
    if (env != null && !env.isBlank()) return env;
    String value = props.getProperty(key);
    if (value != null && !value.isBlank()) return value;
    return defaultValue;
  }

  private static long getLongValue(Properties props, String key, String envKey, long defaultValue) {
    String raw = getValue(props, key, envKey, null);
    if (raw == null) return defaultValue;
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid number for " + key + ": " + raw, e);
    }
  }

  private static boolean getBoolValue(Properties props, String key, String envKey, boolean defaultValue) {
    String raw = getValue(props, key, envKey, null);
    return raw == null ? defaultValue : Boolean.parseBoolean(raw.trim());
  }
}
