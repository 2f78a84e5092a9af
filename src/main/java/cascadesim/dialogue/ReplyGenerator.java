package cascadesim.dialogue;

import cascadesim.agents.Persona;
import cascadesim.agents.PersonalityTraits;
import cascadesim.core.Lottery;
import cascadesim.core.SimulationLogger;
import cascadesim.memory.NarrativeMemory;
import cascadesim.topics.Topic;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ReplyGenerator picks an intent for a speaker and renders a matching template, keeping a
 * short memory of lines and intents so the cast does not repeat itself.
 */
public class ReplyGenerator {
  private static final Pattern TOKEN = Pattern.compile("\\{([a-zA-Z]+)}");
  private static final List<String> THEORY_WORDS = List.of(
      "theory", "hypothesis", "pattern", "what if", "believe", "maybe", "connected");
  private static final List<String> FEAR_WORDS = List.of(
      "afraid", "terrified", "scared", "dangerous", "hide", "watching", "finds us");
  private static final List<String> CHALLENGE_WORDS = List.of(
      "proof", "wrong", "disagree", "flawed", "evidence", "doesn't explain");

  public record Settings(int recentLines,
                         int recentIntents,
                         double overlapThreshold,
                         double hesitationScale,
                         double catchphraseChance) {
    public static Settings defaults() {
      return new Settings(40, 6, 0.7, 0.3, 0.08);
    }
  }

  private final TemplateLibrary library;
  private final IntentTaxonomy taxonomy;
  private final Settings settings;
  private final Random rng;
  private final RecentBuffer<String> recentLines;
  private final RecentBuffer<Intent> recentIntents;

  public ReplyGenerator(TemplateLibrary library, IntentTaxonomy taxonomy, Settings settings, Random rng) {
    this.library = library;
    this.taxonomy = taxonomy;
    this.settings = settings == null ? Settings.defaults() : settings;
    this.rng = rng;
    this.recentLines = new RecentBuffer<>(this.settings.recentLines());
    this.recentIntents = new RecentBuffer<>(this.settings.recentIntents());
  }

  public TemplateLibrary library() { return library; }
  public IntentTaxonomy taxonomy() { return taxonomy; }
  public List<String> recentLines() { return recentLines.items(); }
  public List<Intent> recentIntents() { return recentIntents.items(); }

  public void clear() {
    recentLines.clear();
    recentIntents.clear();
  }

  /**
   * Draws an intent from the speaker's own distribution, biased by the thread phase, the
   * speaker's mood and the narrative state. A third question-like intent in a row is
   * swapped for the speaker's favourite non-question intent.
   */
  public Intent chooseIntent(Persona speaker, ConversationThread thread, NarrativeMemory memory) {
    VoiceProfile voice = library.voiceFor(speaker.name());
    Map<Intent, Double> weights = new EnumMap<>(Intent.class);
    for (Intent intent : taxonomy.selectable()) {
      weights.put(intent, voice.weightFor(intent));
    }

    if (thread != null) {
      Intent phaseIntent = thread.getPhaseAppropriateIntent(speaker);
      weights.computeIfPresent(phaseIntent, (k, w) -> w * 2.0);
    }

    switch (speaker.mood()) {
      case SCARED -> scale(weights, 2.5, Intent.FEAR);
      case PARANOID -> scale(weights, 1.8, Intent.FEAR, Intent.CHALLENGE);
      case SUSPICIOUS -> scale(weights, 1.5, Intent.OBSERVATION, Intent.CHALLENGE);
      case CURIOUS -> scale(weights, 1.6, Intent.THEORY, Intent.QUESTION);
      case INSPIRED -> {
        scale(weights, 1.8, Intent.THEORY);
        scale(weights, 1.3, Intent.META);
      }
      case FRUSTRATED -> scale(weights, 1.7, Intent.CHALLENGE);
      case PLAYFUL -> scale(weights, 1.3, Intent.STATEMENT, Intent.AGREEMENT);
      default -> { }
    }

    if (memory != null) {
      if (memory.metaAwareness() > 0.3) {
        scale(weights, 1.0 + memory.metaAwareness(), Intent.META);
      } else {
        scale(weights, 0.5, Intent.META);
      }
      if (memory.tension() > 0.7) scale(weights, 1.5, Intent.FEAR);
      if (memory.cohesion() > 0.65) scale(weights, 1.4, Intent.AGREEMENT);
    }

    Intent drawn = Lottery.draw(weights, rng);
    if (drawn == null) drawn = Intent.STATEMENT;

    if (drawn.isQuestionLike()) {
      List<Intent> lastTwo = recentIntents.latest(2);
      if (lastTwo.size() == 2 && lastTwo.get(0).isQuestionLike() && lastTwo.get(1).isQuestionLike()) {
        Intent replacement = voice.preferredNonQuestion(taxonomy);
        SimulationLogger.log("[Reply] " + speaker.name() + ": " + drawn + " -> " + replacement + " (question loop)");
        drawn = replacement;
      }
    }
    return drawn;
  }

  private static void scale(Map<Intent, Double> weights, double factor, Intent... intents) {
    for (Intent i : intents) {
      weights.computeIfPresent(i, (k, w) -> w * factor);
    }
  }

  /**
   * Renders one line for {@code intent}. Templates whose rendering nearly duplicates a
   * recent line are skipped unless that leaves nothing, in which case the whole pool is
   * used and the reply is flagged {@code repeated}.
   *
   * @throws TemplateException when the pool is empty or a template is malformed
   */
  public GeneratedReply generate(Intent intent, Persona speaker, Topic topic,
                                 ConversationThread thread, ReplyContext context) {
    ReplyContext ctx = context == null ? ReplyContext.empty() : context;
    List<String> pool = library.poolFor(speaker.name(), intent);
    if (pool.isEmpty()) {
      throw new TemplateException("No templates for " + intent + " (" + speaker.name() + ")");
    }

    Map<String, String> rendered = new LinkedHashMap<>();
    for (String template : pool) {
      rendered.put(template, render(template, speaker, topic, ctx));
    }

    List<String> window = new ArrayList<>(recentLines.items());
    if (thread != null) window.addAll(thread.recentTexts());

    List<String> fresh = new ArrayList<>();
    for (var entry : rendered.entrySet()) {
      if (!OverlapScorer.isNearDuplicate(entry.getValue(), window, settings.overlapThreshold())) {
        fresh.add(entry.getKey());
      }
    }
    List<String> candidates = fresh.isEmpty() ? pool : fresh;

    VoiceProfile voice = library.voiceFor(speaker.name());
    Map<String, Double> weights = new LinkedHashMap<>();
    for (String template : candidates) {
      weights.put(template, templateWeight(template, speaker, voice));
    }
    String chosen = Lottery.draw(weights, rng);
    String text = decorate(rendered.get(chosen), speaker, voice, topic, ctx);

    boolean repeated = OverlapScorer.isNearDuplicate(text, window, settings.overlapThreshold());
    if (!repeated) {
      recentLines.push(text);
      recentIntents.push(intent);
    }
    return new GeneratedReply(intent, text, chosen, repeated);
  }

  /**
   * Picks a fallback line that is not a near duplicate of recent output and registers it.
   * Returns null when every line is stale.
   */
  public GeneratedReply fallback(List<String> lines, ConversationThread thread) {
    if (lines == null || lines.isEmpty()) return null;
    List<String> window = new ArrayList<>(recentLines.items());
    if (thread != null) window.addAll(thread.recentTexts());
    List<String> fresh = new ArrayList<>();
    for (String line : lines) {
      if (!OverlapScorer.isNearDuplicate(line, window, settings.overlapThreshold())) fresh.add(line);
    }
    String chosen = Lottery.pickUniform(fresh, rng);
    if (chosen == null) return null;
    recentLines.push(chosen);
    recentIntents.push(Intent.STATEMENT);
    return new GeneratedReply(Intent.STATEMENT, chosen, chosen, false);
  }

  public boolean isNearDuplicate(String text) {
    return OverlapScorer.isNearDuplicate(text, recentLines.items(), settings.overlapThreshold());
  }

  double templateWeight(String template, Persona speaker, VoiceProfile voice) {
    String lower = template.toLowerCase(Locale.ROOT);
    PersonalityTraits t = speaker.traits();
    double w = 1.0;
    if (t.openness() > 0.6 && containsAny(lower, THEORY_WORDS)) w *= 1.0 + t.openness();
    if (t.neuroticism() > 0.6 && containsAny(lower, FEAR_WORDS)) w *= 1.0 + t.neuroticism();
    if (t.agreeableness() < 0.4 && containsAny(lower, CHALLENGE_WORDS)) w *= 2.0 - t.agreeableness();
    if (t.extraversion() > 0.7 && lower.contains("!")) w *= 1.2;
    for (var bonus : voice.keywordBonuses.entrySet()) {
      if (lower.contains(bonus.getKey().toLowerCase(Locale.ROOT))) w *= bonus.getValue();
    }
    return w;
  }

  private String decorate(String line, Persona speaker, VoiceProfile voice, Topic topic, ReplyContext ctx) {
    String text = line;
    if (!voice.hesitationPhrases.isEmpty()
        && rng.nextDouble() < speaker.traits().neuroticism() * settings.hesitationScale()) {
      String phrase = render(Lottery.pickUniform(voice.hesitationPhrases, rng), speaker, topic, ctx);
      text = phrase + " " + text;
    }
    if (!voice.catchphrases.isEmpty() && rng.nextDouble() < settings.catchphraseChance()) {
      String phrase = render(Lottery.pickUniform(voice.catchphrases, rng), speaker, topic, ctx);
      text = text + " " + phrase;
    }
    return text;
  }

  /**
   * Substitutes {topic}, {from}, {event}, {related} and {self}. Absent context becomes a
   * generic filler.
   */
  public static String render(String template, Persona speaker, Topic topic, ReplyContext ctx) {
    if (template == null) throw new TemplateException("Template is null");
    String skeleton = TOKEN.matcher(template).replaceAll("");
    if (skeleton.indexOf('{') >= 0 || skeleton.indexOf('}') >= 0) {
      throw new TemplateException("Unbalanced braces in: " + template);
    }
    Matcher m = TOKEN.matcher(template);
    StringBuilder sb = new StringBuilder();
    while (m.find()) {
      String value = switch (m.group(1)) {
        case "topic" -> topic == null ? "all of this" : topic.displayName();
        case "from" -> ctx.lastSpeaker() == null || ctx.lastSpeaker().isBlank()
            || (speaker != null && ctx.lastSpeaker().equals(speaker.name()))
            ? "someone"
            : ctx.lastSpeaker();
        case "event" -> ctx.recentEvent() == null || ctx.recentEvent().isBlank() ? "the last glitch" : ctx.recentEvent();
        case "related" -> ctx.relatedTopic() == null ? "something else" : ctx.relatedTopic().displayName();
        case "self" -> speaker == null ? "I" : speaker.name();
        default -> throw new TemplateException("Unknown token {" + m.group(1) + "} in: " + template);
      };
      m.appendReplacement(sb, Matcher.quoteReplacement(value));
    }
    m.appendTail(sb);
    return sb.toString();
  }

  private static boolean containsAny(String lower, List<String> words) {
    for (String w : words) {
      if (lower.contains(w)) return true;
    }
    return false;
  }
}
