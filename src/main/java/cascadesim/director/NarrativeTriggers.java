package cascadesim.director;

import cascadesim.core.SimulationLogger;
import cascadesim.memory.NarrativeMemory;
import cascadesim.memory.ThreatKind;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

public class NarrativeTriggers {
  public enum Trigger {
    VIEWER_GLITCH_REQUEST,
    VIEWER_TENSION_UP,
    VIEWER_OBSERVE,
    VIEWER_MESSAGE,
    HIGH_TENSION,
    HIGH_AWARENESS
  }

  static final double HIGH_TENSION_LEVEL = 0.8;
  static final double HIGH_AWARENESS_LEVEL = 0.7;

  private final Map<Trigger, List<Consumer<NarrativeMemory>>> handlers = new EnumMap<>(Trigger.class);
  private final Set<Trigger> latched = EnumSet.noneOf(Trigger.class);

  public static NarrativeTriggers withDefaults(GlitchSource glitches) {
    NarrativeTriggers t = new NarrativeTriggers();
    t.on(Trigger.VIEWER_GLITCH_REQUEST, glitches::force);
    t.on(Trigger.VIEWER_TENSION_UP, m -> m.adjustTension(0.1));
    t.on(Trigger.VIEWER_OBSERVE, m -> {
      m.markObserverDetected();
      m.updateThreatLevel(ThreatKind.OVERSEER_ATTENTION, 0.1);
    });
    t.on(Trigger.VIEWER_MESSAGE, m -> m.updateThreatLevel(ThreatKind.REALITY_QUESTIONING, 0.05));
    t.on(Trigger.HIGH_TENSION, m -> {
      m.addToHistory("Trigger", "tension spike", "SYSTEM");
      m.recordNotableEvent("the tension spike");
      m.updateThreatLevel(ThreatKind.SYSTEM_INSTABILITY, 0.1);
    });
    t.on(Trigger.HIGH_AWARENESS, m -> {
      m.addToHistory("Trigger", "awareness spike", "SYSTEM");
      m.recordNotableEvent("the awareness spike");
      m.updateThreatLevel(ThreatKind.REALITY_QUESTIONING, 0.1);
    });
    return t;
  }

  public void on(Trigger trigger, Consumer<NarrativeMemory> handler) {
    handlers.computeIfAbsent(trigger, ignored -> new ArrayList<>()).add(handler);
  }

  public int fire(Trigger trigger, NarrativeMemory memory) {
    int ran = 0;
    for (Consumer<NarrativeMemory> h : handlers.getOrDefault(trigger, List.of())) {
      try {
        h.accept(memory);
        ran++;
      } catch (RuntimeException e) {
        SimulationLogger.log("[Trigger] " + trigger + " handler failed: " + e.getMessage());
      }
    }
    SimulationLogger.log("[Trigger] " + trigger);
    return ran;
  }

  public List<Trigger> evaluate(NarrativeMemory memory) {
    List<Trigger> fired = new ArrayList<>();
    edge(Trigger.HIGH_TENSION, memory.tension() > HIGH_TENSION_LEVEL, memory, fired);
    edge(Trigger.HIGH_AWARENESS, memory.metaAwareness() > HIGH_AWARENESS_LEVEL, memory, fired);
    return fired;
  }

  private void edge(Trigger trigger, boolean above, NarrativeMemory memory, List<Trigger> fired) {
    if (!above) {
      latched.remove(trigger);
      return;
    }
    if (latched.add(trigger)) {
      fire(trigger, memory);
      fired.add(trigger);
    }
  }

  public void rearm() {
    latched.clear();
  }
}
