package cascadesim.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import cascadesim.agents.Persona;
import cascadesim.agents.PersonaRole;
import cascadesim.core.ManualClock;
import cascadesim.dialogue.Intent;
import cascadesim.dialogue.ReplyContext;
import cascadesim.dialogue.ReplyGenerator;
import cascadesim.dialogue.TemplateLibrary;
import cascadesim.director.DialogueDirector;
import cascadesim.topics.Topic;
import cascadesim.topics.TopicGraph;

import java.io.IOException;
import java.util.Random;

import org.junit.jupiter.api.Test;

class EngineFactoryTest {

  private static final EngineConfig CONFIG =
      new EngineConfig(5L, 0, 500L, 4_000L, true, "personas.json", "templates.json");

  @Test
  void bundledCastLoads() throws IOException {
    PersonaRegistry cast = EngineFactory.buildCast(CONFIG);
    assertEquals(4, cast.size());
    assertEquals("Orion", cast.firstWithRole(PersonaRole.LEAD).name());
    assertEquals("Nova", cast.byNameApprox("no").name());
    assertNull(cast.byNameApprox(" "));
  }

  @Test
  void bundledVoicesLoad() throws IOException {
    TemplateLibrary lib = EngineFactory.loadTemplates(CONFIG);
    assertFalse(lib.voiceFor("Echo").hesitationPhrases.isEmpty(), "Echo should hesitate");
    assertFalse(lib.overseerLines().isEmpty());
    assertFalse(lib.poolFor("Nobody", Intent.REPLY).isEmpty());
  }

  @Test
  void everyBundledTemplateRenders() throws IOException {
    PersonaRegistry cast = EngineFactory.buildCast(CONFIG);
    TemplateLibrary lib = EngineFactory.loadTemplates(CONFIG);
    TopicGraph graph = new TopicGraph(new Random(1), new ManualClock(0L));
    Topic topic = graph.getOrCreate("the archive");
    ReplyContext ctx = new ReplyContext("Nova", "a flicker", graph.getOrCreate("red cascade"));
    for (Persona p : cast.all()) {
      for (Intent intent : Intent.values()) {
        for (String template : lib.poolFor(p.name(), intent)) {
          assertDoesNotThrow(() -> ReplyGenerator.render(template, p, topic, ctx), template);
        }
      }
    }
  }

  @Test
  void directorWiresTheBundledCast() throws IOException {
    DialogueDirector director = EngineFactory.buildDirector(CONFIG, new ManualClock(0L));
    assertEquals(4, director.cast().size());
    assertNotNull(director.persona("Lumen"));
    assertNotNull(director.topics().getRandom());
  }
}
