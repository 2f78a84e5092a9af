package cascadesim;

import cascadesim.config.EngineConfig;
import cascadesim.config.EngineFactory;
import cascadesim.core.SimClock;
import cascadesim.core.SimulationLogger;
import cascadesim.dialogue.Message;
import cascadesim.director.DialogueDirector;
import cascadesim.director.SimulatedAudience;
import cascadesim.director.ViewerCommands;
import cascadesim.web.MessageFeed;
import cascadesim.web.PollingServer;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

public class Main {
  public static void main(String[] args) throws Exception {
    EngineConfig config = EngineConfig.load();
    SimClock clock = SimClock.system();
    DialogueDirector director = EngineFactory.buildDirector(config, clock);
    MessageFeed feed = new MessageFeed();

    PollingServer pollingServer = new PollingServer(config.serverPort(), director, feed);
    pollingServer.start();
    SimulationLogger.log("[Server] Diagnostics feed at http://localhost:" + pollingServer.port());

    SimulatedAudience audience = EngineFactory.buildAudience(config, new ViewerCommands(director), clock);

    ScheduledExecutorService ticker = Executors.newSingleThreadScheduledExecutor();
    ticker.scheduleWithFixedDelay(() -> {
      try {
        SimulatedAudience.ChatLine chat = audience == null ? null : audience.tick();
        if (chat != null && chat.outcome() == ViewerCommands.Outcome.QUEUED) {
          feed.publishViewer(chat.username(), chat.text(), clock.nowMs());
        }
        Message message = director.produceNextMessage();
        if (message != null) {
          feed.publish(message);
          SimulationLogger.log("[Feed] " + message);
        }
      } catch (RuntimeException e) {
        // a failed tick is skipped; the next one retries
        SimulationLogger.log("[Main] Tick failed: " + e);
      }
    }, 0L, config.tickMs(), TimeUnit.MILLISECONDS);

    CountDownLatch stopped = new CountDownLatch(1);
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      SimulationLogger.log("[Server] Shutting down.");
      ticker.shutdownNow();
      pollingServer.stop();
      stopped.countDown();
    }));
    stopped.await();
  }
}
