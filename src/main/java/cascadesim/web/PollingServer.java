package cascadesim.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import cascadesim.core.SimulationLogger;
import cascadesim.director.DialogueDirector;
import cascadesim.director.ViewerCommands;
import cascadesim.topics.Topic;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executors;

/**
 * Diagnostics feed over plain HTTP polling: delivered lines, engine state, the topic pool
 * and recent log output, plus a chat endpoint for viewer lines and commands.
 */
public class PollingServer {
  private static final String COOKIE = "cascade_viewer";

  private final HttpServer server;
  private final DialogueDirector director;
  private final MessageFeed feed;
  private final ViewerCommands commands;
  private final ObjectMapper mapper = new ObjectMapper();

  public PollingServer(int port, DialogueDirector director, MessageFeed feed) throws IOException {
    this.director = director;
    this.feed = feed;
    this.commands = new ViewerCommands(director);
    this.server = HttpServer.create(new InetSocketAddress(port), 0);
    this.server.setExecutor(Executors.newCachedThreadPool());
    this.server.createContext("/feed", this::handleFeed);
    this.server.createContext("/state", this::handleState);
    this.server.createContext("/topics", this::handleTopics);
    this.server.createContext("/log", this::handleLog);
    this.server.createContext("/chat", this::handleChat);
  }

  public void start() {
    server.start();
  }

  public void stop() {
    server.stop(0);
  }

  public int port() {
    return server.getAddress().getPort();
  }

  private void handleFeed(HttpExchange exchange) throws IOException {
    if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
      exchange.sendResponseHeaders(405, -1);
      return;
    }
    URI uri = exchange.getRequestURI();
    long since = parseLongParam(uri.getQuery(), "since", 0L);
    MessageFeed.FeedSnapshot snap = feed.snapshotFrom(since);
    Map<String, Object> payload = new HashMap<>();
    payload.put("messages", snap.messages);
    payload.put("nextIndex", snap.nextIndex);
    writeJson(exchange, payload);
  }

  private void handleState(HttpExchange exchange) throws IOException {
    if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
      exchange.sendResponseHeaders(405, -1);
      return;
    }
    writeJson(exchange, director.snapshot());
  }

  private void handleTopics(HttpExchange exchange) throws IOException {
    if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
      exchange.sendResponseHeaders(405, -1);
      return;
    }
    List<Map<String, Object>> topics = new ArrayList<>();
    synchronized (director) {
      for (Topic t : director.topics().allTopics()) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("core", t.core());
        m.put("display", t.displayName());
        m.put("status", t.status().name());
        m.put("timesDiscussed", t.timesDiscussed());
        m.put("rumor", t.isRumor());
        m.put("glitchSource", t.isGlitchSource());
        m.put("related", director.topics().relatedCores(t.core()));
        topics.add(m);
      }
    }
    writeJson(exchange, topics);
  }

  private void handleLog(HttpExchange exchange) throws IOException {
    if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
      exchange.sendResponseHeaders(405, -1);
      return;
    }
    URI uri = exchange.getRequestURI();
    long since = parseLongParam(uri.getQuery(), "since", 0L);
    SimulationLogger.LogSnapshot snap = SimulationLogger.snapshotFrom(since);
    Map<String, Object> payload = new HashMap<>();
    payload.put("lines", snap.lines);
    payload.put("nextIndex", snap.nextIndex);
    writeJson(exchange, payload);
  }

  private void handleChat(HttpExchange exchange) throws IOException {
    if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
      exchange.sendResponseHeaders(405, -1);
      return;
    }
    byte[] body = exchange.getRequestBody().readAllBytes();
    Map<?, ?> payload;
    try {
      payload = mapper.readValue(body, Map.class);
    } catch (IOException e) {
      exchange.sendResponseHeaders(400, -1);
      return;
    }
    Object message = payload == null ? null : payload.get("message");
    String text = message == null ? "" : message.toString().trim();
    if (text.isEmpty()) {
      exchange.sendResponseHeaders(400, -1);
      return;
    }
    String name = feed.displayNameFor(ensureViewerCookie(exchange));
    ViewerCommands.Outcome outcome = commands.handle(name, text);
    if (outcome == ViewerCommands.Outcome.QUEUED) {
      feed.publishViewer(name, text, System.currentTimeMillis());
    }
    director.reportExternalActivity();
    Map<String, Object> result = new HashMap<>();
    result.put("outcome", outcome.name());
    result.put("name", name);
    writeJson(exchange, result);
  }

  private void writeJson(HttpExchange exchange, Object payload) throws IOException {
    byte[] body = mapper.writeValueAsBytes(payload);
    exchange.getResponseHeaders().add("Content-Type", "application/json; charset=utf-8");
    exchange.getResponseHeaders().add("Cache-Control", "no-store");
    exchange.getResponseHeaders().add("Access-Control-Allow-Origin", "*");
    exchange.sendResponseHeaders(200, body.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(body);
    }
  }

  private String ensureViewerCookie(HttpExchange exchange) {
    String cookie = getCookieValue(exchange, COOKIE);
    if (cookie != null && !cookie.isBlank()) {
      return cookie;
    }
    String id = UUID.randomUUID().toString();
    exchange.getResponseHeaders().add("Set-Cookie", COOKIE + "=" + id + "; Path=/; SameSite=Lax");
    return id;
  }

  private static String getCookieValue(HttpExchange exchange, String name) {
    List<String> cookies = exchange.getRequestHeaders().get("Cookie");
    if (cookies == null) return null;
    for (String header : cookies) {
      for (String part : header.split(";")) {
        String[] kv = part.trim().split("=", 2);
        if (kv.length == 2 && kv[0].equals(name)) {
          return kv[1];
        }
      }
    }
    return null;
  }

  private static long parseLongParam(String query, String key, long defaultValue) {
    String value = getParam(query, key);
    if (value == null) return defaultValue;
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }

  private static String getParam(String query, String key) {
    if (query == null || query.isBlank()) return null;
    for (String pair : query.split("&")) {
      String[] parts = pair.split("=", 2);
      if (parts.length == 2 && parts[0].equals(key)) {
        return parts[1];
      }
    }
    return null;
  }
}
