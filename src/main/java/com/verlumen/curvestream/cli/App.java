package com.verlumen.curvestream.cli;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.verlumen.curvestream.events.ConnectionState;
import com.verlumen.curvestream.events.DeliveryRecord;
import com.verlumen.curvestream.events.EventStreamClient;
import com.verlumen.curvestream.events.EventStreamConfig;
import com.verlumen.curvestream.filters.AttributeFilter;
import com.verlumen.curvestream.filters.FilterSpec;
import com.verlumen.curvestream.filters.NameFilter;
import com.verlumen.curvestream.model.CurveEvent;
import java.io.PrintStream;
import java.net.URI;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

/** Prints the events stream to standard output. */
final class App {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final String API_KEY_ENV_VAR = "CURVESTREAM_API_KEY";
  private static final String API_URL_ENV_VAR = "CURVESTREAM_API_URL";

  private final EventStreamClient client;
  private final PrintStream out;

  App(EventStreamClient client, PrintStream out) {
    this.client = client;
    this.out = out;
  }

  void run(
      ImmutableList<FilterSpec> filters,
      Duration handshakeTimeout,
      int maxRetries,
      Optional<Duration> pollTimeout)
      throws InterruptedException {
    client.connect(Optional.empty(), handshakeTimeout, maxRetries);
    logger.atInfo().log("Connection state after connect: %s", client.state());
    if (!filters.isEmpty() && client.state() == ConnectionState.CONNECTED) {
      client.subscribe(filters, Optional.empty(), false);
    }
    while (!Thread.currentThread().isInterrupted()) {
      out.println(describe(client.next(pollTimeout)));
    }
  }

  @VisibleForTesting
  static String describe(DeliveryRecord record) {
    switch (record.kind()) {
      case EVENT:
        CurveEvent event = record.event();
        return String.format(
            "EVENT %s %s %s begin=%s end=%s",
            event.id(),
            event.eventType().label(),
            event.subject().name(),
            event.begin().map(Object::toString).orElse("-"),
            event.end().map(Object::toString).orElse("-"));
      case INFO:
        return "INFO " + record.info().message();
      case FILTERS:
        return "FILTERS " + record.filters().filters();
      case ERROR:
        return "ERROR " + record.error().reason();
      case TIMEOUT:
        return "TIMEOUT";
      case DISCONNECTED:
        return "DISCONNECTED " + record.disconnect().message();
    }
    throw new AssertionError("Unhandled kind: " + record.kind());
  }

  /** Builds the filters from the parsed arguments. Curve names win over areas. */
  @VisibleForTesting
  static ImmutableList<FilterSpec> filtersFrom(Namespace namespace) {
    List<String> curves = namespace.getList("curve");
    List<String> areas = namespace.getList("area");
    List<String> eventTypes = namespace.getList("eventType");
    if (curves != null && !curves.isEmpty()) {
      NameFilter.Builder builder = NameFilter.builder().setCurveNames(curves);
      if (eventTypes != null && !eventTypes.isEmpty()) {
        builder.setEventTypeTags(eventTypes);
      }
      return ImmutableList.of(builder.build());
    }
    boolean hasAreas = areas != null && !areas.isEmpty();
    boolean hasEventTypes = eventTypes != null && !eventTypes.isEmpty();
    if (!hasAreas && !hasEventTypes) {
      return ImmutableList.of();
    }
    AttributeFilter.Builder builder = AttributeFilter.builder();
    if (hasAreas) {
      builder.setAreas(areas);
    }
    if (hasEventTypes) {
      builder.setEventTypeTags(eventTypes);
    }
    return ImmutableList.of(builder.build());
  }

  @VisibleForTesting
  static EventStreamConfig configFrom(Namespace namespace) {
    EventStreamConfig config =
        EventStreamConfig.create(
            URI.create(namespace.getString("apiUrl")), namespace.getString("apiKey"));
    String checkpointFile = namespace.getString("checkpointFile");
    if (checkpointFile != null) {
      config = config.withCheckpointFile(Paths.get(checkpointFile));
    }
    return config;
  }

  public static void main(String[] args) throws Exception {
    Namespace namespace;
    try {
      namespace = createParser().parseArgs(args);
    } catch (ArgumentParserException e) {
      createParser().handleError(e);
      System.exit(2);
      return;
    }
    EventStreamConfig config = configFrom(namespace);
    logger.atInfo().log("Starting with %s", config);
    EventStreamClient client = EventStreamClient.create(config);
    Thread main = Thread.currentThread();
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      client.close();
      main.interrupt();
    }, "curvestream-cli-shutdown"));

    int timeoutSeconds = namespace.getInt("timeout");
    Optional<Duration> pollTimeout =
        timeoutSeconds > 0 ? Optional.of(Duration.ofSeconds(timeoutSeconds)) : Optional.empty();
    try {
      new App(client, System.out)
          .run(
              filtersFrom(namespace),
              Duration.ofSeconds(namespace.getInt("handshakeTimeout")),
              namespace.getInt("maxRetries"),
              pollTimeout);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.atInfo().log("Interrupted, shutting down");
    } finally {
      client.close();
    }
  }

  @VisibleForTesting
  static ArgumentParser createParser() {
    ArgumentParser parser = ArgumentParsers.newFor("curvestream-tail")
      .build()
      .defaultHelp(true)
      .description("Connects to the curve events stream and prints every record");

    parser.addArgument("--apiUrl")
      .setDefault(System.getenv().getOrDefault(API_URL_ENV_VAR, "https://app.energyquantified.com/api"))
      .help("Root URL of the API (default: value of " + API_URL_ENV_VAR + " environment variable)");

    parser.addArgument("--apiKey")
      .setDefault(System.getenv().getOrDefault(API_KEY_ENV_VAR, "INVALID_API_KEY"))
      .help("API key (default: value of " + API_KEY_ENV_VAR + " environment variable)");

    parser.addArgument("--checkpointFile")
      .help("File that keeps the id of the last delivered event");

    // Filters
    parser.addArgument("--curve")
      .nargs("*")
      .help("Curve names to follow; takes precedence over --area");

    parser.addArgument("--area")
      .nargs("*")
      .help("Areas to follow, for example DE FR");

    parser.addArgument("--eventType")
      .nargs("*")
      .help("Event types to follow: CURVE_CREATE, CURVE_UPDATE, CURVE_DELETE, CURVE_TRUNCATE");

    // Connection
    parser.addArgument("--timeout")
      .type(Integer.class)
      .setDefault(60)
      .help("Seconds to wait for a record before printing TIMEOUT; 0 waits forever");

    parser.addArgument("--handshakeTimeout")
      .type(Integer.class)
      .setDefault(10)
      .help("Seconds to wait for each connection attempt");

    parser.addArgument("--maxRetries")
      .type(Integer.class)
      .setDefault(5)
      .help("Failed connection attempts in a row before giving up");

    return parser;
  }
}
