package com.verlumen.curvestream.events;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Settings for an {@link EventStreamClient}.
 *
 * @param apiUrl root URL of the API, for example {@code https://app.example.com/api}
 * @param apiKey sent as {@code X-API-KEY} on every request
 * @param checkpointFile where to keep the id of the last delivered event, if anywhere
 * @param checkpointWriteInterval minimum time between two checkpoint writes while streaming
 * @param reconnectPolicy delay between connection attempts
 * @param queueCapacity maximum number of undelivered records
 */
public record EventStreamConfig(
    URI apiUrl,
    String apiKey,
    Optional<Path> checkpointFile,
    Duration checkpointWriteInterval,
    ReconnectPolicy reconnectPolicy,
    int queueCapacity) {
  public static final Duration DEFAULT_CHECKPOINT_WRITE_INTERVAL = Duration.ofSeconds(120);
  public static final int DEFAULT_QUEUE_CAPACITY = 10_000;
  private static final String EVENTS_PATH = "/events/";

  public EventStreamConfig {
    checkNotNull(apiUrl, "apiUrl");
    checkNotNull(apiKey, "apiKey");
    checkNotNull(checkpointFile, "checkpointFile");
    checkNotNull(checkpointWriteInterval, "checkpointWriteInterval");
    checkNotNull(reconnectPolicy, "reconnectPolicy");
    checkArgument(
        "http".equals(apiUrl.getScheme()) || "https".equals(apiUrl.getScheme()),
        "apiUrl must start with 'http' or 'https': %s",
        apiUrl);
    checkArgument(!apiKey.isBlank(), "apiKey is missing");
    checkArgument(
        !checkpointWriteInterval.isNegative(),
        "checkpointWriteInterval must not be negative: %s",
        checkpointWriteInterval);
    checkArgument(queueCapacity > 0, "queueCapacity must be positive: %s", queueCapacity);
  }

  public static EventStreamConfig create(URI apiUrl, String apiKey) {
    return new EventStreamConfig(
        apiUrl,
        apiKey,
        Optional.empty(),
        DEFAULT_CHECKPOINT_WRITE_INTERVAL,
        ReconnectPolicy.standard(),
        DEFAULT_QUEUE_CAPACITY);
  }

  public EventStreamConfig withCheckpointFile(Path checkpointFile) {
    return new EventStreamConfig(
        apiUrl,
        apiKey,
        Optional.of(checkpointFile),
        checkpointWriteInterval,
        reconnectPolicy,
        queueCapacity);
  }

  public EventStreamConfig withCheckpointWriteInterval(Duration checkpointWriteInterval) {
    return new EventStreamConfig(
        apiUrl, apiKey, checkpointFile, checkpointWriteInterval, reconnectPolicy, queueCapacity);
  }

  public EventStreamConfig withReconnectPolicy(ReconnectPolicy reconnectPolicy) {
    return new EventStreamConfig(
        apiUrl, apiKey, checkpointFile, checkpointWriteInterval, reconnectPolicy, queueCapacity);
  }

  public EventStreamConfig withQueueCapacity(int queueCapacity) {
    return new EventStreamConfig(
        apiUrl, apiKey, checkpointFile, checkpointWriteInterval, reconnectPolicy, queueCapacity);
  }

  /** The stream endpoint: the API URL with {@code http} swapped for {@code ws}. */
  public URI eventsUri() {
    String base = apiUrl.toString().replaceFirst("^http", "ws");
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(base + EVENTS_PATH);
  }

  /** The API URL without a trailing slash. */
  public String apiBase() {
    String base = apiUrl.toString();
    return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
  }

  @Override
  public String toString() {
    return String.format(
        "EventStreamConfig{apiUrl=%s, checkpointFile=%s, checkpointWriteInterval=%s}",
        apiUrl, checkpointFile.orElse(null), checkpointWriteInterval);
  }
}
