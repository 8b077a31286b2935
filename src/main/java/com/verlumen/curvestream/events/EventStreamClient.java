package com.verlumen.curvestream.events;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Streams;
import com.google.inject.Guice;
import com.verlumen.curvestream.filters.FilterSpec;
import com.verlumen.curvestream.filters.FilterValidationException;
import com.verlumen.curvestream.model.SequenceId;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Client for the curve events stream.
 *
 * <p>Typical use:
 *
 * <pre>{@code
 * try (EventStreamClient client = EventStreamClient.create(config)) {
 *   client.connect();
 *   client.subscribe(AttributeFilter.builder().setAreas("DE").build());
 *   client.stream(Optional.of(Duration.ofSeconds(60))).forEach(record -> ...);
 * }
 * }</pre>
 *
 * <p>The stream survives disconnects by reconnecting in the background and resuming after the
 * last delivered event. Transport failures are reported as {@link MessageKind#DISCONNECTED}
 * records, never thrown.
 */
public interface EventStreamClient extends AutoCloseable {
  Duration DEFAULT_HANDSHAKE_TIMEOUT = Duration.ofSeconds(10);
  int DEFAULT_MAX_RETRIES = 5;

  static EventStreamClient create(EventStreamConfig config) {
    return Guice.createInjector(EventsModule.create(config)).getInstance(EventStreamClient.class);
  }

  /** Connects with the default handshake timeout and retry limit. */
  default void connect() {
    connect(Optional.empty(), DEFAULT_HANDSHAKE_TIMEOUT, DEFAULT_MAX_RETRIES);
  }

  /** Connects and asks for the events after {@code resumeFrom}, ignoring any checkpoint. */
  default void connect(SequenceId resumeFrom) {
    connect(Optional.of(resumeFrom), DEFAULT_HANDSHAKE_TIMEOUT, DEFAULT_MAX_RETRIES);
  }

  /**
   * Starts connecting and blocks until connected or until {@code maxRetries} attempts in a row have
   * failed. Inspect {@link #state()} to tell which.
   *
   * <p>The first attempt resumes only when {@code resumeFrom} is given. Every reconnect resumes
   * from the last delivered (or checkpointed) event.
   */
  void connect(Optional<SequenceId> resumeFrom, Duration handshakeTimeout, int maxRetries);

  /** Closes the connection and stops reconnecting. Idempotent. */
  @Override
  void close();

  /**
   * Replaces the server-side filters. The filters are resent after every reconnect.
   *
   * @throws FilterValidationException if any filter is invalid; lists every problem found
   * @throws IllegalStateException if not connected
   */
  default void subscribe(FilterSpec... filters) {
    subscribe(ImmutableList.copyOf(filters), Optional.empty(), false);
  }

  /**
   * Like {@link #subscribe(FilterSpec...)}.
   *
   * @param requestId echoed by the server in its answer
   * @param fillResumeId also ask the server to resend the events after the last delivered one
   */
  void subscribe(
      List<? extends FilterSpec> filters, Optional<String> requestId, boolean fillResumeId);

  default void requestActiveFilters() {
    requestActiveFilters(Optional.empty());
  }

  /**
   * Asks for the filters active on the server. The answer arrives as a {@link MessageKind#FILTERS}
   * record.
   *
   * @throws IllegalStateException if not connected
   */
  void requestActiveFilters(Optional<String> requestId);

  /**
   * Returns the next record.
   *
   * <p>Queued records come first. Otherwise, while connected, waits up to {@code timeout} (forever
   * when empty) and returns a {@link MessageKind#TIMEOUT} record on expiry. While reconnecting it
   * waits for a record or the connection. Once disconnected for good it returns {@link
   * MessageKind#DISCONNECTED} records with the cause.
   */
  DeliveryRecord next(Optional<Duration> timeout) throws InterruptedException;

  default DeliveryRecord next(Duration timeout) throws InterruptedException {
    return next(Optional.of(timeout));
  }

  /** An endless iterator over {@link #next(Optional)}. */
  Iterator<DeliveryRecord> records(Optional<Duration> timeout);

  /** An endless stream over {@link #next(Optional)}. */
  default Stream<DeliveryRecord> stream(Optional<Duration> timeout) {
    return Streams.stream(records(timeout));
  }

  ConnectionState state();

  /** Why the connection last dropped or was closed. */
  Optional<ConnectionEvent> lastConnectionEvent();

  /** The id of the last delivered event, or the checkpointed id before any delivery. */
  Optional<SequenceId> lastId();
}
