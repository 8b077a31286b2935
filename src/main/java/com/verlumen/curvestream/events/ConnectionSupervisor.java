package com.verlumen.curvestream.events;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.flogger.FluentLogger;
import com.google.common.net.UrlEscapers;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.verlumen.curvestream.checkpoint.CheckpointException;
import com.verlumen.curvestream.checkpoint.CheckpointStore;
import com.verlumen.curvestream.model.SequenceId;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the WebSocket connection to the events endpoint.
 *
 * <p>{@link #connect} starts one loop thread that opens the connection, waits for it to drop and
 * tries again after a delay from the {@link ReconnectPolicy}, until it has failed {@code
 * maxRetries} times in a row or {@link #close} is called. Only the loop thread changes the
 * connection; other threads see it through {@link #state()}, {@link #lastEvent()} and the {@link
 * DeliveryQueue}.
 */
@Singleton
final class ConnectionSupervisor implements ConnectionStatus, MessageSender {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final String API_KEY_HEADER = "X-API-KEY";
  private static final String RESUME_PARAMETER = "last-id";
  private static final Duration HANDSHAKE_GRACE = Duration.ofSeconds(1);
  private static final Duration SEND_TIMEOUT = Duration.ofSeconds(10);
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final HttpClient httpClient;
  private final EventStreamConfig config;
  private final MessageDispatcher dispatcher;
  private final DeliveryQueue queue;
  private final Subscription subscription;
  private final Watermark watermark;
  private final CheckpointStore checkpointStore;
  private final ThreadFactory threadFactory =
      new ThreadFactoryBuilder().setNameFormat("curvestream-connection-%d").setDaemon(true).build();

  private final AtomicReference<ConnectionState> state =
      new AtomicReference<>(ConnectionState.DISCONNECTED);
  private final AtomicReference<ConnectionEvent> lastEvent = new AtomicReference<>();
  private final AtomicInteger attempts = new AtomicInteger();
  private final Object lifecycleLock = new Object();
  private final Object sendLock = new Object();
  private volatile WebSocket webSocket;
  private Session session;
  private Thread loopThread;

  @Inject
  ConnectionSupervisor(
      HttpClient httpClient,
      EventStreamConfig config,
      MessageDispatcher dispatcher,
      DeliveryQueue queue,
      Subscription subscription,
      Watermark watermark,
      CheckpointStore checkpointStore) {
    this.httpClient = httpClient;
    this.config = config;
    this.dispatcher = dispatcher;
    this.queue = queue;
    this.subscription = subscription;
    this.watermark = watermark;
    this.checkpointStore = checkpointStore;
  }

  /**
   * Starts the connect loop and waits until the connection is open or every attempt failed.
   * Transport failures are not thrown; check {@link #state()} afterwards.
   *
   * @param resumeFrom ask the server for the events after this id on the first attempt; later
   *     attempts always resume from the last delivered event
   */
  void connect(Optional<SequenceId> resumeFrom, Duration handshakeTimeout, int maxRetries) {
    checkNotNull(resumeFrom, "resumeFrom");
    checkArgument(!handshakeTimeout.isNegative(), "handshakeTimeout must not be negative");
    checkArgument(maxRetries >= 1, "maxRetries must be at least 1: %s", maxRetries);
    Session started;
    synchronized (lifecycleLock) {
      ConnectionState current = state.get();
      if (current == ConnectionState.CONNECTED || current == ConnectionState.CONNECTING) {
        logger.atInfo().log("Already %s, ignoring connect()", current);
        return;
      }
      resumeFrom.ifPresent(watermark::reset);
      started = new Session(resumeFrom.isPresent(), handshakeTimeout, maxRetries);
      session = started;
      state.set(ConnectionState.CONNECTING);
      loopThread = threadFactory.newThread(() -> run(started));
      loopThread.start();
    }
    try {
      started.settled.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.atWarning().log("Interrupted while waiting for the connection to open");
    } catch (ExecutionException e) {
      throw new IllegalStateException("Connect loop failed", e.getCause());
    }
  }

  /** Stops the connect loop and closes the connection. Safe to call from any thread, repeatedly. */
  void close() {
    Session stopping;
    Thread thread;
    synchronized (lifecycleLock) {
      stopping = session;
      thread = loopThread;
      boolean loopRunning = thread != null && thread.isAlive();
      if (stopping == null || (state.get() == ConnectionState.DISCONNECTED && !loopRunning)) {
        return;
      }
      state.set(ConnectionState.CLOSING);
      lastEvent.set(ConnectionEvent.closedByUser());
      stopping.stop();
    }
    if (thread != Thread.currentThread()) {
      try {
        thread.join(CLOSE_TIMEOUT.toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        logger.atWarning().log("Interrupted while waiting for %s to stop", thread.getName());
      }
      if (thread.isAlive()) {
        logger.atWarning().log("%s did not stop in time", thread.getName());
      }
    }
    state.set(ConnectionState.DISCONNECTED);
    flushCheckpoint();
    logger.atInfo().log("Connection closed");
  }

  @Override
  public ConnectionState state() {
    return state.get();
  }

  @Override
  public Optional<ConnectionEvent> lastEvent() {
    return Optional.ofNullable(lastEvent.get());
  }

  @Override
  public void send(String message) {
    synchronized (sendLock) {
      WebSocket current = webSocket;
      if (current == null || state.get() != ConnectionState.CONNECTED) {
        throw new IllegalStateException("Not connected to the server (state: " + state.get() + ")");
      }
      logger.atFiner().log("Sending: %s", message);
      try {
        current.sendText(message, true).get(SEND_TIMEOUT.toMillis(), MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted while sending message", e);
      } catch (ExecutionException | TimeoutException e) {
        throw new IllegalStateException("Failed to send message", e);
      }
    }
  }

  /** Connection attempts made since this supervisor was created. */
  @VisibleForTesting
  int attemptCount() {
    return attempts.get();
  }

  private void run(Session current) {
    ConnectionEvent lastDrop = null;
    boolean firstAttempt = true;
    int retryNumber = 0;
    try {
      while (!current.isStopped()) {
        boolean resume = !firstAttempt || current.resumeRequested;
        firstAttempt = false;
        Attempt attempt = new Attempt();
        Optional<WebSocket> opened = handshake(current, attempt, eventsUri(resume));
        if (current.isStopped()) {
          opened.ifPresent(this::closeQuietly);
          break;
        }
        if (opened.isPresent()) {
          // A drop after a successful open starts a fresh budget of maxRetries reconnects.
          current.remaining.set(current.maxRetries);
          retryNumber = 0;
          enterConnected(current, opened.get());
          lastDrop = awaitDrop(current, attempt, opened.get());
          if (current.isStopped()) {
            break;
          }
          onDrop(lastDrop);
        } else {
          lastDrop = attempt.closed.getNow(ConnectionEvent.fromError(new TimeoutException()));
          onDrop(lastDrop);
          if (current.remaining.decrementAndGet() <= 0) {
            ConnectionEvent exhausted = lastDrop.retriesExhausted(current.maxRetries);
            lastEvent.set(exhausted);
            state.set(ConnectionState.DISCONNECTED);
            logger.atWarning().log("Giving up: %s", exhausted.message());
            return;
          }
        }

        retryNumber++;
        Duration delay = config.reconnectPolicy().delay(current.handshakeTimeout, retryNumber);
        logger.atInfo().log(
            "Reconnecting in %s (retry %d, %d failure(s) left)",
            delay, retryNumber, current.remaining.get());
        current.sleep(delay);
      }
    } finally {
      webSocket = null;
      current.settled.complete(null);
    }
  }

  private Optional<WebSocket> handshake(Session current, Attempt attempt, URI uri) {
    attempts.incrementAndGet();
    logger.atInfo().log("Connecting to %s", uri);
    CompletableFuture<WebSocket> future =
        httpClient
            .newWebSocketBuilder()
            .header(API_KEY_HEADER, config.apiKey())
            .connectTimeout(current.handshakeTimeout)
            .buildAsync(uri, new StreamListener(attempt));
    current.pendingHandshake = future;
    if (current.isStopped()) {
      future.cancel(true);
    }
    try {
      return Optional.of(
          future.get(current.handshakeTimeout.plus(HANDSHAKE_GRACE).toMillis(), MILLISECONDS));
    } catch (ExecutionException e) {
      attempt.closed.complete(ConnectionEvent.fromError(e.getCause()));
    } catch (TimeoutException e) {
      future.cancel(true);
      attempt.closed.complete(ConnectionEvent.fromError(e));
    } catch (CancellationException e) {
      attempt.closed.complete(ConnectionEvent.closedByUser());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      current.stop();
      attempt.closed.complete(ConnectionEvent.fromError(e));
    } finally {
      current.pendingHandshake = null;
    }
    logger.atWarning().log("Failed to connect: %s", attempt.closed.getNow(null));
    return Optional.empty();
  }

  /** Replays the subscription on entering CONNECTED, before the first frame is requested. */
  private void enterConnected(Session current, WebSocket opened) {
    webSocket = opened;
    state.set(ConnectionState.CONNECTED);
    logger.atInfo().log("Connected");
    Optional<String> filters = subscription.latest();
    if (filters.isPresent()) {
      try {
        send(filters.get());
        queue.put(DeliveryRecord.ofInfo(new InfoNotice("Resubscribed with the latest filters")));
      } catch (IllegalStateException e) {
        logger.atWarning().withCause(e).log("Failed to replay the subscription");
      }
    }
    current.settled.complete(null);
    opened.request(1);
  }

  private ConnectionEvent awaitDrop(Session current, Attempt attempt, WebSocket opened) {
    try {
      CompletableFuture.anyOf(attempt.closed, current.stopped).get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      current.stop();
    } catch (ExecutionException e) {
      attempt.closed.complete(ConnectionEvent.fromError(e.getCause()));
    }
    webSocket = null;
    if (current.isStopped()) {
      closeQuietly(opened);
      return ConnectionEvent.closedByUser();
    }
    opened.abort();
    return attempt.closed.join();
  }

  private void onDrop(ConnectionEvent event) {
    lastEvent.set(event);
    state.set(ConnectionState.CONNECTING);
    logger.atWarning().log("Disconnected: %s", event);
    flushCheckpoint();
  }

  private void closeQuietly(WebSocket opened) {
    try {
      opened
          .sendClose(WebSocket.NORMAL_CLOSURE, "Connection closed by user")
          .get(CLOSE_TIMEOUT.toMillis(), MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.atFine().log("Interrupted while closing the connection");
    } catch (ExecutionException | TimeoutException e) {
      logger.atFine().withCause(e).log("Close handshake did not complete");
    } finally {
      opened.abort();
    }
  }

  private void flushCheckpoint() {
    Optional<SequenceId> latest = watermark.get();
    if (latest.isEmpty()) {
      return;
    }
    try {
      checkpointStore.write(latest.get(), Duration.ZERO);
    } catch (CheckpointException e) {
      logger.atWarning().withCause(e).log("Failed to flush checkpoint %s", latest.get());
    }
  }

  private URI eventsUri(boolean resume) {
    URI base = config.eventsUri();
    Optional<SequenceId> lastId = resume ? watermark.get() : Optional.empty();
    if (lastId.isEmpty()) {
      return base;
    }
    return URI.create(
        String.format(
            "%s?%s=%s",
            base,
            RESUME_PARAMETER,
            UrlEscapers.urlFormParameterEscaper().escape(lastId.get().toString())));
  }

  /** One call to connect(): settings plus the signals between the caller and the loop thread. */
  private static final class Session {
    final boolean resumeRequested;
    final Duration handshakeTimeout;
    final int maxRetries;
    final AtomicInteger remaining;
    final CompletableFuture<Void> settled = new CompletableFuture<>();
    final CompletableFuture<Void> stopped = new CompletableFuture<>();
    volatile CompletableFuture<WebSocket> pendingHandshake;

    Session(boolean resumeRequested, Duration handshakeTimeout, int maxRetries) {
      this.resumeRequested = resumeRequested;
      this.handshakeTimeout = handshakeTimeout;
      this.maxRetries = maxRetries;
      this.remaining = new AtomicInteger(maxRetries);
    }

    boolean isStopped() {
      return stopped.isDone();
    }

    void stop() {
      stopped.complete(null);
      CompletableFuture<WebSocket> handshake = pendingHandshake;
      if (handshake != null) {
        handshake.cancel(true);
      }
    }

    /** Waits for {@code delay}, returning early when stopped. */
    void sleep(Duration delay) {
      try {
        stopped.get(delay.toMillis(), MILLISECONDS);
      } catch (TimeoutException e) {
        logger.atFinest().log("Slept %s", delay);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        stop();
      } catch (ExecutionException e) {
        throw new IllegalStateException("Stop signal failed", e.getCause());
      }
    }
  }

  /** One connection attempt. {@code closed} completes with the reason it ended. */
  private static final class Attempt {
    final CompletableFuture<ConnectionEvent> closed = new CompletableFuture<>();
  }

  private final class StreamListener implements WebSocket.Listener {
    private final Attempt attempt;
    private final StringBuilder partial = new StringBuilder();

    StreamListener(Attempt attempt) {
      this.attempt = attempt;
    }

    @Override
    public void onOpen(WebSocket ws) {
      // The first request(1) is issued by the loop thread once the subscription is replayed.
      logger.atFine().log("WebSocket opened");
    }

    @Override
    public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
      partial.append(data);
      if (last) {
        String message = partial.toString();
        partial.setLength(0);
        dispatcher.dispatch(message);
      }
      ws.request(1);
      return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
      attempt.closed.complete(ConnectionEvent.fromClose(statusCode, reason));
      return null;
    }

    @Override
    public void onError(WebSocket ws, Throwable error) {
      attempt.closed.complete(ConnectionEvent.fromError(error));
    }
  }
}
