package com.verlumen.curvestream.events;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.curvestream.checkpoint.CheckpointException;
import com.verlumen.curvestream.checkpoint.CheckpointStore;
import com.verlumen.curvestream.filters.FilterSpec;
import com.verlumen.curvestream.model.SequenceId;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

final class EventStreamClientImpl implements EventStreamClient {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ConnectionSupervisor supervisor;
  private final SubscriptionController subscriptionController;
  private final RecordPoller poller;
  private final Watermark watermark;
  private final CheckpointStore checkpointStore;
  private final Thread shutdownHook;

  @Inject
  EventStreamClientImpl(
      ConnectionSupervisor supervisor,
      SubscriptionController subscriptionController,
      RecordPoller poller,
      Watermark watermark,
      CheckpointStore checkpointStore) {
    this.supervisor = supervisor;
    this.subscriptionController = subscriptionController;
    this.poller = poller;
    this.watermark = watermark;
    this.checkpointStore = checkpointStore;
    checkpointStore.read().ifPresent(watermark::advance);
    this.shutdownHook = new Thread(this::flushCheckpoint, "curvestream-checkpoint-flush");
    Runtime.getRuntime().addShutdownHook(shutdownHook);
  }

  @Override
  public void connect(Optional<SequenceId> resumeFrom, Duration handshakeTimeout, int maxRetries) {
    supervisor.connect(resumeFrom, handshakeTimeout, maxRetries);
  }

  @Override
  public void close() {
    supervisor.close();
    flushCheckpoint();
    try {
      Runtime.getRuntime().removeShutdownHook(shutdownHook);
    } catch (IllegalStateException e) {
      logger.atFine().log("JVM is shutting down, keeping the checkpoint hook");
    }
  }

  @Override
  public void subscribe(
      List<? extends FilterSpec> filters, Optional<String> requestId, boolean fillResumeId) {
    subscriptionController.subscribe(filters, requestId, fillResumeId);
  }

  @Override
  public void requestActiveFilters(Optional<String> requestId) {
    subscriptionController.requestActiveFilters(requestId);
  }

  @Override
  public DeliveryRecord next(Optional<Duration> timeout) throws InterruptedException {
    return poller.next(timeout);
  }

  @Override
  public Iterator<DeliveryRecord> records(Optional<Duration> timeout) {
    return poller.iterator(timeout);
  }

  @Override
  public ConnectionState state() {
    return supervisor.state();
  }

  @Override
  public Optional<ConnectionEvent> lastConnectionEvent() {
    return supervisor.lastEvent();
  }

  @Override
  public Optional<SequenceId> lastId() {
    return watermark.get();
  }

  private void flushCheckpoint() {
    Optional<SequenceId> latest = watermark.get();
    if (latest.isEmpty()) {
      return;
    }
    try {
      checkpointStore.write(latest.get(), Duration.ZERO);
    } catch (CheckpointException e) {
      logger.atWarning().withCause(e).log("Failed to write checkpoint %s on shutdown", latest.get());
    }
  }
}
