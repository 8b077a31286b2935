package com.verlumen.curvestream.events;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/** Bounded FIFO between the connection thread and the consumer. */
@Singleton
final class DeliveryQueue {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final BlockingQueue<DeliveryRecord> records;

  @Inject
  DeliveryQueue(EventStreamConfig config) {
    this.records = new LinkedBlockingQueue<>(config.queueCapacity());
  }

  /** Adds a record, waiting for space when the queue is full. */
  void put(DeliveryRecord record) {
    try {
      records.put(record);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.atWarning().log("Interrupted while queueing a %s record; it was dropped", record.kind());
    }
  }

  Optional<DeliveryRecord> poll() {
    return Optional.ofNullable(records.poll());
  }

  Optional<DeliveryRecord> poll(Duration timeout) throws InterruptedException {
    return Optional.ofNullable(records.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
  }

  int size() {
    return records.size();
  }
}
