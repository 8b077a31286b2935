package com.verlumen.curvestream.events;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.collect.AbstractIterator;
import com.google.common.math.LongMath;
import com.google.inject.Inject;
import java.time.Duration;
import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The consumer side of the {@link DeliveryQueue}.
 *
 * <p>Queued records always come first. When the queue is empty the answer depends on the
 * connection:
 *
 * <ul>
 *   <li>disconnected for good: a {@code DISCONNECTED} record at once. The following call waits up
 *       to {@link #DISCONNECTED_PAUSE} for a record or a reconnect before repeating it.
 *   <li>connecting: waits for a record or for the connection to open, without a timeout record.
 *   <li>connected: waits up to the timeout, then returns a {@code TIMEOUT} record.
 * </ul>
 */
final class RecordPoller {
  static final Duration DISCONNECTED_PAUSE = Duration.ofSeconds(2);
  private static final Duration SLICE = Duration.ofMillis(100);
  private static final long NO_PAUSE = Long.MIN_VALUE;

  private final DeliveryQueue queue;
  private final ConnectionStatus status;
  private final Ticker ticker;
  private final AtomicLong pauseUntilNanos = new AtomicLong(NO_PAUSE);

  @Inject
  RecordPoller(DeliveryQueue queue, ConnectionStatus status) {
    this(queue, status, Ticker.systemTicker());
  }

  @VisibleForTesting
  RecordPoller(DeliveryQueue queue, ConnectionStatus status, Ticker ticker) {
    this.queue = queue;
    this.status = status;
    this.ticker = ticker;
  }

  /**
   * Returns the next record, blocking as described above. An empty timeout waits for as long as
   * the connection stays open.
   */
  DeliveryRecord next(Optional<Duration> timeout) throws InterruptedException {
    long start = ticker.read();
    Optional<Long> deadline = timeout.map(t -> LongMath.saturatedAdd(start, saturatedNanos(t)));
    while (true) {
      Optional<DeliveryRecord> queued = queue.poll();
      if (queued.isPresent()) {
        return queued.get();
      }
      long now = ticker.read();
      switch (status.state()) {
        case DISCONNECTED:
        case CLOSING:
          long pauseEnd = pauseUntilNanos.get();
          if (pauseEnd != NO_PAUSE && now < pauseEnd && deadline.map(d -> now < d).orElse(true)) {
            Optional<DeliveryRecord> record = queue.poll(slice(now, pauseEnd, deadline));
            if (record.isPresent()) {
              return record.get();
            }
            continue;
          }
          pauseUntilNanos.set(ticker.read() + DISCONNECTED_PAUSE.toNanos());
          return DeliveryRecord.disconnected(
              status.lastEvent().orElseGet(ConnectionEvent::notConnected));
        case CONNECTING:
          pauseUntilNanos.set(NO_PAUSE);
          Optional<DeliveryRecord> arrived = queue.poll(SLICE);
          if (arrived.isPresent()) {
            return arrived.get();
          }
          continue;
        case CONNECTED:
          pauseUntilNanos.set(NO_PAUSE);
          if (deadline.isPresent() && now >= deadline.get()) {
            return DeliveryRecord.timeout();
          }
          Optional<DeliveryRecord> received =
              queue.poll(slice(now, deadline.orElse(Long.MAX_VALUE), Optional.empty()));
          if (received.isPresent()) {
            return received.get();
          }
          continue;
      }
    }
  }

  /**
   * An endless iterator over {@link #next}.
   *
   * @throws IllegalStateException from {@code next()} if the thread is interrupted while waiting;
   *     the interrupt flag is restored
   */
  Iterator<DeliveryRecord> iterator(Optional<Duration> timeout) {
    return new AbstractIterator<DeliveryRecord>() {
      @Override
      protected DeliveryRecord computeNext() {
        try {
          return RecordPoller.this.next(timeout);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted while waiting for the next record", e);
        }
      }
    };
  }

  /** Timeouts too long to count in nanoseconds are treated as {@code Long.MAX_VALUE}. */
  private static long saturatedNanos(Duration timeout) {
    try {
      return timeout.toNanos();
    } catch (ArithmeticException e) {
      return timeout.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
    }
  }

  private static Duration slice(long now, long until, Optional<Long> deadline) {
    long end = Math.min(until, deadline.orElse(Long.MAX_VALUE));
    long remaining = Math.max(0, LongMath.saturatedSubtract(end, now));
    return Duration.ofNanos(Math.min(remaining, SLICE.toNanos()));
  }
}
