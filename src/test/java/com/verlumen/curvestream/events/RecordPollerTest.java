package com.verlumen.curvestream.events;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.base.Stopwatch;
import com.verlumen.curvestream.model.CurveEvent;
import com.verlumen.curvestream.model.EventType;
import com.verlumen.curvestream.model.SequenceId;
import com.verlumen.curvestream.model.Subject;
import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RecordPollerTest {
  private static final Optional<Duration> ONE_SECOND = Optional.of(Duration.ofSeconds(1));

  private final FakeConnectionStatus status = new FakeConnectionStatus();
  private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
  private DeliveryQueue queue;
  private RecordPoller poller;

  @Before
  public void setUp() {
    queue = new DeliveryQueue(EventStreamConfig.create(URI.create("https://x.test/api"), "key"));
    poller = new RecordPoller(queue, status);
  }

  @After
  public void tearDown() {
    scheduler.shutdownNow();
  }

  @Test
  public void next_returnsQueuedRecordsFirst_evenWhenDisconnected() throws Exception {
    status.state = ConnectionState.DISCONNECTED;
    queue.put(DeliveryRecord.ofEvent(event("1700000000000-1")));
    queue.put(DeliveryRecord.ofInfo(new InfoNotice("second")));

    assertThat(poller.next(ONE_SECOND).kind()).isEqualTo(MessageKind.EVENT);
    assertThat(poller.next(ONE_SECOND).kind()).isEqualTo(MessageKind.INFO);
    assertThat(poller.next(ONE_SECOND).kind()).isEqualTo(MessageKind.DISCONNECTED);
  }

  @Test
  public void next_afterRetriesExhausted_returnsDisconnectedImmediately() throws Exception {
    status.state = ConnectionState.DISCONNECTED;
    status.lastEvent = ConnectionEvent.fromError(new ConnectException("refused")).retriesExhausted(3);
    Stopwatch stopwatch = Stopwatch.createStarted();

    DeliveryRecord record = poller.next(ONE_SECOND);

    assertThat(stopwatch.elapsed()).isLessThan(Duration.ofMillis(500));
    assertThat(record.kind()).isEqualTo(MessageKind.DISCONNECTED);
    assertThat(record.disconnect().message()).contains("Retries exhausted");
  }

  @Test
  public void next_repeatedDisconnected_pausesBetweenRecords() throws Exception {
    status.state = ConnectionState.DISCONNECTED;
    poller.next(ONE_SECOND);
    Stopwatch stopwatch = Stopwatch.createStarted();

    DeliveryRecord record = poller.next(Optional.of(Duration.ofMillis(300)));

    assertThat(record.kind()).isEqualTo(MessageKind.DISCONNECTED);
    assertThat(stopwatch.elapsed()).isAtLeast(Duration.ofMillis(250));
    assertThat(stopwatch.elapsed()).isLessThan(RecordPoller.DISCONNECTED_PAUSE);
  }

  @Test
  public void next_duringPause_returnsArrivingRecord() throws Exception {
    status.state = ConnectionState.DISCONNECTED;
    poller.next(ONE_SECOND);
    scheduler.schedule(
        () -> queue.put(DeliveryRecord.ofInfo(new InfoNotice("late"))), 200, TimeUnit.MILLISECONDS);

    DeliveryRecord record = poller.next(Optional.empty());

    assertThat(record.info().message()).isEqualTo("late");
  }

  @Test
  public void next_neverConnected_describesNotConnected() throws Exception {
    status.state = ConnectionState.DISCONNECTED;

    DeliveryRecord record = poller.next(ONE_SECOND);

    assertThat(record.disconnect()).isEqualTo(ConnectionEvent.notConnected());
  }

  @Test
  public void next_connected_returnsTimeoutAfterTimeout() throws Exception {
    status.state = ConnectionState.CONNECTED;
    Stopwatch stopwatch = Stopwatch.createStarted();

    DeliveryRecord record = poller.next(Optional.of(Duration.ofMillis(200)));

    assertThat(record.kind()).isEqualTo(MessageKind.TIMEOUT);
    assertThat(stopwatch.elapsed()).isAtLeast(Duration.ofMillis(150));
  }

  @Test
  public void next_connected_returnsRecordArrivingBeforeTimeout() throws Exception {
    status.state = ConnectionState.CONNECTED;
    scheduler.schedule(
        () -> queue.put(DeliveryRecord.ofEvent(event("1700000000000-9"))),
        100,
        TimeUnit.MILLISECONDS);

    DeliveryRecord record = poller.next(ONE_SECOND);

    assertThat(record.event().id()).isEqualTo(SequenceId.parse("1700000000000-9"));
  }

  @Test
  public void next_connected_acceptsTimeoutBeyondNanosecondRange() throws Exception {
    status.state = ConnectionState.CONNECTED;
    scheduler.schedule(
        () -> queue.put(DeliveryRecord.ofInfo(new InfoNotice("eventually"))),
        100,
        TimeUnit.MILLISECONDS);

    DeliveryRecord record = poller.next(Optional.of(ChronoUnit.FOREVER.getDuration()));

    assertThat(record.info().message()).isEqualTo("eventually");
  }

  @Test
  public void next_whileReconnecting_waitsPastTimeoutWithoutSyntheticRecord() throws Exception {
    status.state = ConnectionState.CONNECTING;
    scheduler.schedule(
        () -> queue.put(DeliveryRecord.ofInfo(new InfoNotice("back"))), 300, TimeUnit.MILLISECONDS);

    DeliveryRecord record = poller.next(Optional.of(Duration.ofMillis(50)));

    assertThat(record.kind()).isEqualTo(MessageKind.INFO);
  }

  @Test
  public void next_reconnectingThenConnected_timesOut() throws Exception {
    status.state = ConnectionState.CONNECTING;
    scheduler.schedule(() -> status.state = ConnectionState.CONNECTED, 200, TimeUnit.MILLISECONDS);

    DeliveryRecord record = poller.next(Optional.of(Duration.ofMillis(50)));

    assertThat(record.kind()).isEqualTo(MessageKind.TIMEOUT);
  }

  @Test
  public void iterator_neverEnds() {
    status.state = ConnectionState.CONNECTED;
    Iterator<DeliveryRecord> records = poller.iterator(Optional.of(Duration.ofMillis(10)));

    for (int i = 0; i < 3; i++) {
      assertThat(records.hasNext()).isTrue();
      assertThat(records.next().kind()).isEqualTo(MessageKind.TIMEOUT);
    }
  }

  private static CurveEvent event(String id) {
    return CurveEvent.builder()
        .setId(SequenceId.parse(id))
        .setSubject(Subject.named("DE Price"))
        .setEventType(EventType.UPDATE)
        .build();
  }

  private static final class FakeConnectionStatus implements ConnectionStatus {
    volatile ConnectionState state = ConnectionState.DISCONNECTED;
    volatile ConnectionEvent lastEvent;

    @Override
    public ConnectionState state() {
      return state;
    }

    @Override
    public Optional<ConnectionEvent> lastEvent() {
      return Optional.ofNullable(lastEvent);
    }
  }
}
