package com.verlumen.curvestream.events;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.google.gson.JsonParser;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.Bind;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.curvestream.http.HttpClient;
import com.verlumen.curvestream.model.CurveEvent;
import com.verlumen.curvestream.model.CurveType;
import com.verlumen.curvestream.model.EventType;
import com.verlumen.curvestream.model.InstanceRef;
import com.verlumen.curvestream.model.SequenceId;
import com.verlumen.curvestream.model.Subject;
import java.io.IOException;
import java.net.URI;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class EventDataLoaderTest {
  private static final OffsetDateTime BEGIN =
      OffsetDateTime.of(2024, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);
  private static final OffsetDateTime END = BEGIN.plusDays(1);

  @Rule public MockitoRule mocks = MockitoJUnit.rule();

  @Mock @Bind private HttpClient mockHttpClient;

  @Bind
  private EventStreamConfig config =
      EventStreamConfig.create(URI.create("https://x.test/api"), "key");

  @Inject private EventDataLoader loader;

  @Before
  public void setUp() {
    Guice.createInjector(BoundFieldModule.of(this)).injectMembers(this);
  }

  @Test
  public void load_timeseries_requestsRangeWithApiKey() throws Exception {
    when(mockHttpClient.get(anyString(), anyMap())).thenReturn("{\"data\":[]}");

    assertThat(loader.load(event(CurveType.TIMESERIES, EventType.UPDATE).build()))
        .hasValue(JsonParser.parseString("{\"data\":[]}"));

    verify(mockHttpClient).get(
        eq("https://x.test/api/timeseries/DE%20Price/"
            + "?begin=2024-01-01T00%3A00%3A00Z&end=2024-01-02T00%3A00%3A00Z"),
        eq(Map.of("X-API-KEY", "key", "Accept", "application/json")));
  }

  @Test
  public void urlFor_instance_usesIssuedAndLowerCaseTag() {
    CurveEvent event = event(CurveType.INSTANCE, EventType.CREATE)
        .setInstance(InstanceRef.create(BEGIN, "EC"))
        .build();

    assertThat(loader.urlFor(event))
        .isEqualTo("https://x.test/api/instances/DE%20Price/get/2024-01-01T00:00:00Z/ec/");
  }

  @Test
  public void urlFor_periodInstance_withoutTag() {
    CurveEvent event = event(CurveType.INSTANCE_PERIOD, EventType.UPDATE)
        .setInstance(InstanceRef.create(BEGIN, ""))
        .build();

    assertThat(loader.urlFor(event))
        .startsWith(
            "https://x.test/api/period-instances/DE%20Price/get/2024-01-01T00:00:00Z/?begin=");
  }

  @Test
  public void urlFor_otherCurveTypes() {
    assertThat(loader.urlFor(event(CurveType.SCENARIO_TIMESERIES, EventType.UPDATE).build()))
        .startsWith("https://x.test/api/timeseries/DE%20Price/?");
    assertThat(loader.urlFor(event(CurveType.PERIOD, EventType.UPDATE).build()))
        .startsWith("https://x.test/api/periods/DE%20Price/?");
    assertThat(loader.urlFor(event(CurveType.OHLC, EventType.UPDATE).build()))
        .startsWith("https://x.test/api/ohlc/DE%20Price/?");
  }

  @Test
  public void load_deleteAndTruncate_fetchNothing() throws Exception {
    assertThat(loader.load(event(CurveType.TIMESERIES, EventType.DELETE).build())).isEmpty();
    assertThat(loader.load(event(CurveType.TIMESERIES, EventType.TRUNCATE).build())).isEmpty();

    verifyNoInteractions(mockHttpClient);
  }

  @Test
  public void load_instanceWithoutInstanceRef_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () -> loader.load(event(CurveType.INSTANCE, EventType.UPDATE).build()));
  }

  @Test
  public void load_nonJsonResponse_throwsIOException() throws Exception {
    when(mockHttpClient.get(anyString(), anyMap())).thenReturn("<html>oops");

    assertThrows(
        IOException.class, () -> loader.load(event(CurveType.OHLC, EventType.UPDATE).build()));
  }

  private static CurveEvent.Builder event(CurveType curveType, EventType eventType) {
    return CurveEvent.builder()
        .setId(SequenceId.parse("1700000000000-1"))
        .setSubject(Subject.builder().setName("DE Price").setCurveType(curveType).build())
        .setEventType(eventType)
        .setBegin(BEGIN)
        .setEnd(END);
  }
}
