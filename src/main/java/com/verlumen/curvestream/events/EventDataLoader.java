package com.verlumen.curvestream.events;

import com.google.common.collect.ImmutableMap;
import com.google.common.escape.Escaper;
import com.google.common.flogger.FluentLogger;
import com.google.common.net.UrlEscapers;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.curvestream.http.HttpClient;
import com.verlumen.curvestream.model.CurveEvent;
import com.verlumen.curvestream.model.CurveType;
import com.verlumen.curvestream.model.InstanceRef;
import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Fetches the data a {@link CurveEvent} describes from the REST API.
 *
 * <p>Returns the response as raw JSON. Delete and truncate events have no data to fetch.
 */
public final class EventDataLoader {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Escaper PATH_ESCAPER = UrlEscapers.urlPathSegmentEscaper();
  private static final Escaper QUERY_ESCAPER = UrlEscapers.urlFormParameterEscaper();

  private final HttpClient httpClient;
  private final EventStreamConfig config;

  public static EventDataLoader create(EventStreamConfig config) {
    return Guice.createInjector(EventsModule.create(config)).getInstance(EventDataLoader.class);
  }

  @Inject
  EventDataLoader(HttpClient httpClient, EventStreamConfig config) {
    this.httpClient = httpClient;
    this.config = config;
  }

  /**
   * Loads the changed data, or nothing for event types that carry no data.
   *
   * @throws IllegalArgumentException if the event lacks the curve type, or an instance where the
   *     curve type requires one
   * @throws IOException if the request fails or the response is not JSON
   */
  public Optional<JsonElement> load(CurveEvent event) throws IOException {
    if (!event.eventType().hasData()) {
      return Optional.empty();
    }
    String url = urlFor(event);
    String body = httpClient.get(
        url, ImmutableMap.of("X-API-KEY", config.apiKey(), "Accept", "application/json"));
    try {
      return Optional.of(JsonParser.parseString(body));
    } catch (JsonParseException e) {
      logger.atWarning().log("Response from %s is not JSON", url);
      throw new IOException("Failed to parse response from " + url, e);
    }
  }

  String urlFor(CurveEvent event) {
    CurveType curveType = event.subject().curveType().orElseThrow(
        () -> new IllegalArgumentException("Event has no curve type: " + event));
    String curve = PATH_ESCAPER.escape(event.subject().name());
    switch (curveType) {
      case TIMESERIES:
      case SCENARIO_TIMESERIES:
        return withRange(String.format("/timeseries/%s/", curve), event);
      case INSTANCE:
        return config.apiBase() + String.format("/instances/%s/get/%s", curve, instancePath(event));
      case PERIOD:
        return withRange(String.format("/periods/%s/", curve), event);
      case INSTANCE_PERIOD:
        return withRange(
            String.format("/period-instances/%s/get/%s", curve, instancePath(event)), event);
      case OHLC:
        return withRange(String.format("/ohlc/%s/", curve), event);
    }
    throw new AssertionError("Unhandled curve type: " + curveType);
  }

  private static String instancePath(CurveEvent event) {
    InstanceRef instance = event.instance().orElseThrow(
        () -> new IllegalArgumentException("Event for an instance curve has no instance: " + event));
    String issued = PATH_ESCAPER.escape(format(instance.issued()));
    if (instance.tag().isEmpty()) {
      return issued + "/";
    }
    String tag = PATH_ESCAPER.escape(instance.tag().toLowerCase(Locale.ROOT));
    return String.format("%s/%s/", issued, tag);
  }

  private String withRange(String path, CurveEvent event) {
    StringJoiner query = new StringJoiner("&", "?", "").setEmptyValue("");
    event.begin().ifPresent(begin -> query.add("begin=" + QUERY_ESCAPER.escape(format(begin))));
    event.end().ifPresent(end -> query.add("end=" + QUERY_ESCAPER.escape(format(end))));
    return config.apiBase() + path + query;
  }

  private static String format(OffsetDateTime dateTime) {
    return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(dateTime);
  }
}
