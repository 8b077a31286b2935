package com.verlumen.curvestream.events;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.verlumen.curvestream.filters.AttributeFilter;
import com.verlumen.curvestream.filters.NameFilter;
import com.verlumen.curvestream.model.CurveEvent;
import com.verlumen.curvestream.model.CurveType;
import com.verlumen.curvestream.model.EventType;
import com.verlumen.curvestream.model.SequenceId;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class MessageParserTest {
  private final MessageParser parser = new MessageParser();

  @Test
  public void parse_curveEvent() throws Exception {
    DeliveryRecord record = parser.parse(
        "{\"type\":\"curves.event\",\"id\":\"1700000000000-4\","
            + "\"curve\":{\"name\":\"DE Wind Power Production MWh/h 15min Actual\","
            + "\"curve_type\":\"TIMESERIES\",\"area\":\"DE\"},"
            + "\"event_type\":\"CURVE_UPDATE\","
            + "\"begin\":\"2024-01-01T00:00:00+01:00\",\"end\":\"2024-01-02T00:00:00+01:00\","
            + "\"values_changed\":96}");

    assertThat(record.kind()).isEqualTo(MessageKind.EVENT);
    CurveEvent event = record.event();
    assertThat(event.id()).isEqualTo(SequenceId.parse("1700000000000-4"));
    assertThat(event.subject().name()).isEqualTo("DE Wind Power Production MWh/h 15min Actual");
    assertThat(event.subject().curveType()).hasValue(CurveType.TIMESERIES);
    assertThat(event.subject().area()).hasValue("DE");
    assertThat(event.eventType()).isEqualTo(EventType.UPDATE);
    assertThat(event.begin())
        .hasValue(OffsetDateTime.of(2024, 1, 1, 0, 0, 0, 0, ZoneOffset.ofHours(1)));
    assertThat(event.valuesChanged()).hasValue(96L);
    assertThat(event.instance()).isEmpty();
  }

  @Test
  public void parse_eventWithPlainSubjectAndInstance() throws Exception {
    DeliveryRecord record = parser.parse(
        "{\"type\":\"event\",\"id\":\"1700000000000-5\",\"subject\":\"NO1 Forecast\","
            + "\"event_type\":\"CURVE_CREATE\","
            + "\"instance\":{\"issued\":\"2024-01-01T06:00:00Z\",\"tag\":\"ec\"}}");

    CurveEvent event = record.event();
    assertThat(event.subject().name()).isEqualTo("NO1 Forecast");
    assertThat(event.instance().get().tag()).isEqualTo("ec");
    assertThat(event.instance().get().issued())
        .isEqualTo(OffsetDateTime.of(2024, 1, 1, 6, 0, 0, 0, ZoneOffset.UTC));
  }

  @Test
  public void parse_filtersReply() throws Exception {
    DeliveryRecord record = parser.parse(
        "{\"type\":\"filters\",\"request_id\":\"r-1\",\"filters\":["
            + "{\"curve_names\":[\"A\"]},{\"areas\":[\"DE\"],\"event_types\":[\"CURVE_UPDATE\"]}]}");

    assertThat(record.kind()).isEqualTo(MessageKind.FILTERS);
    assertThat(record.filters().requestId()).hasValue("r-1");
    assertThat(record.filters().filters()).hasSize(2);
    assertThat(record.filters().filters().get(0)).isInstanceOf(NameFilter.class);
    assertThat(record.filters().filters().get(1)).isInstanceOf(AttributeFilter.class);
  }

  @Test
  public void parse_infoAndMessageTags() throws Exception {
    assertThat(parser.parse("{\"type\":\"info\",\"message\":\"hello\"}").info())
        .isEqualTo(new InfoNotice("hello"));
    assertThat(parser.parse("{\"type\":\"message\",\"message\":\"hi\"}").info())
        .isEqualTo(new InfoNotice("hi"));
  }

  @Test
  public void parse_unknownTagWithMessage_isInfo() throws Exception {
    DeliveryRecord record = parser.parse("{\"type\":\"maintenance\",\"message\":\"restart at 2\"}");

    assertThat(record.kind()).isEqualTo(MessageKind.INFO);
    assertThat(record.info().message()).isEqualTo("restart at 2");
  }

  @Test
  public void parse_serverError_keepsRawText() throws Exception {
    String raw = "{\"type\":\"error\",\"errors\":[\"bad filter\",\"bad date\"]}";

    DeliveryRecord record = parser.parse(raw);

    assertThat(record.error()).isEqualTo(new ErrorNotice(raw, "bad filter; bad date"));
  }

  @Test
  public void parse_rejectsMalformedMessages() {
    assertThrows(MessageParseException.class, () -> parser.parse("not json at all {"));
    assertThrows(MessageParseException.class, () -> parser.parse("[1,2]"));
    assertThrows(MessageParseException.class, () -> parser.parse("{\"id\":\"x\"}"));
    assertThrows(MessageParseException.class, () -> parser.parse("{\"type\":\"mystery\"}"));
  }

  @Test
  public void parse_unknownEventType_fails() {
    MessageParseException thrown = assertThrows(
        MessageParseException.class,
        () -> parser.parse(
            "{\"type\":\"curves.event\",\"id\":\"1700000000000-1\",\"subject\":\"A\","
                + "\"event_type\":\"CURVE_EXPLODE\"}"));

    assertThat(thrown).hasMessageThat().contains("CURVE_EXPLODE");
  }

  @Test
  public void parse_eventWithBadId_fails() {
    assertThrows(
        MessageParseException.class,
        () -> parser.parse(
            "{\"type\":\"curves.event\",\"id\":\"42\",\"subject\":\"A\","
                + "\"event_type\":\"CURVE_UPDATE\"}"));
  }
}
