package com.verlumen.curvestream.events;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.verlumen.curvestream.filters.FilterSpec;
import com.verlumen.curvestream.filters.FilterSpecs;
import com.verlumen.curvestream.model.CurveEvent;
import com.verlumen.curvestream.model.CurveType;
import com.verlumen.curvestream.model.EventType;
import com.verlumen.curvestream.model.InstanceRef;
import com.verlumen.curvestream.model.SequenceId;
import com.verlumen.curvestream.model.Subject;
import com.verlumen.curvestream.time.DateTimes;
import java.time.DateTimeException;
import java.util.Optional;
import java.util.stream.Collectors;

/** Turns the text of one inbound frame into a {@link DeliveryRecord}. Holds no state. */
final class MessageParser {
  static final String TYPE_KEY = "type";
  private static final String MESSAGE_KEY = "message";

  /**
   * @throws MessageParseException if the text is not a JSON object, has no usable {@code type}, or
   *     lacks a field its type requires
   */
  DeliveryRecord parse(String text) throws MessageParseException {
    JsonObject json = parseObject(text);
    String tag = requiredString(json, TYPE_KEY);
    Optional<InboundMessageType> type = InboundMessageType.fromTag(tag);
    if (type.isEmpty()) {
      // Unknown tags that carry a text message are plain notices.
      if (json.has(MESSAGE_KEY) && isString(json.get(MESSAGE_KEY))) {
        return DeliveryRecord.ofInfo(new InfoNotice(json.get(MESSAGE_KEY).getAsString()));
      }
      throw new MessageParseException(String.format("Unknown message type '%s'", tag));
    }
    try {
      switch (type.get()) {
        case CURVE_EVENT:
          return DeliveryRecord.ofEvent(parseEvent(json));
        case FILTERS:
          return DeliveryRecord.ofFilters(parseFilters(json));
        case INFO:
          return DeliveryRecord.ofInfo(new InfoNotice(requiredString(json, MESSAGE_KEY)));
        case ERROR:
          return DeliveryRecord.ofError(new ErrorNotice(text, errorReason(json)));
      }
    } catch (JsonParseException
        | IllegalStateException
        | UnsupportedOperationException
        | IllegalArgumentException
        | DateTimeException e) {
      throw new MessageParseException(
          String.format("Failed to parse '%s' message: %s", tag, e.getMessage()), e);
    }
    throw new AssertionError("Unhandled message type: " + type.get());
  }

  private static JsonObject parseObject(String text) throws MessageParseException {
    JsonElement root;
    try {
      root = JsonParser.parseString(text);
    } catch (JsonParseException e) {
      throw new MessageParseException("Message is not valid JSON", e);
    }
    if (!root.isJsonObject()) {
      throw new MessageParseException("Message is not a JSON object");
    }
    return root.getAsJsonObject();
  }

  private static CurveEvent parseEvent(JsonObject json) throws MessageParseException {
    String eventTag = requiredString(json, "event_type");
    EventType eventType = EventType.fromTag(eventTag)
        .orElseThrow(() -> new MessageParseException("Unknown event type '" + eventTag + "'"));
    CurveEvent.Builder builder = CurveEvent.builder()
        .setId(SequenceId.parse(requiredString(json, "id")))
        .setSubject(parseSubject(json))
        .setEventType(eventType);
    optional(json, "begin").ifPresent(
        begin -> builder.setBegin(DateTimes.parseOffsetDateTime(begin.getAsString())));
    optional(json, "end").ifPresent(
        end -> builder.setEnd(DateTimes.parseOffsetDateTime(end.getAsString())));
    Optional<JsonElement> instance = optional(json, "instance");
    if (instance.isPresent()) {
      JsonObject instanceJson = instance.get().getAsJsonObject();
      String tag = optional(instanceJson, "tag").map(JsonElement::getAsString).orElse("");
      builder.setInstance(InstanceRef.create(
          DateTimes.parseOffsetDateTime(requiredString(instanceJson, "issued")), tag));
    }
    optional(json, "values_changed").ifPresent(
        count -> builder.setValuesChanged(count.getAsLong()));
    return builder.build();
  }

  /** The subject is either a plain curve name or a curve object; older servers call it "curve". */
  private static Subject parseSubject(JsonObject json) throws MessageParseException {
    JsonElement subject = optional(json, "subject")
        .or(() -> optional(json, "curve"))
        .orElseThrow(() -> new MessageParseException("Missing required field 'subject'"));
    if (isString(subject)) {
      return Subject.named(subject.getAsString());
    }
    JsonObject curve = subject.getAsJsonObject();
    Subject.Builder builder = Subject.builder().setName(requiredString(curve, "name"));
    optional(curve, "curve_type")
        .flatMap(curveType -> CurveType.fromTag(curveType.getAsString()))
        .ifPresent(builder::setCurveType);
    optional(curve, "area").ifPresent(area -> builder.setArea(area.getAsString()));
    return builder.build();
  }

  private static FilterListReply parseFilters(JsonObject json) throws MessageParseException {
    Optional<String> requestId = optional(json, "request_id")
        .or(() -> optional(json, "id"))
        .map(JsonElement::getAsString);
    JsonObject container = optional(json, "data").map(JsonElement::getAsJsonObject).orElse(json);
    ImmutableList<FilterSpec> filters = optional(container, "filters")
        .map(value -> FilterSpecs.fromJsonArray(value.getAsJsonArray()))
        .orElse(ImmutableList.of());
    return new FilterListReply(requestId, filters);
  }

  private static String errorReason(JsonObject json) {
    Optional<JsonElement> errors = optional(json, "errors");
    if (errors.isPresent() && errors.get().isJsonArray()) {
      return errors.get().getAsJsonArray().asList().stream()
          .map(error -> isString(error) ? error.getAsString() : error.toString())
          .collect(Collectors.joining("; "));
    }
    return optional(json, MESSAGE_KEY)
        .filter(MessageParser::isString)
        .map(JsonElement::getAsString)
        .orElse("Server reported an error");
  }

  private static String requiredString(JsonObject json, String key) throws MessageParseException {
    Optional<JsonElement> value = optional(json, key);
    if (value.isEmpty() || !isString(value.get())) {
      throw new MessageParseException(String.format("Missing required field '%s'", key));
    }
    return value.get().getAsString();
  }

  private static Optional<JsonElement> optional(JsonObject json, String key) {
    JsonElement value = json.get(key);
    return value == null || value.isJsonNull() ? Optional.empty() : Optional.of(value);
  }

  private static boolean isString(JsonElement element) {
    return element.isJsonPrimitive() && element.getAsJsonPrimitive().isString();
  }
}
