package com.verlumen.curvestream.filters;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.verlumen.curvestream.model.EventType;
import com.verlumen.curvestream.time.DateTimes;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A server-side predicate restricting which events are pushed on the stream.
 *
 * <p>There are two variants: {@link AttributeFilter} matches curves by their attributes and
 * {@link NameFilter} matches curves by exact name. Both share the event types and the
 * begin/end range of the changed data.
 *
 * <p>Filters are built leniently. Invalid input is recorded instead of thrown, so that {@link
 * #validate()} can report every violated constraint at once.
 */
public abstract class FilterSpec {
  static final String EVENT_TYPES_KEY = "event_types";
  static final String BEGIN_KEY = "begin";
  static final String END_KEY = "end";

  private final ImmutableSet<EventType> eventTypes;
  private final Optional<LocalDateTime> begin;
  private final Optional<LocalDateTime> end;
  private final ImmutableMap<String, String> inputViolations;

  FilterSpec(Builder<?, ?> builder) {
    this.eventTypes = ImmutableSet.copyOf(builder.eventTypes);
    this.begin = builder.begin;
    this.end = builder.end;
    this.inputViolations = ImmutableMap.copyOf(builder.violations);
  }

  public ImmutableSet<EventType> eventTypes() {
    return eventTypes;
  }

  public Optional<LocalDateTime> begin() {
    return begin;
  }

  public Optional<LocalDateTime> end() {
    return end;
  }

  /** Returns every violated constraint, or an empty list if the filter is valid. */
  public final ImmutableList<String> validate() {
    List<String> violations = new ArrayList<>(inputViolations.values());
    if (begin.isPresent() && end.isPresent() && begin.get().isAfter(end.get())) {
      violations.add(
          String.format(
              "begin (%s) must not be after end (%s)",
              DateTimes.format(begin.get()), DateTimes.format(end.get())));
    }
    addVariantViolations(violations);
    return ImmutableList.copyOf(violations);
  }

  public final boolean isValid() {
    return validate().isEmpty();
  }

  /** Serializes this filter into the object sent inside a {@code filter.set} message. */
  public final JsonObject toJson() {
    JsonObject json = new JsonObject();
    if (!eventTypes.isEmpty()) {
      json.add(
          EVENT_TYPES_KEY,
          toJsonArray(eventTypes.stream().map(EventType::tag).collect(toImmutableList())));
    }
    begin.ifPresent(value -> json.addProperty(BEGIN_KEY, DateTimes.format(value)));
    end.ifPresent(value -> json.addProperty(END_KEY, DateTimes.format(value)));
    addVariantProperties(json);
    return json;
  }

  abstract void addVariantViolations(List<String> violations);

  abstract void addVariantProperties(JsonObject json);

  static JsonArray toJsonArray(Collection<String> values) {
    JsonArray array = new JsonArray();
    values.forEach(array::add);
    return array;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + toJson();
  }

  /** Shared builder for both filter variants. */
  public abstract static class Builder<F extends FilterSpec, B extends Builder<F, B>> {
    private final Map<String, String> violations = new LinkedHashMap<>();
    private ImmutableSet<EventType> eventTypes = ImmutableSet.of();
    private Optional<LocalDateTime> begin = Optional.empty();
    private Optional<LocalDateTime> end = Optional.empty();

    Builder() {}

    public B setEventTypes(EventType... eventTypes) {
      violations.remove(EVENT_TYPES_KEY);
      this.eventTypes = ImmutableSet.copyOf(eventTypes);
      return self();
    }

    /** Sets event types by tag. Tags that do not resolve are reported by {@code validate()}. */
    public B setEventTypes(String... tags) {
      return setEventTypeTags(Arrays.asList(tags));
    }

    public B setEventTypeTags(Collection<String> tags) {
      violations.remove(EVENT_TYPES_KEY);
      ImmutableSet.Builder<EventType> resolved = ImmutableSet.builder();
      List<String> unknown = new ArrayList<>();
      for (String tag : tags) {
        Optional<EventType> eventType = EventType.fromTag(tag);
        if (eventType.isPresent()) {
          resolved.add(eventType.get());
        } else {
          unknown.add(String.valueOf(tag));
        }
      }
      if (!unknown.isEmpty()) {
        violations.put(EVENT_TYPES_KEY, "event_types: EventType not found for tag(s): " + unknown);
      }
      this.eventTypes = resolved.build();
      return self();
    }

    public B setBegin(LocalDateTime begin) {
      violations.remove(BEGIN_KEY);
      this.begin = Optional.of(checkNotNull(begin, "begin"));
      return self();
    }

    public B setBegin(LocalDate begin) {
      return setBegin(checkNotNull(begin, "begin").atStartOfDay());
    }

    /** Sets begin from a string. Bare dates are promoted to midnight. */
    public B setBegin(String begin) {
      this.begin = parseDateTime(BEGIN_KEY, begin);
      return self();
    }

    public B setEnd(LocalDateTime end) {
      violations.remove(END_KEY);
      this.end = Optional.of(checkNotNull(end, "end"));
      return self();
    }

    public B setEnd(LocalDate end) {
      return setEnd(checkNotNull(end, "end").atStartOfDay());
    }

    /** Sets end from a string. Bare dates are promoted to midnight. */
    public B setEnd(String end) {
      this.end = parseDateTime(END_KEY, end);
      return self();
    }

    public abstract F build();

    abstract B self();

    void recordViolation(String key, String message) {
      violations.put(key, message);
    }

    void clearViolation(String key) {
      violations.remove(key);
    }

    private Optional<LocalDateTime> parseDateTime(String key, String value) {
      violations.remove(key);
      if (value == null) {
        violations.put(key, key + ": must be a date-time, got null");
        return Optional.empty();
      }
      try {
        return Optional.of(DateTimes.parseLocalDateTime(value));
      } catch (DateTimeParseException e) {
        violations.put(key, String.format("%s: '%s' is not a date or date-time", key, value));
        return Optional.empty();
      }
    }
  }
}
