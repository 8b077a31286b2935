package com.verlumen.curvestream.model;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import java.util.Optional;

/**
 * The data operation an event describes. Also used when filtering events on the stream.
 *
 * <p>Lookups accept the wire tag ({@code CURVE_UPDATE}) as well as the short name ({@code
 * UPDATE}), case-insensitive.
 */
public enum EventType {
  /** A curve was created. */
  CREATE("CURVE_CREATE", "Curve Create"),
  /** Data is created or modified. */
  UPDATE("CURVE_UPDATE", "Curve Update"),
  /** Data in a range is deleted. */
  DELETE("CURVE_DELETE", "Curve Delete"),
  /** All data for a curve is deleted. */
  TRUNCATE("CURVE_TRUNCATE", "Curve Truncate");

  private static final ImmutableMap<String, EventType> BY_TAG = buildLookup();

  private final String tag;
  private final String label;

  EventType(String tag, String label) {
    this.tag = tag;
    this.label = label;
  }

  public String tag() {
    return tag;
  }

  public String label() {
    return label;
  }

  /** Whether there is data left to load for an event of this type. */
  public boolean hasData() {
    return this == CREATE || this == UPDATE;
  }

  public static boolean isValidTag(String tag) {
    return fromTag(tag).isPresent();
  }

  public static Optional<EventType> fromTag(String tag) {
    if (tag == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_TAG.get(tag.trim().toLowerCase(Locale.ROOT)));
  }

  /**
   * Looks up an event type by tag.
   *
   * @throws IllegalArgumentException if no event type exists for the tag
   */
  public static EventType byTag(String tag) {
    Optional<EventType> eventType = fromTag(tag);
    checkArgument(eventType.isPresent(), "EventType not found for tag: %s", tag);
    return eventType.get();
  }

  private static ImmutableMap<String, EventType> buildLookup() {
    ImmutableMap.Builder<String, EventType> lookup = ImmutableMap.builder();
    for (EventType eventType : values()) {
      lookup.put(eventType.tag.toLowerCase(Locale.ROOT), eventType);
      lookup.put(eventType.name().toLowerCase(Locale.ROOT), eventType);
    }
    return lookup.buildOrThrow();
  }
}
