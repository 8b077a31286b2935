package com.verlumen.curvestream.events;

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import java.util.Optional;

/** The {@code type} tags the server sends, mapped to the kind of record they produce. */
enum InboundMessageType {
  CURVE_EVENT(MessageKind.EVENT, "curves.event", "event"),
  FILTERS(MessageKind.FILTERS, "filters", "curves.filters"),
  INFO(MessageKind.INFO, "info", "message"),
  ERROR(MessageKind.ERROR, "error");

  private static final ImmutableMap<String, InboundMessageType> BY_TAG = buildLookup();

  private final MessageKind kind;
  private final String[] tags;

  InboundMessageType(MessageKind kind, String... tags) {
    this.kind = kind;
    this.tags = tags;
  }

  MessageKind kind() {
    return kind;
  }

  /** Looks up a tag, ignoring case. */
  static Optional<InboundMessageType> fromTag(String tag) {
    return Optional.ofNullable(BY_TAG.get(tag.toLowerCase(Locale.ROOT)));
  }

  private static ImmutableMap<String, InboundMessageType> buildLookup() {
    ImmutableMap.Builder<String, InboundMessageType> lookup = ImmutableMap.builder();
    for (InboundMessageType type : values()) {
      for (String tag : type.tags) {
        lookup.put(tag, type);
      }
    }
    return lookup.buildOrThrow();
  }
}
