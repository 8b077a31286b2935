package com.verlumen.curvestream.filters;

import static com.google.common.collect.ImmutableMap.toImmutableMap;

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;

/** The kind of data a curve holds. Always the last word of a curve name. */
public enum DataType {
  ACTUAL,
  CLIMATE,
  SYNTHETIC,
  BACKCAST,
  NORMAL,
  VALUE,
  FORECAST,
  FOREX,
  OHLC,
  REMIT,
  CAPACITY;

  private static final ImmutableMap<String, DataType> BY_TAG =
      Stream.of(values())
          .collect(toImmutableMap(dataType -> dataType.tag().toLowerCase(Locale.ROOT), Function.identity()));

  public String tag() {
    return name();
  }

  public static Optional<DataType> fromTag(String tag) {
    if (tag == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_TAG.get(tag.trim().toLowerCase(Locale.ROOT)));
  }
}
