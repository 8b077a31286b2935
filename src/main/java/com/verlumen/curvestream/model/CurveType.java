package com.verlumen.curvestream.model;

import static com.google.common.collect.ImmutableMap.toImmutableMap;

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/** How the data of a curve is organized, which decides where its data is loaded from. */
public enum CurveType {
  TIMESERIES,
  SCENARIO_TIMESERIES,
  INSTANCE,
  PERIOD,
  INSTANCE_PERIOD,
  OHLC;

  private static final ImmutableMap<String, CurveType> BY_TAG =
      Stream.of(values())
          .collect(toImmutableMap(curveType -> curveType.tag().toLowerCase(Locale.ROOT), c -> c));

  public String tag() {
    return name();
  }

  public static Optional<CurveType> fromTag(String tag) {
    if (tag == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_TAG.get(tag.trim().toLowerCase(Locale.ROOT)));
  }
}
