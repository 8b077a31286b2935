package com.verlumen.curvestream.filters;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.util.Collection;
import java.util.function.Consumer;

/** Reads filters echoed back by the server and checks filter lists before they are sent. */
public final class FilterSpecs {
  /**
   * Decodes one filter object. Presence of {@code curve_names} always selects {@link NameFilter};
   * otherwise the object is read as an {@link AttributeFilter}.
   *
   * @throws IllegalArgumentException if a field has the wrong JSON shape
   */
  public static FilterSpec fromJson(JsonObject json) {
    JsonElement curveNames = json.get(NameFilter.CURVE_NAMES_KEY);
    if (curveNames != null && !curveNames.isJsonNull()) {
      NameFilter.Builder builder =
          NameFilter.builder().setCurveNames(strings(curveNames));
      readShared(json, builder);
      return builder.build();
    }
    AttributeFilter.Builder builder = AttributeFilter.builder();
    readShared(json, builder);
    ifPresent(json, AttributeFilter.QUERY_KEY, value -> builder.setQuery(value.getAsString()));
    ifPresent(json, AttributeFilter.AREAS_KEY, value -> builder.setAreas(strings(value)));
    ifPresent(
        json, AttributeFilter.DATA_TYPES_KEY, value -> builder.setDataTypeTags(strings(value)));
    ifPresent(json, AttributeFilter.COMMODITIES_KEY, value -> builder.setCommodities(strings(value)));
    ifPresent(json, AttributeFilter.CATEGORIES_KEY, value -> builder.setCategories(strings(value)));
    ifPresent(
        json,
        AttributeFilter.EXACT_CATEGORIES_KEY,
        value -> builder.setExactCategories(strings(value)));
    ifPresent(json, AttributeFilter.LOCATION_KEY, value -> builder.setLocation(value.getAsString()));
    return builder.build();
  }

  /** Decodes a JSON array of filter objects. */
  public static ImmutableList<FilterSpec> fromJsonArray(JsonArray array) {
    ImmutableList.Builder<FilterSpec> filters = ImmutableList.builder();
    for (JsonElement element : array) {
      checkArgument(element.isJsonObject(), "Expected a filter object but got: %s", element);
      filters.add(fromJson(element.getAsJsonObject()));
    }
    return filters.build();
  }

  /**
   * Validates every filter and throws if any is invalid. The exception lists all violations of all
   * filters, each prefixed with the position of the filter.
   */
  public static void checkValid(Collection<? extends FilterSpec> filters) {
    ImmutableList.Builder<String> violations = ImmutableList.builder();
    if (filters.isEmpty()) {
      violations.add("filters: at least one filter is required");
    }
    int index = 0;
    for (FilterSpec filter : filters) {
      if (filter == null) {
        violations.add(String.format("filters[%d]: must not be null", index));
      } else {
        for (String violation : filter.validate()) {
          violations.add(String.format("filters[%d] %s", index, violation));
        }
      }
      index++;
    }
    ImmutableList<String> result = violations.build();
    if (!result.isEmpty()) {
      throw new FilterValidationException(result);
    }
  }

  private static void readShared(JsonObject json, FilterSpec.Builder<?, ?> builder) {
    ifPresent(json, FilterSpec.EVENT_TYPES_KEY, value -> builder.setEventTypeTags(strings(value)));
    ifPresent(json, FilterSpec.BEGIN_KEY, value -> builder.setBegin(value.getAsString()));
    ifPresent(json, FilterSpec.END_KEY, value -> builder.setEnd(value.getAsString()));
  }

  private static void ifPresent(JsonObject json, String key, Consumer<JsonElement> action) {
    JsonElement value = json.get(key);
    if (value != null && !value.isJsonNull()) {
      action.accept(value);
    }
  }

  /** Accepts either a single string or an array of strings. */
  private static ImmutableList<String> strings(JsonElement value) {
    if (value.isJsonArray()) {
      return value.getAsJsonArray().asList().stream()
          .map(JsonElement::getAsString)
          .collect(toImmutableList());
    }
    checkArgument(value.isJsonPrimitive(), "Expected a string or a list of strings: %s", value);
    return ImmutableList.of(value.getAsString());
  }

  private FilterSpecs() {}
}
