package com.verlumen.curvestream.filters;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonParser;
import com.verlumen.curvestream.model.EventType;
import java.time.LocalDateTime;
import java.util.Arrays;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class FilterSpecsTest {
  @Test
  public void fromJson_curveNamesSelectNameFilter() {
    FilterSpec filter = FilterSpecs.fromJson(JsonParser.parseString(
        "{\"curve_names\":[\"DE Price\"],\"areas\":[\"DE\"],\"event_types\":[\"CURVE_UPDATE\"]}")
        .getAsJsonObject());

    assertThat(filter).isInstanceOf(NameFilter.class);
    assertThat(((NameFilter) filter).curveNames()).containsExactly("DE Price");
    assertThat(filter.eventTypes()).containsExactly(EventType.UPDATE);
  }

  @Test
  public void fromJson_withoutCurveNames_isAttributeFilter() {
    FilterSpec filter = FilterSpecs.fromJson(JsonParser.parseString(
        "{\"areas\":\"DE\",\"q\":\"wind\",\"begin\":\"2024-01-01 06:00:00\"}").getAsJsonObject());

    assertThat(filter).isInstanceOf(AttributeFilter.class);
    AttributeFilter attributes = (AttributeFilter) filter;
    assertThat(attributes.areas()).containsExactly("DE");
    assertThat(attributes.query()).hasValue("wind");
    assertThat(attributes.begin()).hasValue(LocalDateTime.of(2024, 1, 1, 6, 0));
  }

  @Test
  public void fromJsonArray_readsEveryFilter() {
    ImmutableList<FilterSpec> filters = FilterSpecs.fromJsonArray(JsonParser.parseString(
        "[{\"curve_names\":[\"A\"]},{\"areas\":[\"SE1\"]}]").getAsJsonArray());

    assertThat(filters).hasSize(2);
    assertThat(filters.get(0)).isInstanceOf(NameFilter.class);
    assertThat(filters.get(1)).isInstanceOf(AttributeFilter.class);
  }

  @Test
  public void checkValid_reportsViolationsOfAllFilters() {
    ImmutableList<FilterSpec> filters = ImmutableList.of(
        NameFilter.builder().build(),
        AttributeFilter.builder().setEventTypes("nope").build());

    FilterValidationException thrown =
        assertThrows(FilterValidationException.class, () -> FilterSpecs.checkValid(filters));

    assertThat(thrown.violations()).hasSize(2);
    assertThat(thrown.violations().get(0)).startsWith("filters[0] ");
    assertThat(thrown.violations().get(1)).startsWith("filters[1] ");
    assertThat(thrown).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void checkValid_emptyListAndNullEntries_areViolations() {
    assertThrows(FilterValidationException.class, () -> FilterSpecs.checkValid(ImmutableList.of()));

    FilterValidationException thrown = assertThrows(
        FilterValidationException.class,
        () -> FilterSpecs.checkValid(Arrays.asList(AttributeFilter.builder().build(), null)));
    assertThat(thrown.violations()).containsExactly("filters[1]: must not be null");
  }
}
