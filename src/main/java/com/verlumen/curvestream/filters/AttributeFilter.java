package com.verlumen.curvestream.filters;

import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonObject;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Matches events for curves with the given attributes: a free-text query, areas, data types,
 * commodities, categories, exact categories and location. Unset attributes match everything.
 */
public final class AttributeFilter extends FilterSpec {
  static final String QUERY_KEY = "q";
  static final String AREAS_KEY = "areas";
  static final String DATA_TYPES_KEY = "data_types";
  static final String COMMODITIES_KEY = "commodity";
  static final String CATEGORIES_KEY = "category";
  static final String EXACT_CATEGORIES_KEY = "exact_category";
  static final String LOCATION_KEY = "location";

  private final Optional<String> query;
  private final ImmutableSet<String> areas;
  private final ImmutableSet<DataType> dataTypes;
  private final ImmutableSet<String> commodities;
  private final ImmutableSet<String> categories;
  private final ImmutableSet<String> exactCategories;
  private final Optional<String> location;

  private AttributeFilter(Builder builder) {
    super(builder);
    this.query = builder.query;
    this.areas = builder.areas;
    this.dataTypes = builder.dataTypes;
    this.commodities = builder.commodities;
    this.categories = builder.categories;
    this.exactCategories = builder.exactCategories;
    this.location = builder.location;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<String> query() {
    return query;
  }

  public ImmutableSet<String> areas() {
    return areas;
  }

  public ImmutableSet<DataType> dataTypes() {
    return dataTypes;
  }

  public ImmutableSet<String> commodities() {
    return commodities;
  }

  public ImmutableSet<String> categories() {
    return categories;
  }

  public ImmutableSet<String> exactCategories() {
    return exactCategories;
  }

  public Optional<String> location() {
    return location;
  }

  @Override
  void addVariantViolations(List<String> violations) {
    query.filter(String::isBlank).ifPresent(q -> violations.add("q: must not be blank"));
    location.filter(String::isBlank).ifPresent(l -> violations.add("location: must not be blank"));
  }

  @Override
  void addVariantProperties(JsonObject json) {
    query.ifPresent(value -> json.addProperty(QUERY_KEY, value));
    if (!areas.isEmpty()) {
      json.add(AREAS_KEY, toJsonArray(areas));
    }
    if (!dataTypes.isEmpty()) {
      json.add(DATA_TYPES_KEY, toJsonArray(dataTypes.stream().map(DataType::tag).toList()));
    }
    if (!commodities.isEmpty()) {
      json.add(COMMODITIES_KEY, toJsonArray(commodities));
    }
    if (!categories.isEmpty()) {
      json.add(CATEGORIES_KEY, toJsonArray(categories));
    }
    if (!exactCategories.isEmpty()) {
      json.add(EXACT_CATEGORIES_KEY, toJsonArray(exactCategories));
    }
    location.ifPresent(value -> json.addProperty(LOCATION_KEY, value));
  }

  /** Builder for {@link AttributeFilter}. */
  public static final class Builder extends FilterSpec.Builder<AttributeFilter, Builder> {
    private Optional<String> query = Optional.empty();
    private ImmutableSet<String> areas = ImmutableSet.of();
    private ImmutableSet<DataType> dataTypes = ImmutableSet.of();
    private ImmutableSet<String> commodities = ImmutableSet.of();
    private ImmutableSet<String> categories = ImmutableSet.of();
    private ImmutableSet<String> exactCategories = ImmutableSet.of();
    private Optional<String> location = Optional.empty();

    private Builder() {}

    /** Free-text search on curve names. */
    public Builder setQuery(String query) {
      this.query = optionalText(QUERY_KEY, query);
      return this;
    }

    public Builder setAreas(String... areas) {
      return setAreas(Arrays.asList(areas));
    }

    /** Area tags such as {@code DE} or {@code NO1}. Tags are upper-cased. */
    public Builder setAreas(Collection<String> areas) {
      clearViolation(AREAS_KEY);
      ImmutableSet.Builder<String> normalized = ImmutableSet.builder();
      for (String area : areas) {
        if (area == null || area.isBlank()) {
          recordViolation(AREAS_KEY, "areas: area tags must not be blank");
          continue;
        }
        normalized.add(area.trim().toUpperCase(Locale.ROOT));
      }
      this.areas = normalized.build();
      return this;
    }

    public Builder setDataTypes(DataType... dataTypes) {
      clearViolation(DATA_TYPES_KEY);
      this.dataTypes = ImmutableSet.copyOf(dataTypes);
      return this;
    }

    /** Sets data types by tag. Tags that do not resolve are reported by {@code validate()}. */
    public Builder setDataTypes(String... tags) {
      return setDataTypeTags(Arrays.asList(tags));
    }

    public Builder setDataTypeTags(Collection<String> tags) {
      clearViolation(DATA_TYPES_KEY);
      ImmutableSet.Builder<DataType> resolved = ImmutableSet.builder();
      List<String> unknown = new ArrayList<>();
      for (String tag : tags) {
        DataType.fromTag(tag).ifPresentOrElse(resolved::add, () -> unknown.add(String.valueOf(tag)));
      }
      if (!unknown.isEmpty()) {
        recordViolation(DATA_TYPES_KEY, "data_types: DataType not found for tag(s): " + unknown);
      }
      this.dataTypes = resolved.build();
      return this;
    }

    public Builder setCommodities(String... commodities) {
      return setCommodities(Arrays.asList(commodities));
    }

    public Builder setCommodities(Collection<String> commodities) {
      this.commodities = nonBlank(COMMODITIES_KEY, "commodities", commodities);
      return this;
    }

    public Builder setCategories(String... categories) {
      return setCategories(Arrays.asList(categories));
    }

    /** Curves must have at least one of the categories. */
    public Builder setCategories(Collection<String> categories) {
      this.categories = nonBlank(CATEGORIES_KEY, "categories", categories);
      return this;
    }

    public Builder setExactCategories(String... exactCategories) {
      return setExactCategories(Arrays.asList(exactCategories));
    }

    /**
     * Curves must match one of the exact categories. An exact category is one or more categories
     * in a single string, separated by space.
     */
    public Builder setExactCategories(Collection<String> exactCategories) {
      this.exactCategories = nonBlank(EXACT_CATEGORIES_KEY, "exact_categories", exactCategories);
      return this;
    }

    public Builder setLocation(String location) {
      this.location = optionalText(LOCATION_KEY, location);
      return this;
    }

    private Optional<String> optionalText(String key, String value) {
      clearViolation(key);
      if (value == null) {
        recordViolation(key, key + ": must be a string, got null");
        return Optional.empty();
      }
      return Optional.of(value);
    }

    @Override
    public AttributeFilter build() {
      return new AttributeFilter(this);
    }

    @Override
    Builder self() {
      return this;
    }

    private ImmutableSet<String> nonBlank(String key, String label, Collection<String> values) {
      clearViolation(key);
      ImmutableSet.Builder<String> kept = ImmutableSet.builder();
      for (String value : values) {
        if (value == null || value.isBlank()) {
          recordViolation(key, label + ": values must not be blank");
          continue;
        }
        kept.add(value.trim());
      }
      return kept.build();
    }
  }
}
