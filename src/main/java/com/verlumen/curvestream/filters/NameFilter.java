package com.verlumen.curvestream.filters;

import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonObject;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/** Matches events for curves with one of the given exact names. */
public final class NameFilter extends FilterSpec {
  static final String CURVE_NAMES_KEY = "curve_names";

  private final ImmutableSet<String> curveNames;

  private NameFilter(Builder builder) {
    super(builder);
    this.curveNames = builder.curveNames;
  }

  public static Builder builder() {
    return new Builder();
  }

  public ImmutableSet<String> curveNames() {
    return curveNames;
  }

  @Override
  void addVariantViolations(List<String> violations) {
    if (curveNames.isEmpty()) {
      violations.add("curve_names: at least one curve name is required");
    }
  }

  @Override
  void addVariantProperties(JsonObject json) {
    json.add(CURVE_NAMES_KEY, toJsonArray(curveNames));
  }

  /** Builder for {@link NameFilter}. */
  public static final class Builder extends FilterSpec.Builder<NameFilter, Builder> {
    private ImmutableSet<String> curveNames = ImmutableSet.of();

    private Builder() {}

    public Builder setCurveNames(String... curveNames) {
      return setCurveNames(Arrays.asList(curveNames));
    }

    public Builder setCurveNames(Collection<String> curveNames) {
      clearViolation(CURVE_NAMES_KEY);
      ImmutableSet.Builder<String> names = ImmutableSet.builder();
      for (String name : curveNames) {
        if (name == null || name.isBlank()) {
          recordViolation(CURVE_NAMES_KEY, "curve_names: curve names must not be blank");
          continue;
        }
        names.add(name.trim());
      }
      this.curveNames = names.build();
      return this;
    }

    @Override
    public NameFilter build() {
      return new NameFilter(this);
    }

    @Override
    Builder self() {
      return this;
    }
  }
}
