package com.verlumen.curvestream.model;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.util.Optional;

/** The curve an event is about. Only the name is guaranteed to be present. */
@AutoValue
public abstract class Subject {
  public static Subject named(String name) {
    return builder().setName(name).build();
  }

  public static Builder builder() {
    return new AutoValue_Subject.Builder();
  }

  public abstract String name();

  public abstract Optional<CurveType> curveType();

  public abstract Optional<String> area();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setName(String name);

    public abstract Builder setCurveType(CurveType curveType);

    public abstract Builder setArea(String area);

    abstract Subject autoBuild();

    public Subject build() {
      Subject subject = autoBuild();
      checkArgument(!subject.name().isBlank(), "Subject name must not be blank");
      return subject;
    }
  }
}
