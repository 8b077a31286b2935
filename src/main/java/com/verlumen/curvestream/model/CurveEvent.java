package com.verlumen.curvestream.model;

import com.google.auto.value.AutoValue;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * A change notification for one curve, pushed by the server.
 *
 * <p>The event only describes what changed. Use {@code EventDataLoader} to fetch the data itself.
 */
@AutoValue
public abstract class CurveEvent {
  public static Builder builder() {
    return new AutoValue_CurveEvent.Builder();
  }

  public abstract SequenceId id();

  public abstract Subject subject();

  public abstract EventType eventType();

  /** Start of the changed range, if the change is limited to a range. */
  public abstract Optional<OffsetDateTime> begin();

  /** End of the changed range, if the change is limited to a range. */
  public abstract Optional<OffsetDateTime> end();

  public abstract Optional<InstanceRef> instance();

  /** Number of values changed, when reported by the server. */
  public abstract Optional<Long> valuesChanged();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setId(SequenceId id);

    public abstract Builder setSubject(Subject subject);

    public abstract Builder setEventType(EventType eventType);

    public abstract Builder setBegin(OffsetDateTime begin);

    public abstract Builder setEnd(OffsetDateTime end);

    public abstract Builder setInstance(InstanceRef instance);

    public abstract Builder setValuesChanged(Long valuesChanged);

    public abstract CurveEvent build();
  }
}
