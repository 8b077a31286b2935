package com.verlumen.curvestream.model;

import com.google.auto.value.AutoValue;
import java.time.OffsetDateTime;

/** Identifies one issue of an instance-based curve (for example a forecast run). */
@AutoValue
public abstract class InstanceRef {
  public static InstanceRef create(OffsetDateTime issued, String tag) {
    return new AutoValue_InstanceRef(issued, tag == null ? "" : tag);
  }

  public abstract OffsetDateTime issued();

  /** Instance tag, empty when the instance has none. */
  public abstract String tag();
}
