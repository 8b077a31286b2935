package com.verlumen.curvestream.events;

import com.google.inject.Singleton;
import com.verlumen.curvestream.model.SequenceId;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/** The id of the newest event delivered so far. Only moves forward, except on {@link #reset}. */
@Singleton
final class Watermark {
  private final AtomicReference<SequenceId> latest = new AtomicReference<>();

  Optional<SequenceId> get() {
    return Optional.ofNullable(latest.get());
  }

  /** Moves the watermark to {@code id} if it is newer. Returns the resulting watermark. */
  SequenceId advance(SequenceId id) {
    return latest.accumulateAndGet(
        id, (current, candidate) -> current == null || candidate.isAfter(current) ? candidate : current);
  }

  /** Replaces the watermark, used when the caller resumes from an explicit id. */
  void reset(SequenceId id) {
    latest.set(id);
  }
}
