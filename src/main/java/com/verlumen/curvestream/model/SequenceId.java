package com.verlumen.curvestream.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.auto.value.AutoValue;
import java.time.Instant;
import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifier of an event on the stream, also used as the resume checkpoint.
 *
 * <p>The wire form is two numbers separated by a dash, for example {@code 1700000000000-3}. The
 * first number is a 13 digit epoch timestamp in milliseconds and the second a sequence number
 * within that millisecond. Ids are ordered by timestamp first and then by sequence.
 */
@AutoValue
public abstract class SequenceId implements Comparable<SequenceId> {
  private static final Pattern WIRE_FORMAT = Pattern.compile("^(\\d{13})-(\\d+)$");
  private static final Comparator<SequenceId> ORDER =
      Comparator.comparingLong(SequenceId::timestamp).thenComparingLong(SequenceId::sequence);

  public static SequenceId create(long timestamp, long sequence) {
    checkArgument(timestamp >= 0, "timestamp must not be negative: %s", timestamp);
    checkArgument(sequence >= 0, "sequence must not be negative: %s", sequence);
    return new AutoValue_SequenceId(timestamp, sequence);
  }

  /**
   * Parses the wire form of a sequence id.
   *
   * @throws IllegalArgumentException if the value is not two dash-separated numbers where the
   *     first is exactly 13 digits long
   */
  public static SequenceId parse(String value) {
    checkNotNull(value, "value");
    Matcher matcher = WIRE_FORMAT.matcher(value.trim());
    checkArgument(
        matcher.matches(),
        "Invalid sequence id: '%s'. Expected two numbers separated by a dash ('-'), "
            + "where the first number is exactly 13 digits long.",
        value);
    try {
      return create(Long.parseLong(matcher.group(1)), Long.parseLong(matcher.group(2)));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Sequence id out of range: " + value, e);
    }
  }

  public static boolean isValid(String value) {
    return value != null && WIRE_FORMAT.matcher(value.trim()).matches();
  }

  /** Epoch milliseconds component. */
  public abstract long timestamp();

  /** Sequence within the millisecond. */
  public abstract long sequence();

  public Instant instant() {
    return Instant.ofEpochMilli(timestamp());
  }

  public boolean isAfter(SequenceId other) {
    return compareTo(other) > 0;
  }

  @Override
  public int compareTo(SequenceId other) {
    return ORDER.compare(this, other);
  }

  @Override
  public final String toString() {
    return String.format("%013d-%d", timestamp(), sequence());
  }
}
