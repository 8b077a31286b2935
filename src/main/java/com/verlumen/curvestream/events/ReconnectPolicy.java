package com.verlumen.curvestream.events;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * How long to wait before the next connection attempt.
 *
 * <p>The delay is {@code handshakeTimeout + margin + uniform(minJitter, maxJitter)}, with the
 * timeout and margin scaled by {@code growthFactor ^ (retryNumber - 1)}. A growth factor of 1
 * keeps the delay flat across attempts.
 *
 * @param margin fixed time added to the handshake timeout
 * @param minJitter lower bound of the random extra delay
 * @param maxJitter upper bound of the random extra delay
 * @param growthFactor multiplier applied per retry, at least 1
 */
public record ReconnectPolicy(
    Duration margin, Duration minJitter, Duration maxJitter, double growthFactor) {
  private static final Duration MAX_BASE_DELAY = Duration.ofMinutes(5);

  public ReconnectPolicy {
    checkNotNull(margin, "margin");
    checkNotNull(minJitter, "minJitter");
    checkNotNull(maxJitter, "maxJitter");
    checkArgument(!margin.isNegative(), "margin must not be negative: %s", margin);
    checkArgument(!minJitter.isNegative(), "minJitter must not be negative: %s", minJitter);
    checkArgument(
        maxJitter.compareTo(minJitter) >= 0,
        "maxJitter (%s) must not be less than minJitter (%s)",
        maxJitter,
        minJitter);
    checkArgument(growthFactor >= 1.0, "growthFactor must be at least 1: %s", growthFactor);
  }

  /** Half a second of margin, one to five seconds of jitter and no growth. */
  public static ReconnectPolicy standard() {
    return new ReconnectPolicy(
        Duration.ofMillis(500), Duration.ofSeconds(1), Duration.ofSeconds(5), 1.0);
  }

  public ReconnectPolicy withGrowthFactor(double growthFactor) {
    return new ReconnectPolicy(margin, minJitter, maxJitter, growthFactor);
  }

  /**
   * Delay before retry number {@code retryNumber}, counting from 1.
   *
   * <p>The scaled part is capped at five minutes.
   */
  public Duration delay(Duration handshakeTimeout, int retryNumber) {
    checkArgument(retryNumber >= 1, "retryNumber must be positive: %s", retryNumber);
    long baseMillis = handshakeTimeout.plus(margin).toMillis();
    double scaled = baseMillis * Math.pow(growthFactor, retryNumber - 1);
    long cappedMillis = (long) Math.min(scaled, (double) MAX_BASE_DELAY.toMillis());
    cappedMillis = Math.max(cappedMillis, baseMillis);
    long jitterMillis = minJitter.toMillis() == maxJitter.toMillis()
        ? minJitter.toMillis()
        : ThreadLocalRandom.current().nextLong(minJitter.toMillis(), maxJitter.toMillis() + 1);
    return Duration.ofMillis(cappedMillis + jitterMillis);
  }
}
