package io.offsync.sync;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff with optional jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^attempts}, capped at {@code maxDelay}, then scaled by
 * a random factor in {@code [1 - jitter, 1 + jitter)} and capped again.
 * With the defaults the first retry waits about 10 s, the second 20 s, the third 40 s.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final double jitter;

  /**
   * @param baseDelayMs base delay (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   * @param jitter      relative jitter in {@code [0, 1)}; {@code 0} disables it
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, double jitter) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < 0) {
      throw new IllegalArgumentException("maxDelayMs must be >= 0, got: " + maxDelayMs);
    }
    if (!(jitter >= 0d && jitter < 1d)) {
      throw new IllegalArgumentException("jitter must be in [0, 1), got: " + jitter);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, 0d);
  }

  @Override
  public long computeDelayMs(int attempts) {
    long nominal = nominalDelayMs(attempts);
    if (jitter == 0d || nominal == 0L) {
      return nominal;
    }
    double factor = ThreadLocalRandom.current().nextDouble(1d - jitter, 1d + jitter);
    long withJitter = (long) (nominal * factor);
    return Math.min(maxDelayMs, Math.max(0L, withJitter));
  }

  /**
   * Delay before jitter is applied. Non-decreasing in {@code attempts}.
   *
   * @param attempts the number of executions so far
   * @return the capped exponential delay
   */
  public long nominalDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    if (attempts >= 62) {
      return maxDelayMs;
    }
    long shift = 1L << attempts;
    // Guard against overflow: if shift exceeds maxDelayMs/baseDelayMs, cap directly
    if (shift > maxDelayMs / baseDelayMs) {
      return maxDelayMs;
    }
    return Math.min(maxDelayMs, baseDelayMs * shift);
  }
}
