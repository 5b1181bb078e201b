package fanout.queue;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff.
 *
 * <p>Delay formula: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}.
 * With the default base of 2 s this yields 2 s, 4 s, 8 s, ... Jitter is off unless a
 * jitter fraction is given, in which case the capped delay is scaled by a random factor
 * in {@code [1 - jitter, 1 + jitter)} and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final double jitter;

  /**
   * @param baseDelayMs delay before the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, 0.0);
  }

  /**
   * @param baseDelayMs delay before the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   * @param jitter      jitter fraction in {@code [0, 1)}; {@code 0} disables jitter
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, double jitter) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    if (jitter < 0.0 || jitter >= 1.0) {
      throw new IllegalArgumentException("jitter must be in [0, 1), got: " + jitter);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  @Override
  public long computeDelayMs(int failedAttempts) {
    if (failedAttempts <= 0) {
      return 0L;
    }
    long expDelay;
    if (failedAttempts >= 31) {
      expDelay = Long.MAX_VALUE;
    } else {
      long shift = 1L << (failedAttempts - 1);
      // shift > maxDelay/base means the product would exceed the cap (or overflow)
      expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
    }
    long capped = Math.min(maxDelayMs, expDelay);
    if (jitter == 0.0) {
      return capped;
    }
    double factor = ThreadLocalRandom.current().nextDouble(1.0 - jitter, 1.0 + jitter);
    return Math.min(maxDelayMs, Math.max(0L, (long) (capped * factor)));
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }
}
