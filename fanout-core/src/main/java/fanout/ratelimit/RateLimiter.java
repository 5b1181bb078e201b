package fanout.ratelimit;

/**
 * Gate shared by all delivery workers that bounds the aggregate send rate.
 *
 * <p>A limiter never rejects work; it only delays the caller.
 */
public interface RateLimiter {

  /** Limiter that never waits. */
  RateLimiter UNLIMITED = () -> 0L;

  /**
   * Blocks until the caller may send one message.
   *
   * @return how long the caller waited, in milliseconds
   * @throws InterruptedException if interrupted while waiting
   */
  long acquire() throws InterruptedException;
}
