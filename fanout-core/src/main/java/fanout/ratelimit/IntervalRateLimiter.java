package fanout.ratelimit;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Spaces grants at least {@code 1s / permitsPerSecond} apart across all callers.
 *
 * <p>Each caller reserves the next free slot inside a single lock: the slot is
 * {@code max(now, lastGrant + interval)} and the reservation is recorded before the lock
 * is released. The caller then sleeps outside the lock until its slot, so waiting
 * callers do not hold up reservations of others. Consecutive grants are therefore never
 * closer than the interval, and no more than {@code permitsPerSecond} grants fall into
 * any one-second window.
 *
 * <p>A caller interrupted while sleeping gives up its slot.
 */
public final class IntervalRateLimiter implements RateLimiter {

  /** Sleeps for a number of nanoseconds. */
  @FunctionalInterface
  public interface Sleeper {
    void sleepNanos(long nanos) throws InterruptedException;
  }

  private static final Sleeper THREAD_SLEEPER = TimeUnit.NANOSECONDS::sleep;

  private final ReentrantLock lock = new ReentrantLock();
  private final long intervalNanos;
  private final LongSupplier nanoClock;
  private final Sleeper sleeper;

  private boolean granted;
  private long lastGrantNanos;

  /**
   * @param permitsPerSecond maximum aggregate grants per second; must be &gt; 0
   */
  public IntervalRateLimiter(int permitsPerSecond) {
    this(permitsPerSecond, System::nanoTime, THREAD_SLEEPER);
  }

  /**
   * Creates a limiter with an explicit time source and sleeper.
   *
   * @param permitsPerSecond maximum aggregate grants per second; must be &gt; 0
   * @param nanoClock        monotonic time source in nanoseconds
   * @param sleeper          used to wait until a reserved slot
   */
  public IntervalRateLimiter(int permitsPerSecond, LongSupplier nanoClock, Sleeper sleeper) {
    if (permitsPerSecond <= 0) {
      throw new IllegalArgumentException("permitsPerSecond must be > 0, got: " + permitsPerSecond);
    }
    this.intervalNanos = TimeUnit.SECONDS.toNanos(1) / permitsPerSecond;
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  @Override
  public long acquire() throws InterruptedException {
    long waitNanos;
    lock.lockInterruptibly();
    try {
      long now = nanoClock.getAsLong();
      long slot = granted ? Math.max(now, lastGrantNanos + intervalNanos) : now;
      granted = true;
      lastGrantNanos = slot;
      waitNanos = slot - now;
    } finally {
      lock.unlock();
    }
    if (waitNanos > 0) {
      sleeper.sleepNanos(waitNanos);
    }
    return TimeUnit.NANOSECONDS.toMillis(waitNanos);
  }

  /** Minimum spacing between two grants, in nanoseconds. */
  public long intervalNanos() {
    return intervalNanos;
  }
}
