package fanout.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Produces the times at which the scheduler runs a discovery pass.
 */
@FunctionalInterface
public interface TickSource {

    /**
     * Returns the next tick strictly after {@code after}.
     */
    Instant nextTick(Instant after);

    /**
     * Ticks every {@code period}.
     */
    static TickSource fixedRate(Duration period) {
        Objects.requireNonNull(period, "period");
        if (period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("period must be positive");
        }
        return after -> after.plus(period);
    }
}
