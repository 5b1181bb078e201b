package fanout.spi;

/**
 * Observability hook for exporting fan-out counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /** A scheduler tick started a discovery pass. */
    void incrementTicks();

    /** A scheduler tick was skipped because the previous pass was still running. */
    void incrementTicksSkipped();

    /** Content claimed PENDING to PROCESSING. */
    void incrementClaimSuccess();

    /** Content claim lost to another actor. */
    void incrementClaimConflict();

    /**
     * Tasks enqueued by one fan-out.
     *
     * @param count number of tasks enqueued
     */
    void incrementEnqueued(int count);

    /** A task failed to enqueue. */
    default void incrementEnqueueFailed() {
    }

    /** A delivery attempt succeeded. */
    void incrementDeliverySent();

    /** A delivery attempt failed and was rescheduled. */
    void incrementDeliveryRetried();

    /** A delivery exhausted its attempts. */
    void incrementDeliveryFailed();

    /** Content finalized PROCESSING to SENT (including empty fan-outs). */
    void incrementContentFinalized();

    /**
     * Records the number of READY/RETRY tasks in the queue.
     *
     * @param depth queue depth
     */
    default void recordQueueDepth(int depth) {
    }

    /**
     * Records how long the last rate-limiter acquisition waited.
     *
     * @param waitMs wait in milliseconds (always non-negative)
     */
    default void recordRateLimitWaitMs(long waitMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementTicks() {
        }

        @Override
        public void incrementTicksSkipped() {
        }

        @Override
        public void incrementClaimSuccess() {
        }

        @Override
        public void incrementClaimConflict() {
        }

        @Override
        public void incrementEnqueued(int count) {
        }

        @Override
        public void incrementDeliverySent() {
        }

        @Override
        public void incrementDeliveryRetried() {
        }

        @Override
        public void incrementDeliveryFailed() {
        }

        @Override
        public void incrementContentFinalized() {
        }
    }
}
