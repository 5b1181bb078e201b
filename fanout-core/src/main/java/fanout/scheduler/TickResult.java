package fanout.scheduler;

/**
 * Summary of one scheduler tick.
 *
 * @param status         how the tick ended
 * @param discovered     due content rows returned by the discovery query
 * @param claimed        content items this tick moved to PROCESSING
 * @param finalizedEmpty claimed items finalized immediately because the topic had no
 *                       active subscribers
 * @param enqueued       delivery tasks enqueued
 */
public record TickResult(Status status, int discovered, int claimed, int finalizedEmpty, int enqueued) {

    public enum Status {
        COMPLETED,
        /** A previous pass was still running. */
        SKIPPED,
        /** The discovery query failed; nothing changed. */
        FAILED
    }

    static TickResult skipped() {
        return new TickResult(Status.SKIPPED, 0, 0, 0, 0);
    }

    static TickResult failed() {
        return new TickResult(Status.FAILED, 0, 0, 0, 0);
    }
}
