package fanout.model;

import java.time.Instant;

/**
 * A delivery task that exhausted its attempts, with the last error seen.
 */
public record DeadTask(DeliveryTask task, String lastError, Instant deadAt) {
}
