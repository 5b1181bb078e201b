package fanout.spi;

import fanout.model.DeliveryTask;

import java.time.Instant;
import java.util.List;

/**
 * At-least-once queue of per-subscriber delivery tasks.
 *
 * <p>Claimed tasks are leased: a task that is neither completed, retried nor moved to
 * the dead sink before its lease expires becomes claimable again.
 *
 * @see fanout.queue.StoreBackedTaskQueue
 * @see fanout.queue.InMemoryTaskQueue
 */
public interface TaskQueue {

    /**
     * Adds a task, immediately available.
     *
     * @throws fanout.queue.TaskQueueException if the task could not be stored
     */
    void enqueue(DeliveryTask task);

    /**
     * Leases up to {@code limit} due tasks, oldest first.
     */
    List<DeliveryTask> claim(int limit);

    /** Removes a task after its outcome was recorded. */
    void complete(DeliveryTask task);

    /**
     * Reschedules a failed task. The attempt count is incremented and the lease released.
     */
    void retry(DeliveryTask task, Instant nextAttemptAt, String error);

    /** Moves a task to the dead sink. Dead tasks are never claimed again. */
    void moveToDead(DeliveryTask task, String error);

    /** Number of READY and RETRY tasks (leased ones included). */
    int depth();
}
