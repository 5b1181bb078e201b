package fanout.spi;

import fanout.model.DeadTask;
import fanout.model.DeliveryTask;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * Durable storage of delivery task rows backing {@link fanout.queue.StoreBackedTaskQueue}.
 */
public interface TaskStore {

    /**
     * Inserts a READY task that becomes claimable at {@code availableAt}.
     */
    void insertTask(Connection conn, DeliveryTask task, Instant availableAt);

    /**
     * Leases up to {@code limit} due READY/RETRY tasks to {@code ownerId}, oldest first.
     * Tasks already leased are skipped unless their lease started before {@code lockExpiry}.
     *
     * <p>Implementations may need several statements; callers run this inside a transaction.
     */
    List<DeliveryTask> claimTasks(Connection conn, String ownerId, Instant now, Instant lockExpiry, int limit);

    /**
     * Deletes a task row.
     *
     * @return rows affected
     */
    int deleteTask(Connection conn, String taskId);

    /**
     * Increments attempts, records the error, reschedules to {@code nextAt} and releases the lease.
     *
     * @return rows affected (0 if the task is gone or DEAD)
     */
    int markRetry(Connection conn, String taskId, Instant nextAt, String error);

    /**
     * Moves the task to DEAD, incrementing attempts and releasing the lease.
     *
     * @return rows affected
     */
    int markDead(Connection conn, String taskId, String error, Instant deadAt);

    /** Counts READY and RETRY tasks. */
    int countReady(Connection conn);

    /**
     * Queries DEAD tasks, oldest first.
     *
     * @param contentId optional content filter ({@code null} for all)
     */
    List<DeadTask> queryDead(Connection conn, Long contentId, int limit);

    /**
     * Counts DEAD tasks.
     *
     * @param contentId optional content filter ({@code null} for all)
     */
    int countDead(Connection conn, Long contentId);

    /**
     * Deletes up to {@code limit} DEAD tasks that died before {@code before}.
     *
     * @return rows deleted
     */
    int purgeDead(Connection conn, Instant before, int limit);
}
