package fanout.spi;

import fanout.model.Content;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.OptionalInt;

/**
 * Persistence operations on content rows.
 *
 * <p>All methods receive an explicit {@link Connection}; the caller controls
 * transaction boundaries. Implementations throw unchecked exceptions on storage errors.
 */
public interface ContentStore {

    /**
     * Finds content that is due: {@code scheduled_time <= now}, not sent and still PENDING,
     * ordered by scheduled time then id.
     */
    List<Content> findDueContent(Connection conn, Instant now, int limit);

    /**
     * Conditionally moves content from PENDING to PROCESSING.
     *
     * @return {@code true} if this caller won the claim, {@code false} if the row was
     *     no longer PENDING
     */
    boolean claimForProcessing(Connection conn, long contentId);

    /**
     * Conditionally moves content from PROCESSING to SENT and stamps {@code sentAt}.
     *
     * @return {@code true} only for the caller that performed the transition
     */
    boolean finalizeAsSent(Connection conn, long contentId, Instant sentAt);

    /**
     * Records how many deliveries the fan-out produced for the content.
     */
    void recordExpectedDeliveries(Connection conn, long contentId, int expected);

    /**
     * Returns the recorded expected delivery count, or empty if the content has not
     * been fanned out yet (or does not exist).
     */
    OptionalInt countExpectedDeliveries(Connection conn, long contentId);
}
