package fanout.spi;

import fanout.model.DeliveryLogEntry;
import fanout.model.DeliveryStats;
import fanout.model.DeliveryStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

/**
 * Idempotent per-(content, subscriber) record of delivery outcomes.
 */
public interface DeliveryLogStore {

    /**
     * Inserts or updates the log row for the pair. Repeated calls never create a
     * second row for the same pair.
     */
    void upsertDeliveryLog(Connection conn, long contentId, long subscriberId, DeliveryStatus status,
            String messageId, String errorMessage, Instant sentAt);

    /**
     * Counts rows for the content whose status is terminal (SENT or FAILED).
     */
    int countResolvedDeliveries(Connection conn, long contentId);

    Optional<DeliveryLogEntry> findDeliveryLog(Connection conn, long contentId, long subscriberId);

    /**
     * Aggregates sent / failed / pending counts for the content.
     */
    DeliveryStats deliveryStats(Connection conn, long contentId);
}
