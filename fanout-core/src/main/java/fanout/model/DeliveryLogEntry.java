package fanout.model;

import java.time.Instant;

/**
 * Delivery log row for a (content, subscriber) pair.
 */
public record DeliveryLogEntry(
    long contentId,
    long subscriberId,
    DeliveryStatus status,
    String messageId,
    String errorMessage,
    Instant sentAt
) {
}
