package fanout.jdbc.store;

import fanout.jdbc.JdbcTemplate;
import fanout.model.DeliveryStatus;
import fanout.model.DeliveryTask;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * PostgreSQL fan-out store.
 *
 * <p>Claims tasks with {@code FOR UPDATE SKIP LOCKED} and {@code RETURNING} in a single
 * round trip. The delivery log upsert never downgrades a terminal row back to pending.
 */
public final class PostgresFanoutStore extends AbstractJdbcFanoutStore {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public void upsertDeliveryLog(Connection conn, long contentId, long subscriberId,
      DeliveryStatus status, String messageId, String errorMessage, Instant sentAt) {
    String sql = "INSERT INTO delivery_log " +
        "(content_id, subscriber_id, status, message_id, error_message, sent_at) VALUES (?,?,?,?,?,?) " +
        "ON CONFLICT (content_id, subscriber_id) DO UPDATE SET " +
        "status = EXCLUDED.status, message_id = EXCLUDED.message_id, " +
        "error_message = EXCLUDED.error_message, sent_at = EXCLUDED.sent_at " +
        "WHERE delivery_log.status = '" + DeliveryStatus.PENDING.dbValue() + "' " +
        "OR EXCLUDED.status <> '" + DeliveryStatus.PENDING.dbValue() + "'";
    JdbcTemplate.update(conn, sql, contentId, subscriberId, status.dbValue(), messageId,
        truncateError(errorMessage), toTimestamp(sentAt));
  }

  @Override
  public List<DeliveryTask> claimTasks(Connection conn, String ownerId, Instant now,
      Instant lockExpiry, int limit) {
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    String sql = "UPDATE delivery_task SET locked_by=?, locked_at=? " +
        "WHERE task_id IN (" +
        "SELECT task_id FROM delivery_task" +
        " WHERE status IN " + READY_STATUS_IN + " AND available_at <= ?" +
        " AND (locked_by IS NULL OR locked_at < ?)" +
        " ORDER BY available_at, created_at LIMIT ?" +
        " FOR UPDATE SKIP LOCKED" +
        ") RETURNING " + TASK_COLUMNS;
    return JdbcTemplate.updateReturning(conn, sql, TASK_ROW_MAPPER,
        ownerId, Timestamp.from(nowMs), Timestamp.from(now), Timestamp.from(lockExpiry), limit);
  }
}
