package fanout.jdbc.store;

import fanout.jdbc.JdbcTemplate;
import fanout.model.Content;
import fanout.model.ContentStatus;
import fanout.model.DeadTask;
import fanout.model.DeliveryLogEntry;
import fanout.model.DeliveryStats;
import fanout.model.DeliveryStatus;
import fanout.model.DeliveryTask;
import fanout.model.Subscriber;
import fanout.model.TaskStatus;
import fanout.spi.FanoutStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Base JDBC fan-out store with standard SQL implementations.
 *
 * <p>Subclasses override {@link #claimTasks} and {@link #upsertDeliveryLog} where the
 * database offers a better statement. Register custom implementations via
 * {@code META-INF/services/fanout.jdbc.store.AbstractJdbcFanoutStore}.
 *
 * @see JdbcFanoutStores
 */
public abstract class AbstractJdbcFanoutStore implements FanoutStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final String READY_STATUS_IN =
      "(" + TaskStatus.READY.code() + "," + TaskStatus.RETRY.code() + ")";

  protected static final String TERMINAL_DELIVERY_IN =
      "('" + DeliveryStatus.SENT.dbValue() + "','" + DeliveryStatus.FAILED.dbValue() + "')";

  protected static final String TASK_COLUMNS =
      "task_id, content_id, subscriber_id, email, subject, body, attempts, created_at";

  protected static final JdbcTemplate.RowMapper<DeliveryTask> TASK_ROW_MAPPER = rs -> new DeliveryTask(
      rs.getString("task_id"),
      rs.getLong("content_id"),
      rs.getLong("subscriber_id"),
      rs.getString("email"),
      rs.getString("subject"),
      rs.getString("body"),
      rs.getInt("attempts"),
      rs.getTimestamp("created_at").toInstant());

  private static final JdbcTemplate.RowMapper<Content> CONTENT_ROW_MAPPER = rs -> new Content(
      rs.getLong("id"),
      rs.getLong("topic_id"),
      rs.getString("title"),
      rs.getString("body"),
      rs.getTimestamp("scheduled_time").toInstant(),
      ContentStatus.fromDbValue(rs.getString("status")),
      rs.getBoolean("is_sent"),
      toInstant(rs.getTimestamp("sent_at")));

  private static final JdbcTemplate.RowMapper<DeliveryLogEntry> LOG_ROW_MAPPER = rs -> new DeliveryLogEntry(
      rs.getLong("content_id"),
      rs.getLong("subscriber_id"),
      DeliveryStatus.fromDbValue(rs.getString("status")),
      rs.getString("message_id"),
      rs.getString("error_message"),
      toInstant(rs.getTimestamp("sent_at")));

  /**
   * Unique identifier for this store (e.g., "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:postgresql:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  // ---- content ----

  @Override
  public List<Content> findDueContent(Connection conn, Instant now, int limit) {
    String sql = "SELECT id, topic_id, title, body, scheduled_time, status, is_sent, sent_at " +
        "FROM content WHERE scheduled_time <= ? AND is_sent = FALSE AND status = ? " +
        "ORDER BY scheduled_time, id LIMIT ?";
    return JdbcTemplate.query(conn, sql, CONTENT_ROW_MAPPER,
        Timestamp.from(now), ContentStatus.PENDING.dbValue(), limit);
  }

  @Override
  public boolean claimForProcessing(Connection conn, long contentId) {
    String sql = "UPDATE content SET status = ? WHERE id = ? AND status = ? AND is_sent = FALSE";
    return JdbcTemplate.update(conn, sql,
        ContentStatus.PROCESSING.dbValue(), contentId, ContentStatus.PENDING.dbValue()) == 1;
  }

  @Override
  public boolean finalizeAsSent(Connection conn, long contentId, Instant sentAt) {
    String sql = "UPDATE content SET status = ?, is_sent = TRUE, sent_at = ? WHERE id = ? AND status = ?";
    return JdbcTemplate.update(conn, sql, ContentStatus.SENT.dbValue(), Timestamp.from(sentAt),
        contentId, ContentStatus.PROCESSING.dbValue()) == 1;
  }

  @Override
  public void recordExpectedDeliveries(Connection conn, long contentId, int expected) {
    JdbcTemplate.update(conn, "UPDATE content SET expected_deliveries = ? WHERE id = ?", expected, contentId);
  }

  @Override
  public OptionalInt countExpectedDeliveries(Connection conn, long contentId) {
    List<Integer> rows = JdbcTemplate.query(conn,
        "SELECT expected_deliveries FROM content WHERE id = ?",
        rs -> {
          int value = rs.getInt(1);
          return rs.wasNull() ? null : value;
        },
        contentId);
    if (rows.isEmpty() || rows.get(0) == null) {
      return OptionalInt.empty();
    }
    return OptionalInt.of(rows.get(0));
  }

  // ---- subscriptions ----

  @Override
  public List<Subscriber> activeSubscribersForTopic(Connection conn, long topicId) {
    String sql = "SELECT s.id, s.email, s.is_active FROM subscriber s " +
        "JOIN subscription sub ON sub.subscriber_id = s.id " +
        "WHERE sub.topic_id = ? AND s.is_active = TRUE ORDER BY s.id";
    return JdbcTemplate.query(conn, sql,
        rs -> new Subscriber(rs.getLong("id"), rs.getString("email"), rs.getBoolean("is_active")),
        topicId);
  }

  // ---- delivery log ----

  /**
   * Inserts or updates the log row of a (content, subscriber) pair. A terminal row is never
   * replaced by a PENDING one. The default is a standard {@code MERGE ... USING} as run by
   * H2; other databases override.
   */
  @Override
  public void upsertDeliveryLog(Connection conn, long contentId, long subscriberId,
      DeliveryStatus status, String messageId, String errorMessage, Instant sentAt) {
    String pending = "'" + DeliveryStatus.PENDING.dbValue() + "'";
    String sql = "MERGE INTO delivery_log t USING (VALUES (" +
        "CAST(? AS BIGINT), CAST(? AS BIGINT), CAST(? AS VARCHAR(16)), CAST(? AS VARCHAR(255)), " +
        "CAST(? AS VARCHAR(4000)), CAST(? AS TIMESTAMP))) " +
        "s (content_id, subscriber_id, status, message_id, error_message, sent_at) " +
        "ON t.content_id = s.content_id AND t.subscriber_id = s.subscriber_id " +
        "WHEN MATCHED AND (t.status = " + pending + " OR s.status <> " + pending + ") THEN UPDATE SET " +
        "status = s.status, message_id = s.message_id, error_message = s.error_message, sent_at = s.sent_at " +
        "WHEN NOT MATCHED THEN INSERT (content_id, subscriber_id, status, message_id, error_message, sent_at) " +
        "VALUES (s.content_id, s.subscriber_id, s.status, s.message_id, s.error_message, s.sent_at)";
    JdbcTemplate.update(conn, sql, contentId, subscriberId, status.dbValue(), messageId,
        truncateError(errorMessage), toTimestamp(sentAt));
  }

  @Override
  public int countResolvedDeliveries(Connection conn, long contentId) {
    String sql = "SELECT COUNT(*) FROM delivery_log WHERE content_id = ? AND status IN " + TERMINAL_DELIVERY_IN;
    return JdbcTemplate.query(conn, sql, rs -> rs.getInt(1), contentId).get(0);
  }

  @Override
  public Optional<DeliveryLogEntry> findDeliveryLog(Connection conn, long contentId, long subscriberId) {
    String sql = "SELECT content_id, subscriber_id, status, message_id, error_message, sent_at " +
        "FROM delivery_log WHERE content_id = ? AND subscriber_id = ?";
    return JdbcTemplate.query(conn, sql, LOG_ROW_MAPPER, contentId, subscriberId).stream().findFirst();
  }

  @Override
  public DeliveryStats deliveryStats(Connection conn, long contentId) {
    String sql = "SELECT status, COUNT(*) AS cnt FROM delivery_log WHERE content_id = ? GROUP BY status";
    int sent = 0;
    int failed = 0;
    int pending = 0;
    List<Map.Entry<DeliveryStatus, Integer>> rows = JdbcTemplate.query(conn, sql,
        rs -> Map.entry(DeliveryStatus.fromDbValue(rs.getString("status")), rs.getInt("cnt")), contentId);
    for (Map.Entry<DeliveryStatus, Integer> row : rows) {
      switch (row.getKey()) {
        case SENT -> sent = row.getValue();
        case FAILED -> failed = row.getValue();
        case PENDING -> pending = row.getValue();
      }
    }
    return new DeliveryStats(contentId, sent, failed, pending);
  }

  // ---- delivery tasks ----

  @Override
  public void insertTask(Connection conn, DeliveryTask task, Instant availableAt) {
    String sql = "INSERT INTO delivery_task (" + TASK_COLUMNS +
        ", status, available_at, dead_at, last_error, locked_by, locked_at" +
        ") VALUES (?,?,?,?,?,?,?,?,?,?,NULL,NULL,NULL,NULL)";
    JdbcTemplate.update(conn, sql,
        task.taskId(), task.contentId(), task.subscriberId(), task.email(), task.subject(),
        task.body(), task.attempts(), Timestamp.from(task.createdAt()),
        TaskStatus.READY.code(), Timestamp.from(availableAt));
  }

  @Override
  public List<DeliveryTask> claimTasks(Connection conn, String ownerId, Instant now,
      Instant lockExpiry, int limit) {
    // Truncate to millis so stored value matches query (DB may drop nanos)
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    // Phase 1: UPDATE with subquery (H2-compatible default)
    String claimSql = "UPDATE delivery_task SET locked_by=?, locked_at=? " +
        "WHERE task_id IN (" +
        "SELECT task_id FROM delivery_task" +
        " WHERE status IN " + READY_STATUS_IN + " AND available_at <= ?" +
        " AND (locked_by IS NULL OR locked_at < ?)" +
        " ORDER BY available_at, created_at LIMIT ?)";
    int updated = JdbcTemplate.update(conn, claimSql,
        ownerId, Timestamp.from(nowMs), Timestamp.from(now), Timestamp.from(lockExpiry), limit);
    if (updated == 0) return List.of();
    // Phase 2: SELECT rows claimed in this cycle
    String selectSql = "SELECT " + TASK_COLUMNS + " FROM delivery_task" +
        " WHERE locked_by=? AND locked_at=? AND status IN " + READY_STATUS_IN +
        " ORDER BY available_at, created_at";
    return JdbcTemplate.query(conn, selectSql, TASK_ROW_MAPPER, ownerId, Timestamp.from(nowMs));
  }

  @Override
  public int deleteTask(Connection conn, String taskId) {
    return JdbcTemplate.update(conn, "DELETE FROM delivery_task WHERE task_id=?", taskId);
  }

  @Override
  public int markRetry(Connection conn, String taskId, Instant nextAt, String error) {
    String sql = "UPDATE delivery_task SET status=" + TaskStatus.RETRY.code() +
        ", attempts=attempts+1, available_at=?, last_error=?, locked_by=NULL, locked_at=NULL" +
        " WHERE task_id=? AND status<>" + TaskStatus.DEAD.code();
    return JdbcTemplate.update(conn, sql, Timestamp.from(nextAt), truncateError(error), taskId);
  }

  @Override
  public int markDead(Connection conn, String taskId, String error, Instant deadAt) {
    String sql = "UPDATE delivery_task SET status=" + TaskStatus.DEAD.code() +
        ", attempts=attempts+1, last_error=?, dead_at=?, locked_by=NULL, locked_at=NULL" +
        " WHERE task_id=? AND status<>" + TaskStatus.DEAD.code();
    return JdbcTemplate.update(conn, sql, truncateError(error), Timestamp.from(deadAt), taskId);
  }

  @Override
  public int countReady(Connection conn) {
    String sql = "SELECT COUNT(*) FROM delivery_task WHERE status IN " + READY_STATUS_IN;
    return JdbcTemplate.query(conn, sql, rs -> rs.getInt(1)).get(0);
  }

  @Override
  public List<DeadTask> queryDead(Connection conn, Long contentId, int limit) {
    String sql = "SELECT " + TASK_COLUMNS + ", last_error, dead_at FROM delivery_task" +
        " WHERE status=" + TaskStatus.DEAD.code() +
        (contentId != null ? " AND content_id=?" : "") +
        " ORDER BY dead_at, task_id LIMIT ?";
    JdbcTemplate.RowMapper<DeadTask> mapper = rs -> new DeadTask(
        TASK_ROW_MAPPER.map(rs), rs.getString("last_error"), toInstant(rs.getTimestamp("dead_at")));
    return contentId != null
        ? JdbcTemplate.query(conn, sql, mapper, contentId, limit)
        : JdbcTemplate.query(conn, sql, mapper, limit);
  }

  @Override
  public int countDead(Connection conn, Long contentId) {
    String sql = "SELECT COUNT(*) FROM delivery_task WHERE status=" + TaskStatus.DEAD.code() +
        (contentId != null ? " AND content_id=?" : "");
    JdbcTemplate.RowMapper<Integer> mapper = rs -> rs.getInt(1);
    return (contentId != null
        ? JdbcTemplate.query(conn, sql, mapper, contentId)
        : JdbcTemplate.query(conn, sql, mapper)).get(0);
  }

  /**
   * Deletes the oldest dead tasks first. Subquery form works for H2 and PostgreSQL.
   */
  @Override
  public int purgeDead(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM delivery_task WHERE task_id IN (" +
        "SELECT task_id FROM delivery_task WHERE status=" + TaskStatus.DEAD.code() +
        " AND dead_at < ? ORDER BY dead_at LIMIT ?)";
    return JdbcTemplate.update(conn, sql, Timestamp.from(before), limit);
  }

  protected static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }

  protected static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  private static Instant toInstant(Timestamp ts) {
    return ts == null ? null : ts.toInstant();
  }
}
