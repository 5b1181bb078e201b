package fanout.dead;

import fanout.model.DeadTask;
import fanout.spi.ConnectionProvider;
import fanout.spi.TaskStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only view of delivery tasks that exhausted their attempts.
 *
 * <p>Dead tasks are never replayed: their delivery log rows are already FAILED and the
 * content may have been finalized.
 *
 * @see TaskStore#queryDead
 * @see TaskStore#countDead
 */
public final class DeadTaskManager {
  private static final Logger logger = Logger.getLogger(DeadTaskManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final TaskStore taskStore;

  public DeadTaskManager(ConnectionProvider connectionProvider, TaskStore taskStore) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.taskStore = Objects.requireNonNull(taskStore, "taskStore");
  }

  /**
   * Queries dead tasks.
   *
   * @param contentId optional content filter ({@code null} for all)
   * @param limit     maximum number of tasks to return
   * @return dead tasks, oldest first; empty on storage errors
   */
  public List<DeadTask> query(Long contentId, int limit) {
    try (Connection conn = connectionProvider.getConnection()) {
      return taskStore.queryDead(conn, contentId, limit);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to query dead tasks", e);
      return List.of();
    }
  }

  /**
   * Counts dead tasks.
   *
   * @param contentId optional content filter ({@code null} for all)
   * @return the count; 0 on storage errors
   */
  public int count(Long contentId) {
    try (Connection conn = connectionProvider.getConnection()) {
      return taskStore.countDead(conn, contentId);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to count dead tasks", e);
      return 0;
    }
  }
}
