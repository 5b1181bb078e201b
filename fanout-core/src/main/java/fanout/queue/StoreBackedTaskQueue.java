package fanout.queue;

import fanout.model.DeliveryTask;
import fanout.spi.ConnectionProvider;
import fanout.spi.TaskQueue;
import fanout.spi.TaskStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Durable {@link TaskQueue} over a {@link TaskStore}.
 *
 * <p>Every operation runs on its own connection. Claims lease rows to this queue's owner
 * id; a lease older than {@code leaseTimeout} may be claimed again, so tasks held by a
 * crashed process reappear after the lease expires.
 *
 * <p>Storage failures surface as {@link TaskQueueException}.
 */
public final class StoreBackedTaskQueue implements TaskQueue {

  private final ConnectionProvider connectionProvider;
  private final TaskStore taskStore;
  private final String ownerId;
  private final Duration leaseTimeout;
  private final Clock clock;

  private StoreBackedTaskQueue(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.taskStore = Objects.requireNonNull(builder.taskStore, "taskStore");
    this.leaseTimeout = Objects.requireNonNull(builder.leaseTimeout, "leaseTimeout");
    if (leaseTimeout.isNegative() || leaseTimeout.isZero()) {
      throw new IllegalArgumentException("leaseTimeout must be positive");
    }
    this.ownerId = builder.ownerId != null
        ? builder.ownerId : "worker-" + UUID.randomUUID().toString().substring(0, 8);
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  public String ownerId() {
    return ownerId;
  }

  @Override
  public void enqueue(DeliveryTask task) {
    Objects.requireNonNull(task, "task");
    withConnection("enqueue", task.taskId(),
        conn -> taskStore.insertTask(conn, task, clock.instant()));
  }

  @Override
  public List<DeliveryTask> claim(int limit) {
    if (limit <= 0) {
      return List.of();
    }
    Instant now = clock.instant();
    try (Connection conn = connectionProvider.getConnection()) {
      // Two-phase claim (UPDATE then SELECT) must run in a single transaction
      conn.setAutoCommit(false);
      try {
        List<DeliveryTask> claimed = taskStore.claimTasks(conn, ownerId, now, now.minus(leaseTimeout), limit);
        conn.commit();
        return claimed;
      } catch (RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw new TaskQueueException("Failed to claim delivery tasks", e);
    }
  }

  @Override
  public void complete(DeliveryTask task) {
    withConnection("complete", task.taskId(), conn -> taskStore.deleteTask(conn, task.taskId()));
  }

  @Override
  public void retry(DeliveryTask task, Instant nextAttemptAt, String error) {
    withConnection("retry", task.taskId(),
        conn -> taskStore.markRetry(conn, task.taskId(), nextAttemptAt, error));
  }

  @Override
  public void moveToDead(DeliveryTask task, String error) {
    withConnection("move to dead", task.taskId(),
        conn -> taskStore.markDead(conn, task.taskId(), error, clock.instant()));
  }

  @Override
  public int depth() {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return taskStore.countReady(conn);
    } catch (SQLException e) {
      throw new TaskQueueException("Failed to count ready tasks", e);
    }
  }

  private void withConnection(String action, String taskId, SqlAction op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      op.execute(conn);
    } catch (SQLException e) {
      throw new TaskQueueException("Failed to " + action + " taskId=" + taskId, e);
    }
  }

  @FunctionalInterface
  private interface SqlAction {
    void execute(Connection conn) throws SQLException;
  }

  /** Builder for {@link StoreBackedTaskQueue}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private TaskStore taskStore;
    private String ownerId;
    private Duration leaseTimeout = Duration.ofSeconds(150);
    private Clock clock;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder taskStore(TaskStore taskStore) {
      this.taskStore = taskStore;
      return this;
    }

    /**
     * Sets the lease owner written to claimed rows.
     *
     * <p>Optional. Defaults to {@code worker-<random>}.
     */
    public Builder ownerId(String ownerId) {
      this.ownerId = ownerId;
      return this;
    }

    /**
     * Sets how long a claimed task stays leased before another claim may take it.
     *
     * <p>Optional. Defaults to 150 s (per-attempt timeout plus 30 s). Must be positive.
     */
    public Builder leaseTimeout(Duration leaseTimeout) {
      this.leaseTimeout = leaseTimeout;
      return this;
    }

    /** Optional. Defaults to {@link Clock#systemUTC()}. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public StoreBackedTaskQueue build() {
      return new StoreBackedTaskQueue(this);
    }
  }
}
