package fanout.purge;

import fanout.spi.ConnectionProvider;
import fanout.spi.TaskStore;
import fanout.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled deletion of dead delivery tasks older than a retention period.
 *
 * <p>Each cycle deletes in batches until fewer than {@code batchSize} rows are deleted.
 * Each batch uses its own auto-committed connection to limit lock duration.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class DeadTaskPurgeScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DeadTaskPurgeScheduler.class.getName());

  private final ConnectionProvider connectionProvider;
  private final TaskStore taskStore;
  private final Duration retention;
  private final int batchSize;
  private final long intervalSeconds;
  private final Clock clock;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> purgeTask;
  private volatile boolean closed;

  private DeadTaskPurgeScheduler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.taskStore = Objects.requireNonNull(builder.taskStore, "taskStore");

    if (builder.retention != null && builder.retention.isNegative()) {
      throw new IllegalArgumentException("retention must be >= 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }

    this.retention = builder.retention != null ? builder.retention : Duration.ofHours(24);
    this.batchSize = builder.batchSize;
    this.intervalSeconds = builder.intervalSeconds;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled purge loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("DeadTaskPurgeScheduler has been closed");
    }
    if (purgeTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("fanout-purge-"));
    purgeTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Executes a single purge cycle. May be invoked directly for testing or one-off purges.
   *
   * @return total number of dead tasks deleted
   */
  public long runOnce() {
    if (closed) {
      return 0;
    }
    try {
      Instant cutoff = clock.instant().minus(retention);
      long totalDeleted = 0;
      int deleted;
      do {
        deleted = purgeBatch(cutoff);
        totalDeleted += deleted;
      } while (deleted >= batchSize);
      if (totalDeleted > 0) {
        logger.log(Level.INFO, "Purged {0} dead delivery tasks older than {1}",
            new Object[]{totalDeleted, cutoff});
      }
      return totalDeleted;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Purge cycle failed", t);
      return 0;
    }
  }

  private int purgeBatch(Instant cutoff) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return taskStore.purgeDead(conn, cutoff, batchSize);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to obtain connection for purge", e);
      return 0;
    }
  }

  /** Cancels the purge schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (purgeTask != null) {
      purgeTask.cancel(false);
      purgeTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link DeadTaskPurgeScheduler}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private TaskStore taskStore;
    private Duration retention;
    private int batchSize = 500;
    private long intervalSeconds = 3600;
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
     * Sets how long dead tasks are kept.
     *
     * <p>Optional. Defaults to {@code 24 hours}. Must be &ge; 0.
     */
    public Builder retention(Duration retention) {
      this.retention = retention;
      return this;
    }

    /** Optional. Defaults to {@code 500}. Must be &gt; 0. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Optional. Defaults to {@code 3600} (1 hour). Must be &gt; 0. */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    /** Optional. Defaults to {@link Clock#systemUTC()}. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public DeadTaskPurgeScheduler build() {
      return new DeadTaskPurgeScheduler(this);
    }
  }
}
