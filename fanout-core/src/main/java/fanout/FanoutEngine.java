package fanout;

import fanout.completion.CompletionEvaluator;
import fanout.dead.DeadTaskManager;
import fanout.purge.DeadTaskPurgeScheduler;
import fanout.queue.ExponentialBackoffRetryPolicy;
import fanout.queue.RetryPolicy;
import fanout.queue.StoreBackedTaskQueue;
import fanout.ratelimit.IntervalRateLimiter;
import fanout.ratelimit.RateLimiter;
import fanout.scheduler.ContentScheduler;
import fanout.scheduler.FanOut;
import fanout.scheduler.TickSource;
import fanout.spi.ConnectionProvider;
import fanout.spi.ContentStore;
import fanout.spi.DeliveryLogStore;
import fanout.spi.FanoutStore;
import fanout.spi.Mailer;
import fanout.spi.MetricsExporter;
import fanout.spi.SubscriptionStore;
import fanout.spi.TaskQueue;
import fanout.spi.TaskStore;
import fanout.worker.DeliveryWorkerPool;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the {@link ContentScheduler}, {@link DeliveryWorkerPool},
 * {@link CompletionEvaluator} and, for the durable queue, the {@link DeadTaskPurgeScheduler}
 * into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * var store = JdbcFanoutStores.detect(dataSource);
 * try (FanoutEngine engine = FanoutEngine.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .store(store)
 *     .mailer(mailer)
 *     .config(new FanoutConfig().setEmailsPerSecond(20))
 *     .build()) {
 *   // runs until closed
 * }
 * }</pre>
 *
 * <p>{@link Builder#build()} starts the workers first, then the scheduler. {@link #close()}
 * stops the scheduler first so no new fan-out happens while workers drain.
 */
public final class FanoutEngine implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(FanoutEngine.class.getName());

  private final ContentScheduler scheduler;
  private final DeliveryWorkerPool workerPool;
  private final CompletionEvaluator completionEvaluator;
  private final TaskQueue taskQueue;
  private final DeadTaskManager deadTaskManager;
  private final DeadTaskPurgeScheduler purgeScheduler;
  private final MetricsExporter metrics;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private FanoutEngine(ContentScheduler scheduler, DeliveryWorkerPool workerPool,
      CompletionEvaluator completionEvaluator, TaskQueue taskQueue,
      DeadTaskManager deadTaskManager, DeadTaskPurgeScheduler purgeScheduler,
      MetricsExporter metrics) {
    this.scheduler = scheduler;
    this.workerPool = workerPool;
    this.completionEvaluator = completionEvaluator;
    this.taskQueue = taskQueue;
    this.deadTaskManager = deadTaskManager;
    this.purgeScheduler = purgeScheduler;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  public ContentScheduler scheduler() {
    return scheduler;
  }

  public DeliveryWorkerPool workerPool() {
    return workerPool;
  }

  public CompletionEvaluator completionEvaluator() {
    return completionEvaluator;
  }

  public TaskQueue taskQueue() {
    return taskQueue;
  }

  /**
   * Returns the dead-task view.
   *
   * @throws IllegalStateException if the engine was built without a {@link TaskStore}
   */
  public DeadTaskManager deadTasks() {
    if (deadTaskManager == null) {
      throw new IllegalStateException("Dead tasks are only available with a TaskStore");
    }
    return deadTaskManager;
  }

  /**
   * Shuts down components in order: scheduler, worker pool, purge scheduler, then the
   * metrics exporter if it is {@link AutoCloseable}.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    RuntimeException first = null;
    try {
      scheduler.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      workerPool.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (purgeScheduler != null) {
      try {
        purgeScheduler.close();
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    logger.info("Fan-out engine stopped");
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link FanoutEngine}. A builder can be used once. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private ContentStore contentStore;
    private SubscriptionStore subscriptionStore;
    private DeliveryLogStore deliveryLogStore;
    private TaskStore taskStore;
    private TaskQueue taskQueue;
    private Mailer mailer;
    private MetricsExporter metrics;
    private FanoutConfig config;
    private TickSource tickSource;
    private RateLimiter rateLimiter;
    private RetryPolicy retryPolicy;
    private Clock clock;
    private String ownerId;
    private boolean built;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Uses one store for content, subscriptions, delivery log and delivery tasks.
     */
    public Builder store(FanoutStore store) {
      Objects.requireNonNull(store, "store");
      this.contentStore = store;
      this.subscriptionStore = store;
      this.deliveryLogStore = store;
      this.taskStore = store;
      return this;
    }

    public Builder contentStore(ContentStore contentStore) {
      this.contentStore = contentStore;
      return this;
    }

    public Builder subscriptionStore(SubscriptionStore subscriptionStore) {
      this.subscriptionStore = subscriptionStore;
      return this;
    }

    public Builder deliveryLogStore(DeliveryLogStore deliveryLogStore) {
      this.deliveryLogStore = deliveryLogStore;
      return this;
    }

    /**
     * Sets the durable task storage. Used for the default {@link StoreBackedTaskQueue},
     * dead-task inspection and purging.
     */
    public Builder taskStore(TaskStore taskStore) {
      this.taskStore = taskStore;
      return this;
    }

    /**
     * Sets a custom task queue.
     *
     * <p>Optional. Defaults to a {@link StoreBackedTaskQueue} over the task store.
     */
    public Builder taskQueue(TaskQueue taskQueue) {
      this.taskQueue = taskQueue;
      return this;
    }

    /** <b>Required.</b> */
    public Builder mailer(Mailer mailer) {
      this.mailer = mailer;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to {@code new FanoutConfig()}. */
    public Builder config(FanoutConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Optional. Defaults to a fixed rate of {@link FanoutConfig#getPollIntervalMs()}.
     */
    public Builder tickSource(TickSource tickSource) {
      this.tickSource = tickSource;
      return this;
    }

    /**
     * Optional. Defaults to an {@link IntervalRateLimiter} at
     * {@link FanoutConfig#getEmailsPerSecond()}.
     */
    public Builder rateLimiter(RateLimiter rateLimiter) {
      this.rateLimiter = rateLimiter;
      return this;
    }

    /**
     * Optional. Defaults to {@link ExponentialBackoffRetryPolicy} from the config's retry delays.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /** Optional. Defaults to {@link Clock#systemUTC()}. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Lease owner id for the default durable queue. Optional. */
    public Builder ownerId(String ownerId) {
      this.ownerId = ownerId;
      return this;
    }

    /**
     * Builds and starts the engine: worker pool, scheduler and, with a task store,
     * the dead-task purge scheduler. Components already started are closed if a later
     * one fails to start.
     *
     * @throws NullPointerException  if a required collaborator is missing
     * @throws IllegalStateException if this builder was already used
     */
    public FanoutEngine build() {
      if (built) {
        throw new IllegalStateException("Builder already used");
      }
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(contentStore, "contentStore");
      Objects.requireNonNull(subscriptionStore, "subscriptionStore");
      Objects.requireNonNull(deliveryLogStore, "deliveryLogStore");
      Objects.requireNonNull(mailer, "mailer");
      if (taskQueue == null && taskStore == null) {
        throw new NullPointerException("taskQueue or taskStore");
      }
      built = true;

      FanoutConfig cfg = config != null ? config : new FanoutConfig();
      MetricsExporter m = metrics != null ? metrics : MetricsExporter.NOOP;
      Clock c = clock != null ? clock : Clock.systemUTC();

      TaskQueue queue = taskQueue;
      long workerLeaseMs = 0;
      if (queue == null) {
        workerLeaseMs = cfg.getLeaseTimeoutMs();
        queue = StoreBackedTaskQueue.builder()
            .connectionProvider(connectionProvider)
            .taskStore(taskStore)
            .ownerId(ownerId)
            .leaseTimeout(Duration.ofMillis(cfg.getLeaseTimeoutMs()))
            .clock(c)
            .build();
      }

      CompletionEvaluator evaluator =
          new CompletionEvaluator(connectionProvider, contentStore, deliveryLogStore, m, c);

      DeliveryWorkerPool workers = DeliveryWorkerPool.builder()
          .taskQueue(queue)
          .mailer(mailer)
          .connectionProvider(connectionProvider)
          .deliveryLogStore(deliveryLogStore)
          .completionEvaluator(evaluator)
          .rateLimiter(rateLimiter != null ? rateLimiter : new IntervalRateLimiter(cfg.getEmailsPerSecond()))
          .retryPolicy(retryPolicy != null ? retryPolicy
              : new ExponentialBackoffRetryPolicy(cfg.getRetryBaseDelayMs(), cfg.getRetryMaxDelayMs()))
          .maxAttempts(cfg.getMaxAttempts())
          .workerCount(cfg.getWorkerCount())
          .bufferCapacity(cfg.getBufferCapacity())
          .attemptTimeoutMs(cfg.getAttemptTimeoutMs())
          .pollIntervalMs(cfg.getQueuePollIntervalMs())
          .drainTimeoutMs(cfg.getDrainTimeoutMs())
          .leaseTimeoutMs(workerLeaseMs)
          .metrics(m)
          .clock(c)
          .build();

      FanOut fanOut = FanOut.builder()
          .connectionProvider(connectionProvider)
          .contentStore(contentStore)
          .subscriptionStore(subscriptionStore)
          .taskQueue(queue)
          .defaultSubject(cfg.getDefaultSubject())
          .metrics(m)
          .clock(c)
          .build();

      ContentScheduler scheduler;
      DeadTaskPurgeScheduler purge = null;
      try {
        scheduler = ContentScheduler.builder()
            .connectionProvider(connectionProvider)
            .contentStore(contentStore)
            .fanOut(fanOut)
            .tickSource(tickSource != null
                ? tickSource : TickSource.fixedRate(Duration.ofMillis(cfg.getPollIntervalMs())))
            .batchSize(cfg.getBatchSize())
            .metrics(m)
            .clock(c)
            .build();
        if (taskStore != null && cfg.isPurgeEnabled()) {
          purge = DeadTaskPurgeScheduler.builder()
              .connectionProvider(connectionProvider)
              .taskStore(taskStore)
              .retention(Duration.ofMillis(cfg.getDeadRetentionMs()))
              .intervalSeconds(cfg.getPurgeIntervalSeconds())
              .batchSize(cfg.getPurgeBatchSize())
              .clock(c)
              .build();
        }
      } catch (RuntimeException e) {
        workers.close();
        throw e;
      }

      try {
        workers.start();
        scheduler.start();
        if (purge != null) {
          purge.start();
        }
      } catch (RuntimeException e) {
        scheduler.close();
        workers.close();
        if (purge != null) {
          purge.close();
        }
        throw e;
      }

      DeadTaskManager dead = taskStore != null ? new DeadTaskManager(connectionProvider, taskStore) : null;
      logger.log(Level.INFO, "Fan-out engine started: workers={0}, emailsPerSecond={1}, maxAttempts={2}",
          new Object[]{cfg.getWorkerCount(), cfg.getEmailsPerSecond(), cfg.getMaxAttempts()});
      return new FanoutEngine(scheduler, workers, evaluator, queue, dead, purge, m);
    }
  }
}
