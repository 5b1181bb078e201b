package fanout.worker;

import fanout.completion.CompletionEvaluator;
import fanout.model.DeliveryLogEntry;
import fanout.model.DeliveryStatus;
import fanout.model.DeliveryTask;
import fanout.queue.ExponentialBackoffRetryPolicy;
import fanout.queue.RetryPolicy;
import fanout.ratelimit.RateLimiter;
import fanout.spi.ConnectionProvider;
import fanout.spi.DeliveryLogStore;
import fanout.spi.Mailer;
import fanout.spi.MetricsExporter;
import fanout.spi.TaskQueue;
import fanout.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed pool of delivery workers draining the {@link TaskQueue}.
 *
 * <p>A feeder thread claims at most one task per idle worker every {@code pollIntervalMs}
 * into a bounded in-memory buffer; worker threads take tasks from the buffer. A claimed task
 * whose lease no longer covers a full attempt by the time its send would start is dropped
 * unsent, since the queue may already have handed it to another worker. Each task goes through
 * the shared {@link RateLimiter}, then one {@link Mailer#send} call bounded by the
 * per-attempt timeout. The outcome is written to the delivery log and acknowledged on the
 * queue:
 * <ul>
 *   <li>success: log SENT, task completed;</li>
 *   <li>failure with attempts left: log PENDING with the error, task retried after the
 *       {@link RetryPolicy} delay;</li>
 *   <li>failure on the last attempt: log FAILED, task moved to the dead sink.</li>
 * </ul>
 * Every terminal outcome triggers {@link CompletionEvaluator#evaluate}.
 *
 * <p>Create instances via {@link #builder()} and call {@link #start()}. {@link #close()}
 * stops the feeder and lets workers finish buffered tasks within the drain timeout.
 */
public final class DeliveryWorkerPool implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DeliveryWorkerPool.class.getName());

  private static final long BUFFER_POLL_TIMEOUT_MS = 50;
  private static final int MAX_ERROR_LENGTH = 1000;

  private final TaskQueue taskQueue;
  private final Mailer mailer;
  private final RateLimiter rateLimiter;
  private final RetryPolicy retryPolicy;
  private final ConnectionProvider connectionProvider;
  private final DeliveryLogStore deliveryLogStore;
  private final CompletionEvaluator completionEvaluator;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final int maxAttempts;
  private final int workerCount;
  private final long attemptTimeoutMs;
  private final long pollIntervalMs;
  private final long drainTimeoutMs;
  private final long leaseTimeoutMs;

  private final BlockingQueue<ClaimedTask> buffer;
  private final AtomicBoolean running = new AtomicBoolean(false);
  // claimed by the feeder and not yet finished by a worker
  private final AtomicInteger outstanding = new AtomicInteger();

  private ScheduledExecutorService feeder;
  private ExecutorService workers;
  private ExecutorService attemptExecutor;
  private volatile ScheduledFuture<?> feedTask;
  private volatile boolean closed;

  private DeliveryWorkerPool(Builder builder) {
    this.taskQueue = Objects.requireNonNull(builder.taskQueue, "taskQueue");
    this.mailer = Objects.requireNonNull(builder.mailer, "mailer");
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.deliveryLogStore = Objects.requireNonNull(builder.deliveryLogStore, "deliveryLogStore");
    this.completionEvaluator = Objects.requireNonNull(builder.completionEvaluator, "completionEvaluator");
    this.rateLimiter = builder.rateLimiter != null ? builder.rateLimiter : RateLimiter.UNLIMITED;
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(2000, 60_000);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (builder.workerCount < 0) {
      throw new IllegalArgumentException("workerCount must be >= 0");
    }
    if (builder.bufferCapacity <= 0) {
      throw new IllegalArgumentException("bufferCapacity must be > 0");
    }
    if (builder.attemptTimeoutMs <= 0 || builder.pollIntervalMs <= 0) {
      throw new IllegalArgumentException("attemptTimeoutMs and pollIntervalMs must be > 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    if (builder.leaseTimeoutMs != 0 && builder.leaseTimeoutMs <= builder.attemptTimeoutMs) {
      throw new IllegalArgumentException("leaseTimeoutMs must exceed attemptTimeoutMs");
    }
    this.maxAttempts = builder.maxAttempts;
    this.workerCount = builder.workerCount;
    this.attemptTimeoutMs = builder.attemptTimeoutMs;
    this.pollIntervalMs = builder.pollIntervalMs;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.leaseTimeoutMs = builder.leaseTimeoutMs;
    this.buffer = new ArrayBlockingQueue<>(builder.bufferCapacity);
    this.attemptExecutor = Executors.newFixedThreadPool(
        Math.max(1, builder.workerCount), new DaemonThreadFactory("fanout-attempt-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the feeder and the worker threads. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("DeliveryWorkerPool has been closed");
    }
    if (running.get()) {
      return;
    }
    running.set(true);
    if (workerCount == 0) {
      logger.warning("workerCount=0: no delivery workers started; tasks will not be processed");
    } else {
      workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("fanout-worker-"));
      for (int i = 0; i < workerCount; i++) {
        workers.submit(this::workerLoop);
      }
    }
    feeder = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("fanout-feeder-"));
    feedTask = feeder.scheduleWithFixedDelay(this::feed, 0, pollIntervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Claims one task per idle worker, bounded by the free buffer capacity. With no worker
   * threads the free buffer capacity alone is the limit. Called automatically by the feeder
   * thread, but may also be invoked directly for testing.
   *
   * @return number of tasks moved into the buffer
   */
  public int feed() {
    if (closed) {
      return 0;
    }
    try {
      int capacity = buffer.remainingCapacity();
      if (workerCount > 0) {
        capacity = Math.min(capacity, workerCount - outstanding.get());
      }
      if (capacity <= 0) {
        return 0;
      }
      List<DeliveryTask> claimed = taskQueue.claim(capacity);
      Instant claimedAt = clock.instant();
      int accepted = 0;
      for (DeliveryTask task : claimed) {
        outstanding.incrementAndGet();
        if (buffer.offer(new ClaimedTask(task, claimedAt))) {
          accepted++;
        } else {
          outstanding.decrementAndGet();
          // Only the feeder adds to the buffer, so this is unexpected; the lease will expire
          logger.warning("Worker buffer full; taskId=" + task.taskId() + " left to lease expiry");
        }
      }
      metrics.recordQueueDepth(taskQueue.depth());
      return accepted;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Feed cycle failed", t);
      return 0;
    }
  }

  /** Number of claimed tasks waiting in the in-memory buffer. */
  public int buffered() {
    return buffer.size();
  }

  private void workerLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        if (!running.get() && buffer.isEmpty()) {
          break;
        }
        ClaimedTask claimed = buffer.poll(BUFFER_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (claimed == null) {
          if (!running.get()) break;
          continue;
        }
        try {
          process(claimed.task(), claimed.claimedAt());
        } finally {
          outstanding.decrementAndGet();
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Worker loop error", t);
      }
    }
  }

  /**
   * Executes one delivery attempt for a claimed task and records its outcome.
   * Called by the worker threads, but may also be invoked directly for testing.
   */
  public DeliveryOutcome process(DeliveryTask task) {
    return process(task, null);
  }

  private DeliveryOutcome process(DeliveryTask task, Instant claimedAt) {
    if (isAlreadyResolved(task)) {
      acknowledge("complete", task, () -> taskQueue.complete(task));
      logger.log(Level.FINE, "Skipping taskId={0}: pair already resolved", task.taskId());
      return DeliveryOutcome.ALREADY_RESOLVED;
    }

    String messageId;
    try {
      metrics.recordRateLimitWaitMs(rateLimiter.acquire());
      if (isLeaseTooShort(claimedAt)) {
        logger.log(Level.WARNING, "Dropping taskId={0}: lease would expire during the attempt;"
            + " it will be claimed again", task.taskId());
        return DeliveryOutcome.LEASE_EXPIRED;
      }
      messageId = sendWithTimeout(task);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return DeliveryOutcome.ABANDONED;
    } catch (Exception e) {
      return handleFailure(task, e);
    }
    return handleSuccess(task, messageId);
  }

  private boolean isLeaseTooShort(Instant claimedAt) {
    if (claimedAt == null || leaseTimeoutMs == 0) {
      return false;
    }
    Instant sendDeadline = claimedAt.plusMillis(leaseTimeoutMs - attemptTimeoutMs);
    return clock.instant().isAfter(sendDeadline);
  }

  private boolean isAlreadyResolved(DeliveryTask task) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      Optional<DeliveryLogEntry> entry =
          deliveryLogStore.findDeliveryLog(conn, task.contentId(), task.subscriberId());
      return entry.isPresent() && entry.get().status().isTerminal();
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.WARNING, "Failed to read delivery log for taskId=" + task.taskId()
          + "; attempting delivery", e);
      return false;
    }
  }

  private String sendWithTimeout(DeliveryTask task) throws Exception {
    Future<String> future = attemptExecutor.submit(
        () -> mailer.send(task.email(), task.subject(), task.body()));
    try {
      return future.get(attemptTimeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new TimeoutException("Delivery attempt timed out after " + attemptTimeoutMs + " ms");
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Exception ex) {
        throw ex;
      }
      throw e;
    }
  }

  private DeliveryOutcome handleSuccess(DeliveryTask task, String messageId) {
    Instant now = clock.instant();
    writeLog(task, DeliveryStatus.SENT, messageId, null, now);
    acknowledge("complete", task, () -> taskQueue.complete(task));
    metrics.incrementDeliverySent();
    logger.log(Level.FINE, "Delivered content={0} to subscriber={1}, messageId={2}",
        new Object[]{task.contentId(), task.subscriberId(), messageId});
    completionEvaluator.evaluate(task.contentId());
    return DeliveryOutcome.SENT;
  }

  private DeliveryOutcome handleFailure(DeliveryTask task, Exception failure) {
    int attempt = task.attempts() + 1;
    String error = describe(failure);
    Instant now = clock.instant();
    if (attempt >= maxAttempts) {
      writeLog(task, DeliveryStatus.FAILED, null, error, now);
      acknowledge("move to dead", task, () -> taskQueue.moveToDead(task, error));
      metrics.incrementDeliveryFailed();
      logger.log(Level.SEVERE, "Delivery of content " + task.contentId() + " to subscriber "
          + task.subscriberId() + " failed after " + attempt + " attempts", failure);
      completionEvaluator.evaluate(task.contentId());
      return DeliveryOutcome.FAILED;
    }
    long delayMs = retryPolicy.computeDelayMs(attempt);
    writeLog(task, DeliveryStatus.PENDING, null, error, null);
    acknowledge("retry", task, () -> taskQueue.retry(task, now.plusMillis(delayMs), error));
    metrics.incrementDeliveryRetried();
    logger.log(Level.WARNING, "Attempt {0}/{1} for content {2} to subscriber {3} failed: {4}; retry in {5} ms",
        new Object[]{attempt, maxAttempts, task.contentId(), task.subscriberId(), error, delayMs});
    return DeliveryOutcome.RETRY_SCHEDULED;
  }

  private void writeLog(DeliveryTask task, DeliveryStatus status, String messageId, String error,
      Instant sentAt) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      deliveryLogStore.upsertDeliveryLog(conn, task.contentId(), task.subscriberId(), status,
          messageId, error, sentAt);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to write delivery log " + status + " for taskId=" + task.taskId(), e);
    }
  }

  private void acknowledge(String action, DeliveryTask task, Runnable op) {
    try {
      op.run();
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to " + action + " taskId=" + task.taskId()
          + "; it will be redelivered after its lease expires", e);
    }
  }

  private static String describe(Exception failure) {
    String message = failure.getMessage();
    String text = message == null || message.isBlank() ? failure.getClass().getName() : message;
    return text.length() <= MAX_ERROR_LENGTH ? text : text.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }

  /**
   * Stops claiming new tasks, lets workers drain buffered tasks within the drain timeout,
   * then shuts down all threads. Unfinished tasks stay leased in the queue and are claimed
   * again after their lease expires.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    running.set(false);
    if (feedTask != null) {
      feedTask.cancel(false);
      feedTask = null;
    }
    if (feeder != null) {
      feeder.shutdownNow();
    }
    if (workers != null) {
      workers.shutdown();
      try {
        if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
          logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown. Buffered: " + buffer.size());
          workers.shutdownNow();
          workers.awaitTermination(5, TimeUnit.SECONDS);
        }
      } catch (InterruptedException e) {
        workers.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
    attemptExecutor.shutdownNow();
  }

  private record ClaimedTask(DeliveryTask task, Instant claimedAt) {}

  /** Builder for {@link DeliveryWorkerPool}. */
  public static final class Builder {
    private TaskQueue taskQueue;
    private Mailer mailer;
    private RateLimiter rateLimiter;
    private RetryPolicy retryPolicy;
    private ConnectionProvider connectionProvider;
    private DeliveryLogStore deliveryLogStore;
    private CompletionEvaluator completionEvaluator;
    private MetricsExporter metrics;
    private Clock clock;
    private int maxAttempts = 3;
    private int workerCount = 10;
    private int bufferCapacity = 100;
    private long attemptTimeoutMs = 120_000;
    private long pollIntervalMs = 250;
    private long drainTimeoutMs = 5000;
    private long leaseTimeoutMs;

    private Builder() {}

    /**
     * Sets the queue workers claim tasks from.
     *
     * <p><b>Required.</b>
     */
    public Builder taskQueue(TaskQueue taskQueue) {
      this.taskQueue = taskQueue;
      return this;
    }

    /**
     * Sets the mail transport.
     *
     * <p><b>Required.</b>
     */
    public Builder mailer(Mailer mailer) {
      this.mailer = mailer;
      return this;
    }

    /**
     * Sets the connection provider for delivery log writes.
     *
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder deliveryLogStore(DeliveryLogStore deliveryLogStore) {
      this.deliveryLogStore = deliveryLogStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder completionEvaluator(CompletionEvaluator completionEvaluator) {
      this.completionEvaluator = completionEvaluator;
      return this;
    }

    /**
     * Sets the gate shared by all workers.
     *
     * <p>Optional. Defaults to {@link RateLimiter#UNLIMITED}.
     */
    public Builder rateLimiter(RateLimiter rateLimiter) {
      this.rateLimiter = rateLimiter;
      return this;
    }

    /**
     * Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with a 2 s base and a 60 s cap.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the total number of attempts per task, the first one included.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the number of worker threads.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &ge; 0; {@code 0} starts no workers
     * (testing only).
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /** Optional. Defaults to {@code 100}. Must be &gt; 0. */
    public Builder bufferCapacity(int bufferCapacity) {
      this.bufferCapacity = bufferCapacity;
      return this;
    }

    /**
     * Sets the hard limit for one {@link Mailer#send} call; a slower attempt counts as failed.
     *
     * <p>Optional. Defaults to {@code 120000} ms.
     */
    public Builder attemptTimeoutMs(long attemptTimeoutMs) {
      this.attemptTimeoutMs = attemptTimeoutMs;
      return this;
    }

    /** Sets the feeder's claim interval. Optional. Defaults to {@code 250} ms. */
    public Builder pollIntervalMs(long pollIntervalMs) {
      this.pollIntervalMs = pollIntervalMs;
      return this;
    }

    /** Optional. Defaults to {@code 5000} ms. */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Sets the queue's claim lease so workers can drop tasks whose lease would run out
     * mid-attempt.
     *
     * <p>Optional. {@code 0} (the default) disables the check; otherwise must exceed the
     * attempt timeout.
     */
    public Builder leaseTimeoutMs(long leaseTimeoutMs) {
      this.leaseTimeoutMs = leaseTimeoutMs;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to {@link Clock#systemUTC()}. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the pool. Call {@link DeliveryWorkerPool#start()} to begin processing.
     *
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if a numeric setting is out of range
     */
    public DeliveryWorkerPool build() {
      return new DeliveryWorkerPool(this);
    }
  }
}
