package fanout.scheduler;

import fanout.model.Content;
import fanout.spi.ConnectionProvider;
import fanout.spi.ContentStore;
import fanout.spi.MetricsExporter;
import fanout.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic, single-flight discovery of due content.
 *
 * <p>On every tick from the {@link TickSource} the scheduler queries up to
 * {@code batchSize} due content rows and hands each one to {@link FanOut}. Ticks fire on
 * their own timer thread and the pass runs on a separate runner thread, so a slow pass
 * does not delay the cadence: a tick that arrives while a pass is still running is
 * skipped and logged, never queued.
 *
 * <p>A failed discovery query aborts the tick without changing any state; the next tick
 * retries. A failure while fanning out one item is logged and the pass continues with
 * the next item.
 *
 * <p>Create instances via {@link #builder()}. The {@link #start()} and {@link #close()}
 * methods are synchronized.
 */
public final class ContentScheduler implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ContentScheduler.class.getName());

    private final ConnectionProvider connectionProvider;
    private final ContentStore contentStore;
    private final FanOut fanOut;
    private final TickSource tickSource;
    private final int batchSize;
    private final MetricsExporter metrics;
    private final Clock clock;

    private final AtomicBoolean inFlight = new AtomicBoolean(false);

    private ScheduledExecutorService timer;
    private ExecutorService runner;
    private volatile ScheduledFuture<?> nextTick;
    private volatile boolean closed;

    private ContentScheduler(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.contentStore = Objects.requireNonNull(builder.contentStore, "contentStore");
        this.fanOut = Objects.requireNonNull(builder.fanOut, "fanOut");
        this.tickSource = Objects.requireNonNull(builder.tickSource, "tickSource");
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        this.batchSize = builder.batchSize;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the tick timer. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("ContentScheduler has been closed");
        }
        if (timer != null) {
            return;
        }
        timer = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("fanout-scheduler-"));
        runner = Executors.newSingleThreadExecutor(new DaemonThreadFactory("fanout-discovery-"));
        scheduleNext();
    }

    private synchronized void scheduleNext() {
        if (closed || timer == null) {
            return;
        }
        Instant now = clock.instant();
        Instant next = tickSource.nextTick(now);
        long delayMs = Math.max(0L, Duration.between(now, next).toMillis());
        nextTick = timer.schedule(this::onTick, delayMs, TimeUnit.MILLISECONDS);
    }

    private void onTick() {
        scheduleNext();
        if (!inFlight.compareAndSet(false, true)) {
            recordSkip();
            return;
        }
        try {
            runner.execute(() -> {
                try {
                    runPass();
                } finally {
                    inFlight.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.set(false);
            logger.log(Level.FINE, "Discovery runner shut down; tick dropped", e);
        }
    }

    /**
     * Runs one discovery pass on the calling thread. Called automatically on every tick,
     * but may also be invoked directly for testing.
     *
     * @return the pass summary; {@link TickResult.Status#SKIPPED} if a pass is already running
     */
    public TickResult tick() {
        if (!inFlight.compareAndSet(false, true)) {
            recordSkip();
            return TickResult.skipped();
        }
        try {
            return runPass();
        } finally {
            inFlight.set(false);
        }
    }

    private void recordSkip() {
        metrics.incrementTicksSkipped();
        logger.warning("Previous discovery pass still running; tick skipped");
    }

    private TickResult runPass() {
        metrics.incrementTicks();
        Instant now = clock.instant();
        List<Content> due;
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            due = contentStore.findDueContent(conn, now, batchSize);
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to query due content", e);
            return TickResult.failed();
        }
        if (due.isEmpty()) {
            logger.fine("No due content");
            return new TickResult(TickResult.Status.COMPLETED, 0, 0, 0, 0);
        }
        logger.log(Level.INFO, "Found {0} due content items", due.size());

        int claimed = 0;
        int finalizedEmpty = 0;
        int enqueued = 0;
        for (Content content : due) {
            if (closed) {
                break;
            }
            try {
                FanOut.Result result = fanOut.fanOut(content);
                switch (result.kind()) {
                    case FINALIZED_EMPTY -> {
                        claimed++;
                        finalizedEmpty++;
                    }
                    case ENQUEUED -> {
                        claimed++;
                        enqueued += result.enqueued();
                    }
                    case CLAIM_CONFLICT -> {
                    }
                }
            } catch (SQLException | RuntimeException e) {
                logger.log(Level.SEVERE, "Failed to fan out content " + content.id(), e);
            }
        }
        return new TickResult(TickResult.Status.COMPLETED, due.size(), claimed, finalizedEmpty, enqueued);
    }

    /** Whether a discovery pass is currently running. */
    public boolean isRunning() {
        return inFlight.get();
    }

    /**
     * Cancels the tick timer and shuts down the scheduler threads. A pass in progress
     * stops after the item it is fanning out.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (nextTick != null) {
            nextTick.cancel(false);
            nextTick = null;
        }
        if (timer != null) {
            timer.shutdownNow();
        }
        if (runner != null) {
            runner.shutdown();
            try {
                if (!runner.awaitTermination(5, TimeUnit.SECONDS)) {
                    runner.shutdownNow();
                }
            } catch (InterruptedException e) {
                runner.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Builder for {@link ContentScheduler}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private ContentStore contentStore;
        private FanOut fanOut;
        private TickSource tickSource = TickSource.fixedRate(Duration.ofSeconds(60));
        private int batchSize = 10;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        /**
         * Sets the connection provider used by the discovery query.
         *
         * <p><b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder contentStore(ContentStore contentStore) {
            this.contentStore = contentStore;
            return this;
        }

        /**
         * Sets the fan-out applied to each discovered item.
         *
         * <p><b>Required.</b>
         */
        public Builder fanOut(FanOut fanOut) {
            this.fanOut = fanOut;
            return this;
        }

        /**
         * Optional. Defaults to a fixed 60 s rate.
         */
        public Builder tickSource(TickSource tickSource) {
            this.tickSource = tickSource;
            return this;
        }

        /**
         * Sets the maximum number of due items handled per tick.
         *
         * <p>Optional. Defaults to {@code 10}. Must be &gt; 0.
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Optional. Defaults to {@link MetricsExporter#NOOP}.
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Optional. Defaults to {@link Clock#systemUTC()}.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Builds the scheduler. Call {@link ContentScheduler#start()} to begin ticking.
         *
         * @throws NullPointerException     if a required collaborator is missing
         * @throws IllegalArgumentException if {@code batchSize <= 0}
         */
        public ContentScheduler build() {
            return new ContentScheduler(this);
        }
    }
}
