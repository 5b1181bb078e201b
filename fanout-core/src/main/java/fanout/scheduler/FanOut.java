package fanout.scheduler;

import fanout.model.Content;
import fanout.model.DeliveryTask;
import fanout.model.Subscriber;
import fanout.spi.ConnectionProvider;
import fanout.spi.ContentStore;
import fanout.spi.MetricsExporter;
import fanout.spi.SubscriptionStore;
import fanout.spi.TaskQueue;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Expands one due content item into per-subscriber delivery tasks.
 *
 * <p>The claim (PENDING to PROCESSING), the subscriber snapshot and the recorded expected
 * count commit together in one transaction. A topic without active subscribers is
 * finalized in that same transaction and never touches the queue. Tasks are enqueued
 * after the commit; an enqueue failure is logged and counted but does not undo the claim.
 */
public final class FanOut {
    private static final Logger logger = Logger.getLogger(FanOut.class.getName());

    /** Outcome of fanning out one content item. */
    public record Result(Kind kind, int enqueued, int enqueueFailures) {
        public enum Kind {
            /** Another actor claimed the content first. */
            CLAIM_CONFLICT,
            /** No active subscribers; content finalized as SENT. */
            FINALIZED_EMPTY,
            /** Tasks handed to the queue. */
            ENQUEUED
        }
    }

    private final ConnectionProvider connectionProvider;
    private final ContentStore contentStore;
    private final SubscriptionStore subscriptionStore;
    private final TaskQueue taskQueue;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final String defaultSubject;

    private FanOut(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.contentStore = Objects.requireNonNull(builder.contentStore, "contentStore");
        this.subscriptionStore = Objects.requireNonNull(builder.subscriptionStore, "subscriptionStore");
        this.taskQueue = Objects.requireNonNull(builder.taskQueue, "taskQueue");
        this.defaultSubject = Objects.requireNonNull(builder.defaultSubject, "defaultSubject");
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Claims and fans out one content item.
     *
     * @throws SQLException if the claim transaction fails; the content is left untouched
     */
    public Result fanOut(Content content) throws SQLException {
        List<Subscriber> snapshot;
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(false);
            try {
                if (!contentStore.claimForProcessing(conn, content.id())) {
                    conn.rollback();
                    metrics.incrementClaimConflict();
                    logger.log(Level.FINE, "Content {0} already claimed by another actor", content.id());
                    return new Result(Result.Kind.CLAIM_CONFLICT, 0, 0);
                }
                snapshot = subscriptionStore.activeSubscribersForTopic(conn, content.topicId());
                if (snapshot.isEmpty()) {
                    contentStore.finalizeAsSent(conn, content.id(), clock.instant());
                } else {
                    contentStore.recordExpectedDeliveries(conn, content.id(), snapshot.size());
                }
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        }

        metrics.incrementClaimSuccess();
        if (snapshot.isEmpty()) {
            metrics.incrementContentFinalized();
            logger.log(Level.WARNING, "No active subscribers for topic {0}; content {1} marked as sent",
                    new Object[]{content.topicId(), content.id()});
            return new Result(Result.Kind.FINALIZED_EMPTY, 0, 0);
        }
        logger.log(Level.INFO, "Claimed content {0} for {1} subscribers",
                new Object[]{content.id(), snapshot.size()});
        return enqueueAll(content, snapshot);
    }

    private Result enqueueAll(Content content, List<Subscriber> snapshot) {
        String subject = content.subjectOr(defaultSubject);
        Instant now = clock.instant();
        int enqueued = 0;
        int failed = 0;
        for (Subscriber subscriber : snapshot) {
            DeliveryTask task = DeliveryTask.create(content, subscriber, subject, now);
            try {
                taskQueue.enqueue(task);
                enqueued++;
            } catch (RuntimeException e) {
                failed++;
                metrics.incrementEnqueueFailed();
                logger.log(Level.WARNING, "Failed to enqueue delivery of content " + content.id()
                        + " to subscriber " + subscriber.id(), e);
            }
        }
        metrics.incrementEnqueued(enqueued);
        if (failed > 0) {
            logger.log(Level.SEVERE, "Content {0}: {1} of {2} deliveries could not be enqueued",
                    new Object[]{content.id(), failed, snapshot.size()});
        } else {
            logger.log(Level.INFO, "Enqueued {0} deliveries for content {1}",
                    new Object[]{enqueued, content.id()});
        }
        return new Result(Result.Kind.ENQUEUED, enqueued, failed);
    }

    /** Builder for {@link FanOut}. */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private ContentStore contentStore;
        private SubscriptionStore subscriptionStore;
        private TaskQueue taskQueue;
        private MetricsExporter metrics;
        private Clock clock;
        private String defaultSubject = "Newsletter";

        private Builder() {
        }

        /** <b>Required.</b> */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /** <b>Required.</b> */
        public Builder contentStore(ContentStore contentStore) {
            this.contentStore = contentStore;
            return this;
        }

        /** <b>Required.</b> */
        public Builder subscriptionStore(SubscriptionStore subscriptionStore) {
            this.subscriptionStore = subscriptionStore;
            return this;
        }

        /** <b>Required.</b> */
        public Builder taskQueue(TaskQueue taskQueue) {
            this.taskQueue = taskQueue;
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
         * Subject used when content has no title.
         *
         * <p>Optional. Defaults to {@code "Newsletter"}.
         */
        public Builder defaultSubject(String defaultSubject) {
            this.defaultSubject = defaultSubject;
            return this;
        }

        public FanOut build() {
            return new FanOut(this);
        }
    }
}
