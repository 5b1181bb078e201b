package fanout.completion;

import fanout.model.DeliveryStats;
import fanout.spi.ConnectionProvider;
import fanout.spi.ContentStore;
import fanout.spi.DeliveryLogStore;
import fanout.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides when a content item's fan-out is fully resolved and finalizes it.
 *
 * <p>Called after every terminal delivery outcome. Content is finalized once the number
 * of SENT + FAILED delivery log rows reaches the expected count recorded at fan-out.
 * Finalization is a conditional PROCESSING to SENT update, so concurrent evaluations of
 * the same content yield exactly one {@link Outcome#FINALIZED}.
 *
 * <p>Content with failed deliveries still finalizes as SENT; failures are reported
 * through {@link #progress(long)}.
 */
public final class CompletionEvaluator {
  private static final Logger logger = Logger.getLogger(CompletionEvaluator.class.getName());

  /** Result of one evaluation. */
  public enum Outcome {
    /** This evaluation moved the content to SENT. */
    FINALIZED,
    /** Deliveries are still outstanding, or the expected count is not recorded yet. */
    INCOMPLETE,
    /** Everything is resolved but another evaluation already finalized the content. */
    ALREADY_FINALIZED,
    /** A storage error prevented the evaluation. */
    ERROR
  }

  private final ConnectionProvider connectionProvider;
  private final ContentStore contentStore;
  private final DeliveryLogStore deliveryLogStore;
  private final MetricsExporter metrics;
  private final Clock clock;

  public CompletionEvaluator(ConnectionProvider connectionProvider, ContentStore contentStore,
      DeliveryLogStore deliveryLogStore, MetricsExporter metrics, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.contentStore = Objects.requireNonNull(contentStore, "contentStore");
    this.deliveryLogStore = Objects.requireNonNull(deliveryLogStore, "deliveryLogStore");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    this.clock = clock != null ? clock : Clock.systemUTC();
  }

  /**
   * Evaluates completion of a content item and finalizes it if every expected
   * delivery has a terminal outcome.
   *
   * @param contentId the content to evaluate
   * @return the evaluation outcome; never throws
   */
  public Outcome evaluate(long contentId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      OptionalInt expected = contentStore.countExpectedDeliveries(conn, contentId);
      if (expected.isEmpty()) {
        logger.log(Level.FINE, "No expected delivery count for contentId={0}", contentId);
        return Outcome.INCOMPLETE;
      }
      int resolved = deliveryLogStore.countResolvedDeliveries(conn, contentId);
      int total = expected.getAsInt();
      if (logger.isLoggable(Level.FINE)) {
        int percent = total == 0 ? 100 : (int) Math.min(100L, resolved * 100L / total);
        logger.fine("Progress contentId=" + contentId + ": " + resolved + "/" + total
            + " resolved, " + Math.max(0, total - resolved) + " remaining (" + percent + "%)");
      }
      if (resolved < total) {
        return Outcome.INCOMPLETE;
      }
      if (contentStore.finalizeAsSent(conn, contentId, clock.instant())) {
        metrics.incrementContentFinalized();
        logger.log(Level.INFO, "Content {0} finalized: {1} deliveries resolved",
            new Object[]{contentId, resolved});
        return Outcome.FINALIZED;
      }
      return Outcome.ALREADY_FINALIZED;
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to evaluate completion for contentId=" + contentId, e);
      return Outcome.ERROR;
    }
  }

  /**
   * Returns delivery counts for a content item, or empty if they could not be read.
   */
  public Optional<DeliveryStats> progress(long contentId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      DeliveryStats stats = deliveryLogStore.deliveryStats(conn, contentId);
      OptionalInt expected = contentStore.countExpectedDeliveries(conn, contentId);
      if (expected.isPresent()) {
        logger.log(Level.INFO, "Content {0}: sent={1}, failed={2}, pending={3}, expected={4}",
            new Object[]{contentId, stats.sent(), stats.failed(), stats.pending(), expected.getAsInt()});
      }
      return Optional.of(stats);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to read delivery stats for contentId=" + contentId, e);
      return Optional.empty();
    }
  }
}
