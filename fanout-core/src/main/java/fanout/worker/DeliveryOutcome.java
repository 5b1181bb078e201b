package fanout.worker;

/**
 * Result of processing one claimed delivery task.
 */
public enum DeliveryOutcome {
  /** Sent; delivery log is SENT and the task removed. */
  SENT,
  /** Attempt failed; the task was rescheduled. */
  RETRY_SCHEDULED,
  /** Final attempt failed; delivery log is FAILED and the task moved to the dead sink. */
  FAILED,
  /** The pair already had a terminal log row; the task was dropped without sending. */
  ALREADY_RESOLVED,
  /** The claim lease could no longer cover an attempt; dropped unsent for redelivery. */
  LEASE_EXPIRED,
  /** Interrupted before an outcome was recorded; the lease will expire and the task reappear. */
  ABANDONED
}
