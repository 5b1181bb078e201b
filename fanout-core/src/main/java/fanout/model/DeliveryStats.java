package fanout.model;

/**
 * Per-content delivery counts taken from the delivery log.
 *
 * @param contentId content id
 * @param sent      pairs delivered successfully
 * @param failed    pairs that exhausted their retries
 * @param pending   pairs waiting for a retry
 */
public record DeliveryStats(long contentId, int sent, int failed, int pending) {

  public int total() {
    return sent + failed + pending;
  }

  /** Pairs with a terminal outcome. */
  public int resolved() {
    return sent + failed;
  }
}
