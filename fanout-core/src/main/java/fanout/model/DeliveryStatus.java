package fanout.model;

/**
 * Outcome recorded in the delivery log for one (content, subscriber) pair.
 *
 * <p>{@link #SENT} and {@link #FAILED} are terminal. {@link #PENDING} marks a pair
 * whose last attempt failed and is waiting for a retry.
 */
public enum DeliveryStatus {
  PENDING("pending"),
  SENT("sent"),
  FAILED("failed");

  private final String dbValue;

  DeliveryStatus(String dbValue) {
    this.dbValue = dbValue;
  }

  public String dbValue() {
    return dbValue;
  }

  public boolean isTerminal() {
    return this != PENDING;
  }

  public static DeliveryStatus fromDbValue(String value) {
    for (DeliveryStatus status : values()) {
      if (status.dbValue.equals(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown delivery status: " + value);
  }
}
