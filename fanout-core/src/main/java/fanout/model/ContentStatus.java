package fanout.model;

/**
 * Lifecycle state of a content item.
 *
 * <p>Transitions only move forward: {@code PENDING -> PROCESSING -> SENT}.
 */
public enum ContentStatus {
  PENDING("pending"),
  PROCESSING("processing"),
  SENT("sent");

  private final String dbValue;

  ContentStatus(String dbValue) {
    this.dbValue = dbValue;
  }

  /** Value stored in the {@code content.status} column. */
  public String dbValue() {
    return dbValue;
  }

  public static ContentStatus fromDbValue(String value) {
    for (ContentStatus status : values()) {
      if (status.dbValue.equals(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown content status: " + value);
  }
}
