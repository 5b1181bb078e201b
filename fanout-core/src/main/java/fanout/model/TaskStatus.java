package fanout.model;

/**
 * Status of a row in the durable delivery task queue.
 */
public enum TaskStatus {
  READY(0),
  RETRY(1),
  DEAD(2);

  private final int code;

  TaskStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static TaskStatus fromCode(int code) {
    for (TaskStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown task status code: " + code);
  }
}
