package fanout.queue;

/**
 * Unchecked exception raised when a {@link fanout.spi.TaskQueue} operation cannot reach
 * its backing storage.
 */
public final class TaskQueueException extends RuntimeException {
  public TaskQueueException(String message, Throwable cause) {
    super(message, cause);
  }
}
