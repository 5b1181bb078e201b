package fanout.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the JDBC fan-out stores.
 */
public final class FanoutStoreException extends RuntimeException {
  public FanoutStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
