package fanout.spi;

/**
 * Thrown by a {@link Mailer} when a message could not be sent.
 *
 * <p>Every failure is treated as transient and retried until the attempt budget runs out.
 */
public class MailerException extends Exception {

  public MailerException(String message) {
    super(message);
  }

  public MailerException(String message, Throwable cause) {
    super(message, cause);
  }
}
