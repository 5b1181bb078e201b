package fanout.spi;

/**
 * Sends one email.
 *
 * <p>Implementations must be thread-safe; the worker pool calls {@link #send} concurrently.
 */
@FunctionalInterface
public interface Mailer {

    /**
     * Sends a message.
     *
     * @param to      recipient address
     * @param subject subject line
     * @param body    plain-text body
     * @return the transport message id
     * @throws MailerException if the transport rejected or failed to send the message
     */
    String send(String to, String subject, String body) throws MailerException;
}
