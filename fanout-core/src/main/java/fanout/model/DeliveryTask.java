package fanout.model;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Objects;

/**
 * Unit of work: deliver one content item to one subscriber.
 *
 * <p>The subject and body are copied at fan-out time so that a task does not need
 * to read the content row again when it is executed or retried.
 *
 * @param taskId       ULID, unique per task
 * @param contentId    content being delivered
 * @param subscriberId recipient id
 * @param email        recipient address
 * @param subject      resolved subject line (never null)
 * @param body         message body
 * @param attempts     number of attempts already made
 * @param createdAt    enqueue time
 */
public record DeliveryTask(
    String taskId,
    long contentId,
    long subscriberId,
    String email,
    String subject,
    String body,
    int attempts,
    Instant createdAt
) {
  public DeliveryTask {
    Objects.requireNonNull(taskId, "taskId");
    Objects.requireNonNull(email, "email");
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(body, "body");
    Objects.requireNonNull(createdAt, "createdAt");
    if (attempts < 0) {
      throw new IllegalArgumentException("attempts must be >= 0");
    }
  }

  /**
   * Creates a fresh task with a new ULID and zero attempts.
   */
  public static DeliveryTask create(Content content, Subscriber subscriber, String subject, Instant now) {
    return new DeliveryTask(
        UlidCreator.getMonotonicUlid().toString(),
        content.id(),
        subscriber.id(),
        subscriber.email(),
        subject,
        content.body(),
        0,
        now);
  }

  public DeliveryTask withAttempts(int attempts) {
    return new DeliveryTask(taskId, contentId, subscriberId, email, subject, body, attempts, createdAt);
  }
}
