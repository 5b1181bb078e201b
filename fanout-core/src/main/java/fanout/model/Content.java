package fanout.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A scheduled broadcast message addressed to every active subscriber of a topic.
 *
 * @param id            content id
 * @param topicId       topic whose subscribers receive the content
 * @param title         subject line, may be {@code null}
 * @param body          plain-text body
 * @param scheduledTime earliest time the content may be delivered
 * @param status        lifecycle state
 * @param sent          {@code true} once the content reached {@link ContentStatus#SENT}
 * @param sentAt        time of finalization, {@code null} until sent
 */
public record Content(
    long id,
    long topicId,
    String title,
    String body,
    Instant scheduledTime,
    ContentStatus status,
    boolean sent,
    Instant sentAt
) {
  public Content {
    Objects.requireNonNull(body, "body");
    Objects.requireNonNull(scheduledTime, "scheduledTime");
    Objects.requireNonNull(status, "status");
  }

  /**
   * Returns the title, or {@code defaultSubject} when the title is null or blank.
   */
  public String subjectOr(String defaultSubject) {
    return title == null || title.isBlank() ? defaultSubject : title;
  }
}
