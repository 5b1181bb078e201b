package fanout.model;

import java.util.Objects;

/**
 * A mail recipient. Only active subscribers take part in a fan-out.
 */
public record Subscriber(long id, String email, boolean active) {
  public Subscriber {
    Objects.requireNonNull(email, "email");
  }
}
