package fanout.spi;

import fanout.model.Subscriber;

import java.sql.Connection;
import java.util.List;

/**
 * Read-only view of topic subscriptions.
 */
public interface SubscriptionStore {

    /**
     * Returns the active subscribers of a topic, ordered by subscriber id.
     */
    List<Subscriber> activeSubscribersForTopic(Connection conn, long topicId);
}
