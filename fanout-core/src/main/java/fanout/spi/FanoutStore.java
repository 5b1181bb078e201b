package fanout.spi;

/**
 * Convenience aggregate of every store SPI, implemented by the JDBC stores.
 */
public interface FanoutStore extends ContentStore, SubscriptionStore, DeliveryLogStore, TaskStore {
}
