/**
 * Delivery task queues and retry policies.
 *
 * <p>{@link fanout.queue.StoreBackedTaskQueue} is the durable queue used in production.
 * {@link fanout.queue.InMemoryTaskQueue} keeps the same lease semantics without a database.
 */
package fanout.queue;
