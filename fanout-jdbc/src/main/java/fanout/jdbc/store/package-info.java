/**
 * JDBC-based {@link fanout.spi.FanoutStore} implementations.
 *
 * <p>{@link fanout.jdbc.store.AbstractJdbcFanoutStore} holds the shared SQL and row mapping;
 * subclasses supply database-specific statements: H2 ({@code MERGE ... KEY}, two-phase
 * claim) and PostgreSQL ({@code ON CONFLICT}, {@code FOR UPDATE SKIP LOCKED}).
 *
 * @see fanout.jdbc.store.H2FanoutStore
 * @see fanout.jdbc.store.PostgresFanoutStore
 * @see fanout.jdbc.store.JdbcFanoutStores
 */
package fanout.jdbc.store;
