/**
 * Service provider interfaces: stores, task queue, mail transport and metrics.
 *
 * <p>Store methods take an explicit {@link java.sql.Connection} so the caller decides
 * transaction boundaries. JDBC implementations live in {@code fanout-jdbc}.
 */
package fanout.spi;
