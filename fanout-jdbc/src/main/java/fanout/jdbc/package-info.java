/**
 * JDBC implementations of the fan-out store SPIs.
 *
 * <p>{@link fanout.jdbc.store.JdbcFanoutStores} picks the store for a database from its JDBC
 * URL. Schema scripts ship as classpath resources {@code schema/h2.sql} and
 * {@code schema/postgresql.sql}.
 */
package fanout.jdbc;
