package fanout.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Picks the fan-out store for a database.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/fanout.jdbc.store.AbstractJdbcFanoutStore}. A store matches when
 * the JDBC URL starts with one of its {@link AbstractJdbcFanoutStore#jdbcUrlPrefixes()}, or,
 * for URLs of wrapping drivers, when the database product name equals its
 * {@link AbstractJdbcFanoutStore#name()}.
 */
public final class JdbcFanoutStores {

  private static final List<AbstractJdbcFanoutStore> STORES = ServiceLoader.load(AbstractJdbcFanoutStore.class)
      .stream()
      .map(ServiceLoader.Provider::get)
      .toList();

  private JdbcFanoutStores() {
  }

  /**
   * Detects the store from the connection metadata of a DataSource.
   *
   * @throws IllegalStateException    if the metadata cannot be read
   * @throws IllegalArgumentException if neither URL nor product name matches a store
   */
  public static AbstractJdbcFanoutStore detect(DataSource dataSource) {
    String url;
    String product;
    try (Connection conn = dataSource.getConnection()) {
      DatabaseMetaData meta = conn.getMetaData();
      url = meta.getURL();
      product = meta.getDatabaseProductName();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to read database metadata for fan-out store detection", e);
    }
    return byUrl(url)
        .or(() -> byProductName(product))
        .orElseThrow(() -> new IllegalArgumentException(
            "No fan-out store for database " + product + " at " + url + "; supported: " + names()));
  }

  /**
   * Detects the store from a JDBC URL.
   *
   * @throws IllegalArgumentException if the URL is empty or no store handles it
   */
  public static AbstractJdbcFanoutStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    return byUrl(jdbcUrl).orElseThrow(() -> new IllegalArgumentException(
        "No fan-out store for JDBC URL " + jdbcUrl + "; supported: " + names()));
  }

  private static Optional<AbstractJdbcFanoutStore> byUrl(String jdbcUrl) {
    if (jdbcUrl == null) {
      return Optional.empty();
    }
    String lower = jdbcUrl.toLowerCase(Locale.ROOT);
    return STORES.stream()
        .filter(s -> s.jdbcUrlPrefixes().stream().anyMatch(p -> lower.startsWith(p.toLowerCase(Locale.ROOT))))
        .findFirst();
  }

  private static Optional<AbstractJdbcFanoutStore> byProductName(String product) {
    if (product == null) {
      return Optional.empty();
    }
    return STORES.stream().filter(s -> s.name().equalsIgnoreCase(product.trim())).findFirst();
  }

  private static List<String> names() {
    return STORES.stream().map(AbstractJdbcFanoutStore::name).toList();
  }
}
