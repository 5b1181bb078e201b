package fanout.jdbc;

import fanout.jdbc.store.AbstractJdbcFanoutStore;
import fanout.jdbc.store.H2FanoutStore;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;

import javax.sql.DataSource;
import java.util.UUID;

class H2FanoutStoreTest extends AbstractFanoutStoreIntegrationTest {

  private final H2FanoutStore store = new H2FanoutStore();
  private JdbcDataSource dataSource;

  @BeforeEach
  void setup() throws Exception {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:store_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    TestSchema.create(dataSource, "/schema/h2.sql");
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcFanoutStore store() {
    return store;
  }
}
