package fanout.jdbc.store;

import java.util.List;

/**
 * H2 fan-out store. Primarily for testing and embedded use.
 *
 * <p>Uses the default {@code MERGE ... USING} upsert and the subquery-based two-phase task
 * claim from {@link AbstractJdbcFanoutStore}.
 */
public final class H2FanoutStore extends AbstractJdbcFanoutStore {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
