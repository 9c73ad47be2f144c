package mailbridge.jdbc.store;

import java.util.List;

/**
 * H2 dispatch store. Primarily for testing.
 */
public final class H2DispatchStore extends AbstractJdbcDispatchStore {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
