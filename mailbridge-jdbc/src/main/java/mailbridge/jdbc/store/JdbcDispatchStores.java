package mailbridge.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC dispatch stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/mailbridge.jdbc.store.AbstractJdbcDispatchStore}.
 *
 * <pre>{@code
 * AbstractJdbcDispatchStore store = JdbcDispatchStores.detect(dataSource);
 * AbstractJdbcDispatchStore h2 = JdbcDispatchStores.get("h2");
 * }</pre>
 */
public final class JdbcDispatchStores {

  private static final List<AbstractJdbcDispatchStore> STORES;
  private static final Map<String, AbstractJdbcDispatchStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcDispatchStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcDispatchStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcDispatchStores() {
  }

  public static List<AbstractJdbcDispatchStore> all() {
    return STORES;
  }

  /**
   * Gets a store by name (case-insensitive).
   *
   * @throws IllegalArgumentException if no store has that name
   */
  public static AbstractJdbcDispatchStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcDispatchStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown dispatch store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the store from a DataSource's JDBC URL.
   *
   * @throws IllegalStateException if the URL cannot be read
   */
  public static AbstractJdbcDispatchStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect dispatch store from DataSource", e);
    }
  }

  /**
   * Auto-detects the store from a JDBC URL.
   *
   * @throws IllegalArgumentException if no store handles the URL
   */
  public static AbstractJdbcDispatchStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcDispatchStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No dispatch store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + STORES.stream().flatMap(s -> s.jdbcUrlPrefixes().stream()).toList());
  }
}
