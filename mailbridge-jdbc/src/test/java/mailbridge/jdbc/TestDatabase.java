package mailbridge.jdbc;

import mailbridge.jdbc.store.JdbcMailStore;
import mailbridge.model.Attachment;
import mailbridge.model.Mail;
import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.UUID;

/**
 * Test fixtures: schema-initialised databases and sample rows.
 */
public final class TestDatabase {

  public static final Instant MAIL_DATE = Instant.parse("2024-03-01T10:15:30Z");

  private TestDatabase() {
  }

  /**
   * Returns a fresh in-memory H2 database with the schema applied.
   */
  public static JdbcDataSource h2() {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:mailbridge_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    runScript(dataSource, "/schema/h2.sql");
    return dataSource;
  }

  public static void runScript(DataSource dataSource, String resource) {
    String script;
    try (InputStream is = TestDatabase.class.getResourceAsStream(resource)) {
      if (is == null) throw new IOException("Resource not found: " + resource);
      script = new String(is.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException(e);
    }
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      for (String stmt : script.split(";")) {
        String trimmed = stmt.trim();
        if (!trimmed.isEmpty()) {
          st.execute(trimmed);
        }
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to run " + resource, e);
    }
  }

  public static Mail mail(String id) {
    return Mail.builder(id)
        .date(MAIL_DATE)
        .text("Hello " + id)
        .data(("Message-ID: <" + id + ">\r\n\r\nHello").getBytes(StandardCharsets.US_ASCII))
        .attachment(new Attachment(1, "notes.txt", "text/plain", "utf-8",
            "notes".getBytes(StandardCharsets.UTF_8)))
        .build();
  }

  /**
   * Archives {@link #mail(String)} outside any transaction.
   */
  public static void insertMail(DataSource dataSource, String id) {
    try (Connection conn = dataSource.getConnection()) {
      new JdbcMailStore().insert(conn, mail(id));
    } catch (SQLException e) {
      throw new IllegalStateException(e);
    }
  }

  /**
   * Inserts a consumer with an explicit id.
   */
  public static void insertConsumer(DataSource dataSource, int id) {
    execute(dataSource, "INSERT INTO consumer (id, name) VALUES (?, ?)", id, "consumer-" + id);
  }

  public static int count(DataSource dataSource, String table) {
    try (Connection conn = dataSource.getConnection();
         Statement st = conn.createStatement();
         var rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
      rs.next();
      return rs.getInt(1);
    } catch (SQLException e) {
      throw new IllegalStateException(e);
    }
  }

  public static void execute(DataSource dataSource, String sql, Object... params) {
    try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
      for (int i = 0; i < params.length; i++) {
        ps.setObject(i + 1, params[i]);
      }
      ps.execute();
    } catch (SQLException e) {
      throw new IllegalStateException(e);
    }
  }
}
