package mailbridge.jdbc.store;

import mailbridge.jdbc.JdbcTemplate;
import mailbridge.model.Attachment;
import mailbridge.model.Mail;
import mailbridge.spi.MailStore;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC mail store over the {@code mail} and {@code attachment} tables. The SQL is portable
 * across H2 and PostgreSQL.
 */
public final class JdbcMailStore implements MailStore {

  @Override
  public void insert(Connection conn, Mail mail) {
    JdbcTemplate.update(conn,
        "INSERT INTO mail (id, origin_date, body_text, raw_data) VALUES (?,?,?,?)",
        mail.id(), mail.date(), mail.text(), mail.data());
    List<Object[]> rows = new ArrayList<>();
    for (Attachment a : mail.attachments()) {
      rows.add(new Object[]{mail.id(), a.number(), a.name(), a.type(), a.charset(), a.data()});
    }
    JdbcTemplate.batch(conn,
        "INSERT INTO attachment (mail_id, seq, name, mime_type, charset, raw_data) VALUES (?,?,?,?,?,?)",
        rows);
  }

  @Override
  public Optional<Mail> find(Connection conn, String mailId) {
    Optional<Mail.Builder> found = JdbcTemplate.queryOne(conn,
        "SELECT id, origin_date, body_text, raw_data FROM mail WHERE id=?",
        rs -> Mail.builder(rs.getString("id"))
            .date(JdbcTemplate.getInstant(rs, "origin_date"))
            .text(rs.getString("body_text"))
            .data(rs.getBytes("raw_data")),
        mailId);
    if (found.isEmpty()) {
      return Optional.empty();
    }
    List<Attachment> attachments = JdbcTemplate.query(conn,
        "SELECT seq, name, mime_type, charset, raw_data FROM attachment WHERE mail_id=? ORDER BY seq",
        rs -> new Attachment(
            rs.getInt("seq"),
            rs.getString("name"),
            rs.getString("mime_type"),
            rs.getString("charset"),
            rs.getBytes("raw_data")),
        mailId);
    return Optional.of(found.get().attachments(attachments).build());
  }

  @Override
  public boolean exists(Connection conn, String mailId) {
    return JdbcTemplate.queryOne(conn, "SELECT 1 AS found FROM mail WHERE id=?", rs -> Boolean.TRUE, mailId)
        .isPresent();
  }

  @Override
  public boolean delete(Connection conn, String mailId) {
    return JdbcTemplate.update(conn, "DELETE FROM mail WHERE id=?", mailId) > 0;
  }
}
