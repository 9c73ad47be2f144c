package mailbridge.archive;

import mailbridge.model.Mail;
import mailbridge.spi.ConnectionProvider;
import mailbridge.spi.MailStore;
import mailbridge.spi.TxContext;
import mailbridge.util.ConnectionScope;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read and maintenance access to archived mail.
 *
 * <p>Operations join the caller's transaction when one is active. {@link #archive}
 * otherwise runs in a transaction of its own so a mail is never stored without its
 * attachments.
 */
public final class MailArchive {
  private static final Logger logger = Logger.getLogger(MailArchive.class.getName());

  private final ConnectionScope scope;
  private final MailStore store;

  public MailArchive(ConnectionProvider connectionProvider, TxContext txContext, MailStore store) {
    this.scope = new ConnectionScope(connectionProvider, txContext);
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Stores a mail with its attachments.
   *
   * @throws mailbridge.InvariantViolationException if a mail with the same id is archived
   */
  public void archive(Mail mail) {
    Objects.requireNonNull(mail, "mail");
    scope.inTransaction(conn -> {
      store.insert(conn, mail);
      return null;
    });
  }

  /**
   * Loads a mail with its attachments ordered by sequence number.
   */
  public Optional<Mail> find(String mailId) {
    Objects.requireNonNull(mailId, "mailId");
    return scope.call(conn -> store.find(conn, mailId));
  }

  public boolean exists(String mailId) {
    Objects.requireNonNull(mailId, "mailId");
    return scope.call(conn -> store.exists(conn, mailId));
  }

  /**
   * Deletes a mail together with its attachments and any dispatch still pending for it.
   *
   * @return {@code true} if the mail existed
   */
  public boolean delete(String mailId) {
    Objects.requireNonNull(mailId, "mailId");
    boolean deleted = scope.call(conn -> store.delete(conn, mailId));
    if (deleted) {
      logger.log(Level.INFO, "Deleted mail {0}", mailId);
    }
    return deleted;
  }
}
