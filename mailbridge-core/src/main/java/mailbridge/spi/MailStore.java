package mailbridge.spi;

import mailbridge.model.Mail;

import java.sql.Connection;
import java.util.Optional;

/**
 * Persistence contract for archived mail and its attachments.
 */
public interface MailStore {

    /**
     * Inserts the mail row and one row per attachment.
     *
     * @throws mailbridge.InvariantViolationException if a mail with the same id exists
     */
    void insert(Connection conn, Mail mail);

    /**
     * Loads a mail with its attachments ordered by sequence number.
     */
    Optional<Mail> find(Connection conn, String mailId);

    boolean exists(Connection conn, String mailId);

    /**
     * Deletes a mail; attachments and dispatch rows go with it.
     *
     * @return {@code true} if a row was deleted
     */
    boolean delete(Connection conn, String mailId);
}
