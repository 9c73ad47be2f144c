package mailbridge.ingest;

import mailbridge.model.Consumer;
import mailbridge.model.Mail;
import mailbridge.queue.DispatchQueue;
import mailbridge.spi.ConsumerStore;
import mailbridge.spi.MailStore;
import mailbridge.spi.TxContext;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for new mail: archives it and queues one dispatch per interested consumer,
 * all within the caller's transaction.
 *
 * <p>Ingesting a mail that is already archived leaves the archive untouched but still
 * queues it for consumers that do not have it pending, so a retried ingest after a
 * partial failure completes the fan-out. Notifications go out after commit through the
 * queue's hook.
 *
 * @see DispatchQueue#enqueue
 */
public final class MailIngestor {
    private static final Logger logger = Logger.getLogger(MailIngestor.class.getName());

    private final TxContext txContext;
    private final MailStore mailStore;
    private final ConsumerStore consumerStore;
    private final DispatchQueue queue;
    private final InterestPolicy interestPolicy;

    public MailIngestor(TxContext txContext, MailStore mailStore, ConsumerStore consumerStore,
                        DispatchQueue queue) {
        this(txContext, mailStore, consumerStore, queue, InterestPolicy.ALL);
    }

    /**
     * @param interestPolicy selects recipients; {@code null} defaults to {@link InterestPolicy#ALL}
     */
    public MailIngestor(TxContext txContext, MailStore mailStore, ConsumerStore consumerStore,
                        DispatchQueue queue, InterestPolicy interestPolicy) {
        this.txContext = Objects.requireNonNull(txContext, "txContext");
        this.mailStore = Objects.requireNonNull(mailStore, "mailStore");
        this.consumerStore = Objects.requireNonNull(consumerStore, "consumerStore");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.interestPolicy = interestPolicy == null ? InterestPolicy.ALL : interestPolicy;
    }

    /**
     * Archives a mail and queues it for every interested consumer.
     *
     * @return ids of the consumers a new dispatch was queued for
     * @throws IllegalStateException if no transaction is active
     */
    public List<Integer> ingest(Mail mail) {
        Objects.requireNonNull(mail, "mail");
        if (!txContext.isTransactionActive()) {
            throw new IllegalStateException("No active transaction");
        }
        Connection conn = txContext.currentConnection();
        if (mailStore.exists(conn, mail.id())) {
            logger.log(Level.FINE, "Mail {0} already archived", mail.id());
        } else {
            mailStore.insert(conn, mail);
        }

        List<Integer> queued = new ArrayList<>();
        for (Consumer consumer : consumerStore.findAll(conn)) {
            if (interestPolicy.isInterested(consumer, mail) && queue.enqueue(consumer.id(), mail.id())) {
                queued.add(consumer.id());
            }
        }
        logger.log(Level.FINE, "Ingested mail {0} for consumers {1}", new Object[]{mail.id(), queued});
        return queued;
    }
}
