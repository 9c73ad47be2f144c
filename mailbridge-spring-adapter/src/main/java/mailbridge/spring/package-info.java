/**
 * Spring transaction integration.
 *
 * <p>{@link mailbridge.spring.SpringTxContext} lets {@link mailbridge.ingest.MailIngestor}
 * and {@link mailbridge.queue.DispatchQueue} join Spring-managed transactions.
 */
package mailbridge.spring;
