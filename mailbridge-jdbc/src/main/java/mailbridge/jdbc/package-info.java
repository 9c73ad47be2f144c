/**
 * JDBC persistence for the archive, the consumer registry and the dispatch queue, with
 * H2 and PostgreSQL support, plus PostgreSQL {@code LISTEN/NOTIFY} and advisory locks.
 *
 * @see mailbridge.jdbc.store.JdbcDispatchStores
 * @see mailbridge.jdbc.tx.JdbcTransactionManager
 */
package mailbridge.jdbc;
