/**
 * JDBC stores. Dispatch stores are database-specific and discovered through
 * {@link mailbridge.jdbc.store.JdbcDispatchStores}; the mail and consumer stores are portable.
 */
package mailbridge.jdbc.store;
