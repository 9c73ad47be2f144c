/**
 * PostgreSQL advisory {@link mailbridge.spi.ConsumerLock}.
 */
package mailbridge.jdbc.lock;
