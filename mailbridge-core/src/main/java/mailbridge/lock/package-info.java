/**
 * Process-local {@link mailbridge.spi.ConsumerLock}. The PostgreSQL advisory lock lives in
 * {@code mailbridge-jdbc}.
 */
package mailbridge.lock;
