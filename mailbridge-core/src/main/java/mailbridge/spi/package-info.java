/**
 * Service Provider Interfaces for plugging in transactions, connections, persistence,
 * notification transport, consumer locking and metrics.
 *
 * @see mailbridge.spi.TxContext
 * @see mailbridge.spi.DispatchStore
 * @see mailbridge.spi.NotificationChannel
 * @see mailbridge.spi.ConsumerLock
 * @see mailbridge.spi.MetricsExporter
 */
package mailbridge.spi;
