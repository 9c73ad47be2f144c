/**
 * PostgreSQL {@code LISTEN/NOTIFY} notification channel.
 */
package mailbridge.jdbc.notify;
