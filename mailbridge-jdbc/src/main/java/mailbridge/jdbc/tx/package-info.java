/**
 * Manual JDBC transactions bound to the current thread.
 */
package mailbridge.jdbc.tx;
