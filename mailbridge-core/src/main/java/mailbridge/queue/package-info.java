/**
 * The durable dispatch queue and its post-commit hook.
 */
package mailbridge.queue;
