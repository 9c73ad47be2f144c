/**
 * Change notification: the post-commit {@link mailbridge.notify.ChangePublisher} and the
 * process-local channel.
 */
package mailbridge.notify;
