package mailbridge.queue;

/**
 * Hook invoked by {@link DispatchQueue} once a newly created dispatch row is visible to
 * other transactions.
 *
 * <p>{@link #afterCommit} runs after the enclosing transaction commits, or right after
 * the insert when the enqueue was auto-committed. It is never called for a rolled-back
 * or no-op enqueue. Exceptions are logged and swallowed.
 *
 * @see mailbridge.notify.ChangePublisher
 */
@FunctionalInterface
public interface EnqueueHook {

  void afterCommit(int consumerId, String mailId);

  /**
   * Hook that does nothing; schedulers then rely on polling alone.
   */
  EnqueueHook NOOP = (consumerId, mailId) -> {
  };
}
