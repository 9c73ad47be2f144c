package mailbridge.scheduler;

/**
 * Outcome of one {@link DispatchScheduler#processOnce()} burst.
 *
 * @param lockAcquired {@code false} if another worker held the consumer lock and nothing was done
 * @param delivered    number of dispatches delivered and removed
 * @param failed       number of dispatches rescheduled after a failed attempt
 */
public record BurstResult(boolean lockAcquired, int delivered, int failed) {

  public static final BurstResult LOCKED_OUT = new BurstResult(false, 0, 0);

  public int attempted() {
    return delivered + failed;
  }
}
