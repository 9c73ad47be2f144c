package mailbridge.scheduler;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExponentialBackoffPolicyTest {

  @Test
  void doublesFromBaseDelay() {
    ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(Duration.ofSeconds(1), Duration.ofHours(1));

    assertEquals(Duration.ofSeconds(1), policy.computeDelay(1));
    assertEquals(Duration.ofSeconds(2), policy.computeDelay(2));
    assertEquals(Duration.ofSeconds(4), policy.computeDelay(3));
    assertEquals(Duration.ofSeconds(8), policy.computeDelay(4));
  }

  @Test
  void capsAtMaxDelay() {
    ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(Duration.ofMillis(100), Duration.ofMillis(500));

    assertEquals(Duration.ofMillis(400), policy.computeDelay(3));
    assertEquals(Duration.ofMillis(500), policy.computeDelay(4));
    assertEquals(Duration.ofMillis(500), policy.computeDelay(1000));
  }

  @Test
  void successiveDelaysNeverDecrease() {
    ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(Duration.ofMillis(3), Duration.ofMinutes(10));

    Duration previous = Duration.ZERO;
    for (int attempt = 1; attempt <= 80; attempt++) {
      Duration delay = policy.computeDelay(attempt);
      assertTrue(delay.compareTo(previous) >= 0, "attempt " + attempt);
      previous = delay;
    }
    assertEquals(Duration.ofMinutes(10), previous);
  }

  @Test
  void delayIsAlwaysPositive() {
    ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(Duration.ofMillis(1), Duration.ofMillis(1), 0.9);

    for (int attempt = -1; attempt < 50; attempt++) {
      assertTrue(policy.computeDelay(attempt).toMillis() >= 1);
    }
  }

  @Test
  void jitterStaysWithinBoundsAndCap() {
    ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(Duration.ofMillis(1000), Duration.ofMillis(1500), 0.25);

    for (int i = 0; i < 200; i++) {
      long first = policy.computeDelay(1).toMillis();
      assertTrue(first >= 750 && first < 1250, "got " + first);
      long capped = policy.computeDelay(5).toMillis();
      assertTrue(capped >= 1125 && capped <= 1500, "got " + capped);
    }
  }

  @Test
  void rejectsInvalidArguments() {
    assertThrows(IllegalArgumentException.class,
        () -> new ExponentialBackoffPolicy(Duration.ZERO, Duration.ofSeconds(1)));
    assertThrows(IllegalArgumentException.class,
        () -> new ExponentialBackoffPolicy(Duration.ofSeconds(2), Duration.ofSeconds(1)));
    assertThrows(IllegalArgumentException.class,
        () -> new ExponentialBackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(2), 1.0));
    assertThrows(IllegalArgumentException.class,
        () -> new ExponentialBackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(2), -0.1));
  }
}
