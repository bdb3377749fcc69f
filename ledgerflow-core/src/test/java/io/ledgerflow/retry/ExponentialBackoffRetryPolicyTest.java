package io.ledgerflow.retry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void firstAttemptReturnsInitialDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 2.0, 30000);

    assertEquals(1000L, policy.computeDelayMs(1));
  }

  @Test
  void delayGrowsByMultiplier() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 2.0, 30000);

    assertEquals(2000L, policy.computeDelayMs(2));
    assertEquals(4000L, policy.computeDelayMs(3));
    assertEquals(8000L, policy.computeDelayMs(4));
  }

  @Test
  void delayIsCappedAtMaxDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 2.0, 30000);

    assertEquals(30000L, policy.computeDelayMs(6));
    assertEquals(30000L, policy.computeDelayMs(50));
  }

  @Test
  void fractionalMultiplierMatchesPollingSchedule() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(5000, 1.5, 15000);

    assertEquals(5000L, policy.computeDelayMs(1));
    assertEquals(7500L, policy.computeDelayMs(2));
    assertEquals(11250L, policy.computeDelayMs(3));
    assertEquals(15000L, policy.computeDelayMs(4));
  }

  @Test
  void jitterStaysWithinHalfToOneAndHalfAndUnderCap() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 2.0, 1500, true);

    for (int i = 0; i < 50; i++) {
      long delay = policy.computeDelayMs(1);
      assertTrue(delay >= 500 && delay <= 1500, "got " + delay);
    }
  }

  @Test
  void handlesAttemptCountAtOverflowBoundary() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 2.0, 60000);

    assertEquals(60000L, policy.computeDelayMs(1100));
  }

  @Test
  void zeroAndNegativeAttemptsReturnZero() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 2.0, 10000);

    assertEquals(0L, policy.computeDelayMs(0));
    assertEquals(0L, policy.computeDelayMs(-1));
  }

  @Test
  void rejectsInvalidParameters() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(-1, 2.0, 100));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(100, 0.5, 100));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(100, 2.0, 50));
  }
}
