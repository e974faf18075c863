package bugtrail.retry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BackoffStrategyTest {

  @Test
  void exponentialWithoutJitterDoubles() {
    ExponentialBackoffStrategy strategy = new ExponentialBackoffStrategy(100, 10_000, 0.0);

    assertEquals(100, strategy.computeDelayMs(1));
    assertEquals(200, strategy.computeDelayMs(2));
    assertEquals(400, strategy.computeDelayMs(3));
    assertEquals(800, strategy.computeDelayMs(4));
  }

  @Test
  void exponentialIsCapped() {
    ExponentialBackoffStrategy strategy = new ExponentialBackoffStrategy(1000, 5000);

    assertEquals(5000, strategy.computeDelayMs(4));
    assertEquals(5000, strategy.computeDelayMs(62));
    assertEquals(5000, strategy.computeDelayMs(100));
  }

  @Test
  void exponentialJitterStaysInRange() {
    ExponentialBackoffStrategy low = new ExponentialBackoffStrategy(1000, 100_000, 0.5, () -> 0.0);
    ExponentialBackoffStrategy high = new ExponentialBackoffStrategy(1000, 100_000, 0.5, () -> 0.999);

    assertEquals(1000, low.computeDelayMs(1));
    assertEquals(1499, high.computeDelayMs(1));
    for (int i = 0; i < 50; i++) {
      long delay = new ExponentialBackoffStrategy(1000, 100_000).computeDelayMs(2);
      assertTrue(delay >= 2000 && delay < 3000, "got " + delay);
    }
  }

  @Test
  void zeroOrNegativeAttemptHasNoDelay() {
    assertEquals(0, new ExponentialBackoffStrategy(100, 1000).computeDelayMs(0));
    assertEquals(0, new LinearBackoffStrategy(100, 1000).computeDelayMs(-1));
  }

  @Test
  void linearGrowsByBase() {
    LinearBackoffStrategy strategy = new LinearBackoffStrategy(250, 1000);

    assertEquals(250, strategy.computeDelayMs(1));
    assertEquals(500, strategy.computeDelayMs(2));
    assertEquals(1000, strategy.computeDelayMs(4));
    assertEquals(1000, strategy.computeDelayMs(Integer.MAX_VALUE));
  }

  @Test
  void fixedIgnoresAttempt() {
    FixedBackoffStrategy strategy = new FixedBackoffStrategy(300);

    assertEquals(300, strategy.computeDelayMs(1));
    assertEquals(300, strategy.computeDelayMs(9));
  }

  @Test
  void invalidArgumentsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffStrategy(-1, 10));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffStrategy(100, 10));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffStrategy(10, 100, -0.1));
    assertThrows(IllegalArgumentException.class, () -> new LinearBackoffStrategy(100, 10));
    assertThrows(IllegalArgumentException.class, () -> new FixedBackoffStrategy(-5));
  }

  @Test
  void backoffTypeParsesNames() {
    assertEquals(BackoffType.EXPONENTIAL, BackoffType.fromString("exponential"));
    assertEquals(BackoffType.FIXED, BackoffType.fromString(" Fixed "));
    assertInstanceOf(LinearBackoffStrategy.class, BackoffType.LINEAR.create(10, 100, 0));
    assertThrows(IllegalArgumentException.class, () -> BackoffType.fromString("fibonacci"));
    assertThrows(IllegalArgumentException.class, () -> BackoffType.fromString(null));
  }
}
