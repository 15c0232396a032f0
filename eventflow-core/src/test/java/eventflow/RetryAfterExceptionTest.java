package eventflow;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryAfterExceptionTest {

  @Test
  void carriesDelay() {
    RetryAfterException ex = new RetryAfterException(Duration.ofSeconds(30), "throttled");

    assertEquals(Duration.ofSeconds(30), ex.retryAfter());
    assertEquals("throttled", ex.getMessage());
  }

  @Test
  void rejectsNegativeDelay() {
    assertThrows(IllegalArgumentException.class, () -> new RetryAfterException(Duration.ofSeconds(-1)));
  }

  @Test
  void rejectsNullDelay() {
    assertThrows(NullPointerException.class, () -> new RetryAfterException(null));
  }
}
