package ca.gc.cra.assay.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.assay.application.port.ClockPort;
import ca.gc.cra.assay.config.AssayConfig;
import ca.gc.cra.assay.testutil.ManualClock;
import ca.gc.cra.assay.testutil.RecordingTestHandle;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class WaitForTrueTest {

  private final RecordingTestHandle handle = new RecordingTestHandle();
  private final ManualClock clock = new ManualClock();

  @Test
  void pollsAtConfiguredIntervalAndCapsLastSleep() {
    AtomicInteger calls = new AtomicInteger();

    assertFalse(context(clock).waitForTrue(Duration.ofMillis(250), () -> {
      calls.incrementAndGet();
      return false;
    }));

    assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(100), Duration.ofMillis(50)), clock.sleeps());
    assertEquals(4, calls.get());
    assertEquals("function did not return true within the timeout of PT0.25S (elapsed PT0.25S)",
        handle.only().message());
  }

  @Test
  void returnsOnceThePredicateHolds() {
    AtomicInteger calls = new AtomicInteger();

    assertTrue(context(clock).waitForTrue(Duration.ofSeconds(1), () -> calls.incrementAndGet() == 3));

    assertEquals(2, clock.sleeps().size());
    assertTrue(handle.events().isEmpty());
  }

  @Test
  void predicateRunsOnceEvenWithZeroTimeout() {
    AtomicInteger calls = new AtomicInteger();

    assertFalse(context(clock).waitForTrue(Duration.ZERO, () -> {
      calls.incrementAndGet();
      return false;
    }));

    assertEquals(1, calls.get());
    assertTrue(clock.sleeps().isEmpty());
  }

  @Test
  void interruptionFailsTheCheckAndKeepsTheFlag() {
    ClockPort interrupting = new ClockPort() {
      @Override
      public long nowNanos() {
        return 0L;
      }

      @Override
      public void sleep(Duration duration) throws InterruptedException {
        throw new InterruptedException("test");
      }
    };

    assertFalse(context(interrupting).waitForTrue(Duration.ofSeconds(1), () -> false));

    assertTrue(Thread.interrupted());
    assertTrue(handle.only().message().startsWith("interrupted after"));
  }

  private AssertionContext context(ClockPort source) {
    AssertionEnvironment environment = AssertionEnvironment.standard(AssayConfig.defaults()).withClock(source);
    return AssertionContext.root(handle, environment).lax();
  }
}
