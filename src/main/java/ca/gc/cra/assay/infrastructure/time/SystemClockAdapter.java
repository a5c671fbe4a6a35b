package ca.gc.cra.assay.infrastructure.time;

import ca.gc.cra.assay.application.port.ClockPort;
import java.time.Duration;

/**
 * {@link ClockPort} implementation backed by {@link System#nanoTime()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  /** Shared instance; the adapter holds no state. */
  public static final SystemClockAdapter INSTANCE = new SystemClockAdapter();

  /** Creates a system clock adapter. */
  public SystemClockAdapter() {}

  @Override
  public long nowNanos() {
    return System.nanoTime();
  }

  @Override
  public void sleep(Duration duration) throws InterruptedException {
    if (duration.isNegative() || duration.isZero()) {
      return;
    }
    long nanos = duration.toNanos();
    Thread.sleep(nanos / 1_000_000L, (int) (nanos % 1_000_000L));
  }
}
