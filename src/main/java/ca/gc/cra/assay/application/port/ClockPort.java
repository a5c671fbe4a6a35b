package ca.gc.cra.assay.application.port;

import java.time.Duration;

/**
 * <strong>What:</strong> Port supplying monotonic time and sleeping to polling assertions.
 * <p><strong>Why:</strong> Lets tests of the polling loop run against a deterministic clock.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @implNote Default implementation delegates to {@link System#nanoTime()} and {@link Thread#sleep(long, int)}.
 * @since 0.1.0
 * @see ca.gc.cra.assay.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns a monotonic timestamp in nanoseconds; only differences between readings are meaningful.
   *
   * @return current monotonic reading
   */
  long nowNanos();

  /**
   * Suspends the calling thread.
   *
   * @param duration time to sleep; non-positive durations return immediately
   * @throws InterruptedException if the thread is interrupted while sleeping
   */
  void sleep(Duration duration) throws InterruptedException;
}
