package ca.gc.cra.assay.application;

import ca.gc.cra.assay.application.port.ClockPort;
import ca.gc.cra.assay.application.port.FailureReporter;
import ca.gc.cra.assay.config.AssayConfig;
import ca.gc.cra.assay.domain.diff.DiffGenerator;
import ca.gc.cra.assay.domain.format.ValueFormatter;
import ca.gc.cra.assay.infrastructure.time.SystemClockAdapter;
import java.util.Objects;

/**
 * Collaborators shared, unchanged, by a root context and everything derived from it.
 *
 * @param config library defaults
 * @param reporter failure policy invoked by every failed check
 * @param clock time source of polling assertions
 * @param formatter renders operands in failure messages
 * @param diffGenerator produces diff suffixes for {@code equal} failures
 * @since 0.1.0
 */
public record AssertionEnvironment(
    AssayConfig config,
    FailureReporter reporter,
    ClockPort clock,
    ValueFormatter formatter,
    DiffGenerator diffGenerator) {

  /**
   * Validates that every collaborator is present.
   *
   * @throws NullPointerException if a component is {@code null}
   */
  public AssertionEnvironment {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(reporter, "reporter");
    Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(formatter, "formatter");
    Objects.requireNonNull(diffGenerator, "diffGenerator");
  }

  /**
   * Returns the production environment for {@code config}: default failure policy, system clock.
   *
   * @param config library defaults
   * @return environment
   */
  public static AssertionEnvironment standard(AssayConfig config) {
    return new AssertionEnvironment(
        config,
        DefaultFailureReporter.INSTANCE,
        SystemClockAdapter.INSTANCE,
        new ValueFormatter(config.maxValueLength()),
        new DiffGenerator());
  }

  /** Returns a copy using {@code replacement} as failure policy. */
  public AssertionEnvironment withReporter(FailureReporter replacement) {
    return new AssertionEnvironment(config, replacement, clock, formatter, diffGenerator);
  }

  /** Returns a copy using {@code replacement} as time source. */
  public AssertionEnvironment withClock(ClockPort replacement) {
    return new AssertionEnvironment(config, reporter, replacement, formatter, diffGenerator);
  }
}
