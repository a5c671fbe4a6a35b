package ca.gc.cra.assay.api;

import ca.gc.cra.assay.application.AssertionContext;
import ca.gc.cra.assay.application.AssertionEnvironment;
import ca.gc.cra.assay.application.port.ClockPort;
import ca.gc.cra.assay.application.port.FailureReporter;
import ca.gc.cra.assay.application.port.TestHandle;
import ca.gc.cra.assay.config.AssayConfig;
import ca.gc.cra.assay.config.AssayConfigLoader;
import java.util.Objects;

/**
 * <strong>What:</strong> Entry point creating {@link Asserter} instances bound to a test handle.
 * <p><strong>Role:</strong> Composition root of the library.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve process defaults through {@link AssayConfigLoader} when no configuration is given.</li>
 *   <li>Wire the default failure policy and system clock unless the builder overrides them.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless factory.</p>
 *
 * <pre>{@code
 * Asserter assay = Assay.of(handle);
 * assay.equal(result.size(), 3);
 * assay.lax(lax -> {
 *   lax.equal(user.name(), "ada");
 *   lax.notZero(user.id());
 * });
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Assay {
  private Assay() {
    // Utility
  }

  /**
   * Creates a strict asserter using the process-wide configuration.
   *
   * @param handle handle of the running test; must not be {@code null}
   * @return new asserter
   * @throws NullPointerException if {@code handle} is {@code null}
   */
  public static Asserter of(TestHandle handle) {
    return builder(handle).build();
  }

  /**
   * Creates a strict asserter using {@code config}.
   *
   * @param handle handle of the running test; must not be {@code null}
   * @param config library defaults to apply
   * @return new asserter
   */
  public static Asserter of(TestHandle handle, AssayConfig config) {
    return builder(handle).config(config).build();
  }

  /**
   * Starts a builder for an asserter with custom collaborators.
   *
   * @param handle handle of the running test; must not be {@code null}
   * @return builder
   * @throws NullPointerException if {@code handle} is {@code null}
   */
  public static Builder builder(TestHandle handle) {
    return new Builder(Objects.requireNonNull(handle,
        "handle must not be null; provide the test handle of the running test"));
  }

  /** Builder for asserters with non-default collaborators. */
  public static final class Builder {
    private final TestHandle handle;
    private AssayConfig config;
    private FailureReporter reporter;
    private ClockPort clock;

    private Builder(TestHandle handle) {
      this.handle = handle;
    }

    /** Uses {@code value} instead of the process-wide configuration. */
    public Builder config(AssayConfig value) {
      this.config = Objects.requireNonNull(value, "config");
      return this;
    }

    /** Uses {@code value} as failure policy. */
    public Builder reporter(FailureReporter value) {
      this.reporter = Objects.requireNonNull(value, "reporter");
      return this;
    }

    /** Uses {@code value} as time source for polling checks. */
    public Builder clock(ClockPort value) {
      this.clock = Objects.requireNonNull(value, "clock");
      return this;
    }

    /**
     * Builds the asserter.
     *
     * @return strict asserter without message
     */
    public AssertionContext build() {
      AssayConfig effective = config != null ? config : AssayConfigLoader.processDefaults();
      AssertionEnvironment environment = AssertionEnvironment.standard(effective);
      if (reporter != null) {
        environment = environment.withReporter(reporter);
      }
      if (clock != null) {
        environment = environment.withClock(clock);
      }
      return AssertionContext.root(handle, environment);
    }
  }
}
