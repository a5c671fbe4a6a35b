package ca.gc.cra.assay.application;

import ca.gc.cra.assay.api.Asserter;
import ca.gc.cra.assay.api.ThrowingRunnable;
import ca.gc.cra.assay.application.port.ClockPort;
import ca.gc.cra.assay.application.port.TestHandle;
import ca.gc.cra.assay.domain.compare.EqualityEngine;
import ca.gc.cra.assay.domain.compare.ValueClassifier;
import ca.gc.cra.assay.domain.format.ValueFormatter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Immutable assertion context: test handle, strictness, failure message and the
 * operation set evaluated against it.
 * <p><strong>Why:</strong> Derived contexts (extra message, other strictness, other separator) must never
 * alter a context a caller is still using, including one shared between nested tests.</p>
 * <p><strong>Role:</strong> Application service implementing {@link Asserter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return a fully independent copy from every configuration method.</li>
 *   <li>Evaluate checks through {@link ValueClassifier} and {@link EqualityEngine}.</li>
 *   <li>Route failures to the {@link ca.gc.cra.assay.application.port.FailureReporter} of its
 *   {@link AssertionEnvironment}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Configuration state is immutable. The failure flag of a lax scope is
 * shared by the contexts derived inside that scope and is meant for the asserting thread only.</p>
 *
 * @since 0.1.0
 */
public final class AssertionContext implements Asserter {
  private static final Logger log = LoggerFactory.getLogger(AssertionContext.class);

  private final TestHandle handle;
  private final boolean strict;
  private final String messageTemplate;
  private final List<Object> messageArgs;
  private final String separator;
  private final ScopeTracker scope;
  private final AssertionEnvironment environment;

  private AssertionContext(
      TestHandle handle,
      boolean strict,
      String messageTemplate,
      List<Object> messageArgs,
      String separator,
      ScopeTracker scope,
      AssertionEnvironment environment) {
    this.handle = handle;
    this.strict = strict;
    this.messageTemplate = messageTemplate;
    this.messageArgs = messageArgs;
    this.separator = separator;
    this.scope = scope;
    this.environment = environment;
  }

  /**
   * Creates a strict context without message.
   *
   * @param handle test handle receiving failures
   * @param environment collaborators
   * @return new root context
   * @throws NullPointerException if {@code handle} or {@code environment} is {@code null}
   */
  public static AssertionContext root(TestHandle handle, AssertionEnvironment environment) {
    Objects.requireNonNull(handle, "handle must not be null; provide the test handle of the running test");
    Objects.requireNonNull(environment, "environment");
    return new AssertionContext(handle, true, "", List.of(), null, new ScopeTracker(), environment);
  }

  // --- state ---

  @Override
  public TestHandle handle() {
    return handle;
  }

  @Override
  public boolean isStrict() {
    return strict;
  }

  @Override
  public String messageTemplate() {
    return messageTemplate;
  }

  @Override
  public List<Object> messageArgs() {
    return messageArgs;
  }

  /** Returns {@code true} when a failure message is bound. */
  public boolean hasMessage() {
    return !messageTemplate.isEmpty();
  }

  /** Returns the effective message separator. */
  public String separator() {
    return separator != null ? separator : environment.config().messageSeparator();
  }

  /** Returns the collaborators of this context. */
  public AssertionEnvironment environment() {
    return environment;
  }

  /** Returns {@code true} once a check on this context, or one derived in the same scope, failed. */
  public boolean failed() {
    return scope.failed();
  }

  /**
   * Records a failure on this context's scope. Invoked by failure reporters before the handle is notified.
   */
  public void markFailed() {
    scope.recordFailure();
  }

  // --- configuration ---

  @Override
  public AssertionContext withHandle(TestHandle replacement) {
    Objects.requireNonNull(replacement, "handle");
    return new AssertionContext(
        replacement, strict, messageTemplate, messageArgs, separator, new ScopeTracker(), environment);
  }

  @Override
  public AssertionContext msg(String format, Object... args) {
    Objects.requireNonNull(format, "format");
    return new AssertionContext(handle, strict, format, copyOf(args), separator, scope, environment);
  }

  @Override
  public AssertionContext addMsg(String format, Object... args) {
    if (!hasMessage()) {
      return msg(format, args);
    }
    Objects.requireNonNull(format, "format");
    List<Object> combined = new ArrayList<>(messageArgs);
    combined.addAll(copyOf(args));
    return new AssertionContext(handle, strict, messageTemplate + separator() + format,
        Collections.unmodifiableList(combined), separator, scope, environment);
  }

  @Override
  public AssertionContext prependMsg(String format, Object... args) {
    if (!hasMessage()) {
      return msg(format, args);
    }
    Objects.requireNonNull(format, "format");
    List<Object> combined = new ArrayList<>(copyOf(args));
    combined.addAll(messageArgs);
    return new AssertionContext(handle, strict, format + separator() + messageTemplate,
        Collections.unmodifiableList(combined), separator, scope, environment);
  }

  @Override
  public AssertionContext msgSep(String replacement) {
    Objects.requireNonNull(replacement, "separator");
    String effective = replacement.isEmpty() ? null : replacement;
    return new AssertionContext(handle, strict, messageTemplate, messageArgs, effective, scope, environment);
  }

  @Override
  public AssertionContext lax() {
    return withStrictness(false);
  }

  @Override
  public AssertionContext strict() {
    return withStrictness(true);
  }

  @Override
  public AssertionContext withStrictness(boolean strictness) {
    return new AssertionContext(handle, strictness, messageTemplate, messageArgs, separator, scope, environment);
  }

  /**
   * Returns a copy using another environment, e.g. a recording failure policy or a manual clock.
   *
   * @param replacement collaborators
   * @return new context
   */
  public AssertionContext withEnvironment(AssertionEnvironment replacement) {
    Objects.requireNonNull(replacement, "environment");
    return new AssertionContext(handle, strict, messageTemplate, messageArgs, separator, scope, replacement);
  }

  @Override
  public boolean lax(Consumer<Asserter> body) {
    Objects.requireNonNull(body, "scope");
    AssertionContext child = new AssertionContext(
        handle, false, messageTemplate, messageArgs, separator, new ScopeTracker(), environment);
    body.accept(child);
    if (child.failed()) {
      report("at least one assertion in the lax scope failed (%d failures)", child.scope.failures());
      return false;
    }
    return true;
  }

  // --- checks ---

  @Override
  public boolean equal(Object actual, Object expected) {
    handle.helper();
    if (EqualityEngine.isEqual(actual, expected)) {
      return true;
    }
    String diff = environment.config().diffEnabled()
        ? environment.diffGenerator().diff(actual, expected)
        : "";
    report("actual value '%s' (%s) should be equal to expected value '%s' (%s)%s",
        render(actual), ValueFormatter.typeName(actual),
        render(expected), ValueFormatter.typeName(expected),
        diff);
    return false;
  }

  @Override
  public boolean notEqual(Object actual, Object expected) {
    handle.helper();
    if (!EqualityEngine.isEqual(actual, expected)) {
      return true;
    }
    report("actual value '%s' (%s) should not be equal to expected value '%s' (%s)",
        render(actual), ValueFormatter.typeName(actual),
        render(expected), ValueFormatter.typeName(expected));
    return false;
  }

  @Override
  public boolean oneOf(Object value, Object... candidates) {
    handle.helper();
    List<Object> options = copyOf(candidates);
    if (anyEqual(value, options)) {
      return true;
    }
    report("expected object '%s' to be equal to one of '%s', but got: %s and %s",
        ValueFormatter.typeName(value), ValueFormatter.typeNames(options), render(value), render(options));
    return false;
  }

  @Override
  public boolean notOneOf(Object value, Object... candidates) {
    handle.helper();
    List<Object> options = copyOf(candidates);
    if (!anyEqual(value, options)) {
      return true;
    }
    report("expected object '%s' not to be equal to one of '%s', but got: %s and %s",
        ValueFormatter.typeName(value), ValueFormatter.typeNames(options), render(value), render(options));
    return false;
  }

  @Override
  public boolean contains(Object container, Object item) {
    handle.helper();
    if (ValueClassifier.isTextKind(container) && ValueClassifier.isTextKind(item)) {
      if (container.toString().contains(item.toString())) {
        return true;
      }
      report("'%s' expected to contain '%s'", render(container), render(item));
      return false;
    }
    if (ValueClassifier.isSequenceKind(container)) {
      if (anyEqual(item, ValueClassifier.elements(container))) {
        return true;
      }
      report("'%s' expected to contain '%s'", render(container), render(item));
      return false;
    }
    report("unexpected argument types %s and %s",
        ValueFormatter.typeName(container), ValueFormatter.typeName(item));
    return false;
  }

  @Override
  public boolean err(Throwable error) {
    handle.helper();
    if (error != null) {
      return true;
    }
    report("expected error");
    return false;
  }

  @Override
  public boolean errMsg(Throwable error, String expectedMessage) {
    handle.helper();
    if (error == null) {
      report("expected error '%s'", expectedMessage);
      return false;
    }
    return equal(error.getMessage(), expectedMessage);
  }

  @Override
  public boolean notErr(Throwable error) {
    handle.helper();
    if (error == null) {
      return true;
    }
    report("expected no error, but got: %s", render(error));
    return false;
  }

  @Override
  public boolean nil(Object value) {
    handle.helper();
    if (ValueClassifier.isNilLike(value)) {
      return true;
    }
    report("expected object '%s' to be nil, but got: %s", ValueFormatter.typeName(value), render(value));
    return false;
  }

  @Override
  public boolean notNil(Object value) {
    handle.helper();
    if (!ValueClassifier.isNilLike(value)) {
      return true;
    }
    report("expected object '%s' not to be nil", ValueFormatter.typeName(value));
    return false;
  }

  @Override
  public boolean isTrue(boolean condition) {
    handle.helper();
    if (condition) {
      return true;
    }
    report("expected boolean to be true");
    return false;
  }

  @Override
  public boolean isFalse(boolean condition) {
    handle.helper();
    if (!condition) {
      return true;
    }
    report("expected boolean to be false");
    return false;
  }

  @Override
  public boolean zero(Object value) {
    handle.helper();
    if (ValueClassifier.isZeroValue(value)) {
      return true;
    }
    report("expected object '%s' to be zero value, but it was: %s", ValueFormatter.typeName(value), render(value));
    return false;
  }

  @Override
  public boolean notZero(Object value) {
    handle.helper();
    if (!ValueClassifier.isZeroValue(value)) {
      return true;
    }
    report("expected object '%s' not to be zero value", ValueFormatter.typeName(value));
    return false;
  }

  @Override
  public boolean len(Object value, int length) {
    handle.helper();
    if (!ValueClassifier.isSequenceKind(value) && !ValueClassifier.isMappingKind(value)) {
      report("expected object '%s' to be of length '%d', but the object is not one of array, collection or map",
          ValueFormatter.typeName(value), length);
      return false;
    }
    int actualLength = ValueClassifier.length(value);
    if (actualLength == length) {
      return true;
    }
    report("expected object '%s' to be of length '%d' but it was: %d",
        ValueFormatter.typeName(value), length, actualLength);
    return false;
  }

  @Override
  public boolean shouldPanic(ThrowingRunnable callback) {
    handle.helper();
    Objects.requireNonNull(callback, "callback");
    try {
      callback.run();
    } catch (AssertionError failure) {
      // a failed check inside the callback fails the test, it is not the expected throw
      throw failure;
    } catch (Throwable thrown) {
      if (thrown instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      log.debug("Callback threw as expected: {}", thrown.toString());
      return true;
    }
    report("expected function to panic");
    return false;
  }

  @Override
  public boolean equalType(Object expected, Object actual) {
    handle.helper();
    if (runtimeType(expected) == runtimeType(actual)) {
      return true;
    }
    report("expected objects '%s' to be of the same type as object '%s'",
        ValueFormatter.typeName(expected), ValueFormatter.typeName(actual));
    return false;
  }

  @Override
  public boolean isType(Class<?> expectedType, Object actual) {
    handle.helper();
    if (expectedType == runtimeType(actual)) {
      return true;
    }
    report("expected object '%s' to be of type '%s'",
        ValueFormatter.typeName(actual), expectedType == null ? ValueFormatter.NULL_TYPE : expectedType.getTypeName());
    return false;
  }

  @Override
  public boolean waitForTrue(Duration timeout, BooleanSupplier predicate) {
    handle.helper();
    Objects.requireNonNull(timeout, "timeout");
    Objects.requireNonNull(predicate, "predicate");
    ClockPort clock = environment.clock();
    long timeoutNanos = saturatedNanos(timeout);
    long start = clock.nowNanos();
    while (true) {
      if (predicate.getAsBoolean()) {
        return true;
      }
      long elapsed = clock.nowNanos() - start;
      if (elapsed >= timeoutNanos) {
        report("function did not return true within the timeout of %s (elapsed %s)",
            timeout, Duration.ofNanos(elapsed));
        return false;
      }
      Duration pause = environment.config().pollInterval();
      Duration remaining = Duration.ofNanos(timeoutNanos - elapsed);
      try {
        clock.sleep(pause.compareTo(remaining) < 0 ? pause : remaining);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        report("interrupted after %s while waiting for function to return true",
            Duration.ofNanos(clock.nowNanos() - start));
        return false;
      }
    }
  }

  @Override
  public void fail(String message) {
    handle.helper();
    report("%s", message);
  }

  @Override
  public String toString() {
    return "AssertionContext{strict=" + strict
        + ", message='" + messageTemplate + "'"
        + ", args=" + messageArgs
        + ", separator='" + separator() + "'}";
  }

  // --- internals ---

  private void report(String format, Object... args) {
    environment.reporter().report(this, format, args);
  }

  private String render(Object value) {
    return environment.formatter().render(value);
  }

  private static boolean anyEqual(Object value, List<Object> candidates) {
    for (Object candidate : candidates) {
      if (EqualityEngine.isEqual(value, candidate)) {
        return true;
      }
    }
    return false;
  }

  private static Class<?> runtimeType(Object value) {
    return value == null ? null : value.getClass();
  }

  private static long saturatedNanos(Duration duration) {
    if (duration.isNegative()) {
      return 0L;
    }
    try {
      return duration.toNanos();
    } catch (ArithmeticException ex) {
      return Long.MAX_VALUE;
    }
  }

  private static List<Object> copyOf(Object[] values) {
    if (values == null || values.length == 0) {
      return List.of();
    }
    return Collections.unmodifiableList(new ArrayList<>(Arrays.asList(values)));
  }
}
