package ca.gc.cra.assay.api;

import ca.gc.cra.assay.application.port.TestHandle;
import java.time.Duration;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * <strong>What:</strong> Fluent assertions bound to a host test handle.
 * <p><strong>Why:</strong> Replaces manual {@code if (...) fail(...)} branching with intention-revealing checks
 * that compare loosely typed values and compose failure messages.</p>
 * <p><strong>Role:</strong> Public surface of the library; obtain instances through {@link Assay}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Configuration methods ({@code msg}, {@code addMsg}, {@code prependMsg}, {@code msgSep}, {@code lax},
 *   {@code strict}, {@code withHandle}) return a new asserter; the receiver never changes.</li>
 *   <li>Checks return {@code true} on success. On failure they report through the failure policy: a strict
 *   asserter aborts the test, a lax asserter records the failure and returns {@code false}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Instances are immutable and may be shared; checks run on the caller's
 * thread and the handle decides how concurrent reports interleave.</p>
 *
 * <p>Equality-based checks do not respect type differences: when the types differ but the right operand can be
 * converted to the left operand's type (for example {@code Long} to {@code Integer}), the values are compared
 * as though they had the same type.
 *
 * @since 0.1.0
 */
public interface Asserter {

  /** Returns the test handle failures are reported to. */
  TestHandle handle();

  /**
   * Returns a copy reporting to {@code handle}; useful inside nested tests.
   *
   * @param handle replacement handle; must not be {@code null}
   * @return new asserter
   */
  Asserter withHandle(TestHandle handle);

  /**
   * Returns a copy whose failures carry the given message, replacing any previous message.
   *
   * @param format {@link java.util.Formatter} pattern
   * @param args pattern arguments
   * @return new asserter
   */
  Asserter msg(String format, Object... args);

  /**
   * Returns a copy whose message is the current message, the separator and {@code format}, with
   * {@code args} appended after the current arguments. Without a current message this behaves like
   * {@link #msg(String, Object...)}.
   *
   * <p>Useful for a default message refined per check:
   * <pre>{@code
   * Asserter assay = Assay.of(handle).msg("User ID: %d", user.id());
   * assay.addMsg("Raw response: %s", body).equal(response.status(), 201);
   * }</pre>
   *
   * @param format pattern appended to the current message
   * @param args arguments appended to the current arguments
   * @return new asserter
   */
  Asserter addMsg(String format, Object... args);

  /**
   * Like {@link #addMsg(String, Object...)}, but places {@code format} and {@code args} before the current
   * message and arguments.
   *
   * @param format pattern prepended to the current message
   * @param args arguments prepended to the current arguments
   * @return new asserter
   */
  Asserter prependMsg(String format, Object... args);

  /**
   * Returns a copy using {@code separator} between message parts instead of the configured default
   * ({@code " - "} unless configured otherwise). An empty separator restores the configured default.
   *
   * @param separator non-null separator
   * @return new asserter
   */
  Asserter msgSep(String separator);

  /** Returns a copy whose failures are reported without aborting the test. */
  Asserter lax();

  /** Returns a copy whose failures abort the test. This is the default. */
  Asserter strict();

  /**
   * Returns a copy with the given strictness.
   *
   * @param strict {@code true} to abort on failure
   * @return new asserter
   */
  Asserter withStrictness(boolean strict);

  /**
   * Runs {@code scope} with a lax asserter. Failed checks inside the scope do not abort the test; once the
   * scope returns, a single failure is reported on this asserter if any of them failed.
   *
   * <p>Useful to check many fields of a value and see every mismatch in one run.
   *
   * @param scope callback receiving the lax asserter
   * @return {@code true} when every check inside the scope passed
   */
  boolean lax(Consumer<Asserter> scope);

  /** Returns the message template, empty when none is bound. */
  String messageTemplate();

  /** Returns the message arguments in order. */
  List<Object> messageArgs();

  /** Returns {@code true} when failures abort the test. */
  boolean isStrict();

  /**
   * Performs a deep comparison and fails if the values are not equal. Failures on two collections or two
   * maps carry a structural diff.
   *
   * @param actual observed value
   * @param expected expected value
   * @return {@code true} when equal
   */
  boolean equal(Object actual, Object expected);

  /**
   * Performs a deep comparison and fails if the values are equal.
   *
   * @param actual observed value
   * @param expected value {@code actual} must differ from
   * @return {@code true} when not equal
   */
  boolean notEqual(Object actual, Object expected);

  /**
   * Fails unless {@code value} equals one of {@code candidates}; the first match wins.
   *
   * @param value observed value
   * @param candidates accepted values
   * @return {@code true} when a candidate matched
   */
  boolean oneOf(Object value, Object... candidates);

  /**
   * Fails if {@code value} equals any of {@code candidates}.
   *
   * @param value observed value
   * @param candidates rejected values
   * @return {@code true} when no candidate matched
   */
  boolean notOneOf(Object value, Object... candidates);

  /**
   * Fails unless {@code container} contains {@code item}: a substring check when both are text, element
   * membership when {@code container} is an array or collection. Other operand kinds fail as a type error.
   *
   * @param container text, array or collection
   * @param item substring or element
   * @return {@code true} when contained
   */
  boolean contains(Object container, Object item);

  /** Fails unless an error is present. */
  boolean err(Throwable error);

  /**
   * Fails unless an error is present and its message equals {@code expectedMessage}.
   *
   * @param error observed error
   * @param expectedMessage expected {@link Throwable#getMessage()}
   * @return {@code true} when the message matches
   */
  boolean errMsg(Throwable error, String expectedMessage);

  /** Fails if an error is present. */
  boolean notErr(Throwable error);

  /** Fails unless {@code value} is absent ({@code null} or an empty optional). */
  boolean nil(Object value);

  /** Fails if {@code value} is absent. */
  boolean notNil(Object value);

  /** Fails unless {@code condition} is {@code true}. */
  boolean isTrue(boolean condition);

  /** Fails unless {@code condition} is {@code false}. */
  boolean isFalse(boolean condition);

  /**
   * Fails unless {@code value} is the zero value of its type: absent, empty text, array, collection or map,
   * {@code 0}, {@code false}, or an object whose fields all hold their defaults.
   *
   * @param value observed value
   * @return {@code true} when zero
   */
  boolean zero(Object value);

  /** Fails if {@code value} is the zero value of its type. */
  boolean notZero(Object value);

  /**
   * Fails unless {@code value} is an array, collection or map with {@code length} elements. A value of any
   * other kind fails as a type error.
   *
   * @param value observed container
   * @param length expected element count
   * @return {@code true} when the length matches
   */
  boolean len(Object value, int length);

  /**
   * Fails unless {@code callback} throws. Any throwable satisfies the check except an {@link AssertionError}:
   * that is the host runner's failure signal (for example a strict check failing inside the callback) and is
   * rethrown so the test still fails.
   *
   * @param callback code expected to throw
   * @return {@code true} when the callback threw
   * @throws AssertionError when the callback failed an assertion
   */
  boolean shouldPanic(ThrowingRunnable callback);

  /**
   * Fails unless both values have the same runtime type. Values are not compared.
   *
   * @param expected value of the expected type
   * @param actual observed value
   * @return {@code true} when the runtime types match
   */
  boolean equalType(Object expected, Object actual);

  /**
   * Fails unless the runtime type of {@code actual} is exactly {@code expectedType}.
   *
   * @param expectedType expected runtime class; {@code null} only matches an absent value
   * @param actual observed value
   * @return {@code true} when the runtime type matches
   */
  boolean isType(Class<?> expectedType, Object actual);

  /**
   * Evaluates {@code predicate} until it returns {@code true}, pausing between attempts. Fails when
   * {@code timeout} elapses first. The predicate runs at least once.
   *
   * @param timeout maximum time to wait
   * @param predicate condition to wait for
   * @return {@code true} when the predicate returned {@code true} in time
   */
  boolean waitForTrue(Duration timeout, BooleanSupplier predicate);

  /**
   * Fails unconditionally.
   *
   * @param message failure message, printed verbatim
   */
  void fail(String message);
}
