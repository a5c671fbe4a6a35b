package ca.gc.cra.assay.infrastructure.junit;

import ca.gc.cra.assay.application.port.TestHandle;
import ca.gc.cra.assay.domain.FailureEvent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.opentest4j.AssertionFailedError;
import org.opentest4j.MultipleFailuresError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link TestHandle} adapter for JUnit Jupiter.
 * <p><strong>Why:</strong> JUnit has no notion of a non-fatal failure, so recorded errors are kept until
 * {@link #verify()} raises them at the end of the test.</p>
 * <p><strong>Role:</strong> Adapter on the runner side of the {@link TestHandle} port; created per test by
 * {@link AssayExtension} or directly by the test.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Throw {@link AssertionFailedError} for fatal failures, stripped of helper frames.</li>
 *   <li>Log and collect non-fatal failures.</li>
 *   <li>Raise collected failures as one error from {@link #verify()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent reporters; failures keep arrival order.</p>
 *
 * @since 0.1.0
 */
public final class JUnitTestHandle implements TestHandle {
  private static final Logger log = LoggerFactory.getLogger(JUnitTestHandle.class);
  private static final StackWalker WALKER =
      StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

  private final String testName;
  private final Set<String> helperClasses = ConcurrentHashMap.newKeySet();
  private final List<AssertionFailedError> errors = new CopyOnWriteArrayList<>();

  /**
   * Creates a handle for one test.
   *
   * @param testName name used in log lines and in the aggregated failure heading
   */
  public JUnitTestHandle(String testName) {
    this.testName = Objects.requireNonNull(testName, "testName");
  }

  /** Returns the test name this handle reports for. */
  public String testName() {
    return testName;
  }

  @Override
  public void helper() {
    helperClasses.add(WALKER.getCallerClass().getName());
  }

  @Override
  public void fatal(FailureEvent event) {
    throw toError(event);
  }

  @Override
  public void error(FailureEvent event) {
    AssertionFailedError error = toError(event);
    errors.add(error);
    log.warn("{}: {}", testName, error.getMessage());
  }

  /** Returns the failures recorded through {@link #error(FailureEvent)} so far. */
  public List<AssertionFailedError> errors() {
    return List.copyOf(errors);
  }

  /** Returns {@code true} when at least one non-fatal failure was recorded. */
  public boolean failed() {
    return !errors.isEmpty();
  }

  /**
   * Raises the recorded non-fatal failures, if any.
   *
   * @throws AssertionFailedError when exactly one failure was recorded
   * @throws MultipleFailuresError when several failures were recorded
   */
  public void verify() {
    List<AssertionFailedError> snapshot = new ArrayList<>(errors);
    if (snapshot.isEmpty()) {
      return;
    }
    if (snapshot.size() == 1) {
      throw snapshot.get(0);
    }
    throw new MultipleFailuresError(testName, new ArrayList<>(snapshot));
  }

  private AssertionFailedError toError(FailureEvent event) {
    AssertionFailedError error = new AssertionFailedError(event.message());
    StackTraceElement[] trace = error.getStackTrace();
    StackTraceElement[] filtered = Arrays.stream(trace)
        .filter(frame -> !isInternal(frame))
        .toArray(StackTraceElement[]::new);
    if (filtered.length > 0) {
      error.setStackTrace(filtered);
    }
    return error;
  }

  private boolean isInternal(StackTraceElement frame) {
    String className = frame.getClassName();
    return className.equals(JUnitTestHandle.class.getName()) || helperClasses.contains(className);
  }
}
