package ca.gc.cra.assay.application;

import ca.gc.cra.assay.application.port.FailureReporter;
import ca.gc.cra.assay.application.port.TestHandle;
import ca.gc.cra.assay.domain.FailureEvent;
import ca.gc.cra.assay.domain.Severity;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * <strong>What:</strong> Failure policy used by every production context.
 * <p><strong>Role:</strong> Default {@link FailureReporter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Mark the context's scope as failed.</li>
 *   <li>Append the context's bound message to the check's format, joined by the separator, and append its
 *   arguments after the check's arguments.</li>
 *   <li>Hand the event to the test handle: {@code fatal} for strict contexts, {@code error} for lax ones.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class DefaultFailureReporter implements FailureReporter {
  /** Shared instance. */
  public static final DefaultFailureReporter INSTANCE = new DefaultFailureReporter();

  private DefaultFailureReporter() {}

  @Override
  public void report(AssertionContext context, String format, Object... args) {
    TestHandle handle = context.handle();
    handle.helper();
    context.markFailed();
    FailureEvent event = compose(context, format, args);
    if (event.fatal()) {
      handle.fatal(event);
    } else {
      handle.error(event);
    }
  }

  /**
   * Builds the event a failed check on {@code context} produces.
   *
   * @param context context of the failed check
   * @param format check-specific format
   * @param args check-specific arguments
   * @return event carrying the combined format, arguments and severity
   */
  public static FailureEvent compose(AssertionContext context, String format, Object... args) {
    List<Object> combined = new ArrayList<>(args == null ? List.of() : Arrays.asList(args));
    String combinedFormat = format;
    if (context.hasMessage()) {
      combinedFormat = format + context.separator() + context.messageTemplate();
      combined.addAll(context.messageArgs());
    }
    Severity severity = context.isStrict() ? Severity.FATAL : Severity.NON_FATAL;
    return new FailureEvent(combinedFormat, combined, severity);
  }
}
