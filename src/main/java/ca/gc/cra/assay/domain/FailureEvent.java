package ca.gc.cra.assay.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IllegalFormatException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A single failed check handed to the test handle.
 *
 * @param format {@link java.util.Formatter} pattern including any bound context message
 * @param args positional arguments for {@code format}; may contain {@code null} elements
 * @param severity whether the handle must abort the test
 * @since 0.1.0
 */
public record FailureEvent(String format, List<Object> args, Severity severity) {
  private static final Logger log = LoggerFactory.getLogger(FailureEvent.class);

  /**
   * Creates an event, copying {@code args} into an unmodifiable list.
   *
   * @throws NullPointerException if {@code format} or {@code severity} is {@code null}
   */
  public FailureEvent {
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(severity, "severity");
    args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
  }

  /** Returns {@code true} when the event aborts the test. */
  public boolean fatal() {
    return severity == Severity.FATAL;
  }

  /**
   * Renders the message. A format that does not match its arguments is rendered verbatim followed by the
   * argument list instead of throwing.
   *
   * @return human readable failure message
   */
  public String message() {
    try {
      return String.format(format, args.toArray());
    } catch (IllegalFormatException ex) {
      log.warn("Failure format '{}' does not match its arguments: {}", format, ex.getMessage());
      return format + " " + args;
    }
  }
}
