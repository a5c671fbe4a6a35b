package ca.gc.cra.assay.infrastructure.junit;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.assay.api.Assay;
import ca.gc.cra.assay.api.Asserter;
import ca.gc.cra.assay.domain.FailureEvent;
import ca.gc.cra.assay.domain.Severity;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.opentest4j.AssertionFailedError;
import org.opentest4j.MultipleFailuresError;

class JUnitTestHandleTest {

  private final JUnitTestHandle handle = new JUnitTestHandle("sample");

  @Test
  void fatalThrowsAssertionFailedError() {
    AssertionFailedError error = assertThrows(AssertionFailedError.class,
        () -> handle.fatal(new FailureEvent("bad %s", List.of("value"), Severity.FATAL)));

    assertEquals("bad value", error.getMessage());
    assertFalse(handle.failed());
  }

  @Test
  void helperFramesAreRemovedFromStackTrace() {
    Asserter assay = Assay.of(handle);

    AssertionFailedError error = assertThrows(AssertionFailedError.class, () -> assay.equal(1, 2));

    assertTrue(Arrays.stream(error.getStackTrace())
        .noneMatch(frame -> frame.getClassName().startsWith("ca.gc.cra.assay.application.")));
    assertTrue(Arrays.stream(error.getStackTrace())
        .anyMatch(frame -> frame.getClassName().equals(JUnitTestHandleTest.class.getName())));
  }

  @Test
  void strictFailureInsideShouldPanicStillFailsTheTest() {
    Asserter assay = Assay.of(handle);

    AssertionFailedError error = assertThrows(AssertionFailedError.class,
        () -> assay.shouldPanic(() -> assay.equal(1, 2)));

    assertTrue(error.getMessage().startsWith("actual value '1'"));
  }

  @Test
  void laxFailureInsideShouldPanicIsVerified() {
    Asserter lax = Assay.of(handle).lax();

    lax.shouldPanic(() -> {
      lax.equal(1, 2);
      throw new IllegalStateException("expected");
    });

    assertEquals(1, handle.errors().size());
    assertThrows(AssertionFailedError.class, handle::verify);
  }

  @Test
  void verifyWithoutErrorsPasses() {
    assertDoesNotThrow(handle::verify);
  }

  @Test
  void verifyRaisesSingleError() {
    Assay.of(handle).lax().isTrue(false);

    assertTrue(handle.failed());
    AssertionFailedError error = assertThrows(AssertionFailedError.class, handle::verify);
    assertEquals("expected boolean to be true", error.getMessage());
  }

  @Test
  void verifyAggregatesSeveralErrors() {
    Asserter lax = Assay.of(handle).lax();
    lax.isTrue(false);
    lax.nil(1);

    MultipleFailuresError error = assertThrows(MultipleFailuresError.class, handle::verify);
    assertEquals(2, error.getFailures().size());
    assertEquals(2, handle.errors().size());
  }
}
