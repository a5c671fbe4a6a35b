package ca.gc.cra.assay.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.assay.api.Asserter;
import ca.gc.cra.assay.config.AssayConfig;
import ca.gc.cra.assay.domain.EqualityChecker;
import ca.gc.cra.assay.domain.FailureEvent;
import ca.gc.cra.assay.testutil.RecordingTestHandle;
import ca.gc.cra.assay.testutil.RecordingTestHandle.FatalAbort;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AssertionContextTest {

  private final RecordingTestHandle handle = new RecordingTestHandle();

  static final class Equaler implements EqualityChecker {
    boolean equal;
    boolean called;

    Equaler(boolean equal) {
      this.equal = equal;
    }

    @Override
    public boolean isEqual(Object other) {
      called = true;
      return other instanceof Equaler equaler && equal == equaler.equal;
    }
  }

  @Test
  void rootRequiresHandle() {
    NullPointerException ex = assertThrows(NullPointerException.class,
        () -> AssertionContext.root(null, AssertionEnvironment.standard(AssayConfig.defaults())));
    assertTrue(ex.getMessage().contains("handle must not be null"));
  }

  @Test
  void messagesChainWithSeparator() {
    AssertionContext assay = root();

    AssertionContext withMsg = assay.msg("something %s", "else");
    assertEquals("something %s", withMsg.messageTemplate());
    assertEquals(List.of("else"), withMsg.messageArgs());

    AssertionContext added = withMsg.addMsg("another %s %s", "couple", "things");
    assertEquals("something %s - another %s %s", added.messageTemplate());

    AssertionContext prepended = added.prependMsg("#%d message", 1);
    assertEquals("#%d message - something %s - another %s %s", prepended.messageTemplate());
    assertEquals(List.of(1, "else", "couple", "things"), prepended.messageArgs());
  }

  @Test
  void addAndPrependOnEmptyMessageBehaveLikeMsg() {
    assertEquals("something %s %s", root().addMsg("something %s %s", "new", "here").messageTemplate());
    AssertionContext prepended = root().prependMsg("something %s %s", "new", "here");
    assertEquals("something %s %s", prepended.messageTemplate());
    assertEquals(List.of("new", "here"), prepended.messageArgs());
  }

  @Test
  void customSeparator() {
    AssertionContext assay = root().msgSep(", ").addMsg("msg one").addMsg("msg two");
    assertEquals("msg one, msg two", assay.messageTemplate());
  }

  @Test
  void emptySeparatorRestoresTheDefault() {
    AssertionContext assay = root().msgSep(", ").msgSep("").addMsg("one").addMsg("two");

    assertEquals(" - ", assay.separator());
    assertEquals("one - two", assay.messageTemplate());
  }

  @Test
  void derivedContextsLeaveTheOriginalUntouched() {
    AssertionContext assay = root();
    AssertionContext derived = assay.msg("ctx %s", "a").lax().msgSep("|");

    assertNotSame(assay, derived);
    assertEquals("", assay.messageTemplate());
    assertTrue(assay.isStrict());
    assertEquals(" - ", assay.separator());
    assertFalse(derived.isStrict());
    assertTrue(derived.strict().isStrict());
  }

  @Test
  void passingChecksReportNothing() {
    AssertionContext assay = root();

    assertTrue(assay.equal(0, 0));
    assertTrue(assay.notEqual(1, 2));
    assertTrue(assay.nil(null));
    assertTrue(assay.notNil("x"));
    assertTrue(assay.zero(""));
    assertTrue(assay.notZero(3));
    assertTrue(assay.len(new int[] {1, 2}, 2));
    assertTrue(assay.err(new IllegalStateException()));
    assertTrue(assay.errMsg(new IllegalStateException("boom"), "boom"));
    assertTrue(assay.notErr(null));
    assertTrue(assay.equalType(1, 2));
    assertTrue(assay.isType(String.class, "s"));
    assertTrue(assay.shouldPanic(() -> {
      throw new IllegalStateException("expected");
    }));
    assertTrue(handle.events().isEmpty());
    assertTrue(handle.helperCalls() > 0);
  }

  @Test
  void strictFailureAbortsWithTypedMessage() {
    AssertionContext assay = root();

    assertThrows(FatalAbort.class, () -> assay.equal(0, 1));

    FailureEvent event = handle.only();
    assertTrue(event.fatal());
    assertEquals("actual value '0' (java.lang.Integer) should be equal to expected value '1' (java.lang.Integer)",
        event.message());
  }

  @Test
  void laxFailureContinues() {
    AssertionContext assay = root().lax();

    assertFalse(assay.equal(1, 2));
    assertTrue(assay.equal(2, 2));

    assertEquals(1, handle.events().size());
    assertFalse(handle.only().fatal());
    assertTrue(assay.failed());
  }

  @Test
  void everyFailingCheckReportsOnce() {
    Asserter assay = root().lax();

    assay.notEqual(1, 1);
    assay.err(null);
    assay.errMsg(new IllegalStateException("error 1"), "error 2");
    assay.notErr(new IllegalStateException("error"));
    assay.nil(new Object());
    assay.notNil(null);
    assay.isTrue(false);
    assay.isFalse(true);
    assay.zero(1);
    assay.notZero(0);
    assay.len(new int[0], 1);
    assay.len(null, 1);
    assay.shouldPanic(() -> {});

    assertEquals(13, handle.events().size());
  }

  @Test
  void boundMessageIsAppendedToFailures() {
    root().lax().msg("user %s", "ada").isTrue(false);

    assertEquals("expected boolean to be true - user ada", handle.only().message());
  }

  @Test
  void malformedMessageFallsBackToRawFormat() {
    root().lax().msg("count %d", "x").isTrue(false);

    assertTrue(handle.only().message().contains("count %d"));
  }

  @Test
  void failMessageIsNotAFormat() {
    root().lax().fail("100% broken");

    assertEquals("100% broken", handle.only().message());
  }

  @Test
  void oneOfAndNotOneOf() {
    Asserter assay = root().lax();

    assertTrue(assay.oneOf(2, 1, 2, 3));
    assertFalse(assay.oneOf(4, 1, 2, 3));
    assertFalse(assay.notOneOf(2, 1, 2, 3));
    assertTrue(assay.notOneOf(4, 1, 2, 3));

    assertEquals(2, handle.events().size());
    assertEquals("expected object 'java.lang.Integer' to be equal to one of "
        + "'java.lang.Integer,java.lang.Integer,java.lang.Integer', but got: 4 and [1, 2, 3]",
        handle.messages().get(0));
  }

  @Test
  void containsTextAndSequences() {
    Asserter assay = root().lax();

    assertTrue(assay.contains("hello", "ell"));
    assertTrue(assay.contains(List.of("hello", "world"), "hello"));
    assertTrue(assay.contains(new int[] {1, 2}, 2L));
    assertFalse(assay.contains("hello", "elf"));
    assertFalse(assay.contains(List.of("hello", "world"), "test"));

    assertEquals(List.of("'hello' expected to contain 'elf'", "'[hello, world]' expected to contain 'test'"),
        handle.messages());
  }

  @Test
  void containsRejectsUnsupportedTypes() {
    assertFalse(root().lax().contains(Map.of("a", 1), "a"));

    assertTrue(handle.only().message().startsWith("unexpected argument types java.util."));
  }

  @Test
  void lenMessages() {
    Asserter assay = root().lax();

    assay.len(new ArrayList<>(), 1);
    assay.len(5, 1);

    assertEquals(List.of(
        "expected object 'java.util.ArrayList' to be of length '1' but it was: 0",
        "expected object 'java.lang.Integer' to be of length '1', but the object is not one of array, "
            + "collection or map"), handle.messages());
  }

  @Test
  void equalAppendsDiffForSequences() {
    root().lax().equal(List.of(1, 2), List.of(1, 3));

    assertTrue(handle.only().message().contains(" - Diff:\n  [\n    1,\n-   2,\n+   3,\n  ]"));
  }

  @Test
  void diffCanBeDisabled() {
    AssayConfig config = new AssayConfig(" - ", Duration.ofMillis(100), false, 512, false);
    AssertionContext.root(handle, AssertionEnvironment.standard(config)).lax().equal(List.of(1), List.of(2));

    assertFalse(handle.only().message().contains("Diff"));
  }

  @Test
  void errMsgWithoutErrorNamesTheExpectedMessage() {
    root().lax().errMsg(null, "boom");

    assertEquals("expected error 'boom'", handle.only().message());
  }

  @Test
  void typeChecks() {
    Asserter assay = root().lax();

    assertFalse(assay.equalType(1, 1L));
    assertFalse(assay.isType(Integer.class, null));
    assertTrue(assay.isType(null, null));

    assertEquals(List.of(
        "expected objects 'java.lang.Integer' to be of the same type as object 'java.lang.Long'",
        "expected object 'null' to be of type 'java.lang.Integer'"), handle.messages());
  }

  @Test
  void shouldPanicRethrowsNestedStrictFailures() {
    AssertionContext assay = root();

    assertThrows(FatalAbort.class, () -> assay.shouldPanic(() -> assay.isTrue(false)));

    assertEquals("expected boolean to be true", handle.only().message());
  }

  @Test
  void shouldPanicIgnoresNestedLaxFailuresButStillNeedsAThrow() {
    AssertionContext assay = root().lax();

    assertFalse(assay.shouldPanic(() -> assay.isTrue(false)));

    assertEquals(List.of("expected boolean to be true", "expected function to panic"), handle.messages());
  }

  @Test
  void laxScopeAggregatesIntoOneParentFailure() {
    AssertionContext assay = root();

    FatalAbort abort = assertThrows(FatalAbort.class, () -> assay.lax(lax -> {
      lax.equal(1, 1);
      lax.msg("second").equal(1, 2);
      lax.isTrue(true);
    }));

    assertEquals(2, handle.events().size());
    assertFalse(handle.events().get(0).fatal());
    assertEquals("at least one assertion in the lax scope failed (1 failures)", abort.getMessage());
  }

  @Test
  void laxScopeWithoutFailuresPasses() {
    assertTrue(root().lax(lax -> lax.equal("a", "a")));
    assertTrue(handle.events().isEmpty());
  }

  @Test
  void laxScopeOnLaxParentReturnsFalse() {
    assertFalse(root().lax().lax(lax -> lax.isTrue(false)));
    assertEquals(2, handle.events().size());
  }

  @Test
  void equalityHookResultIsUsedAsIs() {
    Asserter assay = root().lax();
    Equaler a = new Equaler(true);
    Equaler b = new Equaler(false);

    assay.equal(a, b);
    assertTrue(a.called);
    assay.equal(b, a);
    assertTrue(b.called);
    assertEquals(2, handle.events().size());

    a.called = false;
    b.called = false;
    b.equal = true;
    assay.notEqual(a, b);
    assertTrue(a.called);
    assay.notEqual(b, a);
    assertTrue(b.called);
    assertEquals(4, handle.events().size());
  }

  @Test
  void withHandleRoutesFailuresElsewhere() {
    RecordingTestHandle other = new RecordingTestHandle();
    AssertionContext assay = root().lax();

    assay.withHandle(other).isTrue(false);

    assertTrue(handle.events().isEmpty());
    assertEquals(1, other.events().size());
    assertFalse(assay.failed());
  }

  @Test
  void waitForTrueFailsAfterRealTimeout() {
    AssertionContext assay = root().lax();
    long start = System.nanoTime();

    assertFalse(assay.waitForTrue(Duration.ofMillis(200), () -> false));

    assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() >= 200);
    assertEquals(1, handle.events().size());
    assertTrue(assay.waitForTrue(Duration.ofMillis(200), () -> true));
    assertEquals(1, handle.events().size());
  }

  private AssertionContext root() {
    return AssertionContext.root(handle, AssertionEnvironment.standard(AssayConfig.defaults()));
  }
}
