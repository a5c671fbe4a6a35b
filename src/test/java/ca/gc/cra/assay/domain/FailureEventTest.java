package ca.gc.cra.assay.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class FailureEventTest {

  @Test
  void argumentsAreCopied() {
    List<Object> args = new ArrayList<>(List.of("a"));
    FailureEvent event = new FailureEvent("%s", args, Severity.NON_FATAL);
    args.add("b");

    assertEquals(List.of("a"), event.args());
    assertThrows(UnsupportedOperationException.class, () -> event.args().add("c"));
  }

  @Test
  void nullArgumentsAreAllowed() {
    FailureEvent event = new FailureEvent("%s and %s", Arrays.asList(null, 1), Severity.FATAL);

    assertEquals("null and 1", event.message());
  }

  @Test
  void mismatchedFormatDoesNotThrow() {
    FailureEvent event = new FailureEvent("value %d", List.of("text"), Severity.FATAL);

    assertEquals("value %d [text]", event.message());
  }
}
