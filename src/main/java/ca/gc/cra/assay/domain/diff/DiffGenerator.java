package ca.gc.cra.assay.domain.diff;

import ca.gc.cra.assay.domain.compare.ValueClassifier;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.TextNode;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Produces a structural text diff between two sequences or two mappings.
 * <p><strong>Why:</strong> A failed comparison of large collections is hard to read from the rendered values
 * alone; a line per differing element points at the mismatch.</p>
 * <p><strong>Role:</strong> Enrichment of {@code equal} failure messages only; never decides pass or fail.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Round-trip both operands through JSON so that element types no longer matter.</li>
 *   <li>Emit common lines with two-space indent, actual-only lines with {@code -} and expected-only lines
 *   with {@code +}; object keys are sorted.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use once constructed.</p>
 * <p><strong>Observability:</strong> Serialization failures are logged at DEBUG and produce no diff.</p>
 *
 * @since 0.1.0
 */
public final class DiffGenerator {
  /** Prefix separating the diff from the failure message. */
  public static final String HEADER = " - Diff:\n";

  private static final Logger log = LoggerFactory.getLogger(DiffGenerator.class);

  private final ObjectMapper mapper;

  /** Creates a generator that serializes objects by field. */
  public DiffGenerator() {
    this(new ObjectMapper()
        .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS));
  }

  /**
   * Creates a generator using the supplied mapper for the canonical round trip.
   *
   * @param mapper Jackson mapper; must not be {@code null}
   */
  public DiffGenerator(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /**
   * Returns the diff suffix for a failed comparison.
   *
   * @param actual actual operand
   * @param expected expected operand
   * @return {@code " - Diff:\n..."}, or an empty string when the operands are not both sequences or both
   *     mappings, when serialization fails, or when their canonical forms are identical
   */
  public String diff(Object actual, Object expected) {
    boolean sequences = ValueClassifier.isSequenceKind(actual) && ValueClassifier.isSequenceKind(expected);
    boolean mappings = ValueClassifier.isMappingKind(actual) && ValueClassifier.isMappingKind(expected);
    if (!sequences && !mappings) {
      return "";
    }
    JsonNode left;
    JsonNode right;
    try {
      left = canonical(actual);
      right = canonical(expected);
    } catch (IOException | RuntimeException ex) {
      log.debug("Skipping diff, operands are not serializable: {}", ex.toString());
      return "";
    }
    if (left.equals(right)) {
      return "";
    }
    List<String> lines = new ArrayList<>();
    if (left.isArray() && right.isArray()) {
      diffArrays(left, right, lines);
    } else if (left.isObject() && right.isObject()) {
      diffObjects(left, right, lines);
    } else {
      return "";
    }
    return HEADER + String.join("\n", lines);
  }

  private JsonNode canonical(Object value) throws IOException {
    return mapper.readTree(mapper.writeValueAsBytes(value));
  }

  private static void diffArrays(JsonNode actual, JsonNode expected, List<String> lines) {
    lines.add("  [");
    int size = Math.max(actual.size(), expected.size());
    for (int i = 0; i < size; i++) {
      JsonNode a = actual.get(i);
      JsonNode e = expected.get(i);
      emit(lines, "", a, e);
    }
    lines.add("  ]");
  }

  private static void diffObjects(JsonNode actual, JsonNode expected, List<String> lines) {
    TreeSet<String> keys = new TreeSet<>();
    actual.fieldNames().forEachRemaining(keys::add);
    for (Iterator<String> it = expected.fieldNames(); it.hasNext(); ) {
      keys.add(it.next());
    }
    lines.add("  {");
    for (String key : keys) {
      emit(lines, TextNode.valueOf(key) + ": ", actual.get(key), expected.get(key));
    }
    lines.add("  }");
  }

  private static void emit(List<String> lines, String label, JsonNode actual, JsonNode expected) {
    if (actual != null && actual.equals(expected)) {
      lines.add("    " + label + actual + ",");
      return;
    }
    if (actual != null) {
      lines.add("-   " + label + actual + ",");
    }
    if (expected != null) {
      lines.add("+   " + label + expected + ",");
    }
  }
}
