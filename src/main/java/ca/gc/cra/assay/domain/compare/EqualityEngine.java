package ca.gc.cra.assay.domain.compare;

import ca.gc.cra.assay.domain.EqualityChecker;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decides whether two arbitrary runtime values are equal under assertion rules.
 * <p><strong>Why:</strong> Tests routinely compare literals of unspecified width or shape against typed
 * fields; a plain {@code equals} call would reject {@code 1} against {@code 1L}.</p>
 * <p><strong>Role:</strong> Core of the comparison engine used by every equality-based assertion.</p>
 * <p><strong>Responsibilities:</strong>
 * <ol>
 *   <li>Absent operands are equal only to absent operands.</li>
 *   <li>A left operand implementing {@link EqualityChecker} decides alone; its answer is final.</li>
 *   <li>Structurally equal graphs are equal.</li>
 *   <li>Otherwise the right operand is converted to the left operand's runtime type when possible and
 *   compared structurally again.</li>
 * </ol>
 * <p><strong>Thread-safety:</strong> Stateless; hooks run on the calling thread.</p>
 * <p><strong>Observability:</strong> Faults raised while comparing are logged at DEBUG and yield
 * {@code false}.</p>
 *
 * @implNote The relation is not symmetric when hooks are involved: only the left operand's hook runs.
 * @since 0.1.0
 * @see ValueClassifier
 * @see TypeConversions
 */
public final class EqualityEngine {
  private static final Logger log = LoggerFactory.getLogger(EqualityEngine.class);

  private EqualityEngine() {
    // Utility
  }

  /**
   * Returns whether {@code a} and {@code b} are equal.
   *
   * @param a left operand; its hook, when present, decides the outcome
   * @param b right operand; converted to {@code a}'s type when the types differ
   * @return {@code true} when the operands are equal
   */
  public static boolean isEqual(Object a, Object b) {
    boolean aNil = ValueClassifier.isNilLike(a);
    boolean bNil = ValueClassifier.isNilLike(b);
    if (aNil || bNil) {
      return aNil && bNil;
    }

    if (a instanceof EqualityChecker checker) {
      return checker.isEqual(b);
    }

    if (structurallyEqual(a, b)) {
      return true;
    }

    Optional<Object> converted = TypeConversions.convert(b, a.getClass());
    return converted.isPresent() && structurallyEqual(a, converted.get());
  }

  private static boolean structurallyEqual(Object a, Object b) {
    try {
      return DeepEquality.deepEquals(a, b);
    } catch (RuntimeException ex) {
      log.debug("Structural comparison of {} and {} failed: {}",
          a.getClass().getTypeName(), b.getClass().getTypeName(), ex.toString());
      return false;
    }
  }
}
