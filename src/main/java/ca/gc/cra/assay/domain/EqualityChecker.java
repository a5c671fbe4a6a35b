package ca.gc.cra.assay.domain;

/**
 * <strong>What:</strong> Opt-in equality hook for values compared by assertions.
 * <p><strong>Why:</strong> Some types carry fields that should not take part in a structural comparison
 * (timestamps with differing precision, caches, lazily computed hashes).</p>
 * <p><strong>Role:</strong> Domain capability consulted by the equality engine before any structural rule.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Decide whether {@code this} equals an arbitrary other value.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations are invoked on the asserting thread only.</p>
 *
 * @implNote Only the left-hand operand's hook is consulted; {@code equal(a, b)} and {@code equal(b, a)} may
 * therefore disagree when the two types implement different rules.
 * @since 0.1.0
 */
@FunctionalInterface
public interface EqualityChecker {
  /**
   * Returns whether this value should be treated as equal to {@code other}.
   *
   * @param other right-hand operand; never {@code null} or otherwise nil-like
   * @return {@code true} when the values are considered equal
   */
  boolean isEqual(Object other);
}
