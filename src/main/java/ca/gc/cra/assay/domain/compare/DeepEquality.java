package ca.gc.cra.assay.domain.compare;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural equality over arbitrary object graphs.
 *
 * <p>Values are equal when {@code equals} says so, or when they share a shape and their contents are
 * recursively equal: arrays and lists element-wise, sets by mutual membership, maps by keys and values,
 * records by component, and plain objects without an {@code equals} override by declared instance field.
 * {@link BigDecimal} values compare by numeric value regardless of scale.
 *
 * <p>Instances are single use; each top-level comparison tracks the pairs currently under comparison so
 * cyclic graphs terminate. A pair only counts as equal on re-entry while it is still in progress.
 *
 * @since 0.1.0
 */
final class DeepEquality {
  private static final Logger log = LoggerFactory.getLogger(DeepEquality.class);

  private final Set<VisitedPair> inProgress = new HashSet<>();

  private DeepEquality() {}

  /**
   * Compares two values structurally.
   *
   * @param a left operand
   * @param b right operand
   * @return {@code true} when the graphs are structurally equal
   */
  static boolean deepEquals(Object a, Object b) {
    return new DeepEquality().equal(a, b);
  }

  private boolean equal(Object a, Object b) {
    if (a == b) {
      return true;
    }
    if (a == null || b == null) {
      return false;
    }
    if (a instanceof BigDecimal x && b instanceof BigDecimal y) {
      return x.compareTo(y) == 0;
    }
    if (safeEquals(a, b)) {
      return true;
    }
    VisitedPair pair = new VisitedPair(a, b);
    if (!inProgress.add(pair)) {
      // already being compared further up the graph
      return true;
    }
    try {
      return structurallyEqual(a, b);
    } finally {
      inProgress.remove(pair);
    }
  }

  private boolean structurallyEqual(Object a, Object b) {
    if (a.getClass().isArray() && b.getClass().isArray()) {
      return arraysEqual(a, b);
    }
    if (a instanceof Map<?, ?> left && b instanceof Map<?, ?> right) {
      return mapsEqual(left, right);
    }
    if (a instanceof Set<?> left && b instanceof Set<?> right) {
      return setsEqual(left, right);
    }
    if (a instanceof Set<?> || b instanceof Set<?>) {
      return false;
    }
    if (a instanceof Collection<?> left && b instanceof Collection<?> right) {
      return orderedEqual(left, right);
    }
    if (a.getClass() != b.getClass()) {
      return false;
    }
    if (a.getClass().isRecord()) {
      return recordsEqual(a, b);
    }
    if (overridesEquals(a.getClass())) {
      return false;
    }
    return fieldsEqual(a, b);
  }

  private boolean arraysEqual(Object a, Object b) {
    int length = Array.getLength(a);
    if (length != Array.getLength(b)) {
      return false;
    }
    if (a.getClass().getComponentType() != b.getClass().getComponentType()) {
      return false;
    }
    for (int i = 0; i < length; i++) {
      if (!equal(Array.get(a, i), Array.get(b, i))) {
        return false;
      }
    }
    return true;
  }

  private boolean orderedEqual(Collection<?> a, Collection<?> b) {
    if (a.size() != b.size()) {
      return false;
    }
    Iterator<?> left = a.iterator();
    Iterator<?> right = b.iterator();
    while (left.hasNext() && right.hasNext()) {
      if (!equal(left.next(), right.next())) {
        return false;
      }
    }
    return !left.hasNext() && !right.hasNext();
  }

  private boolean setsEqual(Set<?> a, Set<?> b) {
    if (a.size() != b.size()) {
      return false;
    }
    List<Object> remaining = new ArrayList<>(b);
    for (Object element : a) {
      if (!removeMatch(remaining, element)) {
        return false;
      }
    }
    return remaining.isEmpty();
  }

  private boolean removeMatch(List<Object> candidates, Object element) {
    for (Iterator<Object> it = candidates.iterator(); it.hasNext(); ) {
      if (equal(element, it.next())) {
        it.remove();
        return true;
      }
    }
    return false;
  }

  private boolean mapsEqual(Map<?, ?> a, Map<?, ?> b) {
    if (a.size() != b.size()) {
      return false;
    }
    for (Map.Entry<?, ?> entry : a.entrySet()) {
      Object key = entry.getKey();
      if (containsKey(b, key)) {
        if (!equal(entry.getValue(), b.get(key))) {
          return false;
        }
        continue;
      }
      boolean matched = false;
      for (Map.Entry<?, ?> other : b.entrySet()) {
        if (equal(key, other.getKey()) && equal(entry.getValue(), other.getValue())) {
          matched = true;
          break;
        }
      }
      if (!matched) {
        return false;
      }
    }
    return true;
  }

  private static boolean containsKey(Map<?, ?> map, Object key) {
    try {
      return map.containsKey(key);
    } catch (ClassCastException | NullPointerException ex) {
      // sorted maps reject foreign or null keys; fall back to the entry scan
      log.debug("containsKey rejected key of type {}: {}",
          key == null ? "null" : key.getClass().getTypeName(), ex.toString());
      return false;
    }
  }

  private boolean recordsEqual(Object a, Object b) {
    for (RecordComponent component : a.getClass().getRecordComponents()) {
      Method accessor = component.getAccessor();
      if (!accessor.trySetAccessible()) {
        return false;
      }
      try {
        if (!equal(accessor.invoke(a), accessor.invoke(b))) {
          return false;
        }
      } catch (ReflectiveOperationException ex) {
        log.debug("Cannot read record component {} of {}", component.getName(), a.getClass().getName(), ex);
        return false;
      }
    }
    return true;
  }

  private boolean fieldsEqual(Object a, Object b) {
    for (Class<?> type = a.getClass(); type != null && type != Object.class; type = type.getSuperclass()) {
      for (Field field : type.getDeclaredFields()) {
        if (Modifier.isStatic(field.getModifiers())) {
          continue;
        }
        if (!field.trySetAccessible()) {
          return false;
        }
        try {
          if (!equal(field.get(a), field.get(b))) {
            return false;
          }
        } catch (IllegalAccessException ex) {
          log.debug("Cannot read field {} of {}", field.getName(), type.getName(), ex);
          return false;
        }
      }
    }
    return true;
  }

  private static boolean overridesEquals(Class<?> type) {
    try {
      return type.getMethod("equals", Object.class).getDeclaringClass() != Object.class;
    } catch (NoSuchMethodException ex) {
      return false;
    }
  }

  private static boolean safeEquals(Object a, Object b) {
    try {
      return a.equals(b);
    } catch (RuntimeException ex) {
      log.debug("equals() of {} threw {}", a.getClass().getName(), ex.toString());
      return false;
    }
  }

  /** Identity-keyed pair of operands. */
  private static final class VisitedPair {
    private final Object left;
    private final Object right;

    VisitedPair(Object left, Object right) {
      this.left = left;
      this.right = right;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof VisitedPair other && other.left == left && other.right == right;
    }

    @Override
    public int hashCode() {
      return 31 * System.identityHashCode(left) + System.identityHashCode(right);
    }
  }
}
