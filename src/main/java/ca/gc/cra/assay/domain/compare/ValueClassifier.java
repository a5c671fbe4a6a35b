package ca.gc.cra.assay.domain.compare;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <strong>What:</strong> Classifies runtime values independently of their static type.
 * <p><strong>Why:</strong> Assertions receive {@code Object} operands and must decide absence, emptiness and
 * container shape uniformly across references, arrays, collections, maps and optionals.</p>
 * <p><strong>Role:</strong> Leaf of the comparison engine; consumed by {@link EqualityEngine} and the
 * assertion operations.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class ValueClassifier {
  private ValueClassifier() {
    // Utility
  }

  /**
   * Returns whether {@code value} is absent: {@code null} or an empty {@link Optional} variant.
   *
   * <p>Empty arrays, collections and maps are present values and therefore not nil-like.
   *
   * @param value candidate
   * @return {@code true} for absent values
   */
  public static boolean isNilLike(Object value) {
    if (value == null) {
      return true;
    }
    if (value instanceof Optional<?> optional) {
      return optional.isEmpty();
    }
    if (value instanceof OptionalInt optional) {
      return optional.isEmpty();
    }
    if (value instanceof OptionalLong optional) {
      return optional.isEmpty();
    }
    if (value instanceof OptionalDouble optional) {
      return optional.isEmpty();
    }
    return false;
  }

  /**
   * Returns whether {@code value} equals the zero-initialized form of its type.
   *
   * <p>Absent values are zero. Containers and text are zero when their length is 0. A present
   * {@link Optional} is zero when its content is zero. Numbers, booleans and characters are compared with
   * their default value. Any other object is zero when every instance field holds its default.
   *
   * @param value candidate
   * @return {@code true} for zero values
   */
  public static boolean isZeroValue(Object value) {
    if (isNilLike(value)) {
      return true;
    }
    if (value instanceof Optional<?> optional) {
      return isZeroValue(optional.get());
    }
    if (value instanceof OptionalInt optional) {
      return optional.getAsInt() == 0;
    }
    if (value instanceof OptionalLong optional) {
      return optional.getAsLong() == 0L;
    }
    if (value instanceof OptionalDouble optional) {
      return optional.getAsDouble() == 0.0d;
    }
    if (value instanceof CharSequence text) {
      return text.length() == 0;
    }
    if (isSequenceKind(value) || isMappingKind(value)) {
      return length(value) == 0;
    }
    if (value instanceof Boolean flag) {
      return !flag;
    }
    if (value instanceof Character c) {
      return c == '\0';
    }
    if (value instanceof Number number) {
      return isZeroNumber(number);
    }
    if (value instanceof Duration duration) {
      return duration.isZero();
    }
    if (value instanceof Enum<?>) {
      return false;
    }
    return fieldsAtDefaults(value);
  }

  /** Returns whether {@code value} is text ({@link CharSequence}). */
  public static boolean isTextKind(Object value) {
    return value instanceof CharSequence;
  }

  /** Returns whether {@code value} is an array or a {@link Collection}. */
  public static boolean isSequenceKind(Object value) {
    return value != null && (value.getClass().isArray() || value instanceof Collection<?>);
  }

  /** Returns whether {@code value} is an array. */
  public static boolean isArrayKind(Object value) {
    return value != null && value.getClass().isArray();
  }

  /** Returns whether {@code value} is a {@link Map}. */
  public static boolean isMappingKind(Object value) {
    return value instanceof Map<?, ?>;
  }

  /**
   * Returns the number of elements of a sequence or mapping.
   *
   * @param value array, collection or map
   * @return element count
   * @throws IllegalArgumentException if {@code value} is not a sequence or mapping
   */
  public static int length(Object value) {
    if (isArrayKind(value)) {
      return Array.getLength(value);
    }
    if (value instanceof Collection<?> collection) {
      return collection.size();
    }
    if (value instanceof Map<?, ?> map) {
      return map.size();
    }
    throw new IllegalArgumentException("not a sequence or mapping: " + (value == null ? "null" : value.getClass()));
  }

  /**
   * Returns the elements of a sequence in iteration order, boxing primitive array elements.
   *
   * @param value array or collection
   * @return snapshot list of the elements
   * @throws IllegalArgumentException if {@code value} is not a sequence
   */
  public static List<Object> elements(Object value) {
    if (isArrayKind(value)) {
      int length = Array.getLength(value);
      List<Object> result = new ArrayList<>(length);
      for (int i = 0; i < length; i++) {
        result.add(Array.get(value, i));
      }
      return result;
    }
    if (value instanceof Collection<?> collection) {
      return new ArrayList<>(collection);
    }
    throw new IllegalArgumentException("not a sequence: " + (value == null ? "null" : value.getClass()));
  }

  private static boolean isZeroNumber(Number number) {
    if (number instanceof BigDecimal decimal) {
      return decimal.signum() == 0;
    }
    if (number instanceof BigInteger integer) {
      return integer.signum() == 0;
    }
    if (number instanceof AtomicInteger atomic) {
      return atomic.get() == 0;
    }
    if (number instanceof AtomicLong atomic) {
      return atomic.get() == 0L;
    }
    if (number instanceof Double || number instanceof Float) {
      return number.doubleValue() == 0.0d;
    }
    return number.longValue() == 0L && number.doubleValue() == 0.0d;
  }

  private static boolean fieldsAtDefaults(Object value) {
    for (Class<?> type = value.getClass(); type != null && type != Object.class; type = type.getSuperclass()) {
      for (Field field : type.getDeclaredFields()) {
        if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
          continue;
        }
        if (!field.trySetAccessible()) {
          return false;
        }
        Object fieldValue;
        try {
          fieldValue = field.get(value);
        } catch (IllegalAccessException ex) {
          return false;
        }
        if (!isDefaultFieldValue(field.getType(), fieldValue)) {
          return false;
        }
      }
    }
    return true;
  }

  private static boolean isDefaultFieldValue(Class<?> declared, Object fieldValue) {
    if (fieldValue == null) {
      return true;
    }
    if (declared.isPrimitive()
        || fieldValue instanceof Number
        || fieldValue instanceof Boolean
        || fieldValue instanceof Character
        || fieldValue instanceof CharSequence) {
      return isZeroValue(fieldValue);
    }
    return false;
  }
}
