package ca.gc.cra.assay.domain.compare;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Best-effort conversion of a value to another runtime type, used to compare representationally compatible
 * operands such as {@code 1} and {@code 1L}.
 *
 * <p>Supported conversions:
 * <ul>
 *   <li>numeric to numeric with primitive-cast semantics (narrowing truncates);</li>
 *   <li>{@link Character} to numeric and numeric to {@link Character};</li>
 *   <li>any {@link CharSequence} or enum constant to {@link String};</li>
 *   <li>array or collection to an array, converting each element to the component type;</li>
 *   <li>array to {@link List}.</li>
 * </ul>
 * Faults raised while converting are logged at DEBUG and reported as "not convertible".
 *
 * @since 0.1.0
 */
public final class TypeConversions {
  private static final Logger log = LoggerFactory.getLogger(TypeConversions.class);

  private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
      boolean.class, Boolean.class,
      byte.class, Byte.class,
      short.class, Short.class,
      char.class, Character.class,
      int.class, Integer.class,
      long.class, Long.class,
      float.class, Float.class,
      double.class, Double.class);

  private static final List<Class<?>> NUMERIC_TYPES = List.of(
      Byte.class, Short.class, Integer.class, Long.class,
      Float.class, Double.class, BigInteger.class, BigDecimal.class);

  private TypeConversions() {
    // Utility
  }

  /**
   * Converts {@code value} to {@code target}.
   *
   * @param value value to convert; {@code null} is never convertible
   * @param target desired runtime type
   * @return converted value, or empty when the pair is not convertible
   */
  public static Optional<Object> convert(Object value, Class<?> target) {
    if (value == null || target == null) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(convertOrNull(value, wrap(target)));
    } catch (RuntimeException ex) {
      log.debug("Value of type {} is not convertible to {}: {}",
          value.getClass().getTypeName(), target.getTypeName(), ex.toString());
      return Optional.empty();
    }
  }

  /**
   * Returns whether {@code type} is one of the numeric types handled by {@link #convert(Object, Class)}.
   */
  public static boolean isNumericType(Class<?> type) {
    return type != null && NUMERIC_TYPES.contains(wrap(type));
  }

  private static Object convertOrNull(Object value, Class<?> target) {
    if (target.isInstance(value)) {
      return value;
    }
    if (isNumericType(target)) {
      Number number = asNumber(value);
      return number == null ? null : castNumber(number, target);
    }
    if (target == Character.class) {
      return value instanceof Number number ? Character.valueOf((char) number.intValue()) : null;
    }
    if (target == String.class) {
      if (value instanceof CharSequence text) {
        return text.toString();
      }
      return value instanceof Enum<?> constant ? constant.name() : null;
    }
    if (target.isArray()) {
      return toArray(value, target.getComponentType());
    }
    if (List.class.isAssignableFrom(target)) {
      return ValueClassifier.isArrayKind(value) ? ValueClassifier.elements(value) : null;
    }
    return null;
  }

  private static Object toArray(Object value, Class<?> componentType) {
    if (!ValueClassifier.isArrayKind(value) && !(value instanceof Collection<?>)) {
      return null;
    }
    List<Object> elements = ValueClassifier.elements(value);
    Object array = Array.newInstance(componentType, elements.size());
    Class<?> boxed = wrap(componentType);
    for (int i = 0; i < elements.size(); i++) {
      Object element = elements.get(i);
      Object converted = element == null || boxed.isInstance(element)
          ? element
          : convertOrNull(element, boxed);
      if (element != null && converted == null) {
        throw new ClassCastException(element.getClass().getTypeName() + " -> " + componentType.getTypeName());
      }
      // primitive components reject null with IllegalArgumentException
      Array.set(array, i, converted);
    }
    return array;
  }

  private static Number asNumber(Object value) {
    if (value instanceof Number number) {
      return number;
    }
    if (value instanceof Character c) {
      return (int) c;
    }
    return null;
  }

  private static Object castNumber(Number number, Class<?> target) {
    if (target == Byte.class) {
      return number.byteValue();
    }
    if (target == Short.class) {
      return number.shortValue();
    }
    if (target == Integer.class) {
      return number.intValue();
    }
    if (target == Long.class) {
      return number.longValue();
    }
    if (target == Float.class) {
      return number.floatValue();
    }
    if (target == Double.class) {
      return number.doubleValue();
    }
    if (target == BigInteger.class) {
      return toBigDecimal(number).toBigInteger();
    }
    return toBigDecimal(number);
  }

  private static BigDecimal toBigDecimal(Number number) {
    if (number instanceof BigDecimal decimal) {
      return decimal;
    }
    if (number instanceof BigInteger integer) {
      return new BigDecimal(integer);
    }
    if (number instanceof Double || number instanceof Float) {
      // NaN and infinities raise NumberFormatException
      return BigDecimal.valueOf(number.doubleValue());
    }
    return BigDecimal.valueOf(number.longValue());
  }

  private static Class<?> wrap(Class<?> type) {
    return type.isPrimitive() ? WRAPPERS.get(type) : type;
  }
}
