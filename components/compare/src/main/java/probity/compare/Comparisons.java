package probity.compare;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Polymorphic predicates over arbitrary values. All methods are pure and thread-safe; failures to
 * evaluate are reported as {@link ComparisonException} subtypes, never as a {@code false} result.
 */
public final class Comparisons {

  private Comparisons() {}

  /**
   * True for {@code null} and for reference holders pointing at nothing ({@code Optional.empty()},
   * an {@code AtomicReference} holding {@code null}, a cleared {@code Reference}).
   */
  public static boolean isNil(@Nullable final Object value) {
    final ValueKind kind = ValueKind.of(value);
    if (kind == ValueKind.NULL) {
      return true;
    }
    return kind == ValueKind.REFERENCE && References.isAbsent(value);
  }

  /**
   * True for {@code null}, for sequences, maps and strings of size 0, for reference holders that
   * are absent or whose target is empty, and for any other value equal to its type's zero value.
   */
  public static boolean isEmpty(@Nullable final Object value) {
    final ValueKind kind = ValueKind.of(value);
    if (kind == ValueKind.NULL) {
      return true;
    }
    if (kind.isSequence()) {
      return Sequences.size(value) == 0;
    }
    switch (kind) {
      case MAP:
        return ((Map<?, ?>) value).isEmpty();
      case STRING:
        return ((CharSequence) value).length() == 0;
      case REFERENCE:
        return References.isAbsent(value) || isEmpty(References.target(value));
      default:
        return isZero(value);
    }
  }

  /**
   * True if {@code value} is the zero value of its type: {@code null}, {@code false}, numeric zero,
   * {@code '\0'}, the empty string, or an object whose instance fields are all {@code null} or
   * primitive defaults. Non-null containers, holders, enum constants and lambdas are never zero.
   */
  public static boolean isZero(@Nullable final Object value) {
    switch (ValueKind.of(value)) {
      case NULL:
        return true;
      case BOOLEAN:
        return !((Boolean) value);
      case NUMBER:
        return isNumericZero((Number) value);
      case CHARACTER:
        return (Character) value == '\0';
      case STRING:
        return ((CharSequence) value).length() == 0;
      case STRUCT:
        return hasZeroFields(value);
      default:
        return false;
    }
  }

  private static boolean isNumericZero(final Number number) {
    if (number instanceof BigInteger) {
      return ((BigInteger) number).signum() == 0;
    }
    if (number instanceof BigDecimal) {
      return ((BigDecimal) number).signum() == 0;
    }
    return number.doubleValue() == 0;
  }

  private static boolean hasZeroFields(final Object value) {
    final List<Field> fields = DeepEquality.instanceFields(value.getClass());
    if (fields == null) {
      return false;
    }
    for (final Field field : fields) {
      final Object fieldValue;
      try {
        fieldValue = field.get(value);
      } catch (IllegalAccessException e) {
        return false;
      }
      if (fieldValue == null) {
        continue;
      }
      if (!field.getType().isPrimitive() || !isZero(fieldValue)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Strings are searched for a substring, sequences scanned with deep equality, maps checked for
   * key presence.
   *
   * @throws TypeMismatchException if the container is a string and the item is not
   * @throws UnsupportedTypeException if the container is of any other kind
   */
  public static boolean contains(@Nullable final Object container, @Nullable final Object item)
      throws ComparisonException {
    final ValueKind kind = ValueKind.of(container);
    if (kind == ValueKind.STRING) {
      if (ValueKind.of(item) != ValueKind.STRING) {
        throw new TypeMismatchException(
            "item must be a string when container is a string, got " + ValueKind.typeName(item));
      }
      return container.toString().contains(item.toString());
    }
    if (kind.isSequence()) {
      return Sequences.containsDeep(container, item);
    }
    if (kind == ValueKind.MAP) {
      return DeepEquality.findEntry((Map<?, ?>) container, item) != null;
    }
    throw new UnsupportedTypeException(
        "unsupported container type: " + ValueKind.typeName(container));
  }

  /**
   * For sequences every element of {@code subset} must occur somewhere in {@code superset}.
   * Duplicates are not counted: {@code [1, 1]} is a subset of {@code [1]}. For maps every key of
   * {@code subset} must be present in {@code superset} with a deeply equal value.
   */
  public static boolean subset(@Nullable final Object superset, @Nullable final Object subset)
      throws ComparisonException {
    final ValueKind kind = ValueKind.of(superset);
    final ValueKind subsetKind = ValueKind.of(subset);
    if (kind.isSequence()) {
      if (!subsetKind.isSequence()) {
        throw mismatch(superset, subset);
      }
      for (final Object element : Sequences.elements(subset)) {
        if (!Sequences.containsDeep(superset, element)) {
          return false;
        }
      }
      return true;
    }
    if (kind == ValueKind.MAP) {
      if (subsetKind != ValueKind.MAP) {
        throw mismatch(superset, subset);
      }
      final Map<?, ?> superMap = (Map<?, ?>) superset;
      for (final Map.Entry<?, ?> entry : ((Map<?, ?>) subset).entrySet()) {
        final Map.Entry<?, ?> match = DeepEquality.findEntry(superMap, entry.getKey());
        if (match == null || !DeepEquality.deepEquals(match.getValue(), entry.getValue())) {
          return false;
        }
      }
      return true;
    }
    throw new UnsupportedTypeException(
        "unsupported type for subset: " + ValueKind.typeName(superset));
  }

  private static TypeMismatchException mismatch(final Object superset, final Object subset) {
    return new TypeMismatchException(
        "cannot check "
            + ValueKind.typeName(subset)
            + " as a subset of "
            + ValueKind.typeName(superset));
  }

  /**
   * Multiset equality: both sequences hold the same elements with the same number of occurrences,
   * in any order.
   *
   * @throws UnsupportedTypeException if either argument is not a sequence
   * @throws UnhashableException if an element is itself a container
   */
  public static boolean sameElements(@Nullable final Object a, @Nullable final Object b)
      throws ComparisonException {
    if (!ValueKind.of(a).isSequence()) {
      throw new UnsupportedTypeException(
          "first argument must be a sequence, got " + ValueKind.typeName(a));
    }
    if (!ValueKind.of(b).isSequence()) {
      throw new UnsupportedTypeException(
          "second argument must be a sequence, got " + ValueKind.typeName(b));
    }
    if (Sequences.size(a) != Sequences.size(b)) {
      return false;
    }
    return countOccurrences(Sequences.elements(a)).equals(countOccurrences(Sequences.elements(b)));
  }

  private static Map<DeepKey, Integer> countOccurrences(final Collection<Object> elements)
      throws UnhashableException {
    final Map<DeepKey, Integer> counts = new LinkedHashMap<>();
    for (final Object element : elements) {
      if (ValueKind.of(element).isContainer()) {
        throw new UnhashableException(
            "unsupported element type for comparison: " + ValueKind.typeName(element));
      }
      counts.merge(new DeepKey(element), 1, Integer::sum);
    }
    return counts;
  }

  /**
   * Multiset equality that accepts any element, containers included, by pairing elements up with
   * deep equality. Quadratic; prefer {@link #sameElements} for flat sequences.
   *
   * @throws UnsupportedTypeException if either argument is not a sequence
   */
  public static boolean matchElements(@Nullable final Object a, @Nullable final Object b)
      throws UnsupportedTypeException {
    if (!ValueKind.of(a).isSequence()) {
      throw new UnsupportedTypeException(
          "first argument must be a sequence, got " + ValueKind.typeName(a));
    }
    if (!ValueKind.of(b).isSequence()) {
      throw new UnsupportedTypeException(
          "second argument must be a sequence, got " + ValueKind.typeName(b));
    }
    if (Sequences.size(a) != Sequences.size(b)) {
      return false;
    }
    final List<Object> unmatched = Sequences.elements(b);
    for (final Object element : Sequences.elements(a)) {
      final Iterator<Object> candidates = unmatched.iterator();
      boolean found = false;
      while (candidates.hasNext()) {
        if (DeepEquality.deepEquals(element, candidates.next())) {
          candidates.remove();
          found = true;
          break;
        }
      }
      if (!found) {
        return false;
      }
    }
    return unmatched.isEmpty();
  }

  /** Same runtime class; {@code Integer} and {@code Long} differ even when numerically equal. */
  public static boolean isSameType(@Nullable final Object a, @Nullable final Object b) {
    if (a == null || b == null) {
      return a == b;
    }
    return a.getClass() == b.getClass();
  }

  public static boolean implementsCapability(
      final Class<?> capability, @Nullable final Object value) {
    if (capability == null) {
      throw new IllegalArgumentException("capability cannot be null");
    }
    return implementsCapability(Collections.<Class<?>>singletonList(capability), value);
  }

  /**
   * True iff {@code value} is non-null and its runtime class is assignable to every type of the
   * capability set. An empty set is satisfied by every non-null value.
   */
  public static boolean implementsCapability(
      final Collection<? extends Class<?>> capabilitySet, @Nullable final Object value) {
    if (capabilitySet == null) {
      throw new IllegalArgumentException("capabilitySet cannot be null");
    }
    if (value == null) {
      return false;
    }
    for (final Class<?> capability : capabilitySet) {
      if (capability == null) {
        throw new IllegalArgumentException("capabilitySet cannot contain null");
      }
      if (!capability.isInstance(value)) {
        return false;
      }
    }
    return true;
  }

  /** Length of a string, array, collection or map. */
  public static int length(@Nullable final Object value) throws UnsupportedTypeException {
    final ValueKind kind = ValueKind.of(value);
    if (kind == ValueKind.ARRAY) {
      return Array.getLength(value);
    }
    if (kind.isSequence()) {
      return ((Collection<?>) value).size();
    }
    if (kind == ValueKind.MAP) {
      return ((Map<?, ?>) value).size();
    }
    if (kind == ValueKind.STRING) {
      return ((CharSequence) value).length();
    }
    throw new UnsupportedTypeException(
        "unsupported type for length check: " + ValueKind.typeName(value));
  }

  /** Occurrence-count key with deep equality semantics. */
  private static final class DeepKey {
    private final Object value;
    private final int hash;

    DeepKey(final Object value) {
      this.value = value;
      this.hash = DeepEquality.deepHashCode(value);
    }

    @Override
    public boolean equals(final Object o) {
      return o instanceof DeepKey && DeepEquality.deepEquals(value, ((DeepKey) o).value);
    }

    @Override
    public int hashCode() {
      return hash;
    }
  }
}
