package probity.compare;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Structural, recursive equality shared by every engine operation.
 *
 * <p>Values of different runtime types are never equal, even when numerically equivalent ({@code
 * 1} and {@code 1L} differ). Lists compare as lists whatever their implementation class, sets as
 * sets and maps as maps; every other kind requires the exact same class. Objects without their own
 * {@code equals} are compared field by field. Cyclic structures terminate: a pair of values still
 * under comparison further up the recursion is assumed equal.
 */
public final class DeepEquality {

  private DeepEquality() {}

  public static boolean deepEquals(@Nullable final Object a, @Nullable final Object b) {
    return deepEquals(a, b, new HashSet<IdentityPair>());
  }

  /**
   * Hash consistent with {@link #deepEquals(Object, Object)} for scalar, function and struct
   * kinds. Container kinds are rejected by callers before hashing.
   */
  static int deepHashCode(@Nullable final Object value) {
    final ValueKind kind = ValueKind.of(value);
    switch (kind) {
      case NULL:
        return 0;
      case STRING:
        return value.toString().hashCode();
      case BOOLEAN:
      case NUMBER:
      case CHARACTER:
      case ENUM:
        return value.hashCode();
      default:
        return value.getClass().hashCode();
    }
  }

  private static boolean deepEquals(
      @Nullable final Object a, @Nullable final Object b, final Set<IdentityPair> visited) {
    if (a == b) {
      return true;
    }
    final ValueKind kind = ValueKind.of(a);
    if (kind != ValueKind.of(b)) {
      return false;
    }
    switch (kind) {
      case NULL:
        return true;
      case STRING:
        return a.getClass() == b.getClass() && a.toString().equals(b.toString());
      case BOOLEAN:
      case NUMBER:
      case CHARACTER:
      case ENUM:
      case FUNCTION:
        return a.getClass() == b.getClass() && a.equals(b);
      default:
        break;
    }
    // holds only the pairs on the current comparison path
    final IdentityPair pair = new IdentityPair(a, b);
    if (!visited.add(pair)) {
      return true;
    }
    try {
      return containerEquals(kind, a, b, visited);
    } finally {
      visited.remove(pair);
    }
  }

  private static boolean containerEquals(
      final ValueKind kind, final Object a, final Object b, final Set<IdentityPair> visited) {
    switch (kind) {
      case ARRAY:
        return a.getClass() == b.getClass() && orderedEquals(a, b, visited);
      case LIST:
        return orderedEquals(a, b, visited);
      case COLLECTION:
        return a.getClass() == b.getClass() && orderedEquals(a, b, visited);
      case SET:
        return setEquals((Set<?>) a, (Set<?>) b, visited);
      case MAP:
        return mapEquals((Map<?, ?>) a, (Map<?, ?>) b, visited);
      case REFERENCE:
        return a.getClass() == b.getClass()
            && References.isAbsent(a) == References.isAbsent(b)
            && deepEquals(References.target(a), References.target(b), visited);
      default:
        return structEquals(a, b, visited);
    }
  }

  private static boolean orderedEquals(
      final Object a, final Object b, final Set<IdentityPair> visited) {
    if (Sequences.size(a) != Sequences.size(b)) {
      return false;
    }
    final Iterator<Object> left = Sequences.elements(a).iterator();
    final Iterator<Object> right = Sequences.elements(b).iterator();
    while (left.hasNext() && right.hasNext()) {
      if (!deepEquals(left.next(), right.next(), visited)) {
        return false;
      }
    }
    return !left.hasNext() && !right.hasNext();
  }

  private static boolean setEquals(
      final Set<?> a, final Set<?> b, final Set<IdentityPair> visited) {
    if (a.size() != b.size()) {
      return false;
    }
    for (final Object element : a) {
      if (!containsDeep(b, element, visited)) {
        return false;
      }
    }
    return true;
  }

  private static boolean containsDeep(
      final Collection<?> collection, final Object item, final Set<IdentityPair> visited) {
    for (final Object element : collection) {
      if (deepEquals(element, item, visited)) {
        return true;
      }
    }
    return false;
  }

  private static boolean mapEquals(
      final Map<?, ?> a, final Map<?, ?> b, final Set<IdentityPair> visited) {
    if (a.size() != b.size()) {
      return false;
    }
    for (final Map.Entry<?, ?> entry : a.entrySet()) {
      final Map.Entry<?, ?> match = findEntry(b, entry.getKey());
      if (match == null || !deepEquals(entry.getValue(), match.getValue(), visited)) {
        return false;
      }
    }
    return true;
  }

  /** Entry of {@code map} whose key is deeply equal to {@code key}, or {@code null}. */
  @Nullable
  static Map.Entry<?, ?> findEntry(final Map<?, ?> map, @Nullable final Object key) {
    if (hasKey(map, key)) {
      return new AbstractMap.SimpleImmutableEntry<>(key, map.get(key));
    }
    for (final Map.Entry<?, ?> entry : map.entrySet()) {
      if (deepEquals(entry.getKey(), key)) {
        return entry;
      }
    }
    return null;
  }

  private static boolean hasKey(final Map<?, ?> map, @Nullable final Object key) {
    try {
      return map.containsKey(key);
    } catch (ClassCastException | NullPointerException e) {
      // key type or null key not supported by this map
      return false;
    }
  }

  private static boolean structEquals(
      final Object a, final Object b, final Set<IdentityPair> visited) {
    final Class<?> type = a.getClass();
    if (type != b.getClass()) {
      return false;
    }
    if (declaresEquals(type)) {
      return a.equals(b);
    }
    final List<Field> fields = instanceFields(type);
    if (fields == null) {
      return false;
    }
    for (final Field field : fields) {
      try {
        if (!deepEquals(field.get(a), field.get(b), visited)) {
          return false;
        }
      } catch (IllegalAccessException e) {
        return false;
      }
    }
    return true;
  }

  static boolean declaresEquals(final Class<?> type) {
    try {
      return type.getMethod("equals", Object.class).getDeclaringClass() != Object.class;
    } catch (NoSuchMethodException e) {
      return false;
    }
  }

  /**
   * Non-static fields of {@code type} and its superclasses, made accessible. Returns {@code null}
   * when any of them cannot be opened, e.g. JDK internals of a non-open module.
   */
  @Nullable
  @SuppressFBWarnings(
      value = "DP_DO_INSIDE_DO_PRIVILEGED",
      justification = "values are only read, never written")
  static List<Field> instanceFields(final Class<?> type) {
    final List<Field> fields = new ArrayList<>();
    for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
      for (final Field field : c.getDeclaredFields()) {
        if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
          continue;
        }
        if (!field.trySetAccessible()) {
          return null;
        }
        fields.add(field);
      }
    }
    return fields;
  }

  private static final class IdentityPair {
    private final Object left;
    private final Object right;

    IdentityPair(final Object left, final Object right) {
      this.left = left;
      this.right = right;
    }

    @Override
    public boolean equals(final Object o) {
      if (!(o instanceof IdentityPair)) {
        return false;
      }
      final IdentityPair other = (IdentityPair) o;
      return left == other.left && right == other.right;
    }

    @Override
    public int hashCode() {
      return 31 * System.identityHashCode(left) + System.identityHashCode(right);
    }
  }
}
