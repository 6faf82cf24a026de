package probity.compare;

import java.lang.ref.Reference;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;

/**
 * Runtime classification of an arbitrary value. Every operation of the engine dispatches on the
 * kind first, so the order of the checks in {@link #of(Object)} matters: a {@code List} is never
 * reported as a plain {@code COLLECTION}.
 */
public enum ValueKind {
  NULL,
  BOOLEAN,
  NUMBER,
  CHARACTER,
  STRING,
  ENUM,
  ARRAY,
  LIST,
  SET,
  COLLECTION,
  MAP,
  /** Holders that may point at nothing: {@code Optional*}, {@code AtomicReference}, references. */
  REFERENCE,
  /** Lambdas and other synthetic classes. */
  FUNCTION,
  STRUCT;

  public static ValueKind of(@Nullable final Object value) {
    if (value == null) {
      return NULL;
    }
    if (value instanceof Boolean) {
      return BOOLEAN;
    }
    if (value instanceof Number) {
      return NUMBER;
    }
    if (value instanceof Character) {
      return CHARACTER;
    }
    if (value instanceof CharSequence) {
      return STRING;
    }
    if (value instanceof Enum) {
      return ENUM;
    }
    final Class<?> type = value.getClass();
    if (type.isArray()) {
      return ARRAY;
    }
    if (value instanceof List) {
      return LIST;
    }
    if (value instanceof Set) {
      return SET;
    }
    if (value instanceof Collection) {
      return COLLECTION;
    }
    if (value instanceof Map) {
      return MAP;
    }
    if (value instanceof Optional
        || value instanceof OptionalInt
        || value instanceof OptionalLong
        || value instanceof OptionalDouble
        || value instanceof AtomicReference
        || value instanceof Reference) {
      return REFERENCE;
    }
    if (type.isSynthetic() || type.getName().contains("$$Lambda")) {
      return FUNCTION;
    }
    return STRUCT;
  }

  /** Array, list, set or other collection. */
  public boolean isSequence() {
    return this == ARRAY || this == LIST || this == SET || this == COLLECTION;
  }

  /** Kinds whose elements cannot be used as an occurrence-count key. */
  public boolean isContainer() {
    return isSequence() || this == MAP || this == REFERENCE;
  }

  public boolean isScalar() {
    return this == BOOLEAN
        || this == NUMBER
        || this == CHARACTER
        || this == STRING
        || this == ENUM;
  }

  /** Type name used in error messages, {@code null} for the null reference. */
  public static String typeName(@Nullable final Object value) {
    return value == null ? "null" : value.getClass().getName();
  }
}
