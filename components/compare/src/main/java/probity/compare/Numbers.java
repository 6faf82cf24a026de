package probity.compare;

import javax.annotation.Nullable;

/** Numeric coercion and comparison of loosely typed values. */
public final class Numbers {

  /** Absorbs binary floating point representation error; not a tolerance knob. */
  static final double COMPARE_EPSILON = 1e-9;

  private Numbers() {}

  /**
   * Coerces any {@link Number} to {@code double}: integral values convert exactly up to 2^53,
   * {@code Float} widens natively.
   *
   * @throws UnsupportedTypeException if {@code value} is not a number
   */
  public static double toDouble(@Nullable final Object value) throws UnsupportedTypeException {
    if (ValueKind.of(value) != ValueKind.NUMBER) {
      throw new UnsupportedTypeException(
          "unsupported type for numeric comparison: " + ValueKind.typeName(value));
    }
    return ((Number) value).doubleValue();
  }

  /**
   * @return -1, 0 or 1 as {@code a} is less than, equal to (within {@value #COMPARE_EPSILON}) or
   *     greater than {@code b}; a value always compares equal to itself, NaN and infinities
   *     included
   * @throws UnsupportedTypeException naming both operand types if either is not a number
   */
  public static int compare(@Nullable final Object a, @Nullable final Object b)
      throws UnsupportedTypeException {
    final double left;
    final double right;
    try {
      left = toDouble(a);
      right = toDouble(b);
    } catch (UnsupportedTypeException e) {
      throw new UnsupportedTypeException(
          "unsupported numeric types: "
              + ValueKind.typeName(a)
              + " vs "
              + ValueKind.typeName(b),
          e);
    }
    if (Double.compare(left, right) == 0) {
      return 0;
    }
    final double diff = left - right;
    if (Math.abs(diff) < COMPARE_EPSILON) {
      return 0;
    }
    return diff > 0 ? 1 : -1;
  }

  /**
   * Checks {@code |expected - actual| <= delta}. The reported difference is {@code expected -
   * actual}.
   */
  public static Tolerance withinDelta(
      @Nullable final Object expected, @Nullable final Object actual, final double delta)
      throws UnsupportedTypeException {
    final double a = coerce("expected", expected);
    final double b = coerce("actual", actual);
    final double diff = a - b;
    return new Tolerance(Math.abs(diff) <= delta, diff);
  }

  /**
   * Checks the relative difference {@code |a - b| / (|a + b| / 2)} against {@code epsilon}. Equal
   * values pass with a difference of 0, which also covers a mean of 0.
   */
  public static Tolerance withinEpsilon(
      @Nullable final Object expected, @Nullable final Object actual, final double epsilon)
      throws UnsupportedTypeException {
    final double a = coerce("expected", expected);
    final double b = coerce("actual", actual);
    if (a == b) {
      return new Tolerance(true, 0);
    }
    final double relative = Math.abs(a - b) / (Math.abs(a + b) / 2);
    return new Tolerance(relative <= epsilon, relative);
  }

  private static double coerce(final String side, @Nullable final Object value)
      throws UnsupportedTypeException {
    try {
      return toDouble(value);
    } catch (UnsupportedTypeException e) {
      throw new UnsupportedTypeException(side + " value is not numeric: " + e.getMessage(), e);
    }
  }
}
