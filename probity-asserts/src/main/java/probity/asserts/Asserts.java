package probity.asserts;

import com.squareup.moshi.JsonAdapter;
import com.squareup.moshi.JsonDataException;
import com.squareup.moshi.Moshi;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import probity.compare.ComparisonException;
import probity.compare.Comparisons;
import probity.compare.DeepEquality;
import probity.compare.Numbers;
import probity.compare.Tolerance;
import probity.compare.ValueKind;
import probity.stacktrace.CaptureConfig;
import probity.stacktrace.StackTrace;
import probity.stacktrace.StackTraces;

/**
 * Assertions over arbitrary values. Each method returns {@code true} when the assertion holds;
 * otherwise it reports a {@link Failure} to the configured {@link FailureSink} and returns {@code
 * false} if the sink did not throw.
 *
 * <p>Every failure carries a stack trace whose first frame is the caller of the assertion method.
 * This relies on every public method reporting through {@link #fail} or {@link #failComparing}
 * directly, which is what {@link CaptureConfig#DEFAULT_SKIP_FRAMES} accounts for.
 */
public final class Asserts {

  private static final Logger LOGGER = LoggerFactory.getLogger(Asserts.class);

  public static final int DEFAULT_FRAME_LIMIT = 10;

  private static final Asserts STANDARD = builder().build();

  private static final JsonAdapter<Object> JSON = new Moshi.Builder().build().adapter(Object.class);

  private final FailureSink failureSink;
  private final CaptureConfig captureConfig;
  private final int frameLimit;

  private Asserts(final Builder builder) {
    this.failureSink = builder.failureSink;
    this.captureConfig = builder.captureConfig;
    this.frameLimit = builder.frameLimit;
  }

  /** Shared instance failing the test with an {@code AssertionFailedError}. */
  public static Asserts standard() {
    return STANDARD;
  }

  public static Builder builder() {
    return new Builder();
  }

  // ---------------- equality ----------------

  public boolean equal(@Nullable final Object expected, @Nullable final Object actual) {
    if (DeepEquality.deepEquals(expected, actual)) {
      return true;
    }
    return failComparing(
        "values not equal: expected: "
            + Messages.describe(expected)
            + " actual: "
            + Messages.describe(actual),
        expected,
        actual);
  }

  public boolean notEqual(@Nullable final Object notExpected, @Nullable final Object actual) {
    if (!DeepEquality.deepEquals(notExpected, actual)) {
      return true;
    }
    return fail(
        "values unexpectedly equal: not expected: "
            + Messages.describe(notExpected)
            + " actual: "
            + Messages.describe(actual));
  }

  /** Reference identity. */
  public boolean same(@Nullable final Object expected, @Nullable final Object actual) {
    if (expected == actual) {
      return true;
    }
    return failComparing(
        "expected same reference, but got different: "
            + Messages.identity(expected)
            + " vs "
            + Messages.identity(actual),
        expected,
        actual);
  }

  public boolean jsonEqual(final String expected, final String actual) {
    final Object expectedJson;
    final Object actualJson;
    try {
      expectedJson = JSON.fromJson(expected);
    } catch (IOException | JsonDataException e) {
      return fail("failed to unmarshal expected JSON: " + e.getMessage());
    }
    try {
      actualJson = JSON.fromJson(actual);
    } catch (IOException | JsonDataException e) {
      return fail("failed to unmarshal actual JSON: " + e.getMessage());
    }
    if (DeepEquality.deepEquals(expectedJson, actualJson)) {
      return true;
    }
    return failComparing(
        "JSON not equal: expected: " + expectedJson + " actual: " + actualJson, expected, actual);
  }

  // ---------------- nil, empty, zero ----------------

  public boolean isNil(@Nullable final Object actual) {
    if (Comparisons.isNil(actual)) {
      return true;
    }
    return fail("expected nil, but got: " + Messages.describe(actual));
  }

  public boolean notNil(@Nullable final Object value) {
    if (!Comparisons.isNil(value)) {
      return true;
    }
    return fail("expected non-nil value, but got nil");
  }

  public boolean empty(@Nullable final Object value) {
    if (Comparisons.isEmpty(value)) {
      return true;
    }
    return fail("expected empty value, but got: " + Messages.describe(value));
  }

  public boolean notEmpty(@Nullable final Object value) {
    if (!Comparisons.isEmpty(value)) {
      return true;
    }
    return fail("expected non-empty value, but got empty: " + Messages.describe(value));
  }

  public boolean isZero(@Nullable final Object value) {
    if (Comparisons.isZero(value)) {
      return true;
    }
    return fail("expected zero value, but got: " + Messages.describe(value));
  }

  // ---------------- booleans and errors ----------------

  public boolean isTrue(final boolean condition) {
    if (condition) {
      return true;
    }
    return fail("expected true, but got false");
  }

  public boolean isFalse(final boolean condition) {
    if (!condition) {
      return true;
    }
    return fail("expected false, but got true");
  }

  public boolean noError(@Nullable final Throwable error) {
    if (error == null) {
      return true;
    }
    return fail("unexpected error: " + error);
  }

  public boolean error(@Nullable final Throwable error) {
    if (error != null) {
      return true;
    }
    return fail("expected an error, but got null");
  }

  public boolean errorContains(@Nullable final Throwable error, final String substring) {
    if (error == null) {
      return fail("expected an error, but got null");
    }
    final String message = error.getMessage() == null ? "" : error.getMessage();
    if (message.contains(substring)) {
      return true;
    }
    return fail(
        "expected error message to contain \"" + substring + "\", but got \"" + message + "\"");
  }

  // ---------------- thrown faults ----------------

  public boolean panics(final ThrowingRunnable fn) {
    try {
      fn.run();
    } catch (Throwable t) {
      return true;
    }
    return fail("expected panic, but none occurred");
  }

  public boolean notPanics(final ThrowingRunnable fn) {
    try {
      fn.run();
    } catch (Throwable t) {
      LOGGER.debug("Unexpected panic", t);
      return fail("unexpected panic: " + t);
    }
    return true;
  }

  /** Passes when {@code fn} throws a throwable with the class and message of {@code expected}. */
  public boolean panicsWithValue(final Throwable expected, final ThrowingRunnable fn) {
    Throwable thrown = null;
    try {
      fn.run();
    } catch (Throwable t) {
      thrown = t;
    }
    if (thrown == null) {
      return fail("expected panic, but none occurred");
    }
    if (thrown.getClass() == expected.getClass()
        && Objects.equals(thrown.getMessage(), expected.getMessage())) {
      return true;
    }
    return failComparing(
        "expected panic value " + expected + ", but got " + thrown, expected, thrown);
  }

  // ---------------- containers ----------------

  public boolean contains(@Nullable final Object container, @Nullable final Object item) {
    final boolean exists;
    try {
      exists = Comparisons.contains(container, item);
    } catch (ComparisonException e) {
      return fail(e.getMessage());
    }
    if (exists) {
      return true;
    }
    return fail(
        "expected "
            + Messages.describe(container)
            + " to contain "
            + Messages.describe(item)
            + ", but it did not");
  }

  public boolean notContains(@Nullable final Object container, @Nullable final Object item) {
    final boolean exists;
    try {
      exists = Comparisons.contains(container, item);
    } catch (ComparisonException e) {
      return fail(e.getMessage());
    }
    if (!exists) {
      return true;
    }
    return fail(
        "expected "
            + Messages.describe(container)
            + " to not contain "
            + Messages.describe(item)
            + ", but it did");
  }

  /** Strings, arrays, collections and maps. */
  public boolean hasLength(@Nullable final Object object, final int length) {
    final int actual;
    try {
      actual = Comparisons.length(object);
    } catch (ComparisonException e) {
      return fail(e.getMessage());
    }
    if (actual == length) {
      return true;
    }
    return failComparing("expected length " + length + ", but got " + actual, length, actual);
  }

  /** Existence only: duplicates in {@code subset} need a single occurrence in {@code list}. */
  public boolean subset(@Nullable final Object list, @Nullable final Object subset) {
    final boolean contained;
    try {
      contained = Comparisons.subset(list, subset);
    } catch (ComparisonException e) {
      return fail(e.getMessage());
    }
    if (contained) {
      return true;
    }
    return fail(
        "expected "
            + Messages.describe(subset)
            + " to be a subset of "
            + Messages.describe(list)
            + ", but it's not");
  }

  /** Same elements with the same multiplicity; elements must not be containers. */
  public boolean sameElements(@Nullable final Object a, @Nullable final Object b) {
    final boolean same;
    try {
      same = Comparisons.sameElements(a, b);
    } catch (ComparisonException e) {
      return fail(e.getMessage());
    }
    if (same) {
      return true;
    }
    return failComparing(
        "expected same elements in both sequences: "
            + Messages.describe(a)
            + " vs "
            + Messages.describe(b),
        a,
        b);
  }

  /** Like {@link #sameElements} but accepts nested containers as elements. */
  public boolean elementsMatch(@Nullable final Object listA, @Nullable final Object listB) {
    final boolean match;
    try {
      match = Comparisons.matchElements(listA, listB);
    } catch (ComparisonException e) {
      return fail(e.getMessage());
    }
    if (match) {
      return true;
    }
    return failComparing(
        "element lists are not equal: expected: "
            + Messages.describe(listA)
            + " actual: "
            + Messages.describe(listB),
        listA,
        listB);
  }

  // ---------------- ordering and tolerance ----------------

  public boolean greater(@Nullable final Object a, @Nullable final Object b) {
    final int cmp;
    try {
      cmp = Numbers.compare(a, b);
    } catch (ComparisonException e) {
      return fail("failed to compare values: " + e.getMessage());
    }
    if (cmp > 0) {
      return true;
    }
    return fail("expected " + a + " to be greater than " + b);
  }

  public boolean greaterOrEqual(@Nullable final Object a, @Nullable final Object b) {
    final int cmp;
    try {
      cmp = Numbers.compare(a, b);
    } catch (ComparisonException e) {
      return fail("failed to compare values: " + e.getMessage());
    }
    if (cmp >= 0) {
      return true;
    }
    return fail("expected " + a + " to be greater than or equal to " + b);
  }

  public boolean less(@Nullable final Object a, @Nullable final Object b) {
    final int cmp;
    try {
      cmp = Numbers.compare(a, b);
    } catch (ComparisonException e) {
      return fail("failed to compare values: " + e.getMessage());
    }
    if (cmp < 0) {
      return true;
    }
    return fail("expected " + a + " to be less than " + b);
  }

  public boolean lessOrEqual(@Nullable final Object a, @Nullable final Object b) {
    final int cmp;
    try {
      cmp = Numbers.compare(a, b);
    } catch (ComparisonException e) {
      return fail("failed to compare values: " + e.getMessage());
    }
    if (cmp <= 0) {
      return true;
    }
    return fail("expected " + a + " to be less than or equal to " + b);
  }

  public boolean inDelta(
      @Nullable final Object expected, @Nullable final Object actual, final double delta) {
    final Tolerance tolerance;
    try {
      tolerance = Numbers.withinDelta(expected, actual, delta);
    } catch (ComparisonException e) {
      return fail(e.getMessage());
    }
    if (tolerance.isWithin()) {
      return true;
    }
    return fail(
        "expected "
            + actual
            + " to be within "
            + delta
            + " of "
            + expected
            + ", but difference was "
            + Math.abs(tolerance.getDifference()));
  }

  /** Relative tolerance; {@code epsilon} is a fraction, 0.01 meaning 1%. */
  public boolean inEpsilon(
      @Nullable final Object expected, @Nullable final Object actual, final double epsilon) {
    final Tolerance tolerance;
    try {
      tolerance = Numbers.withinEpsilon(expected, actual, epsilon);
    } catch (ComparisonException e) {
      return fail(e.getMessage());
    }
    if (tolerance.isWithin()) {
      return true;
    }
    return fail(
        "expected "
            + actual
            + " to be within "
            + epsilon * 100
            + "% of "
            + expected
            + ", but difference was "
            + tolerance.getDifference() * 100
            + "%");
  }

  public boolean withinDuration(
      final Instant expected, final Instant actual, final Duration delta) {
    final Duration diff = Duration.between(actual, expected);
    if (diff.compareTo(delta.negated()) >= 0 && diff.compareTo(delta) <= 0) {
      return true;
    }
    return fail(
        "expected time "
            + actual
            + " to be within "
            + delta
            + " of "
            + expected
            + ", but difference was "
            + diff);
  }

  // ---------------- types ----------------

  public boolean isOfType(final Class<?> expectedType, @Nullable final Object obj) {
    if (obj != null && obj.getClass() == expectedType) {
      return true;
    }
    return failComparing(
        "expected type " + expectedType.getName() + ", but got " + ValueKind.typeName(obj),
        expectedType,
        obj == null ? null : obj.getClass());
  }

  /** Both values have exactly the same runtime class. */
  public boolean sameType(@Nullable final Object expected, @Nullable final Object actual) {
    if (Comparisons.isSameType(expected, actual)) {
      return true;
    }
    return fail(
        "expected type "
            + ValueKind.typeName(expected)
            + ", but got "
            + ValueKind.typeName(actual));
  }

  public boolean implementsCapability(final Class<?> capability, @Nullable final Object obj) {
    if (Comparisons.implementsCapability(capability, obj)) {
      return true;
    }
    return fail(
        "expected "
            + ValueKind.typeName(obj)
            + " to implement "
            + capability.getName()
            + ", but it does not");
  }

  // ---------------- strings ----------------

  public boolean matchesRegex(final String str, final String pattern) {
    final boolean matched;
    try {
      matched = Pattern.compile(pattern).matcher(str).find();
    } catch (PatternSyntaxException e) {
      return fail("invalid regex pattern: " + e.getMessage());
    }
    if (matched) {
      return true;
    }
    return fail(
        "expected string \"" + str + "\" to match regex \"" + pattern + "\", but it did not");
  }

  public boolean hasPrefix(final String str, final String prefix) {
    if (str.startsWith(prefix)) {
      return true;
    }
    return fail(
        "expected string \"" + str + "\" to have prefix \"" + prefix + "\", but it did not");
  }

  public boolean hasSuffix(final String str, final String suffix) {
    if (str.endsWith(suffix)) {
      return true;
    }
    return fail(
        "expected string \"" + str + "\" to have suffix \"" + suffix + "\", but it did not");
  }

  // ---------------- reporting ----------------

  private boolean fail(final String message) {
    final StackTrace stackTrace = StackTraces.capture(captureConfig);
    report(new Failure(message, null, null, false, stackTrace.limit(frameLimit)), stackTrace);
    return false;
  }

  private boolean failComparing(
      final String message, @Nullable final Object expected, @Nullable final Object actual) {
    final StackTrace stackTrace = StackTraces.capture(captureConfig);
    report(new Failure(message, expected, actual, true, stackTrace.limit(frameLimit)), stackTrace);
    return false;
  }

  private void report(final Failure failure, final StackTrace stackTrace) {
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Assertion failed: {}\n{}", failure.getMessage(), stackTrace);
    }
    failureSink.fail(failure);
  }

  public static final class Builder {
    private FailureSink failureSink = ThrowingFailureSink.INSTANCE;
    private CaptureConfig captureConfig = CaptureConfig.DEFAULT;
    private int frameLimit = DEFAULT_FRAME_LIMIT;

    private Builder() {}

    public Builder failureSink(final FailureSink failureSink) {
      if (failureSink == null) {
        throw new IllegalArgumentException("failureSink cannot be null");
      }
      this.failureSink = failureSink;
      return this;
    }

    /**
     * Stack capture parameters. The skip count must keep accounting for the two frames of the
     * assertion method and its reporting helper for failures to start at the caller.
     */
    public Builder captureConfig(final CaptureConfig captureConfig) {
      if (captureConfig == null) {
        throw new IllegalArgumentException("captureConfig cannot be null");
      }
      this.captureConfig = captureConfig;
      return this;
    }

    /** Number of frames kept in each failure's stack trace. */
    public Builder frameLimit(final int frameLimit) {
      if (frameLimit < 0) {
        throw new IllegalArgumentException("frameLimit cannot be negative: " + frameLimit);
      }
      this.frameLimit = frameLimit;
      return this;
    }

    public Asserts build() {
      return new Asserts(this);
    }
  }
}
