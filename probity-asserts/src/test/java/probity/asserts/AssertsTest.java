package probity.asserts;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.Closeable;
import java.io.IOException;
import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import probity.stacktrace.CaptureConfig;
import probity.stacktrace.Frame;

public class AssertsTest {

  private static final String TEST_CLASS = AssertsTest.class.getName();

  private RecordingFailureSink sink;
  private Asserts asserts;

  @BeforeEach
  public void setUp() {
    sink = new RecordingFailureSink();
    asserts = Asserts.builder().failureSink(sink).build();
  }

  private static Map<String, Object> map(final Object... keyValues) {
    final Map<String, Object> map = new HashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      map.put((String) keyValues[i], keyValues[i + 1]);
    }
    return map;
  }

  private void assertFailedWith(final String message) {
    assertEquals(1, sink.getFailures().size(), sink.getFailures().toString());
    assertEquals(message, sink.lastMessage());
    sink.clear();
  }

  private void assertFailedContaining(final String fragment) {
    assertEquals(1, sink.getFailures().size(), sink.getFailures().toString());
    assertTrue(sink.lastMessage().contains(fragment), sink.lastMessage());
    sink.clear();
  }

  private void assertNoFailures() {
    assertTrue(sink.getFailures().isEmpty(), sink.getFailures().toString());
  }

  @Test
  public void equal_compares_deeply() {
    assertTrue(asserts.equal(Arrays.asList(1, 2), Arrays.asList(1, 2)));
    assertTrue(asserts.equal(map("a", new int[] {1}), map("a", new int[] {1})));
    assertTrue(asserts.equal(null, null));
    assertNoFailures();

    assertFalse(asserts.equal(1, 2));
    final Failure failure = sink.lastFailure();
    assertNotNull(failure);
    assertTrue(failure.isComparison());
    assertEquals(1, failure.getExpected());
    assertEquals(2, failure.getActual());
    assertFailedWith("values not equal: expected: 1 actual: 2");
  }

  @Test
  public void equal_distinguishes_numeric_types() {
    assertFalse(asserts.equal(1, 1L));
    assertFailedContaining("values not equal");
  }

  @Test
  public void equal_prints_array_contents() {
    assertFalse(asserts.equal(new int[] {1, 2}, new int[] {1, 3}));
    assertFailedWith("values not equal: expected: [1, 2] actual: [1, 3]");
  }

  @Test
  public void not_equal() {
    assertTrue(asserts.notEqual("a", "b"));
    assertNoFailures();

    assertFalse(asserts.notEqual(Arrays.asList("a"), Arrays.asList("a")));
    assertFailedWith("values unexpectedly equal: not expected: [a] actual: [a]");
  }

  @Test
  public void same_uses_identity() {
    final List<String> list = new ArrayList<>();
    assertTrue(asserts.same(list, list));
    assertNoFailures();

    assertFalse(asserts.same(list, new ArrayList<String>()));
    assertFailedContaining("expected same reference, but got different: java.util.ArrayList@");
  }

  @Test
  public void nil_and_not_nil() {
    assertTrue(asserts.isNil(null));
    assertTrue(asserts.isNil(Optional.empty()));
    assertTrue(asserts.notNil("x"));
    assertNoFailures();

    assertFalse(asserts.isNil("x"));
    assertFailedWith("expected nil, but got: x");
    assertFalse(asserts.notNil(null));
    assertFailedWith("expected non-nil value, but got nil");
  }

  @Test
  public void empty_and_not_empty() {
    assertTrue(asserts.empty(""));
    assertTrue(asserts.empty(Collections.emptyList()));
    assertTrue(asserts.empty(0));
    assertTrue(asserts.notEmpty(Collections.singletonMap("k", "v")));
    assertNoFailures();

    assertFalse(asserts.empty(Arrays.asList(1)));
    assertFailedWith("expected empty value, but got: [1]");
    assertFalse(asserts.notEmpty(new int[0]));
    assertFailedWith("expected non-empty value, but got empty: []");
  }

  @Test
  public void zero_values() {
    assertTrue(asserts.isZero(0));
    assertTrue(asserts.isZero(0.0));
    assertTrue(asserts.isZero(false));
    assertTrue(asserts.isZero(""));
    assertNoFailures();

    assertFalse(asserts.isZero(7));
    assertFailedWith("expected zero value, but got: 7");
  }

  @Test
  public void booleans() {
    assertTrue(asserts.isTrue(true));
    assertTrue(asserts.isFalse(false));
    assertNoFailures();

    assertFalse(asserts.isTrue(false));
    assertFailedWith("expected true, but got false");
    assertFalse(asserts.isFalse(true));
    assertFailedWith("expected false, but got true");
  }

  @Test
  public void errors() {
    final IOException error = new IOException("disk on fire");
    assertTrue(asserts.noError(null));
    assertTrue(asserts.error(error));
    assertTrue(asserts.errorContains(error, "fire"));
    assertNoFailures();

    assertFalse(asserts.noError(error));
    assertFailedWith("unexpected error: java.io.IOException: disk on fire");
    assertFalse(asserts.error(null));
    assertFailedWith("expected an error, but got null");
    assertFalse(asserts.errorContains(null, "fire"));
    assertFailedWith("expected an error, but got null");
    assertFalse(asserts.errorContains(error, "water"));
    assertFailedWith("expected error message to contain \"water\", but got \"disk on fire\"");
  }

  @Test
  public void panics() {
    assertTrue(
        asserts.panics(
            () -> {
              throw new IllegalStateException("boom");
            }));
    assertTrue(asserts.notPanics(() -> {}));
    assertNoFailures();

    assertFalse(asserts.panics(() -> {}));
    assertFailedWith("expected panic, but none occurred");
    assertFalse(
        asserts.notPanics(
            () -> {
              throw new IllegalStateException("boom");
            }));
    assertFailedWith("unexpected panic: java.lang.IllegalStateException: boom");
  }

  @Test
  public void panics_with_value() {
    assertTrue(
        asserts.panicsWithValue(
            new IllegalStateException("boom"),
            () -> {
              throw new IllegalStateException("boom");
            }));
    assertNoFailures();

    assertFalse(
        asserts.panicsWithValue(
            new IllegalStateException("boom"),
            () -> {
              throw new IllegalArgumentException("boom");
            }));
    assertFailedContaining("but got java.lang.IllegalArgumentException: boom");
    assertFalse(asserts.panicsWithValue(new IllegalStateException("boom"), () -> {}));
    assertFailedWith("expected panic, but none occurred");
  }

  @Test
  public void contains_and_not_contains() {
    assertTrue(asserts.contains("hello world", "world"));
    assertTrue(
        asserts.contains(Arrays.asList(Arrays.asList(1), Arrays.asList(2)), Arrays.asList(2)));
    assertTrue(asserts.contains(map("k", 1), "k"));
    assertTrue(asserts.notContains(new int[] {1, 2}, 3));
    assertNoFailures();

    assertFalse(asserts.contains(Arrays.asList(1, 2), 3));
    assertFailedWith("expected [1, 2] to contain 3, but it did not");
    assertFalse(asserts.notContains("abc", "b"));
    assertFailedWith("expected abc to not contain b, but it did");
  }

  @Test
  public void contains_reports_engine_errors() {
    assertFalse(asserts.contains("abc", 1));
    assertFailedWith("item must be a string when container is a string, got java.lang.Integer");
    assertFalse(asserts.contains(42, 1));
    assertFailedWith("unsupported container type: java.lang.Integer");
  }

  @Test
  public void has_length() {
    assertTrue(asserts.hasLength("abc", 3));
    assertTrue(asserts.hasLength(new long[] {1, 2}, 2));
    assertTrue(asserts.hasLength(map("a", 1), 1));
    assertNoFailures();

    assertFalse(asserts.hasLength(Arrays.asList(1, 2), 3));
    assertFailedWith("expected length 3, but got 2");
    assertFalse(asserts.hasLength(5, 1));
    assertFailedWith("unsupported type for length check: java.lang.Integer");
  }

  @Test
  public void subset() {
    assertTrue(asserts.subset(Arrays.asList(1, 2, 3), Arrays.asList(3, 1)));
    assertTrue(asserts.subset(Arrays.asList(1), Arrays.asList(1, 1)));
    assertTrue(asserts.subset(map("a", 1, "b", 2), map("b", 2)));
    assertNoFailures();

    assertFalse(asserts.subset(Arrays.asList(1, 2), Arrays.asList(4)));
    assertFailedWith("expected [4] to be a subset of [1, 2], but it's not");
    assertFalse(asserts.subset(map("a", 1), Arrays.asList(1)));
    assertFailedContaining("cannot check java.util.Arrays$ArrayList as a subset of");
  }

  @Test
  public void same_elements() {
    assertTrue(asserts.sameElements(Arrays.asList(1, 2, 2), Arrays.asList(2, 1, 2)));
    assertNoFailures();

    assertFalse(asserts.sameElements(Arrays.asList(1, 2, 2), Arrays.asList(1, 1, 2)));
    assertFailedContaining("expected same elements in both sequences");
    assertFalse(asserts.sameElements("ab", Arrays.asList("a", "b")));
    assertFailedWith("first argument must be a sequence, got java.lang.String");
    assertFalse(
        asserts.sameElements(
            Arrays.asList(Arrays.asList(1)), Arrays.asList(Arrays.asList(1))));
    assertFailedContaining("unsupported element type for comparison");
  }

  @Test
  public void elements_match_accepts_nested_containers() {
    assertTrue(
        asserts.elementsMatch(
            Arrays.asList(Arrays.asList(1), Arrays.asList(2)),
            Arrays.asList(Arrays.asList(2), Arrays.asList(1))));
    assertNoFailures();

    assertFalse(asserts.elementsMatch(Arrays.asList(1, 2), Arrays.asList(1, 3)));
    assertFailedWith("element lists are not equal: expected: [1, 2] actual: [1, 3]");
  }

  @Test
  public void ordering() {
    assertTrue(asserts.greater(2, 1));
    assertTrue(asserts.greater(2.5, 2L));
    assertTrue(asserts.greaterOrEqual(2, 2.0));
    assertTrue(asserts.less(1, 2));
    assertTrue(asserts.lessOrEqual(2, 2));
    assertNoFailures();

    assertFalse(asserts.greater(1, 1));
    assertFailedWith("expected 1 to be greater than 1");
    assertFalse(asserts.less(3, 2));
    assertFailedWith("expected 3 to be less than 2");
    assertFalse(asserts.greaterOrEqual(1, 2));
    assertFailedWith("expected 1 to be greater than or equal to 2");
    assertFalse(asserts.lessOrEqual(3, 2));
    assertFailedWith("expected 3 to be less than or equal to 2");
    assertFalse(asserts.greater("a", 1));
    assertFailedWith(
        "failed to compare values: unsupported numeric types: "
            + "java.lang.String vs java.lang.Integer");
  }

  @Test
  public void tolerances() {
    assertTrue(asserts.inDelta(1.0, 1.05, 0.1));
    assertTrue(asserts.inEpsilon(100, 101, 0.02));
    assertTrue(asserts.inEpsilon(0, 0, 0.01));
    assertNoFailures();

    assertFalse(asserts.inDelta(1, 2, 0.5));
    assertFailedWith("expected 2 to be within 0.5 of 1, but difference was 1.0");
    assertFalse(asserts.inEpsilon(100, 200, 0.01));
    assertFailedContaining("expected 200 to be within 1.0% of 100");
    assertFalse(asserts.inDelta("x", 1, 0.5));
    assertFailedContaining("expected value is not numeric");
  }

  @Test
  public void within_duration() {
    final Instant now = Instant.parse("2024-01-01T00:00:00Z");
    assertTrue(asserts.withinDuration(now, now.plusSeconds(1), Duration.ofSeconds(1)));
    assertTrue(asserts.withinDuration(now, now.minusSeconds(1), Duration.ofSeconds(1)));
    assertNoFailures();

    assertFalse(asserts.withinDuration(now, now.plusSeconds(5), Duration.ofSeconds(1)));
    assertFailedContaining("but difference was PT-5S");
  }

  @Test
  public void types() {
    assertTrue(asserts.isOfType(String.class, "x"));
    assertTrue(asserts.sameType(1, 2));
    assertTrue(asserts.implementsCapability(Serializable.class, "x"));
    assertNoFailures();

    assertFalse(asserts.isOfType(Integer.class, "x"));
    assertFailedWith("expected type java.lang.Integer, but got java.lang.String");
    assertFalse(asserts.isOfType(Integer.class, null));
    assertFailedWith("expected type java.lang.Integer, but got null");
    assertFalse(asserts.sameType(1, 1L));
    assertFailedWith("expected type java.lang.Integer, but got java.lang.Long");
    assertFalse(asserts.implementsCapability(Closeable.class, "x"));
    assertFailedWith("expected java.lang.String to implement java.io.Closeable, but it does not");
  }

  @Test
  public void strings() {
    assertTrue(asserts.matchesRegex("order-42", "\\d+"));
    assertTrue(asserts.hasPrefix("order-42", "order"));
    assertTrue(asserts.hasSuffix("order-42", "42"));
    assertNoFailures();

    assertFalse(asserts.matchesRegex("order", "^\\d+$"));
    assertFailedWith("expected string \"order\" to match regex \"^\\d+$\", but it did not");
    assertFalse(asserts.matchesRegex("order", "("));
    assertFailedContaining("invalid regex pattern");
    assertFalse(asserts.hasPrefix("order", "x"));
    assertFailedWith("expected string \"order\" to have prefix \"x\", but it did not");
    assertFalse(asserts.hasSuffix("order", "x"));
    assertFailedWith("expected string \"order\" to have suffix \"x\", but it did not");
  }

  @Test
  public void json_equal_ignores_formatting_and_key_order() {
    assertTrue(asserts.jsonEqual("{\"a\": 1, \"b\": [1, 2]}", "{\"b\":[1,2],\"a\":1.0}"));
    assertNoFailures();

    assertFalse(asserts.jsonEqual("{\"a\": 1}", "{\"a\": 2}"));
    assertFailedContaining("JSON not equal");
    assertFalse(asserts.jsonEqual("{", "{}"));
    assertFailedContaining("failed to unmarshal expected JSON");
    assertFalse(asserts.jsonEqual("{}", "[1,"));
    assertFailedContaining("failed to unmarshal actual JSON");
  }

  @Test
  public void failure_trace_starts_at_caller() {
    asserts.equal(1, 2);

    final Frame top = sink.lastFailure().getStackTrace().frames().get(0);
    assertEquals(TEST_CLASS + ".failure_trace_starts_at_caller", top.getFunction());
    assertEquals("AssertsTest.java", top.getFile());
  }

  @Test
  public void every_failure_kind_starts_at_caller() {
    asserts.isNil("x");
    asserts.contains(1, 1);
    asserts.greater(0, 1);
    asserts.jsonEqual("{", "{}");
    asserts.panics(() -> {});

    assertEquals(5, sink.getFailures().size());
    for (final Failure failure : sink.getFailures()) {
      assertEquals(
          TEST_CLASS + ".every_failure_kind_starts_at_caller",
          failure.getStackTrace().frames().get(0).getFunction(),
          failure.getMessage());
    }
  }

  @Test
  public void frame_limit_bounds_failure_trace() {
    final Asserts limited = Asserts.builder().failureSink(sink).frameLimit(1).build();

    limited.isTrue(false);

    assertEquals(1, sink.lastFailure().getStackTrace().frames().size());
  }

  @Test
  public void zero_buffer_yields_empty_trace() {
    final Asserts blind =
        Asserts.builder().failureSink(sink).captureConfig(new CaptureConfig(0, 2)).build();

    assertFalse(blind.isTrue(false));

    assertTrue(sink.lastFailure().getStackTrace().frames().isEmpty());
    assertEquals("expected true, but got false", sink.lastMessage());
  }

  @Test
  public void builder_rejects_invalid_arguments() {
    assertThrows(IllegalArgumentException.class, () -> Asserts.builder().frameLimit(-1));
    assertThrows(IllegalArgumentException.class, () -> Asserts.builder().failureSink(null));
    assertThrows(IllegalArgumentException.class, () -> Asserts.builder().captureConfig(null));
  }
}
