package probity.asserts;

import javax.annotation.Nullable;
import probity.stacktrace.StackTrace;

/** A failed assertion: message, compared values when there are any, and where it happened. */
public final class Failure {

  private final String message;
  @Nullable private final Object expected;
  @Nullable private final Object actual;
  private final boolean comparison;
  private final StackTrace stackTrace;

  Failure(
      final String message,
      @Nullable final Object expected,
      @Nullable final Object actual,
      final boolean comparison,
      final StackTrace stackTrace) {
    this.message = message;
    this.expected = expected;
    this.actual = actual;
    this.comparison = comparison;
    this.stackTrace = stackTrace;
  }

  public String getMessage() {
    return message;
  }

  /** Whether {@link #getExpected()} and {@link #getActual()} carry the compared values. */
  public boolean isComparison() {
    return comparison;
  }

  @Nullable
  public Object getExpected() {
    return expected;
  }

  @Nullable
  public Object getActual() {
    return actual;
  }

  /** Already limited to the frame count configured on {@link Asserts}. */
  public StackTrace getStackTrace() {
    return stackTrace;
  }

  /** Message followed by the rendered frames. */
  public String describe() {
    return message + "\n--- Stack trace ---\n" + stackTrace.render() + "\n-------------------";
  }

  @Override
  public String toString() {
    return message;
  }
}
