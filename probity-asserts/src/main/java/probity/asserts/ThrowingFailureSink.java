package probity.asserts;

import org.opentest4j.AssertionFailedError;

/** Fails the running test by throwing an {@link AssertionFailedError}. */
public final class ThrowingFailureSink implements FailureSink {

  public static final ThrowingFailureSink INSTANCE = new ThrowingFailureSink();

  private ThrowingFailureSink() {}

  @Override
  public void fail(final Failure failure) {
    if (failure.isComparison()) {
      throw new AssertionFailedError(
          failure.describe(), failure.getExpected(), failure.getActual());
    }
    throw new AssertionFailedError(failure.describe());
  }
}
