package probity.stacktrace;

import java.util.Arrays;
import java.util.function.Function;
import java.util.stream.Stream;

/** Fallback walker reading the stack of a freshly created {@link Throwable}. */
final class ThrowableStackWalker extends AbstractStackWalker {

  @Override
  public boolean isEnabled() {
    return true;
  }

  @Override
  <T> T doGetStack(Function<Stream<StackTraceElement>, T> consumer) {
    final StackTraceElement[] stack = new Throwable().getStackTrace();
    return consumer.apply(Arrays.stream(stack));
  }
}
