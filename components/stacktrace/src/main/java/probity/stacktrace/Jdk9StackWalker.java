package probity.stacktrace;

import java.util.function.Function;
import java.util.stream.Stream;

/** Backed by {@link java.lang.StackWalker}, which avoids materializing the whole stack. */
final class Jdk9StackWalker extends AbstractStackWalker {

  private final java.lang.StackWalker walker;

  Jdk9StackWalker() {
    this.walker = java.lang.StackWalker.getInstance();
  }

  @Override
  public boolean isEnabled() {
    try {
      return walker.walk(s -> s.findFirst().isPresent());
    } catch (Throwable t) {
      return false;
    }
  }

  @Override
  <T> T doGetStack(Function<Stream<StackTraceElement>, T> consumer) {
    return walker.walk(
        frames ->
            consumer.apply(frames.map(java.lang.StackWalker.StackFrame::toStackTraceElement)));
  }
}
