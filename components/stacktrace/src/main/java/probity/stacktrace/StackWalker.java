package probity.stacktrace;

import java.util.function.Function;
import java.util.stream.Stream;

public interface StackWalker {

  boolean isEnabled();

  /**
   * Stack is streamed innermost first, without any frame of the capture machinery itself. Frames
   * are raw: nothing is filtered or normalized.
   */
  <T> T walk(Function<Stream<Frame>, T> consumer);
}
