package probity.stacktrace;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Stream;

public abstract class AbstractStackWalker implements StackWalker {

  private static final Set<String> CAPTURE_CLASSES =
      Collections.unmodifiableSet(
          new HashSet<>(
              Arrays.asList(
                  StackTraces.class.getName(),
                  AbstractStackWalker.class.getName(),
                  Jdk9StackWalker.class.getName(),
                  ThrowableStackWalker.class.getName())));

  @Override
  public <T> T walk(Function<Stream<Frame>, T> consumer) {
    return doGetStack(input -> consumer.apply(doFilterStack(input)));
  }

  final Stream<Frame> doFilterStack(Stream<StackTraceElement> stream) {
    return stream.dropWhile(AbstractStackWalker::isCaptureStackElement).map(Frame::of);
  }

  abstract <T> T doGetStack(Function<Stream<StackTraceElement>, T> consumer);

  static boolean isCaptureStackElement(final StackTraceElement el) {
    String clazz = el.getClassName();
    final int nested = clazz.indexOf('$');
    if (nested > 0) {
      clazz = clazz.substring(0, nested);
    }
    return CAPTURE_CLASSES.contains(clazz);
  }
}
