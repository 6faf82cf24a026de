package probity.stacktrace;

import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class StackWalkerFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(StackWalkerFactory.class);

  public static final StackWalker INSTANCE;

  static {
    Stream<StackWalker> stream = Stream.of(jdk9()).map(Supplier::get);
    INSTANCE =
        stream
            .filter(Objects::nonNull)
            .filter(StackWalker::isEnabled)
            .findFirst()
            .orElseGet(throwableStackWalker());
    LOGGER.debug("Using {} for stack trace capture", INSTANCE.getClass().getSimpleName());
  }

  private StackWalkerFactory() {}

  private static Supplier<StackWalker> throwableStackWalker() {
    return ThrowableStackWalker::new;
  }

  private static Supplier<StackWalker> jdk9() {
    return () -> {
      try {
        return new Jdk9StackWalker();
      } catch (Throwable e) {
        LOGGER.warn("Jdk9StackWalker not available", e);
        return null;
      }
    };
  }
}
