package probity.stacktrace;

import java.util.List;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * Entry point of the stack trace subsystem. Captures never throw: degenerate configurations yield
 * an empty snapshot.
 */
public final class StackTraces {

  private StackTraces() {}

  public static StackTrace capture() {
    return capture(StackWalkerFactory.INSTANCE, CaptureConfig.DEFAULT);
  }

  /**
   * Captures the calling thread's stack. With {@code skipFrames == 0} the first frame is the direct
   * caller of this method.
   *
   * @param config buffer and skip parameters, {@link CaptureConfig#DEFAULT} when {@code null}
   */
  public static StackTrace capture(@Nullable final CaptureConfig config) {
    return capture(StackWalkerFactory.INSTANCE, config);
  }

  static StackTrace capture(final StackWalker walker, @Nullable final CaptureConfig config) {
    final CaptureConfig effective = config == null ? CaptureConfig.DEFAULT : config;
    final int bufferSize = effective.getBufferSize();
    final int skip = Math.max(0, effective.getSkipFrames());
    if (bufferSize <= 0) {
      return StackTrace.EMPTY;
    }
    // every raw line takes more than one character, so the frames read also cover the raw text
    final long depth = Math.min((long) skip + bufferSize, Integer.MAX_VALUE);
    final List<Frame> all = walker.walk(s -> s.limit(depth).collect(Collectors.toList()));
    if (skip >= all.size()) {
      return StackTrace.EMPTY;
    }
    final List<Frame> read = all.subList(skip, all.size());
    return new StackTrace(Frames.filter(read), rawText(all, bufferSize));
  }

  static String rawText(final List<Frame> frames, final int bufferSize) {
    final Thread thread = Thread.currentThread();
    final StringBuilder sb = new StringBuilder(Math.min(bufferSize, 4096));
    sb.append('"').append(thread.getName()).append("\" #").append(thread.getId());
    sb.append(" [").append(thread.getState()).append("]:");
    for (final Frame frame : frames) {
      if (sb.length() >= bufferSize) {
        break;
      }
      sb.append("\n\tat ").append(frame);
    }
    if (sb.length() > bufferSize) {
      sb.setLength(bufferSize);
    }
    return sb.toString().trim();
  }
}
