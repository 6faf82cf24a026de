package probity.stacktrace;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/** Post-processing over raw {@code (function, file, line)} frames, independent of any walker. */
public final class Frames {

  public static final Set<String> DEFAULT_SOURCE_SUFFIXES = Collections.singleton(".java");

  private Frames() {}

  public static List<Frame> filter(final Collection<Frame> frames) {
    return filter(frames, DEFAULT_SOURCE_SUFFIXES);
  }

  /**
   * Drops frames that are not well-formed or do not point at a source file, and normalizes the
   * function name of the remaining ones. Order is preserved.
   */
  public static List<Frame> filter(final Collection<Frame> frames, final Set<String> suffixes) {
    final Predicate<Frame> retained = isSourceFrame(suffixes);
    final List<Frame> filtered = new ArrayList<>(frames.size());
    for (final Frame frame : frames) {
      if (!retained.test(frame)) {
        continue;
      }
      filtered.add(
          new Frame(normalizeFunction(frame.getFunction()), frame.getFile(), frame.getLine()));
    }
    return filtered;
  }

  static Predicate<Frame> isSourceFrame(final Set<String> suffixes) {
    return frame -> frame.isWellFormed() && hasSuffix(frame.getFile(), suffixes);
  }

  private static boolean hasSuffix(final String file, final Set<String> suffixes) {
    for (final String suffix : suffixes) {
      if (file.endsWith(suffix)) {
        return true;
      }
    }
    return false;
  }

  /** app//com.foo.Bar.run -> com.foo.Bar.run; names ending in '/' are kept as they are. */
  public static String normalizeFunction(final String function) {
    final int slash = function.lastIndexOf('/');
    return slash < 0 || slash == function.length() - 1
        ? function
        : function.substring(slash + 1);
  }

  /** One {@code file:line function} line per frame, no trailing newline. */
  public static String render(final List<Frame> frames) {
    final StringBuilder sb = new StringBuilder(frames.size() * 64);
    for (int i = 0; i < frames.size(); i++) {
      if (i > 0) {
        sb.append('\n');
      }
      final Frame frame = frames.get(i);
      sb.append(frame.getFile()).append(':').append(frame.getLine()).append(' ');
      sb.append(frame.getFunction());
    }
    return sb.toString();
  }
}
