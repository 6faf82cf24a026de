package probity.stacktrace;

import java.util.Objects;
import javax.annotation.Nullable;

/**
 * One call-stack entry. Frames produced by a {@link StackWalker} are raw and may carry a missing
 * file or a non-positive line; frames returned by {@link Frames#filter} are always well-formed.
 */
public final class Frame {

  @Nullable private final String function;
  @Nullable private final String file;
  private final int line;

  public Frame(@Nullable final String function, @Nullable final String file, final int line) {
    this.function = function;
    this.file = file;
    this.line = line;
  }

  /** Raw frame with a module/class-loader qualified function name, as the JDK prints it. */
  public static Frame of(final StackTraceElement element) {
    return new Frame(qualifiedFunction(element), element.getFileName(), element.getLineNumber());
  }

  /** app//com.foo.Bar.run, java.base/java.lang.Thread.run, com.foo.Bar.run */
  static String qualifiedFunction(final StackTraceElement element) {
    final StringBuilder sb = new StringBuilder();
    final String loader = element.getClassLoaderName();
    final String module = element.getModuleName();
    if (loader != null && !loader.isEmpty()) {
      sb.append(loader).append('/');
    }
    if (module != null && !module.isEmpty()) {
      sb.append(module);
      final String version = element.getModuleVersion();
      if (version != null && !version.isEmpty()) {
        sb.append('@').append(version);
      }
      sb.append('/');
    } else if (sb.length() > 0) {
      sb.append('/');
    }
    return sb.append(element.getClassName()).append('.').append(element.getMethodName()).toString();
  }

  @Nullable
  public String getFunction() {
    return function;
  }

  @Nullable
  public String getFile() {
    return file;
  }

  public int getLine() {
    return line;
  }

  public boolean isWellFormed() {
    return function != null && !function.isEmpty() && file != null && !file.isEmpty() && line >= 1;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Frame frame = (Frame) o;
    return line == frame.line
        && Objects.equals(function, frame.function)
        && Objects.equals(file, frame.file);
  }

  @Override
  public int hashCode() {
    return Objects.hash(function, file, line);
  }

  /** Same shape as {@link StackTraceElement#toString()}. */
  @Override
  public String toString() {
    final String location;
    if (file == null) {
      location = line == -2 ? "Native Method" : "Unknown Source";
    } else {
      location = line >= 0 ? file + ":" + line : file;
    }
    return function + "(" + location + ")";
  }
}
