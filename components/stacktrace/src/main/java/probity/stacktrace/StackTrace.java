package probity.stacktrace;

import java.util.Collections;
import java.util.List;

/** Immutable snapshot of filtered frames (innermost first) and the raw text of the same stack. */
public final class StackTrace {

  static final StackTrace EMPTY = new StackTrace(Collections.<Frame>emptyList(), "");

  private final List<Frame> frames;
  private final String raw;

  StackTrace(final List<Frame> frames, final String raw) {
    this.frames = Collections.unmodifiableList(frames);
    this.raw = raw;
  }

  public List<Frame> frames() {
    return frames;
  }

  /**
   * Returns a snapshot with at most {@code n} innermost frames. The raw text is never truncated.
   *
   * @return this snapshot when it already has {@code n} frames or fewer
   */
  public StackTrace limit(final int n) {
    if (n >= frames.size()) {
      return this;
    }
    return new StackTrace(frames.subList(0, Math.max(0, n)), raw);
  }

  /** Filtered frames in {@code file:line function} form. */
  public String render() {
    return Frames.render(frames);
  }

  /** Raw, unfiltered text of the captured stack. */
  @Override
  public String toString() {
    return raw;
  }
}
