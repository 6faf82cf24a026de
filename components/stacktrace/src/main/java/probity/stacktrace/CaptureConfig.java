package probity.stacktrace;

/**
 * Parameters of a single {@link StackTraces#capture(CaptureConfig)} call.
 *
 * <p>{@code bufferSize} bounds both the number of call-stack entries read and the length of the
 * raw text. {@code skipFrames} drops that many innermost frames on top of the capture routine's own
 * frames. Values are not validated; degenerate values produce an empty snapshot.
 */
public final class CaptureConfig {

  public static final int DEFAULT_BUFFER_SIZE = 2048;
  public static final int DEFAULT_SKIP_FRAMES = 2;

  public static final CaptureConfig DEFAULT =
      new CaptureConfig(DEFAULT_BUFFER_SIZE, DEFAULT_SKIP_FRAMES);

  private final int bufferSize;
  private final int skipFrames;

  public CaptureConfig(final int bufferSize, final int skipFrames) {
    this.bufferSize = bufferSize;
    this.skipFrames = skipFrames;
  }

  public int getBufferSize() {
    return bufferSize;
  }

  public int getSkipFrames() {
    return skipFrames;
  }

  public CaptureConfig withSkipFrames(final int skipFrames) {
    return new CaptureConfig(bufferSize, skipFrames);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CaptureConfig)) {
      return false;
    }
    final CaptureConfig that = (CaptureConfig) o;
    return bufferSize == that.bufferSize && skipFrames == that.skipFrames;
  }

  @Override
  public int hashCode() {
    return 31 * bufferSize + skipFrames;
  }

  @Override
  public String toString() {
    return "CaptureConfig{bufferSize=" + bufferSize + ", skipFrames=" + skipFrames + '}';
  }
}
