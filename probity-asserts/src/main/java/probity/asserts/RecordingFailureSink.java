package probity.asserts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/** Keeps failures in memory instead of failing the test. Thread-safe. */
public final class RecordingFailureSink implements FailureSink {

  private final List<Failure> failures = Collections.synchronizedList(new ArrayList<Failure>());

  @Override
  public void fail(final Failure failure) {
    failures.add(failure);
  }

  /** Snapshot of the failures recorded so far, oldest first. */
  public List<Failure> getFailures() {
    synchronized (failures) {
      return Collections.unmodifiableList(new ArrayList<>(failures));
    }
  }

  @Nullable
  public Failure lastFailure() {
    synchronized (failures) {
      return failures.isEmpty() ? null : failures.get(failures.size() - 1);
    }
  }

  /** Message of the last failure, empty when nothing failed. */
  public String lastMessage() {
    final Failure last = lastFailure();
    return last == null ? "" : last.getMessage();
  }

  public void clear() {
    failures.clear();
  }
}
