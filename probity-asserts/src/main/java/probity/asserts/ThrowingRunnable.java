package probity.asserts;

/** Code under test that may throw anything. */
@FunctionalInterface
public interface ThrowingRunnable {

  void run() throws Throwable;
}
