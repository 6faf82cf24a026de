package probity.asserts;

/**
 * Receives assertion failures. The default implementation signals the enclosing test run; other
 * implementations may record failures instead.
 */
public interface FailureSink {

  void fail(Failure failure);
}
