package probity.compare;

/** Base of the errors the comparison engine reports instead of a result. */
public abstract class ComparisonException extends Exception {

  protected ComparisonException(final String message) {
    super(message);
  }

  protected ComparisonException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
