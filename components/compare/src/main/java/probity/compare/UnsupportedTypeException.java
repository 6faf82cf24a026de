package probity.compare;

/** A runtime type cannot be coerced or compared by the requested operation. */
public class UnsupportedTypeException extends ComparisonException {

  public UnsupportedTypeException(final String message) {
    super(message);
  }

  public UnsupportedTypeException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
