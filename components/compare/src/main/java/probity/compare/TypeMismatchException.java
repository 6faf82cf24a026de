package probity.compare;

/** Two operands that must share a type or kind do not. */
public class TypeMismatchException extends ComparisonException {

  public TypeMismatchException(final String message) {
    super(message);
  }

  public TypeMismatchException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
