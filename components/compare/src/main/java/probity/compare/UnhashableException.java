package probity.compare;

/** An element cannot serve as a distinguishing key when counting occurrences. */
public class UnhashableException extends ComparisonException {

  public UnhashableException(final String message) {
    super(message);
  }
}
