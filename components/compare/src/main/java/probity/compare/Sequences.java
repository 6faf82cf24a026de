package probity.compare;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/** Uniform view over the sequence kinds: arrays and collections. */
final class Sequences {

  private Sequences() {}

  static int size(final Object sequence) {
    if (sequence.getClass().isArray()) {
      return Array.getLength(sequence);
    }
    return ((Collection<?>) sequence).size();
  }

  /** Elements in iteration order; primitive array elements are boxed. */
  static List<Object> elements(final Object sequence) {
    if (sequence.getClass().isArray()) {
      final int length = Array.getLength(sequence);
      final List<Object> elements = new ArrayList<>(length);
      for (int i = 0; i < length; i++) {
        elements.add(Array.get(sequence, i));
      }
      return elements;
    }
    return new ArrayList<>((Collection<?>) sequence);
  }

  static boolean containsDeep(final Object sequence, final Object item) {
    for (final Object element : elements(sequence)) {
      if (DeepEquality.deepEquals(element, item)) {
        return true;
      }
    }
    return false;
  }
}
