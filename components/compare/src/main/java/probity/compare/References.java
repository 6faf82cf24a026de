package probity.compare;

import java.lang.ref.Reference;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;

/** Access to the target of {@link ValueKind#REFERENCE} values. */
final class References {

  private References() {}

  static boolean isAbsent(final Object reference) {
    if (reference instanceof Optional) {
      return !((Optional<?>) reference).isPresent();
    }
    if (reference instanceof OptionalInt) {
      return !((OptionalInt) reference).isPresent();
    }
    if (reference instanceof OptionalLong) {
      return !((OptionalLong) reference).isPresent();
    }
    if (reference instanceof OptionalDouble) {
      return !((OptionalDouble) reference).isPresent();
    }
    return target(reference) == null;
  }

  @Nullable
  static Object target(final Object reference) {
    if (reference instanceof Optional) {
      return ((Optional<?>) reference).orElse(null);
    }
    if (reference instanceof OptionalInt) {
      final OptionalInt optional = (OptionalInt) reference;
      return optional.isPresent() ? optional.getAsInt() : null;
    }
    if (reference instanceof OptionalLong) {
      final OptionalLong optional = (OptionalLong) reference;
      return optional.isPresent() ? optional.getAsLong() : null;
    }
    if (reference instanceof OptionalDouble) {
      final OptionalDouble optional = (OptionalDouble) reference;
      return optional.isPresent() ? optional.getAsDouble() : null;
    }
    if (reference instanceof AtomicReference) {
      return ((AtomicReference<?>) reference).get();
    }
    if (reference instanceof Reference) {
      return ((Reference<?>) reference).get();
    }
    throw new IllegalArgumentException("not a reference: " + ValueKind.typeName(reference));
  }
}
