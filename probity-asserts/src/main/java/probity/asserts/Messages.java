package probity.asserts;

import java.util.Arrays;
import javax.annotation.Nullable;

final class Messages {

  private Messages() {}

  /** {@code String.valueOf} that also prints array contents. */
  static String describe(@Nullable final Object value) {
    if (value != null && value.getClass().isArray()) {
      final String wrapped = Arrays.deepToString(new Object[] {value});
      return wrapped.substring(1, wrapped.length() - 1);
    }
    return String.valueOf(value);
  }

  static String identity(@Nullable final Object value) {
    if (value == null) {
      return "null";
    }
    return value.getClass().getName() + "@" + Integer.toHexString(System.identityHashCode(value));
  }
}
