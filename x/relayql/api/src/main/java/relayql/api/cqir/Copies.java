package relayql.api.cqir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Unmodifiable copies. Maps keep insertion order. */
final class Copies {

  private Copies() {}

  static <V> Map<String, V> orderedMap(Map<String, V> source) {
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }

  static <T> @Nullable List<T> nullableList(@Nullable List<T> source) {
    return source == null ? null : List.copyOf(source);
  }

  /** Copies nested lists and maps of a literal payload. Lists may hold nulls. */
  static @Nullable Object payload(@Nullable Object value) {
    if (value instanceof List<?> list) {
      List<@Nullable Object> copy = new ArrayList<>(list.size());
      for (Object item : list) {
        copy.add(payload(item));
      }
      return Collections.unmodifiableList(copy);
    }
    if (value instanceof Map<?, ?> map) {
      Map<String, @Nullable Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        copy.put(String.valueOf(entry.getKey()), payload(entry.getValue()));
      }
      return Collections.unmodifiableMap(copy);
    }
    return value;
  }
}
