package relayql.transform;

import java.util.Map;
import org.jspecify.annotations.Nullable;

/** The names visible where an embedded definition appears in the source. */
@FunctionalInterface
public interface BindingScope {

  /** How {@code name} is bound at the definition, or null when it is not bound. */
  @Nullable BindingKind getBinding(String name);

  default boolean isBound(String name) {
    return getBinding(name) != null;
  }

  /** True when {@code name} is declared in the file rather than imported or required. */
  default boolean isDefinedLocally(String name) {
    return getBinding(name) == BindingKind.LOCAL;
  }

  static BindingScope empty() {
    return name -> null;
  }

  static BindingScope of(Map<String, BindingKind> bindings) {
    Map<String, BindingKind> copy = Map.copyOf(bindings);
    return copy::get;
  }
}
