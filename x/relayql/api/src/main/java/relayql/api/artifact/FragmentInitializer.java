package relayql.api.artifact;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * How the runtime obtains the value of one substitution slot. Fragment names follow the {@code
 * Module_property} convention; {@code moduleName} and {@code propertyName} are its two halves.
 */
public sealed interface FragmentInitializer {

  /** The slot the printed tree refers to through {@link relayql.api.cqir.FragmentReference}. */
  String substitutionName();

  /** The spread's target fragment. */
  String fragmentName();

  String moduleName();

  String propertyName();

  /**
   * A masked spread: the slot holds an opaque reference obtained from the container's {@code
   * getFragment}. When the module is bound locally the lookup goes through its {@code
   * __container__} first.
   *
   * @param arguments the {@code @arguments} bindings, or null for a plain spread. Values are
   *     {@link relayql.api.cqir.CallVariable}s or literal payloads.
   */
  record Masked(
      String substitutionName,
      String fragmentName,
      String moduleName,
      String propertyName,
      boolean containerCheck,
      @Nullable Map<String, Object> arguments)
      implements FragmentInitializer {

    public Masked {
      arguments =
          arguments == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }
  }

  /**
   * An unmasked spread: the slot holds the fragment's own printed content. With {@code
   * localPropertyBinding} the fragment is read from the local binding named after the property,
   * otherwise from the module's property.
   */
  record Unmasked(
      String substitutionName,
      String fragmentName,
      String moduleName,
      String propertyName,
      boolean localPropertyBinding)
      implements FragmentInitializer {}
}
