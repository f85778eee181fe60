package relayql.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import relayql.api.artifact.FragmentInitializer;

/**
 * Turns substitution slots into the initializers that fill them at run time.
 *
 * <p>A masked slot asks the target's container for an opaque reference through {@code
 * getFragment}. An unmasked slot reads the target's printed fragment directly, so the target
 * must be reachable from the scope: either its module or a local binding named after its
 * property.
 */
public final class FragmentReferenceResolver {

  private static final Logger log = LoggerFactory.getLogger(FragmentReferenceResolver.class);

  private FragmentReferenceResolver() {}

  /** One initializer per slot, in slot order. */
  public static List<FragmentInitializer> resolve(
      Map<String, SubstitutionSlot> slots, BindingScope scope) {
    List<FragmentInitializer> initializers = new ArrayList<>(slots.size());
    slots.forEach((name, slot) -> initializers.add(resolve(name, slot, scope)));
    return initializers;
  }

  public static FragmentInitializer resolve(
      String substitutionName, SubstitutionSlot slot, BindingScope scope) {
    FragmentNameParts parts = FragmentNameParts.parse(slot.fragmentName(), slot.location());
    String module = parts.moduleName();
    String property = parts.propertyName();

    if (slot.masked()) {
      boolean containerCheck = scope.isDefinedLocally(module);
      log.debug(
          "Slot {} resolves to {}.getFragment(\"{}\"){}",
          substitutionName,
          module,
          property,
          containerCheck ? " through __container__" : "");
      return new FragmentInitializer.Masked(
          substitutionName,
          slot.fragmentName(),
          module,
          property,
          containerCheck,
          slot.arguments());
    }

    if (!scope.isBound(module) && !scope.isBound(property)) {
      throw new RelayTransformException(
          ErrorCode.UNRESOLVED_FRAGMENT_REFERENCE,
          String.format(
              "Please make sure module '%s' is imported and not renamed or the fragment '%s' "
                  + "is defined and bound to local variable '%s'.",
              module,
              slot.fragmentName(),
              property),
          slot.location());
    }
    boolean localPropertyBinding = scope.isBound(property);
    log.debug(
        "Slot {} reads unmasked fragment {} from {}",
        substitutionName,
        slot.fragmentName(),
        localPropertyBinding ? property : module + "." + property);
    return new FragmentInitializer.Unmasked(
        substitutionName, slot.fragmentName(), module, property, localPropertyBinding);
  }
}
