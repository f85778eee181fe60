package relayql.transform;

import graphql.language.SourceLocation;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A fragment spread taken out of the printed tree. The printed tree refers to it by its slot
 * name; the {@link FragmentReferenceResolver} turns it into a run-time lookup.
 *
 * @param fragmentName the spread's target fragment
 * @param arguments the {@code @arguments} bindings, or null. Values are {@link
 *     relayql.api.cqir.CallVariable}s for variables and literal payloads otherwise.
 * @param masked false only for {@code @relay(mask: false)}
 * @param location where the spread appears, reported by resolution errors
 */
public record SubstitutionSlot(
    String fragmentName,
    @Nullable Map<String, Object> arguments,
    boolean masked,
    @Nullable SourceLocation location) {

  public SubstitutionSlot {
    Objects.requireNonNull(fragmentName, "fragmentName");
    arguments =
        arguments == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
  }

  public SubstitutionSlot(
      String fragmentName, @Nullable Map<String, Object> arguments, boolean masked) {
    this(fragmentName, arguments, masked, null);
  }
}
