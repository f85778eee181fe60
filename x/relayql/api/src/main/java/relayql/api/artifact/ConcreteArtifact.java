package relayql.api.artifact;

import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import relayql.api.cqir.ConcreteDefinition;

/**
 * The compiled form of one definition.
 *
 * @param kind fragment or operation
 * @param name the operation name; null for fragments
 * @param operation {@code query}, {@code mutation} or {@code subscription}; null for fragments
 * @param argumentDefinitions the variables the definition reads
 * @param node the printed definition
 * @param initializers one per substitution slot, in spread order
 */
public record ConcreteArtifact(
    ArtifactKind kind,
    @Nullable String name,
    @Nullable String operation,
    List<ArgumentDefinition> argumentDefinitions,
    ConcreteDefinition node,
    List<FragmentInitializer> initializers) {

  public ConcreteArtifact {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(node, "node");
    argumentDefinitions = List.copyOf(argumentDefinitions);
    initializers = List.copyOf(initializers);
  }
}
