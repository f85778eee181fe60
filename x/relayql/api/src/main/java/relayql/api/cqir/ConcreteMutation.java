package relayql.api.cqir;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A printed mutation. {@code calls} always holds exactly one call named after the root field whose
 * value is the {@code input} variable.
 */
public record ConcreteMutation(
    String name,
    String responseType,
    List<ConcreteCall> calls,
    @Nullable ConcreteSelections children,
    @Nullable List<ConcreteDirective> directives,
    Map<String, Object> metadata)
    implements ConcreteNode, ConcreteDefinition {

  public ConcreteMutation {
    Objects.requireNonNull(name, "name");
    calls = List.copyOf(calls);
    directives = Copies.nullableList(directives);
    metadata = Copies.orderedMap(metadata);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.MUTATION;
  }

  @Override
  public <R> R accept(ConcreteVisitor<R> visitor) {
    return visitor.visitMutation(this);
  }
}
