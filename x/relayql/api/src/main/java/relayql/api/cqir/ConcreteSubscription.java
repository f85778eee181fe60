package relayql.api.cqir;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A printed subscription. {@code calls} always holds exactly one call named after the root field
 * whose value is the {@code input} variable.
 */
public record ConcreteSubscription(
    String name,
    String responseType,
    List<ConcreteCall> calls,
    @Nullable ConcreteSelections children,
    @Nullable List<ConcreteDirective> directives,
    Map<String, Object> metadata)
    implements ConcreteNode, ConcreteDefinition {

  public ConcreteSubscription {
    Objects.requireNonNull(name, "name");
    calls = List.copyOf(calls);
    directives = Copies.nullableList(directives);
    metadata = Copies.orderedMap(metadata);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.SUBSCRIPTION;
  }

  @Override
  public <R> R accept(ConcreteVisitor<R> visitor) {
    return visitor.visitSubscription(this);
  }
}
