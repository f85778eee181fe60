package relayql.api.cqir;

import java.util.Map;
import java.util.Objects;

/** An argument applied to a field, e.g. {@code first: 10}. */
public record ConcreteCall(String name, Map<String, Object> metadata, CallArgument value)
    implements ConcreteNode {

  public ConcreteCall {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(value, "value");
    metadata = Copies.orderedMap(metadata);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.CALL;
  }

  @Override
  public <R> R accept(ConcreteVisitor<R> visitor) {
    return visitor.visitCall(this);
  }
}
