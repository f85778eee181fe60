package relayql.api.cqir;

import java.util.Objects;

/** A call value bound to a query variable. */
public record CallVariable(String callVariableName) implements ConcreteNode, CallArgument {

  public CallVariable {
    Objects.requireNonNull(callVariableName, "callVariableName");
  }

  @Override
  public NodeKind kind() {
    return NodeKind.CALL_VARIABLE;
  }

  @Override
  public <R> R accept(ConcreteVisitor<R> visitor) {
    return visitor.visitCallVariable(this);
  }
}
