package relayql.api.cqir;

import java.util.List;

/** The value of a list-literal argument: one call value per element, printed as a plain array. */
public record CallValueList(List<CallArgument> values) implements Concrete, CallArgument {

  public CallValueList {
    values = List.copyOf(values);
  }

  @Override
  public <R> R accept(ConcreteVisitor<R> visitor) {
    return visitor.visitCallValueList(this);
  }
}
