package relayql.api.cqir;

import java.util.Map;
import java.util.Objects;

/**
 * A fragment declared with {@code @relay(variables: [...])}. The runtime builds the fragment with
 * one initial value per listed variable so it can track them.
 */
public record ParametrizedFragment(ConcreteFragment fragment, Map<String, CallArgument> variables)
    implements RuntimeExpression, ConcreteDefinition, ConcreteSelection {

  public ParametrizedFragment {
    Objects.requireNonNull(fragment, "fragment");
    variables = Copies.orderedMap(variables);
  }

  @Override
  public String name() {
    return fragment.name();
  }

  @Override
  public <R> R accept(ConcreteVisitor<R> visitor) {
    return visitor.visitParametrizedFragment(this);
  }
}
