package relayql.api.cqir;

import java.util.List;
import java.util.Objects;

/** A directive passed through to the runtime, e.g. {@code @include(if: $cond)}. */
public record ConcreteDirective(String name, List<Argument> args) implements ConcreteNode {

  public ConcreteDirective {
    Objects.requireNonNull(name, "name");
    args = List.copyOf(args);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.DIRECTIVE;
  }

  @Override
  public <R> R accept(ConcreteVisitor<R> visitor) {
    return visitor.visitDirective(this);
  }

  /** One {@code name: value} pair of a directive. */
  public record Argument(String name, CallArgument value) {}
}
