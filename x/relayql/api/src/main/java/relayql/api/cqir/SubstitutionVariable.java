package relayql.api.cqir;

import java.util.Objects;

/** A variable whose name matches an enclosing substitution; its value is taken from it. */
public record SubstitutionVariable(String name) implements RuntimeExpression, CallArgument {

  public SubstitutionVariable {
    Objects.requireNonNull(name, "name");
  }

  @Override
  public <R> R accept(ConcreteVisitor<R> visitor) {
    return visitor.visitSubstitutionVariable(this);
  }
}
