package relayql.api.cqir;

import java.util.Objects;

/** A fragment spread, resolved at run time from the substitution named {@code substitutionName}. */
public record FragmentReference(String substitutionName)
    implements RuntimeExpression, ConcreteSelection {

  public FragmentReference {
    Objects.requireNonNull(substitutionName, "substitutionName");
  }

  @Override
  public <R> R accept(ConcreteVisitor<R> visitor) {
    return visitor.visitFragmentReference(this);
  }
}
