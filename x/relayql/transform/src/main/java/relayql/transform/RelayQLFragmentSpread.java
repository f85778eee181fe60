package relayql.transform;

import graphql.language.FragmentSpread;

/** A named spread. After normalization its name is a substitution slot. */
public final class RelayQLFragmentSpread extends RelayQLNode implements RelayQLSelection {

  private final String name;

  RelayQLFragmentSpread(RelayQLContext context, FragmentSpread ast) {
    super(context, ast.getDirectives(), ast.getSourceLocation());
    this.name = ast.getName();
  }

  public String getName() {
    return name;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitFragmentSpread(this);
  }
}
