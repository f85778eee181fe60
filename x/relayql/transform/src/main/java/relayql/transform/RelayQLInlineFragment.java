package relayql.transform;

import graphql.language.InlineFragment;

/** An inline fragment, printed as a nested fragment. */
public final class RelayQLInlineFragment extends RelayQLNode implements RelayQLSelection {

  private final InlineFragment ast;
  private final RelayQLType parentType;

  RelayQLInlineFragment(RelayQLContext context, InlineFragment ast, RelayQLType parentType) {
    super(context, ast.getDirectives(), ast.getSourceLocation());
    this.ast = ast;
    this.parentType = parentType;
  }

  public RelayQLFragment getFragment() {
    return RelayQLFragment.fromInlineFragment(getContext(), ast, parentType);
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitInlineFragment(this);
  }
}
