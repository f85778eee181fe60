package relayql.transform;

import graphql.language.OperationDefinition;
import graphql.schema.GraphQLObjectType;

/** A mutation operation, typed by the schema's mutation root. */
public final class RelayQLMutation extends RelayQLDefinition {

  RelayQLMutation(RelayQLContext context, OperationDefinition ast) {
    super(
        context,
        ast.getName(),
        ast.getDirectives(),
        ast.getSelectionSet(),
        ast.getSourceLocation());
  }

  @Override
  public RelayQLType getType() {
    GraphQLObjectType rootType = getContext().schema().getMutationType();
    if (rootType == null) {
      throw new RelayTransformException(
          ErrorCode.MISSING_ROOT_TYPE,
          "Schema does not contain a root mutation type.",
          getLocation());
    }
    return new RelayQLType(getContext(), rootType);
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitMutation(this);
  }
}
