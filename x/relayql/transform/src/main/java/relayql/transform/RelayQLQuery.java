package relayql.transform;

import graphql.language.OperationDefinition;
import graphql.schema.GraphQLObjectType;

/** A query operation, typed by the schema's query root. */
public final class RelayQLQuery extends RelayQLDefinition {

  RelayQLQuery(RelayQLContext context, OperationDefinition ast) {
    super(
        context,
        ast.getName(),
        ast.getDirectives(),
        ast.getSelectionSet(),
        ast.getSourceLocation());
  }

  @Override
  public RelayQLType getType() {
    GraphQLObjectType rootType = getContext().schema().getQueryType();
    if (rootType == null) {
      throw new RelayTransformException(
          ErrorCode.MISSING_ROOT_TYPE,
          "Schema does not contain a root query type.",
          getLocation());
    }
    return new RelayQLType(getContext(), rootType);
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitQuery(this);
  }
}
