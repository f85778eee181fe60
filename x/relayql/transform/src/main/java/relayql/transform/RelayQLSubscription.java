package relayql.transform;

import graphql.language.OperationDefinition;
import graphql.schema.GraphQLObjectType;

/** A subscription operation, typed by the schema's subscription root. */
public final class RelayQLSubscription extends RelayQLDefinition {

  RelayQLSubscription(RelayQLContext context, OperationDefinition ast) {
    super(
        context,
        ast.getName(),
        ast.getDirectives(),
        ast.getSelectionSet(),
        ast.getSourceLocation());
  }

  @Override
  public RelayQLType getType() {
    GraphQLObjectType rootType = getContext().schema().getSubscriptionType();
    if (rootType == null) {
      throw new RelayTransformException(
          ErrorCode.MISSING_ROOT_TYPE,
          "Schema does not contain a root subscription type.",
          getLocation());
    }
    return new RelayQLType(getContext(), rootType);
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitSubscription(this);
  }
}
