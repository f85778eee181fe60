package relayql.transform;

import graphql.Scalars;
import graphql.schema.GraphQLInputType;
import graphql.schema.GraphQLList;
import graphql.schema.GraphQLType;
import graphql.schema.GraphQLTypeUtil;

/** The declared type of a field or directive argument. */
public final class RelayQLArgumentType {

  private final GraphQLType modifiedType;

  RelayQLArgumentType(GraphQLInputType modifiedType) {
    this.modifiedType = modifiedType;
  }

  private RelayQLArgumentType(GraphQLType modifiedType) {
    this.modifiedType = modifiedType;
  }

  public String getName(boolean withModifiers) {
    return withModifiers
        ? GraphQLTypeUtil.simplePrint(modifiedType)
        : GraphQLTypeUtil.unwrapAll(modifiedType).getName();
  }

  public boolean isList() {
    return GraphQLTypeUtil.isList(GraphQLTypeUtil.unwrapNonNull(modifiedType));
  }

  public boolean isNonNull() {
    return GraphQLTypeUtil.isNonNull(modifiedType);
  }

  /** The element type of a list type; any other type is returned as is. */
  public RelayQLArgumentType ofType() {
    GraphQLType nullable = GraphQLTypeUtil.unwrapNonNull(modifiedType);
    if (nullable instanceof GraphQLList list) {
      return new RelayQLArgumentType(list.getWrappedType());
    }
    return this;
  }

  public boolean isBoolean() {
    return isScalarNamed(Scalars.GraphQLBoolean.getName());
  }

  public boolean isID() {
    return isScalarNamed(Scalars.GraphQLID.getName());
  }

  public boolean isString() {
    return isScalarNamed(Scalars.GraphQLString.getName());
  }

  private boolean isScalarNamed(String scalarName) {
    return getName(false).equals(scalarName);
  }

  @Override
  public String toString() {
    return getName(true);
  }
}
