package relayql.transform;

import graphql.introspection.Introspection;
import graphql.language.Field;
import graphql.language.InlineFragment;
import graphql.language.SelectionSet;
import graphql.language.TypeName;
import graphql.schema.GraphQLCompositeType;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLFieldsContainer;
import graphql.schema.GraphQLImplementingType;
import graphql.schema.GraphQLInterfaceType;
import graphql.schema.GraphQLNamedOutputType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLOutputType;
import graphql.schema.GraphQLSchema;
import graphql.schema.GraphQLType;
import graphql.schema.GraphQLTypeUtil;
import graphql.schema.GraphQLUnionType;
import graphql.schema.GraphQLUnmodifiedType;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Read-only view of one output type of the schema, including its list and non-null modifiers.
 * This is the only place the transform inspects the schema's output types.
 */
public final class RelayQLType {

  private final RelayQLContext context;
  private final GraphQLType modifiedType;
  private final GraphQLUnmodifiedType unmodifiedType;

  RelayQLType(RelayQLContext context, GraphQLType modifiedType) {
    this.context = context;
    this.modifiedType = modifiedType;
    this.unmodifiedType = GraphQLTypeUtil.unwrapAll(modifiedType);
  }

  /**
   * The type's name.
   *
   * @param withModifiers whether list and non-null modifiers are included, as in {@code [User!]!}
   */
  public String getName(boolean withModifiers) {
    return withModifiers ? GraphQLTypeUtil.simplePrint(modifiedType) : unmodifiedType.getName();
  }

  public boolean isAbstract() {
    return unmodifiedType instanceof GraphQLInterfaceType
        || unmodifiedType instanceof GraphQLUnionType;
  }

  public boolean isList() {
    return GraphQLTypeUtil.isList(GraphQLTypeUtil.unwrapNonNull(modifiedType));
  }

  public boolean canHaveSubselections() {
    return unmodifiedType instanceof GraphQLCompositeType;
  }

  public boolean isQueryType() {
    return unmodifiedType == context.schema().getQueryType();
  }

  public boolean isMutationType() {
    return unmodifiedType == context.schema().getMutationType();
  }

  public boolean isSubscriptionType() {
    return unmodifiedType == context.schema().getSubscriptionType();
  }

  public boolean hasField(String fieldName) {
    return getFieldDefinition(fieldName) != null;
  }

  /**
   * Looks up a field, including the introspection fields: {@code __typename} on every composite
   * type, {@code __schema} and {@code __type} on the query type.
   */
  public @Nullable RelayQLFieldDefinition getFieldDefinition(String fieldName) {
    GraphQLFieldDefinition definition = null;
    if (isQueryType() && fieldName.equals(Introspection.SchemaMetaFieldDef.getName())) {
      definition = Introspection.SchemaMetaFieldDef;
    } else if (isQueryType() && fieldName.equals(Introspection.TypeMetaFieldDef.getName())) {
      definition = Introspection.TypeMetaFieldDef;
    } else if (canHaveSubselections()
        && fieldName.equals(Introspection.TypeNameMetaFieldDef.getName())) {
      definition = Introspection.TypeNameMetaFieldDef;
    } else if (unmodifiedType instanceof GraphQLFieldsContainer container) {
      definition = container.getFieldDefinition(fieldName);
    }
    return definition == null ? null : new RelayQLFieldDefinition(context, definition);
  }

  /** The identity field, present when every value of this type is a {@code Node}. */
  public @Nullable RelayQLFieldDefinition getIdentifyingFieldDefinition() {
    return alwaysImplements(FieldNames.NODE_INTERFACE)
        ? getFieldDefinition(FieldNames.ID)
        : null;
  }

  /** A selection of {@code fieldName} on this type that does not appear in the source. */
  public RelayQLField generateField(String fieldName) {
    Field ast = Field.newField(fieldName).build();
    return new RelayQLField(context, ast, this);
  }

  /** The fragment {@code ... on Node { id }}, named {@code IdFragment}. */
  public RelayQLFragment generateIdFragment() {
    InlineFragment ast =
        InlineFragment.newInlineFragment()
            .typeCondition(new TypeName(FieldNames.NODE_INTERFACE))
            .selectionSet(new SelectionSet(List.of(Field.newField(FieldNames.ID).build())))
            .build();
    return RelayQLFragment.generated(context, "IdFragment", ast, this);
  }

  /** True when this type is, or some value of it can be, an instance of {@code typeName}. */
  public boolean mayImplement(String typeName) {
    return getName(false).equals(typeName)
        || getInterfaces().stream().anyMatch(type -> type.alwaysImplements(typeName))
        || (isAbstract()
            && getConcreteTypes().stream().anyMatch(type -> type.alwaysImplements(typeName)));
  }

  /** True when every value of this type is an instance of {@code typeName}. */
  public boolean alwaysImplements(String typeName) {
    return getName(false).equals(typeName)
        || getInterfaces().stream().anyMatch(type -> type.alwaysImplements(typeName))
        || (isAbstract()
            && getConcreteTypes().stream().allMatch(type -> type.alwaysImplements(typeName)));
  }

  /**
   * A paginated list: named {@code *Connection}, with an {@code edges} field whose type has a
   * composite {@code node} and a scalar {@code cursor}.
   */
  public boolean isConnection() {
    if (!getName(false).endsWith("Connection")) {
      return false;
    }
    FieldNames fields = context.fieldNames();
    RelayQLFieldDefinition edges = getFieldDefinition(fields.edges());
    if (edges == null || !edges.getType().canHaveSubselections()) {
      return false;
    }
    RelayQLType edgeType = edges.getType();
    RelayQLFieldDefinition node = edgeType.getFieldDefinition(fields.node());
    if (node == null || !node.getType().canHaveSubselections()) {
      return false;
    }
    RelayQLFieldDefinition cursor = edgeType.getFieldDefinition(fields.cursor());
    return cursor != null && !cursor.getType().canHaveSubselections();
  }

  public boolean isConnectionEdge() {
    FieldNames fields = context.fieldNames();
    return getName(false).endsWith("Edge")
        && hasField(fields.node())
        && hasField(fields.cursor());
  }

  public boolean isConnectionPageInfo() {
    return getName(false).equals("PageInfo");
  }

  RelayQLContext getContext() {
    return context;
  }

  private List<RelayQLType> getInterfaces() {
    List<RelayQLType> interfaces = new ArrayList<>();
    if (unmodifiedType instanceof GraphQLImplementingType implementing) {
      for (GraphQLNamedOutputType type : implementing.getInterfaces()) {
        interfaces.add(new RelayQLType(context, type));
      }
    }
    return interfaces;
  }

  private List<RelayQLType> getConcreteTypes() {
    GraphQLSchema schema = context.schema();
    List<RelayQLType> types = new ArrayList<>();
    if (unmodifiedType instanceof GraphQLInterfaceType interfaceType) {
      for (GraphQLObjectType type : schema.getImplementations(interfaceType)) {
        types.add(new RelayQLType(context, type));
      }
    } else if (unmodifiedType instanceof GraphQLUnionType unionType) {
      for (GraphQLOutputType type : unionType.getTypes()) {
        types.add(new RelayQLType(context, type));
      }
    }
    return types;
  }

  @Override
  public String toString() {
    return getName(true);
  }
}
