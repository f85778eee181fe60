package relayql.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The structural rules the runtime imposes on definitions, beyond what the schema enforces. Each
 * check throws on the first violation.
 */
public final class StructuralValidator {

  private StructuralValidator() {}

  /**
   * Queries, mutations and subscriptions select exactly one root field.
   *
   * @param operation {@code query}, {@code mutation} or {@code subscription}
   */
  public static void requireSingleRootField(
      RelayQLDefinition definition, List<RelayQLField> rootFields, String operation) {
    if (rootFields.size() != 1) {
      throw new RelayTransformException(
          ErrorCode.TOO_MANY_ROOT_FIELDS,
          String.format(
              "There are %d fields supplied to the %s named `%s`, but %ss must have exactly "
                  + "one field.",
              rootFields.size(),
              operation,
              definition.getName(),
              operation),
          definition.getLocation());
    }
  }

  /** A query's root field takes at most one argument, its identifying argument. */
  public static void validateRootFieldArity(RelayQLDefinition query, RelayQLField rootField) {
    if (rootField.getArguments().size() > 1) {
      throw new RelayTransformException(
          ErrorCode.INVALID_ROOT_FIELD_ARITY,
          String.format(
              "Invalid root field `%s`; Relay only supports root fields with zero or one "
                  + "argument.",
              rootField.getName()),
          query.getLocation());
    }
  }

  /** {@code node(id: ...)} belongs on the query root only. */
  public static void validateField(RelayQLField field, RelayQLType parentType) {
    if (!field.getName().equals("node")) {
      return;
    }
    Map<String, RelayQLArgumentType> declared = field.getDeclaredArguments();
    if (!parentType.isQueryType()
        && declared.size() == 1
        && declared.containsKey(FieldNames.ID)) {
      throw new RelayTransformException(
          ErrorCode.MISPLACED_NODE_FIELD,
          String.format(
              "You defined a `node(%s: %s)` field on type `%s`, but Relay requires the `node` "
                  + "field to be defined on the root type. See the Object Identification Guide: "
                  + "%nhttp://facebook.github.io/relay/docs/graphql-object-identification.html",
              FieldNames.ID,
              declared.get(FieldNames.ID).getName(true),
              parentType.getName(false)),
          field.getLocation());
    }
  }

  /**
   * Pagination arguments on a connection field. Literal {@code first} and {@code last} cannot be
   * combined, nor {@code before} with {@code first} or {@code after} with {@code last}, unless
   * both sides are variables. Selecting {@code edges} or {@code pageInfo} needs a limit or a
   * {@code find} argument, and selecting a plain list of the connection's nodes is refused.
   */
  public static void validateConnectionField(RelayQLField field, FieldNames fieldNames) {
    RelayQLArgument first = field.findArgument("first");
    RelayQLArgument last = field.findArgument("last");
    RelayQLArgument before = field.findArgument("before");
    RelayQLArgument after = field.findArgument("after");

    if (!bothVariablesOrNotBoth(first, last)) {
      throw conflictingArguments(
          field,
          String.format(
              "Connection arguments `%s(first: <count>, last: <count>)` are not supported "
                  + "unless both are variables. Use `(first: <count>)`, `(last: <count>)`, or "
                  + "`(first: $<var>, last: $<var>)`.",
              field.getName()));
    }
    if (!bothVariablesOrNotBoth(first, before)) {
      throw conflictingArguments(
          field,
          String.format(
              "Connection arguments `%s(before: <cursor>, first: <count>)` are not supported "
                  + "unless both are variables. Use `(first: <count>)`, "
                  + "`(after: <cursor>, first: <count>)`, `(before: <cursor>, last: <count>)`, "
                  + "or `(before: $<var>, first: $<var>)`.",
              field.getName()));
    }
    if (!bothVariablesOrNotBoth(last, after)) {
      throw conflictingArguments(
          field,
          String.format(
              "Connection arguments `%s(after: <cursor>, last: <count>)` are not supported "
                  + "unless both are variables. Use `(last: <count>)`, "
                  + "`(before: <cursor>, last: <count>)`, `(after: <cursor>, first: <count>)`, "
                  + "or `(after: $<var>, last: $<var>)`.",
              field.getName()));
    }

    String nodeTypeName = connectionNodeTypeName(field.getType(), fieldNames);
    // Spreads are opaque here, so only fields reachable through inline fragments are checked.
    for (RelayQLField subfield : collectSubfields(field)) {
      String name = subfield.getName();
      if (name.equals(fieldNames.edges()) || name.equals(fieldNames.pageInfo())) {
        boolean hasCondition =
            field.isPattern()
                || field.hasArgument("find")
                || field.hasArgument("first")
                || field.hasArgument("last");
        if (!hasCondition) {
          throw new RelayTransformException(
              ErrorCode.MISSING_PAGINATION_ARGUMENT,
              String.format(
                  "You supplied the `%s` field on a connection named `%s`, but you did not "
                      + "supply an argument necessary for Relay to handle the connection. "
                      + "Please specify a limit argument like `first`, or `last` or fetch a "
                      + "specific item with a `find` argument.",
                  name,
                  field.getName()),
              field.getLocation());
        }
      } else {
        RelayQLType subfieldType = subfield.getType();
        if (subfieldType.isList() && subfieldType.getName(false).equals(nodeTypeName)) {
          throw new RelayTransformException(
              ErrorCode.USE_EDGES_NODE_INSTEAD,
              String.format(
                  "You supplied a field named `%s` on a connection named `%s`, but pagination "
                      + "is not supported on connections without using `%s`. Use "
                      + "`%s{%s{%s{...}}}` instead.",
                  name,
                  field.getName(),
                  fieldNames.edges(),
                  field.getName(),
                  fieldNames.edges(),
                  fieldNames.node()),
              field.getLocation());
        }
      }
    }
  }

  /**
   * A mutation or subscription root field declares exactly one argument, named {@code
   * inputArgumentName}, and is called with at most one argument.
   */
  public static void validateMutationField(RelayQLField rootField, String inputArgumentName) {
    Map<String, RelayQLArgumentType> declared = rootField.getDeclaredArguments();
    if (declared.size() != 1) {
      throw new RelayTransformException(
          ErrorCode.WRONG_MUTATION_ARGUMENT_SHAPE,
          String.format(
              "Your schema defines a mutation field `%s` that takes %d arguments, but mutation "
                  + "fields must have exactly one argument named `%s`.",
              rootField.getName(),
              declared.size(),
              inputArgumentName),
          rootField.getLocation());
    }
    String declaredName = declared.keySet().iterator().next();
    if (!declaredName.equals(inputArgumentName)) {
      throw new RelayTransformException(
          ErrorCode.WRONG_MUTATION_ARGUMENT_SHAPE,
          String.format(
              "Your schema defines a mutation field `%s` that takes an argument named `%s`, "
                  + "but mutation fields must have exactly one argument named `%s`.",
              rootField.getName(),
              declaredName,
              inputArgumentName),
          rootField.getLocation());
    }
    int supplied = rootField.getArguments().size();
    if (supplied > 1) {
      throw new RelayTransformException(
          ErrorCode.WRONG_MUTATION_ARGUMENT_SHAPE,
          String.format(
              "There are %d arguments supplied to the mutation field named `%s`, but mutation "
                  + "fields must have exactly one `%s` argument.",
              supplied,
              rootField.getName(),
              inputArgumentName),
          rootField.getLocation());
    }
  }

  private static boolean bothVariablesOrNotBoth(
      @Nullable RelayQLArgument a,
      @Nullable RelayQLArgument b) {
    return a == null || b == null || (a.isVariable() && b.isVariable());
  }

  private static RelayTransformException conflictingArguments(RelayQLField field, String message) {
    return new RelayTransformException(
        ErrorCode.CONFLICTING_PAGINATION_ARGUMENTS, message, field.getLocation());
  }

  private static String connectionNodeTypeName(RelayQLType connectionType, FieldNames names) {
    RelayQLFieldDefinition edges = connectionType.getFieldDefinition(names.edges());
    if (edges == null) {
      throw new IllegalStateException(connectionType + " is not a connection");
    }
    RelayQLFieldDefinition node = edges.getType().getFieldDefinition(names.node());
    if (node == null) {
      throw new IllegalStateException(connectionType + " is not a connection");
    }
    return node.getType().getName(false);
  }

  /** Direct subfields, including those of nested inline fragments. */
  private static List<RelayQLField> collectSubfields(RelayQLNodeWithSelections parent) {
    List<RelayQLField> fields = new ArrayList<>();
    for (RelayQLSelection selection : parent.getSelections()) {
      selection.accept(
          new RelayQLSelection.Visitor<Void>() {
            @Override
            public Void visitField(RelayQLField field) {
              fields.add(field);
              return null;
            }

            @Override
            public Void visitFragmentSpread(RelayQLFragmentSpread spread) {
              return null;
            }

            @Override
            public Void visitInlineFragment(RelayQLInlineFragment inlineFragment) {
              fields.addAll(collectSubfields(inlineFragment.getFragment()));
              return null;
            }
          });
    }
    return fields;
  }
}
