package relayql.transform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static relayql.transform.TransformAssertions.assertFailsWith;

import org.junit.jupiter.api.Test;

class StructuralValidatorTest {

  private final FieldNames fieldNames = FieldNames.of(false);

  @Test
  void requiresExactlyOneRootField() {
    RelayQLDefinition query =
        definition(
            "query TwoFields { viewer { settings { notifications } } node(id: \"1\") { id } }");

    assertThatThrownBy(
            () -> StructuralValidator.requireSingleRootField(query, query.getFields(), "query"))
        .isInstanceOf(RelayTransformException.class)
        .hasMessageStartingWith(
            "There are 2 fields supplied to the query named `TwoFields`, but querys must have "
                + "exactly one field.");

    RelayQLDefinition single = definition("query OneField { viewer { actor { name } } }");
    assertThatCode(
            () -> StructuralValidator.requireSingleRootField(single, single.getFields(), "query"))
        .doesNotThrowAnyException();
  }

  @Test
  void allowsAtMostOneRootFieldArgument() {
    RelayQLDefinition query =
        definition("query SearchQuery { search(text: \"a\", first: 1) { ... on Story { text } } }");

    assertFailsWith(
        ErrorCode.INVALID_ROOT_FIELD_ARITY,
        () -> StructuralValidator.validateRootFieldArity(query, query.getFields().get(0)));
  }

  @Test
  void rejectsBeforeWithFirst() {
    RelayQLField friends = friends("friends(first: 10, before: \"cursor\") { count }");

    assertThatThrownBy(() -> StructuralValidator.validateConnectionField(friends, fieldNames))
        .isInstanceOfSatisfying(
            RelayTransformException.class,
            e -> {
              assertThat(e.getCode()).isEqualTo(ErrorCode.CONFLICTING_PAGINATION_ARGUMENTS);
              assertThat(e.getReason()).contains("friends(before: <cursor>, first: <count>)");
              assertThat(e.getCategory()).isEqualTo(ErrorCode.Category.STRUCTURAL_VIOLATION);
            });
  }

  @Test
  void rejectsAfterWithLast() {
    RelayQLField friends = friends("friends(last: 10, after: \"cursor\") { count }");

    assertThatThrownBy(() -> StructuralValidator.validateConnectionField(friends, fieldNames))
        .hasMessageContaining("friends(after: <cursor>, last: <count>)");
  }

  @Test
  void rejectsLiteralMixedWithVariable() {
    RelayQLField friends = friends("friends(first: 10, last: $last) { count }");

    assertFailsWith(
        ErrorCode.CONFLICTING_PAGINATION_ARGUMENTS,
        () -> StructuralValidator.validateConnectionField(friends, fieldNames));
  }

  @Test
  void acceptsCursorsAsVariables() {
    RelayQLField friends = friends("friends(first: $first, before: $before) { count }");

    assertThatCode(() -> StructuralValidator.validateConnectionField(friends, fieldNames))
        .doesNotThrowAnyException();
  }

  @Test
  void acceptsFindInsteadOfLimit() {
    RelayQLField friends = friends("friends(find: \"4\") { edges { node { name } } }");

    assertThatCode(() -> StructuralValidator.validateConnectionField(friends, fieldNames))
        .doesNotThrowAnyException();
  }

  @Test
  void checksFieldsOfInlineFragments() {
    RelayQLField friends =
        friends("friends { ... on UserConnection { pageInfo { hasNextPage } } }");

    assertThatThrownBy(() -> StructuralValidator.validateConnectionField(friends, fieldNames))
        .isInstanceOfSatisfying(
            RelayTransformException.class,
            e -> {
              assertThat(e.getCode()).isEqualTo(ErrorCode.MISSING_PAGINATION_ARGUMENT);
              assertThat(e.getReason())
                  .startsWith(
                      "You supplied the `pageInfo` field on a connection named `friends`");
            });
  }

  @Test
  void doesNotLookIntoFragmentSpreads() {
    RelayQLField friends = friends("friends { ...UserConnectionFragment }");

    assertThatCode(() -> StructuralValidator.validateConnectionField(friends, fieldNames))
        .doesNotThrowAnyException();
  }

  @Test
  void allowsNodeFieldOnQueryType() {
    RelayQLDefinition query = definition("query NodeQuery { node(id: \"1\") { id } }");
    RelayQLType queryType = query.getType();

    assertThatCode(() -> StructuralValidator.validateField(query.getFields().get(0), queryType))
        .doesNotThrowAnyException();
  }

  @Test
  void rejectsNodeFieldOnOtherTypes() {
    RelayQLDefinition query =
        definition(
            "query ViewerQuery { viewer { settings { node(id: \"1\") { notifications } } } }");
    RelayQLField settings = (RelayQLField) query.getFields().get(0).getSelections().get(0);
    RelayQLField node = (RelayQLField) settings.getSelections().get(0);

    assertThatThrownBy(() -> StructuralValidator.validateField(node, settings.getType()))
        .isInstanceOfSatisfying(
            RelayTransformException.class,
            e -> {
              assertThat(e.getCode()).isEqualTo(ErrorCode.MISPLACED_NODE_FIELD);
              assertThat(e.getReason())
                  .startsWith("You defined a `node(id: ID)` field on type `Settings`");
              assertThat(e.getLocation()).isNotNull();
              assertThat(e.getMessage()).endsWith("(line 1, column 41)");
            });
  }

  @Test
  void requiresSingleInputArgumentOnMutationFields() {
    RelayQLField rateStory = mutationField("rateStory(input: $input) { story { text } }");
    RelayQLField shareStory = mutationField("shareStory(data: $input) { story { text } }");

    assertThatThrownBy(() -> StructuralValidator.validateMutationField(rateStory, "input"))
        .hasMessageContaining("takes 2 arguments");
    assertThatThrownBy(() -> StructuralValidator.validateMutationField(shareStory, "input"))
        .hasMessageContaining("takes an argument named `data`");
    assertThatCode(() -> StructuralValidator.validateMutationField(shareStory, "data"))
        .doesNotThrowAnyException();
  }

  private static RelayQLDefinition definition(String text) {
    return RelayQLDefinition.of(
        TestSchemas.context(), RelayQLCompiler.parse(text).getDefinitions().get(0));
  }

  private static RelayQLField friends(String selection) {
    RelayQLDefinition fragment = definition("fragment UserFriends on User { " + selection + " }");
    return fragment.getFields().get(0);
  }

  private static RelayQLField mutationField(String selection) {
    return definition("mutation M { " + selection + " }").getFields().get(0);
  }
}
