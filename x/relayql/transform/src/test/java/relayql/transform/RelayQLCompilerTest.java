package relayql.transform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static relayql.transform.TransformAssertions.assertFailsWith;

import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import relayql.api.artifact.ArtifactKind;
import relayql.api.artifact.ConcreteArtifact;
import relayql.api.cqir.ConcreteDefinition;
import relayql.api.cqir.ConcreteFragment;
import relayql.api.cqir.ConcreteQuery;
import relayql.api.cqir.ConcreteSubscription;
import relayql.api.cqir.FragmentReference;
import relayql.api.cqir.SubstitutionVariable;

class RelayQLCompilerTest {

  private final RelayQLCompiler compiler = new RelayQLCompiler(TestSchemas.schema());

  @Test
  void compilesOperationTag() {
    TagReplacement replacement =
        compiler.compileGraphQLTag(
            "query ViewerQuery { viewer { actor { name } } }", BindingScope.empty(), null);

    assertThat(replacement).isInstanceOf(TagReplacement.Single.class);
    ConcreteArtifact artifact = ((TagReplacement.Single) replacement).artifact();
    assertThat(artifact.kind()).isEqualTo(ArtifactKind.OPERATION_DEFINITION);
    assertThat(artifact.name()).isEqualTo("ViewerQuery");
  }

  @Test
  void keysFragmentsByPropertyName() {
    TagReplacement replacement =
        compiler.compileGraphQLTag(
            "fragment Feed_story on Story { text } "
                + "fragment Feed_viewer on Viewer { actor { name } }",
            BindingScope.empty(),
            null);

    TagReplacement.FragmentMap map = (TagReplacement.FragmentMap) replacement;
    assertThat(map.artifacts()).containsOnlyKeys("story", "viewer");
    assertThat(map.artifacts().keySet()).containsExactly("story", "viewer");
    assertThat(map.artifacts().get("viewer").node().name()).isEqualTo("Feed_viewer");
  }

  @Test
  void compilesSingleFragmentForAssignedProperty() {
    TagReplacement replacement =
        compiler.compileGraphQLTag(
            "fragment Feed_story on Story { text }", BindingScope.empty(), "story");

    assertThat(((TagReplacement.Single) replacement).artifact().node().name())
        .isEqualTo("Feed_story");
  }

  @Test
  void rejectsSeveralFragmentsForAssignedProperty() {
    assertFailsWith(
        ErrorCode.UNEXPECTED_DEFINITIONS,
        () ->
            compiler.compileGraphQLTag(
                "fragment Feed_story on Story { text } fragment Feed_viewer on Viewer { "
                    + "actor { name } }",
                BindingScope.empty(),
                "story"));
  }

  @Test
  void rejectsOperationsMixedIntoFragmentTag() {
    assertFailsWith(
        ErrorCode.UNEXPECTED_DEFINITIONS,
        () ->
            compiler.compileGraphQLTag(
                "fragment Feed_story on Story { text } query Q { viewer { actor { name } } }",
                BindingScope.empty(),
                null));
  }

  @Test
  void rejectsSeveralOperationsInOneTag() {
    assertFailsWith(
        ErrorCode.UNEXPECTED_DEFINITIONS,
        () ->
            compiler.compileGraphQLTag(
                "query A { viewer { actor { name } } } query B { viewer { actor { name } } }",
                BindingScope.empty(),
                null));
  }

  @Test
  void rejectsSchemaDefinitions() {
    assertFailsWith(
        ErrorCode.UNSUPPORTED_DEFINITION,
        () -> compiler.compileGraphQLTag("type Foo { a: Int }", BindingScope.empty(), null));
  }

  @Test
  void numbersSlotsAfreshForEachTag() {
    String text = "fragment Feed_story on Story { ...Foo @arguments(size: 1) }";

    ConcreteArtifact first =
        ((TagReplacement.Single) compiler.compileGraphQLTag(text, BindingScope.empty(), "story"))
            .artifact();
    ConcreteArtifact second =
        ((TagReplacement.Single) compiler.compileGraphQLTag(text, BindingScope.empty(), "story"))
            .artifact();

    assertThat(first.initializers().get(0).substitutionName()).isEqualTo("Foo_args1");
    assertThat(second).isEqualTo(first);
  }

  @Test
  void reportsSyntaxErrorsWithLocation() {
    assertThatThrownBy(() -> RelayQLCompiler.parse("query Q { viewer { "))
        .isInstanceOfSatisfying(
            RelayTransformException.class,
            e -> {
              assertThat(e.getCode()).isEqualTo(ErrorCode.INVALID_SYNTAX);
              assertThat(e.getCategory()).isEqualTo(ErrorCode.Category.MALFORMED_INPUT);
              assertThat(e.getLocation()).isNotNull();
            });
  }

  @Test
  void compilesRelayQLLiteral() {
    ConcreteDefinition printed =
        compiler.compileRelayQL("query ViewerQuery { viewer { actor { name } } }", Set.of());

    assertThat(printed).isInstanceOf(ConcreteQuery.class);
    assertThat(((ConcreteQuery) printed).fieldName()).isEqualTo("viewer");
  }

  @Test
  void compilesRelayQLFragmentWithSubstitutions() {
    ConcreteDefinition printed =
        compiler.compileRelayQL(
            "fragment Feed_user on User { name ...friends }", Set.of("friends"));

    ConcreteFragment fragment = (ConcreteFragment) printed;
    assertThat(fragment.children().flatten()).isTrue();
    assertThat(fragment.children().selections()).contains(new FragmentReference("friends"));
  }

  @Test
  void compilesRelayQLSubscription() {
    ConcreteDefinition printed =
        compiler.compileRelayQL(
            "subscription StorySubscription { storyUpdated(input: $input) { story { text } } }",
            Set.of("input"));

    assertThat(((ConcreteSubscription) printed).calls().get(0).value())
        .isEqualTo(new SubstitutionVariable("input"));
  }

  @Test
  void relayQLLiteralHoldsExactlyOneDefinition() {
    assertFailsWith(
        ErrorCode.UNEXPECTED_DEFINITIONS,
        () ->
            compiler.compileRelayQL(
                "fragment A on User { name } fragment B on User { name }", Set.of()));
  }

  @Test
  void validationCanBeTurnedOffPerLiteral() {
    String text = "query TwoFields { viewer { actor { name } } node(id: \"1\") { id } }";

    assertFailsWith(ErrorCode.TOO_MANY_ROOT_FIELDS, () -> compiler.compileRelayQL(text, Set.of()));
    assertThat(compiler.compileRelayQL(text, Set.of(), false).name()).isEqualTo("TwoFields");
  }

  @Test
  void usesConfiguredOptions() {
    RelayQLCompiler lenient =
        new RelayQLCompiler(
            TestSchemas.schema(), TransformOptions.defaults().withValidation(false));
    String text = "query TwoFields { viewer { actor { name } } node(id: \"1\") { id } }";

    assertThat(lenient.getOptions().enableValidation()).isFalse();
    assertThat(lenient.compileRelayQL(text, Set.of()).name()).isEqualTo("TwoFields");
  }

  @Test
  void rejectsDirectivesMissingFromSchema() {
    assertFailsWith(
        ErrorCode.UNKNOWN_DIRECTIVE,
        () -> compiler.compileRelayQL("query Q { viewer @bogus { actor { name } } }", Set.of()));
  }

  @Test
  void resolvesFragmentsDefinedInScope() {
    TagReplacement replacement =
        compiler.compileGraphQLTag(
            "fragment Feed_story on Story { ...Story_story }",
            BindingScope.of(Map.of("Story", BindingKind.LOCAL)),
            "story");

    ConcreteArtifact artifact = ((TagReplacement.Single) replacement).artifact();
    assertThat(artifact.initializers()).hasSize(1);
    assertThat(artifact.initializers().get(0).moduleName()).isEqualTo("Story");
  }
}
