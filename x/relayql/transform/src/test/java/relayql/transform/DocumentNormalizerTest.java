package relayql.transform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static relayql.transform.TransformAssertions.assertFailsWith;

import graphql.language.Definition;
import graphql.language.SourceLocation;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import relayql.api.cqir.CallVariable;

class DocumentNormalizerTest {

  @Test
  void numbersArgumentSlotsPerFragment() {
    NormalizedDocument document =
        normalize(
            "fragment Story_story on Story { ...Foo ...Foo @arguments(size: 1) "
                + "...Bar @arguments(size: $size) ...Foo @arguments(size: 2) }");

    assertThat(document.slots().keySet())
        .containsExactly("Foo", "Foo_args1", "Bar_args1", "Foo_args2");
    assertThat(slotsWithoutLocations(document))
        .containsEntry("Foo", new SubstitutionSlot("Foo", null, true))
        .containsEntry("Foo_args1", new SubstitutionSlot("Foo", Map.of("size", 1L), true))
        .containsEntry("Foo_args2", new SubstitutionSlot("Foo", Map.of("size", 2L), true))
        .containsEntry(
            "Bar_args1",
            new SubstitutionSlot("Bar", Map.of("size", new CallVariable("size")), true));
    assertThat(document.printedText())
        .contains("...Foo_args1", "...Bar_args1", "...Foo_args2")
        .doesNotContain("@arguments");
  }

  @Test
  void startsNumberingAfreshForEachDefinition() {
    String text = "fragment Story_story on Story { ...Foo @arguments(size: 1) }";

    assertThat(normalize(text).slots()).containsOnlyKeys("Foo_args1");
    assertThat(normalize(text).slots()).containsOnlyKeys("Foo_args1");
  }

  @Test
  void marksSpreadsWithMaskFalseAsUnmasked() {
    NormalizedDocument document =
        normalize(
            "fragment Story_story on Story { "
                + "...Foo @relay(mask: false) ...Bar @relay(mask: true) }");

    assertThat(slotsWithoutLocations(document))
        .containsExactly(
            entry("Foo", new SubstitutionSlot("Foo", null, false)),
            entry("Bar", new SubstitutionSlot("Bar", null, true)));
    assertThat(document.printedText()).doesNotContain("@relay");
  }

  @Test
  void collectsArgumentDefinitionsAndVariables() {
    NormalizedDocument document =
        normalize(
            "fragment User_user on User @argumentDefinitions(size: {type: \"Int\"}) { "
                + "profilePicture(size: $size) { uri } "
                + "friends(first: $count) @connection(key: \"User_friends\") { count } "
                + "...Foo @arguments(scale: $scale) }");

    assertThat(document.argumentDefinitions()).hasSize(1);
    assertThat(document.argumentDefinitions().get(0).getName()).isEqualTo("size");
    assertThat(document.variables()).containsExactly("size", "count", "scale");
    assertThat(document.printedText())
        .doesNotContain("@argumentDefinitions")
        .doesNotContain("@connection")
        .contains("profilePicture(size: $size)");
  }

  @Test
  void recordsOperationVariablesFirst() {
    NormalizedDocument document =
        normalize(
            "query UserQuery($id: ID!, $unused: Int) { "
                + "user(id: $id) { friends(first: 10, orderby: [$order]) @include(if: $show) "
                + "{ count } } }");

    assertThat(document.variables()).containsExactly("id", "unused", "order", "show");
    assertThat(document.argumentDefinitions()).isNull();
    assertThat(document.slots()).isEmpty();
  }

  @Test
  void rewritesSpreadsInsideInlineFragments() {
    NormalizedDocument document =
        normalize(
            "fragment Story_story on Story { "
                + "author { ... on User { ...Foo @arguments(a: 1) } } }");

    assertThat(document.slots()).containsOnlyKeys("Foo_args1");
    assertThat(document.printedText()).contains("...Foo_args1");
  }

  @Test
  void rejectsDuplicateArgumentDefinitions() {
    assertFailsWith(
        ErrorCode.DUPLICATE_ARGUMENT_DEFINITIONS,
        () ->
            normalize(
                "fragment User_user on User @argumentDefinitions(a: {type: \"Int\"}) "
                    + "@argumentDefinitions(b: {type: \"Int\"}) { name }"));
  }

  @Test
  void rejectsArgumentsTogetherWithUnmasking() {
    assertFailsWith(
        ErrorCode.CONFLICTING_SPREAD_DIRECTIVES,
        () ->
            normalize(
                "fragment Story_story on Story { ...Foo @arguments(a: 1) @relay(mask: false) }"));
  }

  @Test
  void rejectsRelayDirectiveWithoutMask() {
    assertFailsWith(
        ErrorCode.INVALID_RELAY_SPREAD_DIRECTIVE,
        () -> normalize("fragment Story_story on Story { ...Foo @relay(plural: true) }"));
  }

  @Test
  void rejectsOtherSpreadDirectives() {
    assertFailsWith(
        ErrorCode.UNSUPPORTED_SPREAD_DIRECTIVE,
        () -> normalize("fragment Story_story on Story { ...Foo @include(if: $show) }"));
  }

  @Test
  void rejectsInputObjectFragmentArguments() {
    assertFailsWith(
        ErrorCode.UNSUPPORTED_LITERAL,
        () -> normalize("fragment Story_story on Story { ...Foo @arguments(a: {b: 1}) }"));
  }

  @Test
  void keepsListFragmentArguments() {
    NormalizedDocument document =
        normalize("fragment Story_story on Story { ...Foo @arguments(ids: [\"1\", \"2\"]) }");

    assertThat(document.slots().get("Foo_args1").arguments())
        .containsExactly(entry("ids", List.of("1", "2")));
  }

  @Test
  void recordsWhereEachSpreadAppears() {
    NormalizedDocument document =
        normalize("fragment Story_story on Story {\n  text\n  ...Foo @arguments(size: 1)\n}");

    SourceLocation location = document.slots().get("Foo_args1").location();
    assertThat(location).isNotNull();
    assertThat(location.getLine()).isEqualTo(3);
  }

  private static Map<String, SubstitutionSlot> slotsWithoutLocations(NormalizedDocument document) {
    Map<String, SubstitutionSlot> slots = new LinkedHashMap<>();
    document
        .slots()
        .forEach(
            (name, slot) ->
                slots.put(
                    name,
                    new SubstitutionSlot(slot.fragmentName(), slot.arguments(), slot.masked())));
    return slots;
  }

  private static NormalizedDocument normalize(String text) {
    Definition<?> definition = RelayQLCompiler.parse(text).getDefinitions().get(0);
    return DocumentNormalizer.normalize(definition);
  }
}
