package relayql.transform;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import relayql.api.cqir.CallValue;

class JavaScriptPrinterTest {

  private final RelayQLCompiler compiler = new RelayQLCompiler(TestSchemas.schema());
  private final JavaScriptPrinter printer = new JavaScriptPrinter(TransformOptions.defaults());

  @Test
  void printsArtifactAsFunctionOfRuntimeHelpers() {
    String js =
        printer.print(
            compiler.compileGraphQLTag(
                "fragment User_user on User { name ...Foo }", BindingScope.empty(), "user"));

    assertThat(js).startsWith("function (RelayQL_GENERATED) {");
    assertThat(js).contains("const Foo = Foo.getFragment(\"data\");");
    assertThat(js).contains("return {");
    assertThat(js).contains("kind: \"FragmentDefinition\"");
    assertThat(js).contains("argumentDefinitions: []");
    assertThat(js).contains("kind: \"Fragment\"");
    assertThat(js).contains("id: RelayQL_GENERATED.__id()");
    assertThat(js).contains("children: [].concat.apply([], [");
    assertThat(js).contains("RelayQL_GENERATED.__frag(Foo)");
    assertThat(js).endsWith("}");
  }

  @Test
  void passesFragmentArguments() {
    String js =
        printer.print(
            compiler.compileGraphQLTag(
                "fragment User_user on User "
                    + "@argumentDefinitions(size: {type: \"Int\", defaultValue: 32}) { "
                    + "profilePicture(size: $size) { uri } ...Foo @arguments(size: $size) }",
                BindingScope.empty(),
                "user"));

    assertThat(js).contains("const Foo_args1 = Foo.getFragment(\"data\", {");
    assertThat(js).contains("callVariableName: \"size\"");
    assertThat(js).contains("kind: \"LocalArgument\"");
    assertThat(js).contains("defaultValue: 32");
  }

  @Test
  void looksUpLocalContainersFirst() {
    String js =
        printer.print(
            compiler.compileGraphQLTag(
                "fragment User_user on User { ...Foo }",
                BindingScope.of(Map.of("Foo", BindingKind.LOCAL)),
                "user"));

    assertThat(js).contains("const Foo = (Foo.__container__ || Foo).getFragment(\"data\");");
  }

  @Test
  void readsUnmaskedFragmentsFromModules() {
    String js =
        printer.print(
            compiler.compileGraphQLTag(
                "fragment Story_story on Story { text ...Bar_user @relay(mask: false) }",
                BindingScope.of(Map.of("Bar", BindingKind.REQUIRE)),
                "story"));

    assertThat(js)
        .contains(
            "const Bar_user = RelayQL_GENERATED.__getClassicFragment(Bar.user.user || Bar.user, "
                + "true).node;");
  }

  @Test
  void readsUnmaskedFragmentsFromLocalProperty() {
    String js =
        printer.print(
            compiler.compileGraphQLTag(
                "fragment Story_story on Story { text ...Bar_user @relay(mask: false) }",
                BindingScope.of(Map.of("user", BindingKind.LOCAL)),
                "story"));

    assertThat(js).contains("RelayQL_GENERATED.__getClassicFragment(user.user, true).node;");
  }

  @Test
  void printsOperationHeader() {
    String js =
        printer.print(
            compiler.compileGraphQLTag(
                "query UserQuery($id: ID!) { user(id: $id) { name } }",
                BindingScope.empty(),
                null));

    assertThat(js).doesNotContain("const ");
    assertThat(js).contains("kind: \"OperationDefinition\"");
    assertThat(js).contains("params: {}");
    assertThat(js).contains("name: \"UserQuery\"");
    assertThat(js).contains("operation: \"query\"");
    assertThat(js).contains("defaultValue: null");
  }

  @Test
  void printsFragmentMapKeyedByProperty() {
    String js =
        printer.print(
            compiler.compileGraphQLTag(
                "fragment Feed_story on Story { text } "
                    + "fragment Feed_viewer on Viewer { actor { name } }",
                BindingScope.empty(),
                null));

    assertThat(js).startsWith("{");
    assertThat(js).contains("story: function (RelayQL_GENERATED) {");
    assertThat(js).contains("viewer: function (RelayQL_GENERATED) {");
    assertThat(js.indexOf("story:")).isLessThan(js.indexOf("viewer:"));
  }

  @Test
  void usesConfiguredTagName() {
    JavaScriptPrinter custom =
        new JavaScriptPrinter(TransformOptions.defaults().withTagName("GQL"));

    String js =
        custom.print(
            compiler.compileGraphQLTag(
                "fragment User_user on User { name ...Foo }", BindingScope.empty(), "user"));

    assertThat(js).startsWith("function (GQL) {");
    assertThat(js).contains("GQL.__frag(Foo)");
    assertThat(js).doesNotContain("RelayQL_GENERATED");
  }

  @Test
  void quotesPropertyKeysThatAreNotIdentifiers() {
    assertThat(JavaScriptPrinter.propertyKey("story")).isEqualTo("story");
    assertThat(JavaScriptPrinter.propertyKey("$story_2")).isEqualTo("$story_2");
    assertThat(JavaScriptPrinter.propertyKey("my-prop")).isEqualTo("\"my-prop\"");
    assertThat(JavaScriptPrinter.propertyKey("2nd")).isEqualTo("\"2nd\"");
  }

  @Test
  void printsRelayQLLiteralAsExpression() {
    String js =
        printer.printExpression(
            compiler.compileRelayQL(
                "fragment UserPicture on User @relay(variables: [\"size\"]) { "
                    + "profilePicture(size: $size) { uri } }",
                Set.of("size")));

    assertThat(js).startsWith("RelayQL_GENERATED.__createFragment({");
    assertThat(js).contains("RelayQL_GENERATED.__var(size)");
    assertThat(js).contains("size: RelayQL_GENERATED.__var(size)");
  }

  @Test
  void escapesStringValues() {
    assertThat(printer.printExpression(new CallValue("say \"hi\"")))
        .isEqualTo("{\n  kind: \"CallValue\",\n  callValue: \"say \\\"hi\\\"\"\n}");
    assertThat(printer.printExpression(new CallValue(null))).contains("callValue: null");
  }
}
