package relayql.transform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static relayql.transform.TransformAssertions.assertFailsWith;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import relayql.api.artifact.FragmentInitializer;
import relayql.api.cqir.CallVariable;

class FragmentReferenceResolverTest {

  @Test
  void resolvesMaskedSlotThroughContainer() {
    SubstitutionSlot slot = new SubstitutionSlot("TodoList_list", null, true);

    FragmentInitializer imported =
        FragmentReferenceResolver.resolve(
            "TodoList_list", slot, BindingScope.of(Map.of("TodoList", BindingKind.IMPORT)));
    FragmentInitializer local =
        FragmentReferenceResolver.resolve(
            "TodoList_list", slot, BindingScope.of(Map.of("TodoList", BindingKind.LOCAL)));

    assertThat(imported)
        .isEqualTo(
            new FragmentInitializer.Masked(
                "TodoList_list", "TodoList_list", "TodoList", "list", false, null));
    assertThat(((FragmentInitializer.Masked) local).containerCheck()).isTrue();
  }

  @Test
  void masksWithoutAnyBinding() {
    FragmentInitializer initializer =
        FragmentReferenceResolver.resolve(
            "Foo", new SubstitutionSlot("Foo", null, true), BindingScope.empty());

    assertThat(initializer)
        .isEqualTo(new FragmentInitializer.Masked("Foo", "Foo", "Foo", "data", false, null));
  }

  @Test
  void carriesFragmentArguments() {
    Map<String, Object> arguments = new LinkedHashMap<>();
    arguments.put("size", new CallVariable("size"));
    arguments.put("count", 10L);

    FragmentInitializer.Masked initializer =
        (FragmentInitializer.Masked)
            FragmentReferenceResolver.resolve(
                "Foo_args1", new SubstitutionSlot("Foo", arguments, true), BindingScope.empty());

    assertThat(initializer.substitutionName()).isEqualTo("Foo_args1");
    assertThat(initializer.arguments()).containsExactlyEntriesOf(arguments);
  }

  @Test
  void readsUnmaskedSlotFromModule() {
    FragmentInitializer initializer =
        FragmentReferenceResolver.resolve(
            "Bar_user",
            new SubstitutionSlot("Bar_user", null, false),
            BindingScope.of(Map.of("Bar", BindingKind.REQUIRE)));

    assertThat(initializer)
        .isEqualTo(
            new FragmentInitializer.Unmasked("Bar_user", "Bar_user", "Bar", "user", false));
  }

  @Test
  void prefersLocalPropertyBindingForUnmaskedSlot() {
    FragmentInitializer initializer =
        FragmentReferenceResolver.resolve(
            "Bar_user",
            new SubstitutionSlot("Bar_user", null, false),
            BindingScope.of(Map.of("Bar", BindingKind.IMPORT, "user", BindingKind.LOCAL)));

    assertThat(((FragmentInitializer.Unmasked) initializer).localPropertyBinding()).isTrue();
  }

  @Test
  void rejectsUnmaskedSlotThatCannotBeReached() {
    SubstitutionSlot slot = new SubstitutionSlot("Bar_user", null, false);

    assertThatThrownBy(
            () -> FragmentReferenceResolver.resolve("Bar_user", slot, BindingScope.empty()))
        .isInstanceOfSatisfying(
            RelayTransformException.class,
            e -> {
              assertThat(e.getCode()).isEqualTo(ErrorCode.UNRESOLVED_FRAGMENT_REFERENCE);
              assertThat(e.getCategory())
                  .isEqualTo(ErrorCode.Category.SCOPE_RESOLUTION_FAILURE);
              assertThat(e.getMessage())
                  .isEqualTo(
                      "Please make sure module 'Bar' is imported and not renamed or the "
                          + "fragment 'Bar_user' is defined and bound to local variable 'user'.");
            });
  }

  @Test
  void keepsSlotOrder() {
    Map<String, SubstitutionSlot> slots = new LinkedHashMap<>();
    slots.put("Foo", new SubstitutionSlot("Foo", null, true));
    slots.put("Foo_args1", new SubstitutionSlot("Foo", Map.of("a", 1L), true));
    slots.put("Bar_user", new SubstitutionSlot("Bar_user", null, false));

    List<FragmentInitializer> initializers =
        FragmentReferenceResolver.resolve(
            slots, BindingScope.of(Map.of("user", BindingKind.LOCAL)));

    assertThat(initializers)
        .extracting(FragmentInitializer::substitutionName)
        .containsExactly("Foo", "Foo_args1", "Bar_user");
  }

  @Test
  void rejectsMalformedFragmentName() {
    assertFailsWith(
        ErrorCode.INVALID_FRAGMENT_NAME,
        () ->
            FragmentReferenceResolver.resolve(
                "Foo_data", new SubstitutionSlot("Foo_data", null, true), BindingScope.empty()));
  }
}
