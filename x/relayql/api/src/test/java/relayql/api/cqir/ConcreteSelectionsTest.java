package relayql.api.cqir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConcreteSelectionsTest {

  private static ConcreteField field(String alias, String name, Map<String, Object> metadata) {
    return new ConcreteField(alias, name, "String", null, null, null, metadata);
  }

  @Test
  void fieldsSkipReferencesAndFragments() {
    ConcreteField name = field(null, "name", Map.of());
    ConcreteFragment fragment =
        new ConcreteFragment("Foo", "User", null, null, Map.of("isAbstract", false));
    ConcreteSelections selections =
        new ConcreteSelections(List.of(name, new FragmentReference("Foo"), fragment), true);

    assertThat(selections.fields()).containsExactly(name);
    assertThat(selections.flatten()).isTrue();
  }

  @Test
  void responseKeyPrefersAlias() {
    assertThat(field("displayName", "name", Map.of()).responseKey()).isEqualTo("displayName");
    assertThat(field(null, "name", Map.of()).responseKey()).isEqualTo("name");
  }

  @Test
  void hasFlagOnlyForTrueValues() {
    ConcreteField field = field(null, "id", Map.of("isGenerated", true, "isRequisite", false));

    assertThat(field.hasFlag("isGenerated")).isTrue();
    assertThat(field.hasFlag("isRequisite")).isFalse();
    assertThat(field.hasFlag("isConnection")).isFalse();
  }

  @Test
  void copiesInputs() {
    List<ConcreteSelection> selections = new ArrayList<>();
    selections.add(field(null, "name", Map.of()));
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("b", 1);
    metadata.put("a", 2);

    ConcreteSelections copy = new ConcreteSelections(selections, false);
    ConcreteField field = field(null, "text", metadata);
    selections.clear();
    metadata.put("c", 3);

    assertThat(copy.selections()).hasSize(1);
    assertThat(field.metadata().keySet()).containsExactly("b", "a");
    assertThatThrownBy(() -> field.metadata().put("d", 4))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
