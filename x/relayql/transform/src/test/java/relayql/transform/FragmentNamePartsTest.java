package relayql.transform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static relayql.transform.TransformAssertions.assertFailsWith;

import graphql.language.SourceLocation;
import org.junit.jupiter.api.Test;

class FragmentNamePartsTest {

  @Test
  void splitsModuleAndProperty() {
    assertThat(FragmentNameParts.parse("TodoList_list"))
        .isEqualTo(new FragmentNameParts("TodoList", "list"));
    assertThat(FragmentNameParts.parse("Todo_list_items"))
        .isEqualTo(new FragmentNameParts("Todo", "list_items"));
  }

  @Test
  void defaultsToDataProperty() {
    assertThat(FragmentNameParts.parse("TodoList"))
        .isEqualTo(new FragmentNameParts("TodoList", "data"));
  }

  @Test
  void rejectsExplicitDataProperty() {
    assertThatThrownBy(() -> FragmentNameParts.parse("TodoList_data"))
        .isInstanceOf(RelayTransformException.class)
        .hasMessageContaining("Name the fragment `TodoList` instead.");
  }

  @Test
  void rejectsNamesOutsideTheConvention() {
    assertFailsWith(ErrorCode.INVALID_FRAGMENT_NAME, () -> FragmentNameParts.parse("_list"));
    assertFailsWith(ErrorCode.INVALID_FRAGMENT_NAME, () -> FragmentNameParts.parse("Todo-List"));
    assertFailsWith(ErrorCode.INVALID_FRAGMENT_NAME, () -> FragmentNameParts.parse("TodoList_"));
  }

  @Test
  void reportsWhereTheNameAppears() {
    SourceLocation location = new SourceLocation(4, 10);

    assertThatThrownBy(() -> FragmentNameParts.parse("TodoList_data", location))
        .isInstanceOfSatisfying(
            RelayTransformException.class,
            e -> {
              assertThat(e.getLocation()).isSameAs(location);
              assertThat(e.getMessage()).endsWith("(line 4, column 10)");
            });
  }
}
