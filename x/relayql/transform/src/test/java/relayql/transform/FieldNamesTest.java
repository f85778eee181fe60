package relayql.transform;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class FieldNamesTest {

  @Test
  void camelCaseByDefault() {
    FieldNames names = FieldNames.of(false);

    assertThat(names.pageInfo()).isEqualTo("pageInfo");
    assertThat(names.clientMutationId()).isEqualTo("clientMutationId");
    assertThat(names.typename()).isEqualTo("__typename");
  }

  @Test
  void snakeCaseRenamesCompoundNames() {
    FieldNames names = FieldNames.of(true);

    assertThat(names.pageInfo()).isEqualTo("page_info");
    assertThat(names.hasNextPage()).isEqualTo("has_next_page");
    assertThat(names.hasPreviousPage()).isEqualTo("has_previous_page");
    assertThat(names.clientSubscriptionId()).isEqualTo("client_subscription_id");
    assertThat(names.typename()).isEqualTo("__typename");
    assertThat(names.edges()).isEqualTo("edges");
  }

  @Test
  void toSnakeCase() {
    assertThat(FieldNames.toSnakeCase("hasNextPage")).isEqualTo("has_next_page");
    assertThat(FieldNames.toSnakeCase("cursor")).isEqualTo("cursor");
  }
}
