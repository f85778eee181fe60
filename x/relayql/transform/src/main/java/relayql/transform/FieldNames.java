package relayql.transform;

/**
 * Names of the fields the runtime itself relies on. With snake case enabled every camelCase name
 * is looked up as snake_case, so {@code pageInfo} becomes {@code page_info}. The identity field
 * and the {@code Node} interface keep their names in both modes.
 */
public record FieldNames(
    String typename,
    String clientMutationId,
    String clientSubscriptionId,
    String cursor,
    String edges,
    String hasNextPage,
    String hasPreviousPage,
    String node,
    String pageInfo) {

  public static final String ID = "id";
  public static final String NODE_INTERFACE = "Node";

  private static final FieldNames CAMEL_CASE =
      new FieldNames(
          "__typename",
          "clientMutationId",
          "clientSubscriptionId",
          "cursor",
          "edges",
          "hasNextPage",
          "hasPreviousPage",
          "node",
          "pageInfo");

  public static FieldNames of(boolean snakeCase) {
    if (!snakeCase) {
      return CAMEL_CASE;
    }
    FieldNames c = CAMEL_CASE;
    return new FieldNames(
        toSnakeCase(c.typename),
        toSnakeCase(c.clientMutationId),
        toSnakeCase(c.clientSubscriptionId),
        toSnakeCase(c.cursor),
        toSnakeCase(c.edges),
        toSnakeCase(c.hasNextPage),
        toSnakeCase(c.hasPreviousPage),
        toSnakeCase(c.node),
        toSnakeCase(c.pageInfo));
  }

  /** {@code hasNextPage} to {@code has_next_page}. */
  static String toSnakeCase(String name) {
    StringBuilder sb = new StringBuilder(name.length() + 4);
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (c >= 'A' && c <= 'Z') {
        sb.append('_').append(Character.toLowerCase(c));
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }
}
