package relayql.transform;

import graphql.schema.GraphQLSchema;
import java.util.Objects;

/**
 * What every node of the typed view needs: the schema, the runtime's field names, and whether
 * the enclosing definition is a pattern ({@code @relay(pattern: true)}), which relaxes the
 * pagination-argument requirement on connections.
 */
public record RelayQLContext(GraphQLSchema schema, FieldNames fieldNames, boolean pattern) {

  public RelayQLContext {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(fieldNames, "fieldNames");
  }

  public static RelayQLContext of(GraphQLSchema schema, TransformOptions options) {
    return new RelayQLContext(schema, FieldNames.of(options.snakeCase()), false);
  }

  RelayQLContext withPattern(boolean pattern) {
    return pattern == this.pattern ? this : new RelayQLContext(schema, fieldNames, pattern);
  }
}
