package relayql.transform;

import graphql.schema.GraphQLSchema;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/** The schema the tests compile against, loaded once. */
final class TestSchemas {

  private static GraphQLSchema schema;

  private TestSchemas() {}

  static synchronized GraphQLSchema schema() {
    if (schema == null) {
      InputStream inputStream =
          Objects.requireNonNull(
              TestSchemas.class.getClassLoader().getResourceAsStream("schema.graphqls"));
      try {
        schema =
            new SchemaLoader()
                .parse(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }
    return schema;
  }

  static RelayQLContext context() {
    return RelayQLContext.of(schema(), TransformOptions.defaults());
  }
}
