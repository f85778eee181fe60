package relayql.transform;

import graphql.schema.GraphQLSchema;
import graphql.schema.idl.RuntimeWiring;
import graphql.schema.idl.SchemaGenerator;
import graphql.schema.idl.SchemaParser;
import graphql.schema.idl.TypeDefinitionRegistry;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.List;

/**
 * Builds the schema definitions are compiled against from SDL. The schema is only introspected,
 * never executed, so every field is wired to a mocked data fetcher.
 */
public class SchemaLoader {

  private final SchemaParser schemaParser = new SchemaParser();
  private final SchemaGenerator schemaGenerator = new SchemaGenerator();

  /**
   * Parses SDL text.
   *
   * @param sdl the schema definition language source
   * @return the schema
   */
  public GraphQLSchema parse(String sdl) {
    return build(schemaParser.parse(sdl));
  }

  /**
   * Parses a schema from a Reader.
   *
   * @param reader the reader to parse from
   * @return the schema
   * @throws IOException if there's an error reading the content
   */
  public GraphQLSchema parse(Reader reader) throws IOException {
    try (reader) {
      return build(schemaParser.parse(reader));
    }
  }

  /**
   * Parses a schema file.
   *
   * @param schemaFile the schema file to parse
   * @return the schema
   */
  public GraphQLSchema parse(File schemaFile) {
    return parse(List.of(schemaFile));
  }

  /**
   * Parses several schema files and merges them, so type extensions may live in separate files.
   *
   * @param schemaFiles the schema files to parse
   * @return the merged schema
   */
  public GraphQLSchema parse(List<File> schemaFiles) {
    TypeDefinitionRegistry registry = new TypeDefinitionRegistry();
    for (File schemaFile : schemaFiles) {
      registry.merge(schemaParser.parse(schemaFile));
    }
    return build(registry);
  }

  private GraphQLSchema build(TypeDefinitionRegistry registry) {
    return schemaGenerator.makeExecutableSchema(registry, RuntimeWiring.MOCKED_WIRING);
  }
}
