package relayql.transform;

import graphql.schema.GraphQLArgument;
import graphql.schema.GraphQLFieldDefinition;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** A field as the schema declares it. */
public final class RelayQLFieldDefinition {

  private final RelayQLContext context;
  private final GraphQLFieldDefinition definition;

  RelayQLFieldDefinition(RelayQLContext context, GraphQLFieldDefinition definition) {
    this.context = context;
    this.definition = definition;
  }

  public String getName() {
    return definition.getName();
  }

  public RelayQLType getType() {
    return new RelayQLType(context, definition.getType());
  }

  /** Declared arguments by name, in declaration order. */
  public Map<String, RelayQLArgumentType> getDeclaredArguments() {
    Map<String, RelayQLArgumentType> arguments = new LinkedHashMap<>();
    for (GraphQLArgument argument : definition.getArguments()) {
      arguments.put(argument.getName(), new RelayQLArgumentType(argument.getType()));
    }
    return arguments;
  }

  public @Nullable RelayQLArgumentType getArgument(String argumentName) {
    GraphQLArgument argument = definition.getArgument(argumentName);
    return argument == null ? null : new RelayQLArgumentType(argument.getType());
  }

  public boolean hasArgument(String argumentName) {
    return definition.getArgument(argumentName) != null;
  }
}
