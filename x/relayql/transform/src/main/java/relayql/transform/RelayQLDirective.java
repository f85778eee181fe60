package relayql.transform;

import graphql.language.Argument;
import graphql.language.Directive;
import graphql.schema.GraphQLArgument;
import graphql.schema.GraphQLDirective;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** A directive applied in a definition. The schema must declare it. */
public final class RelayQLDirective {

  private final Directive ast;
  private final GraphQLDirective definition;

  RelayQLDirective(RelayQLContext context, Directive ast) {
    this.ast = ast;
    GraphQLDirective definition = context.schema().getDirective(ast.getName());
    if (definition == null) {
      throw new RelayTransformException(
          ErrorCode.UNKNOWN_DIRECTIVE,
          String.format(
              "You supplied a directive named `%s`, but no such directive exists.",
              ast.getName()),
          ast.getSourceLocation());
    }
    this.definition = definition;
  }

  public String getName() {
    return ast.getName();
  }

  public List<RelayQLArgument> getArguments() {
    List<RelayQLArgument> arguments = new ArrayList<>();
    for (Argument argument : ast.getArguments()) {
      GraphQLArgument declared = definition.getArgument(argument.getName());
      if (declared == null) {
        throw new RelayTransformException(
            ErrorCode.UNKNOWN_ARGUMENT,
            String.format(
                "You supplied an argument named `%s` on directive `%s`, but no such argument "
                    + "exists on that directive.",
                argument.getName(),
                getName()),
            argument.getSourceLocation());
      }
      arguments.add(
          new RelayQLArgument(
              argument.getName(),
              argument.getValue(),
              new RelayQLArgumentType(declared.getType()),
              argument.getSourceLocation()));
    }
    return arguments;
  }

  public @Nullable RelayQLArgument findArgument(String argumentName) {
    for (RelayQLArgument argument : getArguments()) {
      if (argument.getName().equals(argumentName)) {
        return argument;
      }
    }
    return null;
  }
}
