package relayql.transform;

import graphql.language.Argument;
import graphql.language.Field;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** A field selection, resolved against the type it is selected on. */
public final class RelayQLField extends RelayQLNodeWithSelections implements RelayQLSelection {

  private final Field ast;
  private final RelayQLFieldDefinition definition;

  RelayQLField(RelayQLContext context, Field ast, RelayQLType parentType) {
    super(context, ast.getDirectives(), ast.getSelectionSet(), ast.getSourceLocation());
    this.ast = ast;
    RelayQLFieldDefinition definition = parentType.getFieldDefinition(ast.getName());
    if (definition == null) {
      throw new RelayTransformException(
          ErrorCode.UNKNOWN_FIELD,
          String.format(
              "You supplied a field named `%s` on type `%s`, but no such field exists in the "
                  + "schema.",
              ast.getName(),
              parentType.getName(false)),
          ast.getSourceLocation());
    }
    this.definition = definition;
  }

  public String getName() {
    return ast.getName();
  }

  public @Nullable String getAlias() {
    return ast.getAlias();
  }

  @Override
  public RelayQLType getType() {
    return definition.getType();
  }

  /** The supplied arguments, in source order. */
  public List<RelayQLArgument> getArguments() {
    List<RelayQLArgument> arguments = new ArrayList<>();
    for (Argument argument : ast.getArguments()) {
      RelayQLArgumentType type = definition.getArgument(argument.getName());
      if (type == null) {
        throw new RelayTransformException(
            ErrorCode.UNKNOWN_ARGUMENT,
            String.format(
                "You supplied an argument named `%s` on field `%s`, but no such argument "
                    + "exists on that field.",
                argument.getName(),
                getName()),
            argument.getSourceLocation());
      }
      arguments.add(
          new RelayQLArgument(
              argument.getName(), argument.getValue(), type, argument.getSourceLocation()));
    }
    return arguments;
  }

  public boolean hasArgument(String argumentName) {
    return ast.getArguments().stream().anyMatch(arg -> arg.getName().equals(argumentName));
  }

  public @Nullable RelayQLArgument findArgument(String argumentName) {
    for (RelayQLArgument argument : getArguments()) {
      if (argument.getName().equals(argumentName)) {
        return argument;
      }
    }
    return null;
  }

  public boolean hasDeclaredArgument(String argumentName) {
    return definition.hasArgument(argumentName);
  }

  public @Nullable RelayQLArgumentType getDeclaredArgument(String argumentName) {
    return definition.getArgument(argumentName);
  }

  public Map<String, RelayQLArgumentType> getDeclaredArguments() {
    return definition.getDeclaredArguments();
  }

  /** True inside a definition marked {@code @relay(pattern: true)}. */
  public boolean isPattern() {
    return getContext().pattern();
  }

  @Override
  public <R> R accept(RelayQLSelection.Visitor<R> visitor) {
    return visitor.visitField(this);
  }
}
