package relayql.transform;

import graphql.language.ArrayValue;
import graphql.language.SourceLocation;
import graphql.language.Value;
import graphql.language.VariableReference;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** An argument applied to a field or directive, paired with its declared type. */
public final class RelayQLArgument {

  private final String name;
  private final Value<?> value;
  private final RelayQLArgumentType type;
  private final @Nullable SourceLocation location;

  RelayQLArgument(
      String name, Value<?> value, RelayQLArgumentType type, @Nullable SourceLocation location) {
    this.name = name;
    this.value = value;
    this.type = type;
    this.location = location;
  }

  public String getName() {
    return name;
  }

  public RelayQLArgumentType getType() {
    return type;
  }

  public @Nullable SourceLocation getLocation() {
    return location;
  }

  public boolean isVariable() {
    return value instanceof VariableReference;
  }

  public String getVariableName() {
    if (value instanceof VariableReference variable) {
      return variable.getName();
    }
    throw new IllegalStateException("Argument `" + name + "` is not a variable");
  }

  /** True for a list literal, whose elements may themselves be variables. */
  public boolean isList() {
    return value instanceof ArrayValue;
  }

  /** The elements of a list literal, each typed with the list's element type. */
  public List<RelayQLArgument> getListElements() {
    if (!(value instanceof ArrayValue array)) {
      throw new IllegalStateException("Argument `" + name + "` is not a list");
    }
    List<RelayQLArgument> elements = new ArrayList<>();
    for (Value<?> element : array.getValues()) {
      elements.add(new RelayQLArgument(name, element, type.ofType(), location));
    }
    return elements;
  }

  /** The literal payload; see {@link relayql.api.cqir.CallValue}. */
  public @Nullable Object getLiteralValue() {
    return LiteralValues.toPayload(value, location);
  }
}
