package relayql.api.cqir;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A printed query: the single root field, its optional identifying-argument call, and the root
 * field's selections.
 *
 * @param name the query name
 * @param type the root field's type name without modifiers
 * @param fieldName the root field name
 * @param calls the identifying-argument call, or null when the root field takes no argument
 * @param children the root field's selections, or null when it has none
 * @param directives the root field's directives, or null when it has none
 * @param metadata {@code isPlural}, {@code isAbstract}, {@code identifyingArgName} and {@code
 *     identifyingArgType} when they apply
 */
public record ConcreteQuery(
    String name,
    String type,
    String fieldName,
    @Nullable List<ConcreteCall> calls,
    @Nullable ConcreteSelections children,
    @Nullable List<ConcreteDirective> directives,
    Map<String, Object> metadata)
    implements ConcreteNode, ConcreteDefinition {

  public ConcreteQuery {
    Objects.requireNonNull(name, "name");
    calls = Copies.nullableList(calls);
    directives = Copies.nullableList(directives);
    metadata = Copies.orderedMap(metadata);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.QUERY;
  }

  @Override
  public <R> R accept(ConcreteVisitor<R> visitor) {
    return visitor.visitQuery(this);
  }
}
