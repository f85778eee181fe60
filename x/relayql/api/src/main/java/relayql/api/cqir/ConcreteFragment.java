package relayql.api.cqir;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A printed fragment, either a top-level fragment definition or an inline fragment nested in a
 * selection array. Its {@link #id()} is assigned by the runtime when the artifact is evaluated.
 */
public record ConcreteFragment(
    String name,
    String type,
    @Nullable ConcreteSelections children,
    @Nullable List<ConcreteDirective> directives,
    Map<String, Object> metadata)
    implements ConcreteNode, ConcreteDefinition, ConcreteSelection {

  public ConcreteFragment {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    directives = Copies.nullableList(directives);
    metadata = Copies.orderedMap(metadata);
  }

  public GeneratedFragmentId id() {
    return GeneratedFragmentId.INSTANCE;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.FRAGMENT;
  }

  @Override
  public <R> R accept(ConcreteVisitor<R> visitor) {
    return visitor.visitFragment(this);
  }
}
