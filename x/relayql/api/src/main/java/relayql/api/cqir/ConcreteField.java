package relayql.api.cqir;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/** A printed field selection. */
public record ConcreteField(
    @Nullable String alias,
    String fieldName,
    String type,
    @Nullable List<ConcreteCall> calls,
    @Nullable ConcreteSelections children,
    @Nullable List<ConcreteDirective> directives,
    Map<String, Object> metadata)
    implements ConcreteNode, ConcreteSelection {

  public ConcreteField {
    Objects.requireNonNull(fieldName, "fieldName");
    Objects.requireNonNull(type, "type");
    calls = Copies.nullableList(calls);
    directives = Copies.nullableList(directives);
    metadata = Copies.orderedMap(metadata);
  }

  /** The key the response stores this field under. */
  public String responseKey() {
    return alias != null ? alias : fieldName;
  }

  /** True when the metadata flag is present and set. */
  public boolean hasFlag(String key) {
    return Boolean.TRUE.equals(metadata.get(key));
  }

  @Override
  public NodeKind kind() {
    return NodeKind.FIELD;
  }

  @Override
  public <R> R accept(ConcreteVisitor<R> visitor) {
    return visitor.visitField(this);
  }
}
