package relayql.api.cqir;

import org.jspecify.annotations.Nullable;

/**
 * A literal call value. The payload is null, a {@link String}, {@link Boolean} or {@link Number},
 * a {@link java.util.List} of payloads, or a {@link java.util.Map} from field name to payload for
 * input object literals. A null payload is printed explicitly.
 */
public record CallValue(@Nullable Object callValue) implements ConcreteNode, CallArgument {

  public CallValue {
    callValue = Copies.payload(callValue);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.CALL_VALUE;
  }

  @Override
  public <R> R accept(ConcreteVisitor<R> visitor) {
    return visitor.visitCallValue(this);
  }
}
