package relayql.api.cqir;

import java.util.List;

/**
 * The children array of a field or fragment.
 *
 * <p>When {@code flatten} is set the array holds at least one {@link FragmentReference}. Those
 * evaluate to arrays at run time, so the runtime must concatenate the elements one level deep
 * before reading them.
 */
public record ConcreteSelections(List<ConcreteSelection> selections, boolean flatten)
    implements Concrete {

  public ConcreteSelections {
    selections = List.copyOf(selections);
  }

  /** The printed fields, skipping fragments and references. */
  public List<ConcreteField> fields() {
    return selections.stream()
        .filter(ConcreteField.class::isInstance)
        .map(ConcreteField.class::cast)
        .toList();
  }

  @Override
  public <R> R accept(ConcreteVisitor<R> visitor) {
    return visitor.visitSelections(this);
  }
}
