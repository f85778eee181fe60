package relayql.api.cqir;

/** One element of a {@link ConcreteSelections} array. */
public sealed interface ConcreteSelection
    permits ConcreteField, ConcreteFragment, FragmentReference, ParametrizedFragment {

  <R> R accept(ConcreteVisitor<R> visitor);
}
