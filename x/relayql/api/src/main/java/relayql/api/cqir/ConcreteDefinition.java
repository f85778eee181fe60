package relayql.api.cqir;

/** The value produced by printing one top-level definition. */
public sealed interface ConcreteDefinition extends Concrete
    permits ConcreteQuery,
        ConcreteMutation,
        ConcreteSubscription,
        ConcreteFragment,
        ParametrizedFragment {

  /** The definition's name as written in the document. */
  String name();
}
