package relayql.api.cqir;

/** A tagged node of the concrete tree. The {@link #kind()} is the tag written to the output. */
public sealed interface ConcreteNode extends Concrete
    permits ConcreteQuery,
        ConcreteMutation,
        ConcreteSubscription,
        ConcreteFragment,
        ConcreteField,
        ConcreteCall,
        CallVariable,
        CallValue,
        ConcreteDirective {

  NodeKind kind();
}
