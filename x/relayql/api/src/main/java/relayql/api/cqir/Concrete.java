package relayql.api.cqir;

/** Any value that can appear in a printed concrete query tree. */
public sealed interface Concrete
    permits ConcreteNode, ConcreteDefinition, RuntimeExpression, CallValueList, ConcreteSelections {

  <R> R accept(ConcreteVisitor<R> visitor);
}
