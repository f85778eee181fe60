package relayql.api.cqir;

/** The value side of a {@link ConcreteCall} or of a directive argument. */
public sealed interface CallArgument
    permits CallVariable, CallValue, CallValueList, SubstitutionVariable {

  <R> R accept(ConcreteVisitor<R> visitor);
}
