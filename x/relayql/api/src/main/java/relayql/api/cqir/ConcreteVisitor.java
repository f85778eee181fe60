package relayql.api.cqir;

/**
 * Exhaustive dispatch over every {@link Concrete} kind.
 *
 * @param <R> the result of visiting one value
 */
public interface ConcreteVisitor<R> {

  R visitQuery(ConcreteQuery query);

  R visitMutation(ConcreteMutation mutation);

  R visitSubscription(ConcreteSubscription subscription);

  R visitFragment(ConcreteFragment fragment);

  R visitField(ConcreteField field);

  R visitCall(ConcreteCall call);

  R visitCallVariable(CallVariable variable);

  R visitCallValue(CallValue value);

  R visitCallValueList(CallValueList values);

  R visitDirective(ConcreteDirective directive);

  R visitSelections(ConcreteSelections selections);

  R visitFragmentReference(FragmentReference reference);

  R visitSubstitutionVariable(SubstitutionVariable variable);

  R visitFragmentId(GeneratedFragmentId id);

  R visitParametrizedFragment(ParametrizedFragment fragment);
}
