package relayql.api.cqir;

/**
 * A placeholder that is only resolved when the generated artifact is evaluated by the runtime.
 * Each kind renders as a call on the generated-tag identifier (for example {@code
 * RelayQL_GENERATED.__frag(Foo)}).
 */
public sealed interface RuntimeExpression extends Concrete
    permits FragmentReference, SubstitutionVariable, GeneratedFragmentId, ParametrizedFragment {}
