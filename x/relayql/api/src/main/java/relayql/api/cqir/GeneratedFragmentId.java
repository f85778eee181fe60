package relayql.api.cqir;

/** The id of a printed fragment, generated by the runtime each time the artifact is evaluated. */
public record GeneratedFragmentId() implements RuntimeExpression {

  public static final GeneratedFragmentId INSTANCE = new GeneratedFragmentId();

  @Override
  public <R> R accept(ConcreteVisitor<R> visitor) {
    return visitor.visitFragmentId(this);
  }
}
