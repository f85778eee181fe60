package relayql.api.cqir;

/** The {@code kind} tag of each {@link ConcreteNode}. */
public enum NodeKind {
  QUERY("Query"),
  MUTATION("Mutation"),
  SUBSCRIPTION("Subscription"),
  FRAGMENT("Fragment"),
  FIELD("Field"),
  CALL("Call"),
  CALL_VARIABLE("CallVariable"),
  CALL_VALUE("CallValue"),
  DIRECTIVE("Directive");

  private final String wireName;

  NodeKind(String wireName) {
    this.wireName = wireName;
  }

  /** The tag as the runtime reads it, e.g. {@code CallVariable}. */
  public String wireName() {
    return wireName;
  }
}
