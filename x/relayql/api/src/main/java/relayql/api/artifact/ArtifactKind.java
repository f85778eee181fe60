package relayql.api.artifact;

/** The {@code kind} tag of a {@link ConcreteArtifact}. */
public enum ArtifactKind {
  FRAGMENT_DEFINITION("FragmentDefinition"),
  OPERATION_DEFINITION("OperationDefinition");

  private final String wireName;

  ArtifactKind(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }
}
