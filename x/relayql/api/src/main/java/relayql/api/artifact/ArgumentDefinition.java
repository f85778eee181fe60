package relayql.api.artifact;

import org.jspecify.annotations.Nullable;

/** A variable the printed definition reads, and where its value comes from. */
public sealed interface ArgumentDefinition {

  String name();

  /** The wire tag, {@code LocalArgument} or {@code RootArgument}. */
  String kind();

  /**
   * A variable declared by the definition itself, with an optional default value (a literal
   * payload as described on {@link relayql.api.cqir.CallValue}).
   */
  record LocalArgument(String name, @Nullable Object defaultValue) implements ArgumentDefinition {
    @Override
    public String kind() {
      return "LocalArgument";
    }
  }

  /** A variable a fragment reads from the query that includes it. */
  record RootArgument(String name) implements ArgumentDefinition {
    @Override
    public String kind() {
      return "RootArgument";
    }
  }
}
