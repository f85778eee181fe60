package relayql.transform;

import java.util.List;

/**
 * Model of the function that replaces one compiled definition.
 *
 * @param tagName the parameter the runtime helpers arrive under
 * @param initializers one constant per substitution slot
 * @param body the returned artifact object, already printed
 */
public record ArtifactModel(String tagName, List<Initializer> initializers, String body) {

  // ST (StringTemplate) requires JavaBean-style getters
  public String getTagName() {
    return tagName;
  }

  public List<Initializer> getInitializers() {
    return initializers;
  }

  public boolean getHasInitializers() {
    return !initializers.isEmpty();
  }

  public String getBody() {
    return body;
  }

  /** A {@code const} binding a substitution slot to its run-time value. */
  public record Initializer(String name, String expression) {

    public String getName() {
      return name;
    }

    public String getExpression() {
      return expression;
    }
  }
}
