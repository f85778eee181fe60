package relayql.transform;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings shared by every compilation. Immutable, so one instance can serve concurrent builds.
 *
 * @param inputArgumentName the single argument mutation and subscription root fields must declare
 * @param snakeCase whether the schema names the runtime's well-known fields in snake_case
 * @param enableValidation whether root-field count validation runs for directly printed
 *     definitions
 * @param tagName the identifier the generated code receives the runtime helpers under
 */
public record TransformOptions(
    String inputArgumentName, boolean snakeCase, boolean enableValidation, String tagName) {

  public static final String DEFAULT_INPUT_ARGUMENT_NAME = "input";
  public static final String DEFAULT_TAG_NAME = "RelayQL_GENERATED";

  static final String PREFIX = "relayql.";

  public TransformOptions {
    Objects.requireNonNull(inputArgumentName, "inputArgumentName");
    Objects.requireNonNull(tagName, "tagName");
    if (inputArgumentName.isEmpty()) {
      inputArgumentName = DEFAULT_INPUT_ARGUMENT_NAME;
    }
  }

  public static TransformOptions defaults() {
    return new TransformOptions(DEFAULT_INPUT_ARGUMENT_NAME, false, true, DEFAULT_TAG_NAME);
  }

  public TransformOptions withInputArgumentName(String inputArgumentName) {
    return new TransformOptions(inputArgumentName, snakeCase, enableValidation, tagName);
  }

  public TransformOptions withSnakeCase(boolean snakeCase) {
    return new TransformOptions(inputArgumentName, snakeCase, enableValidation, tagName);
  }

  public TransformOptions withValidation(boolean enableValidation) {
    return new TransformOptions(inputArgumentName, snakeCase, enableValidation, tagName);
  }

  public TransformOptions withTagName(String tagName) {
    return new TransformOptions(inputArgumentName, snakeCase, enableValidation, tagName);
  }

  /**
   * Reads {@code relayql.inputArgumentName}, {@code relayql.snakeCase}, {@code
   * relayql.enableValidation} and {@code relayql.tagName}. Absent keys keep their defaults.
   */
  public static TransformOptions fromProperties(Properties properties) {
    TransformOptions defaults = defaults();
    return new TransformOptions(
        properties.getProperty(PREFIX + "inputArgumentName", defaults.inputArgumentName()).trim(),
        Boolean.parseBoolean(
            properties.getProperty(PREFIX + "snakeCase", Boolean.toString(defaults.snakeCase()))),
        Boolean.parseBoolean(
            properties.getProperty(
                PREFIX + "enableValidation", Boolean.toString(defaults.enableValidation()))),
        properties.getProperty(PREFIX + "tagName", defaults.tagName()).trim());
  }

  /**
   * Loads options from a properties file on the classpath.
   *
   * @param resource the resource path, e.g. {@code relayql.properties}
   * @throws IllegalArgumentException if the resource does not exist
   */
  public static TransformOptions load(String resource) {
    ClassLoader loader = TransformOptions.class.getClassLoader();
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalArgumentException("Options resource not found: " + resource);
      }
      Properties properties = new Properties();
      properties.load(in);
      return fromProperties(properties);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read options resource: " + resource, e);
    }
  }
}
