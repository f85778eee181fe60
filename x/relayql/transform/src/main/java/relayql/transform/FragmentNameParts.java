package relayql.transform;

import graphql.language.SourceLocation;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * The two halves of a fragment name: {@code TodoList_list} is property {@code list} of module
 * {@code TodoList}. A bare module name stands for its {@code data} property.
 */
public record FragmentNameParts(String moduleName, String propertyName) {

  static final String DEFAULT_PROPERTY_NAME = "data";

  private static final Pattern FRAGMENT_NAME =
      Pattern.compile("^([a-zA-Z][a-zA-Z0-9]*)(?:_([a-zA-Z][_a-zA-Z0-9]*))?$");

  public static FragmentNameParts parse(String fragmentName) {
    return parse(fragmentName, null);
  }

  /**
   * @param location where the name appears, reported when the name is malformed
   */
  public static FragmentNameParts parse(String fragmentName, @Nullable SourceLocation location) {
    Matcher matcher = FRAGMENT_NAME.matcher(fragmentName);
    if (!matcher.matches()) {
      throw new RelayTransformException(
          ErrorCode.INVALID_FRAGMENT_NAME,
          String.format(
              "Fragment `%s` should be named `<ModuleName>_<propName>` or `<ModuleName>`.",
              fragmentName),
          location);
    }
    String propertyName = matcher.group(2);
    if (DEFAULT_PROPERTY_NAME.equals(propertyName)) {
      throw new RelayTransformException(
          ErrorCode.INVALID_FRAGMENT_NAME,
          String.format(
              "Fragment `%s` should not end in `_%s` to avoid conflict with a fragment named "
                  + "`%s` which also provides resulting data via the React prop `%s`. Name the "
                  + "fragment `%s` instead.",
              fragmentName,
              DEFAULT_PROPERTY_NAME,
              matcher.group(1),
              DEFAULT_PROPERTY_NAME,
              matcher.group(1)),
          location);
    }
    return new FragmentNameParts(
        matcher.group(1), propertyName != null ? propertyName : DEFAULT_PROPERTY_NAME);
  }
}
