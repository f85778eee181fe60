package relayql.transform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Properties;
import org.junit.jupiter.api.Test;

class TransformOptionsTest {

  @Test
  void defaults() {
    TransformOptions options = TransformOptions.defaults();

    assertThat(options.inputArgumentName()).isEqualTo("input");
    assertThat(options.snakeCase()).isFalse();
    assertThat(options.enableValidation()).isTrue();
    assertThat(options.tagName()).isEqualTo("RelayQL_GENERATED");
  }

  @Test
  void loadsFromClasspath() {
    TransformOptions options = TransformOptions.load("relayql-test.properties");

    assertThat(options).isEqualTo(new TransformOptions("data", true, false, "GQL"));
  }

  @Test
  void missingResourceIsRejected() {
    assertThatThrownBy(() -> TransformOptions.load("does-not-exist.properties"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("does-not-exist.properties");
  }

  @Test
  void absentPropertiesKeepDefaults() {
    Properties properties = new Properties();
    properties.setProperty("relayql.snakeCase", "true");

    TransformOptions options = TransformOptions.fromProperties(properties);

    assertThat(options).isEqualTo(TransformOptions.defaults().withSnakeCase(true));
  }

  @Test
  void blankInputArgumentNameFallsBackToDefault() {
    Properties properties = new Properties();
    properties.setProperty("relayql.inputArgumentName", "  ");

    assertThat(TransformOptions.fromProperties(properties).inputArgumentName()).isEqualTo("input");
    assertThat(TransformOptions.defaults().withInputArgumentName("").inputArgumentName())
        .isEqualTo("input");
  }
}
