package io.markuptemplate.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.markuptemplate.core.engine.TemplateCompiler;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ConfigLoader}: YAML keys, defaults for missing keys, environment overrides and
 * error paths.
 */
@DisplayName("YAML config loader")
class ConfigLoaderTest {

    private static final Map<String, String> NO_ENV = Map.of();

    private static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class.getClassLoader().getResource("config/" + name).toURI());
    }

    @Nested
    @DisplayName("YAML")
    class Yaml {

        @Test
        @DisplayName("Minimal config → search path set, everything else defaulted")
        void minimalConfigAppliesDefaults() throws Exception {
            EngineConfig config = ConfigLoader.load(fixture("minimal-config.yaml"), NO_ENV::get);

            assertThat(config.searchPath()).containsExactly(Path.of("templates"));
            assertThat(config.autoReload()).isFalse();
            assertThat(config.directiveNamespace()).isEqualTo(TemplateCompiler.DEFAULT_NAMESPACE);
            assertThat(config.expressionLang()).isEqualTo("simple");
            assertThat(config.collapseWhitespace()).isTrue();
        }

        @Test
        @DisplayName("Full config → all fields populated")
        void fullConfigPopulatesAllFields() throws Exception {
            EngineConfig config = ConfigLoader.load(fixture("full-config.yaml"), NO_ENV::get);

            assertThat(config.searchPath()).containsExactly(Path.of("templates"), Path.of("shared/templates"));
            assertThat(config.autoReload()).isTrue();
            assertThat(config.directiveNamespace()).isEqualTo("urn:example:directives");
            assertThat(config.expressionLang()).isEqualTo("jslt");
            assertThat(config.collapseWhitespace()).isFalse();
        }
    }

    @Nested
    @DisplayName("Environment overrides")
    class EnvironmentOverrides {

        @Test
        @DisplayName("Env vars take precedence over YAML values")
        void envOverridesYaml() throws Exception {
            Map<String, String> env = Map.of(
                    ConfigLoader.ENV_EXPRESSION_LANG, "simple",
                    ConfigLoader.ENV_AUTO_RELOAD, "false",
                    ConfigLoader.ENV_SEARCH_PATH, "a" + File.pathSeparator + " b ");

            EngineConfig config = ConfigLoader.load(fixture("full-config.yaml"), env::get);

            assertThat(config.expressionLang()).isEqualTo("simple");
            assertThat(config.autoReload()).isFalse();
            assertThat(config.searchPath()).containsExactly(Path.of("a"), Path.of("b"));
            assertThat(config.directiveNamespace()).isEqualTo("urn:example:directives");
        }

        @Test
        @DisplayName("Blank env var is treated as unset")
        void blankEnvIsIgnored() throws Exception {
            Map<String, String> env = Map.of(ConfigLoader.ENV_EXPRESSION_LANG, "   ");

            EngineConfig config = ConfigLoader.load(fixture("full-config.yaml"), env::get);

            assertThat(config.expressionLang()).isEqualTo("jslt");
        }

        @Test
        @DisplayName("No file → defaults plus environment")
        void fromEnvironmentOnly() {
            Map<String, String> env = Map.of(
                    ConfigLoader.ENV_COLLAPSE_WHITESPACE, "false",
                    ConfigLoader.ENV_DIRECTIVE_NAMESPACE, "urn:env");

            EngineConfig config = ConfigLoader.fromEnvironment(env::get);

            assertThat(config.collapseWhitespace()).isFalse();
            assertThat(config.directiveNamespace()).isEqualTo("urn:env");
            assertThat(config.searchPath()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Missing file → ConfigLoadException")
        void missingFile() {
            assertThatThrownBy(() -> ConfigLoader.load(Path.of("does/not/exist.yaml"), NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("not found");
        }

        @Test
        @DisplayName("Malformed YAML → ConfigLoadException with cause")
        void malformedYaml() {
            assertThatThrownBy(() -> ConfigLoader.load(fixture("malformed-config.yaml"), NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Failed to parse YAML")
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        @DisplayName("Non-boolean flag → ConfigLoadException naming the key")
        void invalidBoolean() {
            assertThatThrownBy(() -> ConfigLoader.load(fixture("invalid-bool-config.yaml"), NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("templates.auto-reload");
        }
    }
}
