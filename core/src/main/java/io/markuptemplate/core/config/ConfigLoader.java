package io.markuptemplate.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link EngineConfig} from a YAML file and overlays environment variables.
 *
 * <p>YAML layout:
 *
 * <pre>
 * templates:
 *   search-path: [templates, shared/templates]
 *   auto-reload: true
 *   directive-namespace: http://markuptemplate.io/ns/directives
 * expressions:
 *   lang: simple
 * output:
 *   collapse-whitespace: true
 * </pre>
 *
 * <p>Every key can be overridden by an environment variable, which takes precedence over the
 * YAML value. A variable counts as set only if it is defined and not blank. {@code
 * MARKUP_TEMPLATE_SEARCH_PATH} uses the platform path separator.
 */
public final class ConfigLoader {

    public static final String ENV_SEARCH_PATH = "MARKUP_TEMPLATE_SEARCH_PATH";
    public static final String ENV_AUTO_RELOAD = "MARKUP_TEMPLATE_AUTO_RELOAD";
    public static final String ENV_DIRECTIVE_NAMESPACE = "MARKUP_TEMPLATE_DIRECTIVE_NAMESPACE";
    public static final String ENV_EXPRESSION_LANG = "MARKUP_TEMPLATE_EXPRESSION_LANG";
    public static final String ENV_COLLAPSE_WHITESPACE = "MARKUP_TEMPLATE_COLLAPSE_WHITESPACE";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /** Loads from {@code configPath} with overrides from {@link System#getenv}. */
    public static EngineConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads from {@code configPath} with overrides from {@code envLookup}, which returns
     * {@code null} for undefined variables.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static EngineConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root != null ? root : YAML_MAPPER.createObjectNode(), envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    /** Builds a configuration from defaults and environment variables only. */
    public static EngineConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(YAML_MAPPER.createObjectNode(), envLookup);
    }

    private static EngineConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        EngineConfig.Builder builder = EngineConfig.builder();

        JsonNode templates = root.path("templates");
        if (templates.has("search-path")) {
            builder.searchPath(paths(templates.get("search-path")));
        }
        if (templates.has("auto-reload")) {
            builder.autoReload(bool(templates.get("auto-reload"), "templates.auto-reload"));
        }
        if (templates.has("directive-namespace")) {
            builder.directiveNamespace(templates.get("directive-namespace").asText());
        }
        JsonNode expressions = root.path("expressions");
        if (expressions.has("lang")) {
            builder.expressionLang(expressions.get("lang").asText());
        }
        JsonNode output = root.path("output");
        if (output.has("collapse-whitespace")) {
            builder.collapseWhitespace(bool(output.get("collapse-whitespace"), "output.collapse-whitespace"));
        }

        envString(envLookup, ENV_SEARCH_PATH, value -> {
            List<Path> directories = new ArrayList<>();
            for (String entry : value.split(File.pathSeparator)) {
                if (!entry.isBlank()) {
                    directories.add(Path.of(entry.trim()));
                }
            }
            builder.searchPath(directories);
        });
        envString(envLookup, ENV_AUTO_RELOAD, value -> builder.autoReload(Boolean.parseBoolean(value)));
        envString(envLookup, ENV_DIRECTIVE_NAMESPACE, builder::directiveNamespace);
        envString(envLookup, ENV_EXPRESSION_LANG, builder::expressionLang);
        envString(envLookup, ENV_COLLAPSE_WHITESPACE, value -> builder.collapseWhitespace(Boolean.parseBoolean(value)));

        return builder.build();
    }

    private static List<Path> paths(JsonNode node) {
        List<Path> directories = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(entry -> directories.add(Path.of(entry.asText())));
        } else if (node.isTextual()) {
            directories.add(Path.of(node.asText()));
        } else {
            throw new ConfigLoadException("templates.search-path must be a list of directories, got: " + node);
        }
        return directories;
    }

    private static boolean bool(JsonNode node, String key) {
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual() && (node.asText().equalsIgnoreCase("true") || node.asText().equalsIgnoreCase("false"))) {
            return Boolean.parseBoolean(node.asText());
        }
        throw new ConfigLoadException(key + " must be true or false, got: " + node);
    }

    /**
     * Passes the trimmed value of {@code envVar} to {@code setter} if the variable is defined and
     * not blank.
     */
    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        String value = envLookup.apply(envVar);
        if (value != null && !value.trim().isEmpty()) {
            setter.accept(value.trim());
        }
    }
}
