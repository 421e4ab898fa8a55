package io.markuptemplate.core.config;

import io.markuptemplate.core.engine.TemplateCompiler;
import io.markuptemplate.core.engine.simple.SimpleExpressionEngine;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Configuration of a {@code TemplateEngine}. Use {@link #builder()} to construct instances; every
 * field has a default.
 *
 * @param searchPath         directories searched, in order, for templates loaded by name
 * @param autoReload         recompile cached templates whose file changed on disk
 * @param directiveNamespace namespace URI identifying directive attributes
 * @param expressionLang     id of the expression engine used for templates
 * @param collapseWhitespace install the whitespace post-filter
 */
public record EngineConfig(
        List<Path> searchPath,
        boolean autoReload,
        String directiveNamespace,
        String expressionLang,
        boolean collapseWhitespace) {

    public EngineConfig {
        searchPath = List.copyOf(searchPath);
        Objects.requireNonNull(directiveNamespace, "directiveNamespace must not be null");
        Objects.requireNonNull(expressionLang, "expressionLang must not be null");
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link EngineConfig}. */
    public static final class Builder {

        private final List<Path> searchPath = new ArrayList<>();
        private boolean autoReload;
        private String directiveNamespace = TemplateCompiler.DEFAULT_NAMESPACE;
        private String expressionLang = SimpleExpressionEngine.ENGINE_ID;
        private boolean collapseWhitespace = true;

        private Builder() {}

        public Builder searchPath(List<Path> directories) {
            searchPath.clear();
            searchPath.addAll(directories);
            return this;
        }

        public Builder addSearchPath(Path directory) {
            searchPath.add(directory);
            return this;
        }

        public Builder autoReload(boolean autoReload) {
            this.autoReload = autoReload;
            return this;
        }

        public Builder directiveNamespace(String directiveNamespace) {
            this.directiveNamespace = directiveNamespace;
            return this;
        }

        public Builder expressionLang(String expressionLang) {
            this.expressionLang = expressionLang;
            return this;
        }

        public Builder collapseWhitespace(boolean collapseWhitespace) {
            this.collapseWhitespace = collapseWhitespace;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(searchPath, autoReload, directiveNamespace, expressionLang, collapseWhitespace);
        }
    }
}
