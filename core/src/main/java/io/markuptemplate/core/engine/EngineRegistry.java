package io.markuptemplate.core.engine;

import io.markuptemplate.core.engine.jslt.JsltExpressionEngine;
import io.markuptemplate.core.engine.simple.SimpleExpressionEngine;
import io.markuptemplate.core.spi.ExpressionEngine;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expression languages available to the template compiler, keyed by the language name used in
 * configuration ({@code expressions.lang}). Thread-safe.
 */
public final class EngineRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(EngineRegistry.class);

    private final Map<String, ExpressionEngine> languages = new ConcurrentHashMap<>();

    /** Returns a registry holding the built-in {@code simple} and {@code jslt} languages. */
    public static EngineRegistry withDefaults() {
        EngineRegistry registry = new EngineRegistry();
        registry.register(new SimpleExpressionEngine());
        registry.register(new JsltExpressionEngine());
        return registry;
    }

    /**
     * Makes {@code engine} available under its {@link ExpressionEngine#id()}. A language that is
     * already registered is taken over by the new engine.
     *
     * @return the engine previously registered for the language, if any
     * @throws IllegalArgumentException if the engine reports no language name
     */
    public Optional<ExpressionEngine> register(ExpressionEngine engine) {
        Objects.requireNonNull(engine, "engine must not be null");
        String lang = engine.id();
        if (lang == null || lang.isBlank()) {
            throw new IllegalArgumentException(
                    "Expression engine " + engine.getClass().getName() + " reports no language name");
        }
        ExpressionEngine previous = languages.put(lang, engine);
        if (previous != null && previous != engine) {
            LOG.debug("Expression language '{}' taken over by {}", lang, engine.getClass().getSimpleName());
        }
        return Optional.ofNullable(previous);
    }

    public Optional<ExpressionEngine> find(String lang) {
        return Optional.ofNullable(languages.get(lang));
    }

    /** @throws IllegalArgumentException naming the registered languages if {@code lang} is unknown */
    public ExpressionEngine require(String lang) {
        return find(lang).orElseThrow(() -> new IllegalArgumentException(
                "Unknown expression language '" + lang + "'; registered: " + languages()));
    }

    public boolean supports(String lang) {
        return languages.containsKey(lang);
    }

    /** Registered language names, sorted. */
    public Set<String> languages() {
        return new TreeSet<>(languages.keySet());
    }
}
