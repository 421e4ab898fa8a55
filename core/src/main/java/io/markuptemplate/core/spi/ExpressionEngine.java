package io.markuptemplate.core.spi;

/**
 * Pluggable expression language. Implementations compile the source of interpolations
 * ({@code ${...}}, {@code $name}) and directive values into reusable handles, and are registered
 * with an {@code EngineRegistry} under their {@link #id()}.
 *
 * <p>Implementations MUST be stateless and thread-safe.
 */
public interface ExpressionEngine {

    /**
     * Returns the engine identifier, e.g. {@code "simple"} or {@code "jslt"}. The id is what the
     * {@code expressions.lang} configuration key selects.
     */
    String id();

    /**
     * Compiles the given expression source into an immutable, thread-safe handle.
     *
     * @param expression the expression source
     * @return a compiled expression ready for evaluation
     * @throws io.markuptemplate.core.error.ExpressionCompileException if the source has syntax
     *     errors
     */
    CompiledExpression compile(String expression);
}
