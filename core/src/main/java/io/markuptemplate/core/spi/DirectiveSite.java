package io.markuptemplate.core.spi;

import io.markuptemplate.core.model.Position;

/** Compile-time services available to a {@link DirectiveFactory}. */
public interface DirectiveSite {

    /** Position of the element carrying the directive. */
    Position position();

    /**
     * Compiles an expression with the template's expression engine.
     *
     * @throws io.markuptemplate.core.error.TemplateSyntaxException if the source does not compile;
     *     the exception carries the template name and position
     */
    CompiledExpression compile(String source);

    /** Registers a filter that runs on every generate pass, after the pre-filters. */
    void addRuntimeFilter(TemplateFilter filter);
}
