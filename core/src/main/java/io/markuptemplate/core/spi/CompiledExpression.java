package io.markuptemplate.core.spi;

import io.markuptemplate.core.model.Context;

/**
 * An immutable, thread-safe compiled expression handle produced by {@link
 * ExpressionEngine#compile(String)}. A single instance is shared by every evaluation of the
 * template that contains it.
 */
public interface CompiledExpression {

    /** The source text the expression was compiled from. */
    String source();

    /**
     * Evaluates the expression against the given context.
     *
     * @param context the current template context
     * @return the value, which may be {@code null} or {@link
     *     io.markuptemplate.core.model.Undefined#INSTANCE}
     * @throws io.markuptemplate.core.error.ExpressionEvalException if evaluation fails
     */
    Object evaluate(Context context);
}
