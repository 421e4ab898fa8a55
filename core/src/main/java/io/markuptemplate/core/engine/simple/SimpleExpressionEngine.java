package io.markuptemplate.core.engine.simple;

import io.markuptemplate.core.error.ExpressionCompileException;
import io.markuptemplate.core.error.ExpressionEvalException;
import io.markuptemplate.core.error.TemplateException;
import io.markuptemplate.core.model.Context;
import io.markuptemplate.core.spi.CompiledExpression;
import io.markuptemplate.core.spi.ExpressionEngine;

/**
 * The default expression language: a small infix syntax over Java values.
 *
 * <p>Names resolve against the context (falling back to the built-in functions), {@code a.b}
 * reads map entries, JSON fields, bean properties, record components and public fields, and
 * {@code a[k]} indexes lists, arrays, strings, maps and JSON nodes. Lookups that find nothing
 * produce an undefined value. Thread-safe: compiled expressions are immutable.
 */
public final class SimpleExpressionEngine implements ExpressionEngine {

    public static final String ENGINE_ID = "simple";

    @Override
    public String id() {
        return ENGINE_ID;
    }

    @Override
    public CompiledExpression compile(String expression) {
        if (expression == null) {
            throw new ExpressionCompileException("Expression must not be null", null, -1);
        }
        return new SimpleCompiledExpression(expression, ExpressionParser.parse(expression));
    }

    /** A parsed expression. */
    private record SimpleCompiledExpression(String source, Node root) implements CompiledExpression {

        @Override
        public Object evaluate(Context context) {
            try {
                return root.evaluate(context);
            } catch (ExpressionEvalException e) {
                throw e.expression() != null ? e : new ExpressionEvalException(e.detail(), e, source);
            } catch (TemplateException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ExpressionEvalException(
                        "Evaluation of \"" + source + "\" failed: " + e.getMessage(), e, source);
            }
        }

        @Override
        public String toString() {
            return "<Expression \"" + source + "\">";
        }
    }
}
