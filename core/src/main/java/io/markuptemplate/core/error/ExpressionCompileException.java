package io.markuptemplate.core.error;

/**
 * Thrown by an {@link io.markuptemplate.core.spi.ExpressionEngine} when an expression fails to
 * compile. Carries the offending source and the offset of the error within it; the template
 * compiler translates it into a {@link TemplateSyntaxException} with the template position.
 */
public final class ExpressionCompileException extends TemplateLoadException {

    private static final long serialVersionUID = 1L;

    private final String expression;
    private final int offset;

    public ExpressionCompileException(String message, String expression, int offset) {
        super(message, null, null);
        this.expression = expression;
        this.offset = offset;
    }

    public ExpressionCompileException(String message, Throwable cause, String expression, int offset) {
        super(message, cause, null);
        this.expression = expression;
        this.offset = offset;
    }

    /** The expression source that failed to compile. */
    public String expression() {
        return expression;
    }

    /** Offset of the error within the expression, or -1 if unknown. */
    public int offset() {
        return offset;
    }
}
