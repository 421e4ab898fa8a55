package io.markuptemplate.core.error;

import io.markuptemplate.core.model.Position;

/**
 * Thrown when an expression fails at runtime (calling a non-callable value, a type error, an
 * exception raised by user code). The generate stage re-raises it as a {@link
 * TemplateRuntimeException} carrying the template position.
 */
public final class ExpressionEvalException extends TemplateEvalException {

    private static final long serialVersionUID = 1L;

    private final String expression;
    private final transient Position eventPosition;

    public ExpressionEvalException(String message, String expression) {
        this(message, null, expression, null);
    }

    public ExpressionEvalException(String message, Throwable cause, String expression) {
        this(message, cause, expression, null);
    }

    private ExpressionEvalException(String message, Throwable cause, String expression, Position eventPosition) {
        super(message, cause, null);
        this.expression = expression;
        this.eventPosition = eventPosition;
    }

    /** The source of the failing expression, or {@code null} if not known. */
    public String expression() {
        return expression;
    }

    /** Position of the event whose expression failed, when the evaluating stage knew it. */
    public Position eventPosition() {
        return eventPosition;
    }

    /** Returns a copy tagged with the position of the event being evaluated. */
    public ExpressionEvalException at(Position position) {
        if (eventPosition != null) {
            return this;
        }
        ExpressionEvalException tagged = new ExpressionEvalException(detail(), getCause(), expression, position);
        tagged.setStackTrace(getStackTrace());
        return tagged;
    }
}
