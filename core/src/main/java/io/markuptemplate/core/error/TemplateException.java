package io.markuptemplate.core.error;

import io.markuptemplate.core.model.Position;

/**
 * Abstract base for all template exceptions. Never thrown directly; use the concrete subclasses
 * under {@link TemplateLoadException} or {@link TemplateEvalException}.
 */
public abstract class TemplateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        GENERATE
    }

    private final String detail;
    private final String filename;
    private final int line;
    private final int column;
    private final Phase phase;

    protected TemplateException(String message, Throwable cause, Position position, Phase phase) {
        super(describe(message, position), cause);
        this.detail = message;
        this.filename = position != null ? position.filename() : null;
        this.line = position != null ? position.line() : -1;
        this.column = position != null ? position.column() : -1;
        this.phase = phase;
    }

    private static String describe(String message, Position position) {
        if (position == null) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" [").append(position.filename());
        if (position.line() >= 0) {
            sb.append(", line ").append(position.line());
            if (position.column() >= 0) {
                sb.append(", column ").append(position.column());
            }
        }
        return sb.append(']').toString();
    }

    /** Human-readable error description without location information. */
    public String detail() {
        return detail;
    }

    /** The template file name, or {@code null} if not known. */
    public String filename() {
        return filename;
    }

    /** The line number in the template, or -1 if not known. */
    public int line() {
        return line;
    }

    /** The column number in the template, or -1 if not known. */
    public int column() {
        return column;
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
