package io.markuptemplate.core.error;

import io.markuptemplate.core.model.Position;

/**
 * Thrown when a template is malformed: markup that is not well-formed, a directive value that
 * cannot be parsed, or an expression with a syntax error.
 */
public class TemplateSyntaxException extends TemplateLoadException {

    private static final long serialVersionUID = 1L;

    public TemplateSyntaxException(String message, Position position) {
        super(message, null, position);
    }

    public TemplateSyntaxException(String message, Throwable cause, Position position) {
        super(message, cause, position);
    }
}
