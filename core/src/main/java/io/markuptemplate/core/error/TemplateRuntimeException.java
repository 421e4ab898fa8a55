package io.markuptemplate.core.error;

import io.markuptemplate.core.model.Position;

/**
 * An evaluation failure translated at the outermost generate boundary, carrying the template name
 * and the line/column of the event that was being processed.
 */
public final class TemplateRuntimeException extends TemplateEvalException {

    private static final long serialVersionUID = 1L;

    public TemplateRuntimeException(String message, Throwable cause, Position position) {
        super(message, cause, position);
    }
}
