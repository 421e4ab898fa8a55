package io.markuptemplate.core.error;

import io.markuptemplate.core.model.Position;

/**
 * Abstract parent for errors raised while a template is generated. They surface when the event
 * that needs the failing evaluation is pulled from the output stream.
 */
public abstract class TemplateEvalException extends TemplateException {

    private static final long serialVersionUID = 1L;

    protected TemplateEvalException(String message, Throwable cause, Position position) {
        super(message, cause, position, Phase.GENERATE);
    }
}
