package io.markuptemplate.core.error;

import io.markuptemplate.core.model.Position;

/**
 * Abstract parent for errors raised while locating, parsing or compiling a template. These abort
 * compilation; no partially compiled template is ever returned.
 */
public abstract class TemplateLoadException extends TemplateException {

    private static final long serialVersionUID = 1L;

    protected TemplateLoadException(String message, Throwable cause, Position position) {
        super(message, cause, position, Phase.LOAD);
    }
}
