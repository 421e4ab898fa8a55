package io.markuptemplate.core.error;

import io.markuptemplate.core.model.Position;

/**
 * Thrown when an attribute in the directive namespace has a local name that no registered
 * directive answers to.
 */
public final class BadDirectiveException extends TemplateSyntaxException {

    private static final long serialVersionUID = 1L;

    private final String directiveName;

    public BadDirectiveException(String directiveName, String filename, int line) {
        super("Bad directive \"" + directiveName + "\"", new Position(filename, line, -1));
        this.directiveName = directiveName;
    }

    /** The unrecognized local name. */
    public String directiveName() {
        return directiveName;
    }
}
