package io.markuptemplate.core.error;

import java.nio.file.Path;
import java.util.List;

/** Thrown when a template name cannot be resolved against any directory of the search path. */
public final class TemplateNotFoundException extends TemplateLoadException {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final transient List<Path> searchPath;

    public TemplateNotFoundException(String name, List<Path> searchPath) {
        super("Template \"" + name + "\" not found (search path: " + searchPath + ")", null, null);
        this.name = name;
        this.searchPath = List.copyOf(searchPath);
    }

    /** The requested template name. */
    public String name() {
        return name;
    }

    /** The directories that were searched, in order. */
    public List<Path> searchPath() {
        return searchPath;
    }
}
