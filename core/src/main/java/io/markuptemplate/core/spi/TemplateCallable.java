package io.markuptemplate.core.spi;

import java.util.List;
import java.util.Map;

/**
 * A value that expressions can call with positional and keyword arguments, such as a template
 * function defined by the {@code def} directive or the {@code select} function bound inside match
 * templates.
 */
@FunctionalInterface
public interface TemplateCallable {

    Object call(List<Object> args, Map<String, Object> kwargs);
}
