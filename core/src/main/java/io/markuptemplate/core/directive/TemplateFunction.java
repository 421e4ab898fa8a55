package io.markuptemplate.core.directive;

import io.markuptemplate.core.model.Context;
import io.markuptemplate.core.model.MarkupStream;
import io.markuptemplate.core.spi.TemplateCallable;
import java.util.List;
import java.util.Map;

/**
 * Callable bound by a {@code def} element. Calls evaluate the body against the context the
 * function was defined in and return a lazy {@link MarkupStream}.
 */
public final class TemplateFunction implements TemplateCallable {

    private final DefDirective definition;
    private final Context context;

    TemplateFunction(DefDirective definition, Context context) {
        this.definition = definition;
        this.context = context;
    }

    public String name() {
        return definition.signature().name();
    }

    @Override
    public MarkupStream call(List<Object> args, Map<String, Object> kwargs) {
        return definition.invoke(context, args, kwargs);
    }

    @Override
    public String toString() {
        return "<TemplateFunction " + name() + ">";
    }
}
