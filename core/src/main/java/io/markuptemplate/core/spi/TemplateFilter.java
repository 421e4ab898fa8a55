package io.markuptemplate.core.spi;

import io.markuptemplate.core.model.Context;
import io.markuptemplate.core.model.Event;
import io.markuptemplate.core.model.StartElement;
import java.util.Iterator;
import java.util.List;

/**
 * A stream-to-stream stage of the generate pipeline. Filters must be lazy: they pull from {@code
 * stream} only as far as needed to produce the next event.
 */
@FunctionalInterface
public interface TemplateFilter {

    Iterator<Event> apply(Iterator<Event> stream, Context context);

    /**
     * Applies the filter to one expansion level of a generation. {@code enclosing} lists the
     * elements left open by the levels around this one, outermost first; filters that ignore
     * element ancestry need not override this.
     */
    default Iterator<Event> apply(Iterator<Event> stream, Context context, List<StartElement> enclosing) {
        return apply(stream, context);
    }
}
