package io.markuptemplate.core.directive;

import io.markuptemplate.core.engine.PullIterator;
import io.markuptemplate.core.engine.Values;
import io.markuptemplate.core.model.Context;
import io.markuptemplate.core.model.Event;
import io.markuptemplate.core.spi.CompiledExpression;
import io.markuptemplate.core.spi.Directive;
import io.markuptemplate.core.spi.DirectiveSite;
import java.util.Iterator;

/**
 * Removes the element's start and end tags but keeps its children. With an expression, the tags
 * are removed only when it is truthy; an empty value always strips.
 */
public final class StripDirective implements Directive {

    private final CompiledExpression condition;

    StripDirective(CompiledExpression condition) {
        this.condition = condition;
    }

    static StripDirective create(String value, DirectiveSite site) {
        return new StripDirective(value.isBlank() ? null : site.compile(value));
    }

    @Override
    public Iterator<Event> apply(Iterator<Event> stream, Context context) {
        return new PullIterator<>() {
            private Boolean strip;
            private Event held;

            @Override
            protected Event computeNext() {
                if (strip == null) {
                    strip = condition == null || Values.isTruthy(condition.evaluate(context));
                    if (strip && stream.hasNext()) {
                        stream.next();
                    }
                }
                if (!strip) {
                    return stream.hasNext() ? stream.next() : endOfData();
                }
                // Hold one event back so the last one (the end tag) is never emitted.
                if (held == null) {
                    if (!stream.hasNext()) {
                        return endOfData();
                    }
                    held = stream.next();
                }
                if (!stream.hasNext()) {
                    return endOfData();
                }
                Event out = held;
                held = stream.next();
                return out;
            }
        };
    }

    @Override
    public String toString() {
        return "<StripDirective" + (condition != null ? " \"" + condition.source() + "\">" : ">");
    }
}
