package io.markuptemplate.core.directive;

import io.markuptemplate.core.engine.PullIterator;
import io.markuptemplate.core.engine.Values;
import io.markuptemplate.core.model.Attributes;
import io.markuptemplate.core.model.Context;
import io.markuptemplate.core.model.Event;
import io.markuptemplate.core.model.EventKind;
import io.markuptemplate.core.model.StartElement;
import io.markuptemplate.core.model.Undefined;
import io.markuptemplate.core.spi.CompiledExpression;
import io.markuptemplate.core.spi.Directive;
import io.markuptemplate.core.spi.DirectiveSite;
import java.util.Iterator;
import java.util.Map;

/**
 * Merges name/value pairs into the attributes of the element. Pairs with a {@code null} value
 * remove the attribute; other values are set as trimmed text. A falsy expression result leaves the
 * attributes unchanged.
 */
public final class AttrsDirective implements Directive {

    private final CompiledExpression pairs;

    AttrsDirective(CompiledExpression pairs) {
        this.pairs = pairs;
    }

    static AttrsDirective create(String value, DirectiveSite site) {
        return new AttrsDirective(site.compile(value));
    }

    @Override
    public Iterator<Event> apply(Iterator<Event> stream, Context context) {
        return new PullIterator<>() {
            private boolean first = true;

            @Override
            protected Event computeNext() {
                if (!stream.hasNext()) {
                    return endOfData();
                }
                Event event = stream.next();
                if (!first || !event.is(EventKind.START)) {
                    first = false;
                    return event;
                }
                first = false;
                Object value = pairs.evaluate(context);
                if (!Values.isTruthy(value)) {
                    return event;
                }
                StartElement element = event.startElement();
                Attributes attributes = element.attributes();
                for (Map.Entry<String, Object> pair : Values.pairs(value)) {
                    if (Undefined.isAbsent(pair.getValue())) {
                        attributes = attributes.remove(pair.getKey());
                    } else {
                        attributes = attributes.set(pair.getKey(), Values.toText(pair.getValue()).strip(), event.position());
                    }
                }
                return new Event(EventKind.START, element.withAttributes(attributes), event.position());
            }
        };
    }

    @Override
    public String toString() {
        return "<AttrsDirective \"" + pairs.source() + "\">";
    }
}
