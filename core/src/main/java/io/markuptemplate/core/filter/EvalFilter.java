package io.markuptemplate.core.filter;

import io.markuptemplate.core.engine.PullIterator;
import io.markuptemplate.core.engine.Values;
import io.markuptemplate.core.error.ExpressionEvalException;
import io.markuptemplate.core.model.Attribute;
import io.markuptemplate.core.model.Attributes;
import io.markuptemplate.core.model.Context;
import io.markuptemplate.core.model.Event;
import io.markuptemplate.core.model.EventKind;
import io.markuptemplate.core.model.MarkupStream;
import io.markuptemplate.core.model.Position;
import io.markuptemplate.core.model.StartElement;
import io.markuptemplate.core.model.Undefined;
import io.markuptemplate.core.spi.CompiledExpression;
import io.markuptemplate.core.spi.TemplateFilter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Evaluates EXPR events and interpolated attribute values against the context, as each event is
 * pulled.
 *
 * <p>Expression results become events: {@code null} and undefined produce nothing, strings become
 * TEXT, events pass through, markup streams and other iterables are spliced in (and evaluated
 * themselves), anything else is rendered as text. An attribute whose value consists only of
 * expressions that all produce nothing is dropped.
 *
 * <p>Evaluation failures are re-thrown tagged with the position of the failing event.
 */
public final class EvalFilter implements TemplateFilter {

    @Override
    public Iterator<Event> apply(Iterator<Event> stream, Context context) {
        return new PullIterator<>() {
            private Iterator<Event> spliced;

            @Override
            protected Event computeNext() {
                while (true) {
                    if (spliced != null) {
                        if (spliced.hasNext()) {
                            return spliced.next();
                        }
                        spliced = null;
                    }
                    if (!stream.hasNext()) {
                        return endOfData();
                    }
                    Event event = stream.next();
                    if (event.is(EventKind.START)) {
                        return evaluateAttributes(event, context);
                    }
                    if (!event.is(EventKind.EXPR)) {
                        return event;
                    }
                    Object result = evaluate(event.expression(), event.position(), context);
                    spliced = toEvents(result, event.position(), context);
                }
            }
        };
    }

    private Iterator<Event> toEvents(Object result, Position position, Context context) {
        if (Undefined.isAbsent(result)) {
            return null;
        }
        if (result instanceof String text) {
            return text.isEmpty() ? null : List.of(Event.text(text, position)).iterator();
        }
        if (result instanceof Event event) {
            return apply(List.of(event).iterator(), context);
        }
        if (result instanceof MarkupStream markup) {
            return apply(markup.iterator(), context);
        }
        if (result instanceof Iterable<?> || result.getClass().isArray()) {
            Iterator<?> items = Values.iterate(result);
            return apply(new PullIterator<Event>() {
                @Override
                protected Event computeNext() {
                    while (items.hasNext()) {
                        Object item = items.next();
                        if (item instanceof Event event) {
                            return event;
                        }
                        if (!Undefined.isAbsent(item)) {
                            return Event.text(Values.toText(item), position);
                        }
                    }
                    return endOfData();
                }
            }, context);
        }
        return List.of(Event.text(Values.toText(result), position)).iterator();
    }

    private Event evaluateAttributes(Event event, Context context) {
        StartElement element = event.startElement();
        if (element.attributes().asList().stream().allMatch(Attribute::isLiteral)) {
            return event;
        }
        List<Attribute> evaluated = new ArrayList<>(element.attributes().size());
        for (Attribute attribute : element.attributes()) {
            if (attribute.isLiteral()) {
                evaluated.add(attribute);
                continue;
            }
            StringBuilder value = new StringBuilder();
            boolean present = false;
            for (Event fragment : attribute.value()) {
                if (fragment.is(EventKind.TEXT)) {
                    value.append(fragment.text());
                    present = true;
                    continue;
                }
                Object result = evaluate(fragment.expression(), fragment.position(), context);
                if (!Undefined.isAbsent(result)) {
                    value.append(Values.toText(result));
                    present = true;
                }
            }
            if (present) {
                evaluated.add(Attribute.literal(attribute.name(), value.toString(), event.position()));
            }
        }
        return new Event(EventKind.START, element.withAttributes(new Attributes(evaluated)), event.position());
    }

    private static Object evaluate(CompiledExpression expression, Position position, Context context) {
        try {
            return expression.evaluate(context);
        } catch (ExpressionEvalException e) {
            throw e.at(position);
        }
    }
}
