package io.markuptemplate.core.engine;

import io.markuptemplate.core.error.ExpressionEvalException;
import io.markuptemplate.core.error.TemplateRuntimeException;
import io.markuptemplate.core.model.Context;
import io.markuptemplate.core.model.Event;
import io.markuptemplate.core.model.EventKind;
import io.markuptemplate.core.model.MarkupStream;
import io.markuptemplate.core.model.Position;
import io.markuptemplate.core.model.StartElement;
import io.markuptemplate.core.model.SubProgram;
import io.markuptemplate.core.spi.Directive;
import io.markuptemplate.core.spi.TemplateFilter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * A compiled template: the parsed event list plus the filters to run during generation.
 *
 * <p>Immutable after compilation, so a template can be generated any number of times, also
 * concurrently as long as each generation uses its own {@link Context}. The one exception is the
 * body captured by {@code def} and {@code match} elements, which is recorded once, atomically, on
 * first generation.
 */
public final class Template {

    private final String filename;
    private final List<Event> events;
    private final List<TemplateFilter> preFilters;
    private final List<TemplateFilter> filters;
    private final List<TemplateFilter> postFilters;

    Template(
            String filename,
            List<Event> events,
            List<TemplateFilter> preFilters,
            List<TemplateFilter> filters,
            List<TemplateFilter> postFilters) {
        this.filename = filename;
        this.events = List.copyOf(events);
        this.preFilters = List.copyOf(preFilters);
        this.filters = List.copyOf(filters);
        this.postFilters = List.copyOf(postFilters);
    }

    public String filename() {
        return filename;
    }

    /** The compiled event list, with SUB events for elements carrying directives. */
    public List<Event> events() {
        return events;
    }

    /** Filters registered by directives during compilation, in registration order. */
    public List<TemplateFilter> filters() {
        return filters;
    }

    public MarkupStream generate(Map<String, ?> data) {
        return generate(new Context(data));
    }

    /**
     * Returns the lazy output stream for this template. Nothing is evaluated until events are
     * pulled.
     *
     * <p>Expression failures surface from the stream's iterator as {@link
     * TemplateRuntimeException} carrying the position of the failing event. Closing the stream
     * pops any frames still pushed by directives of this generation.
     */
    public MarkupStream generate(Context context) {
        int depth = context.depth();
        Expansion expansion = new Expansion(context);
        Iterator<Event> stream = expansion;
        for (TemplateFilter filter : postFilters) {
            stream = filter.apply(stream, context);
        }
        return new MarkupStream(new Translating(stream, expansion), () -> context.unwind(depth));
    }

    private Iterator<Event> filtered(Iterator<Event> stream, Context context, List<StartElement> enclosing) {
        for (TemplateFilter filter : preFilters) {
            stream = filter.apply(stream, context, enclosing);
        }
        for (TemplateFilter filter : filters) {
            stream = filter.apply(stream, context, enclosing);
        }
        return stream;
    }

    /**
     * Expands SUB events. Each nesting level is an iterator on an explicit stack, so nesting
     * depth is not bounded by the call stack. Elements opened by emitted events are tracked so
     * that a nested level is filtered knowing its ancestors.
     */
    private final class Expansion extends PullIterator<Event> {

        private final Context context;
        private final Deque<Iterator<Event>> levels = new ArrayDeque<>();
        private final List<StartElement> open = new ArrayList<>();
        private Position current = Position.UNKNOWN;

        Expansion(Context context) {
            this.context = context;
            levels.push(filtered(events.iterator(), context, List.of()));
        }

        @Override
        protected Event computeNext() {
            while (!levels.isEmpty()) {
                Iterator<Event> level = levels.peek();
                if (!level.hasNext()) {
                    levels.pop();
                    continue;
                }
                Event event = level.next();
                current = event.position();
                if (event.is(EventKind.START)) {
                    open.add(event.startElement());
                } else if (event.is(EventKind.END) && !open.isEmpty()) {
                    open.remove(open.size() - 1);
                }
                if (!event.is(EventKind.SUB)) {
                    return event;
                }
                SubProgram sub = event.subProgram();
                Iterator<Event> substream = sub.events().iterator();
                List<Directive> directives = sub.directives();
                for (int i = directives.size() - 1; i >= 0; i--) {
                    substream = directives.get(i).apply(substream, context);
                }
                // The enclosing level is not pulled again until this one is exhausted.
                levels.push(filtered(substream, context, List.copyOf(open)));
            }
            return endOfData();
        }
    }

    /** Converts expression failures into runtime errors at the outermost boundary. */
    private static final class Translating implements Iterator<Event> {

        private final Iterator<Event> delegate;
        private final Expansion expansion;

        Translating(Iterator<Event> delegate, Expansion expansion) {
            this.delegate = delegate;
            this.expansion = expansion;
        }

        @Override
        public boolean hasNext() {
            try {
                return delegate.hasNext();
            } catch (ExpressionEvalException e) {
                throw translate(e);
            }
        }

        @Override
        public Event next() {
            try {
                return delegate.next();
            } catch (ExpressionEvalException e) {
                throw translate(e);
            }
        }

        private TemplateRuntimeException translate(ExpressionEvalException e) {
            Position position = e.eventPosition() != null ? e.eventPosition() : expansion.current;
            return new TemplateRuntimeException(e.detail(), e, position);
        }
    }

    @Override
    public String toString() {
        return "<Template \"" + filename + "\">";
    }
}
