package io.markuptemplate.core.filter;

import io.markuptemplate.core.directive.MatchDirective;
import io.markuptemplate.core.engine.PullIterator;
import io.markuptemplate.core.markup.PathPattern;
import io.markuptemplate.core.model.Context;
import io.markuptemplate.core.model.Event;
import io.markuptemplate.core.model.EventKind;
import io.markuptemplate.core.model.StartElement;
import io.markuptemplate.core.spi.Directive;
import io.markuptemplate.core.spi.TemplateFilter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runtime filter registered by a {@code match} element. Tracks the ancestors of the element being
 * streamed, starting from the elements opened by enclosing expansion levels; when an element
 * matches the pattern, its whole subtree is consumed and replaced by a SUB event whose only
 * directive expands the match template over the captured subtree.
 *
 * <p>The replacement body is not matched again by the same filter while it is being expanded;
 * other match filters still apply to it.
 */
public final class MatchFilter implements TemplateFilter {

    private static final AtomicLong IDS = new AtomicLong();

    private final PathPattern pattern;
    private final MatchDirective template;
    // Bound in the expansion frame; not a valid expression name.
    private final String activeMarker = "#match-" + IDS.incrementAndGet();

    public MatchFilter(PathPattern pattern, MatchDirective template) {
        this.pattern = pattern;
        this.template = template;
    }

    public PathPattern pattern() {
        return pattern;
    }

    @Override
    public Iterator<Event> apply(Iterator<Event> stream, Context context) {
        return apply(stream, context, List.of());
    }

    @Override
    public Iterator<Event> apply(Iterator<Event> stream, Context context, List<StartElement> enclosing) {
        return new PullIterator<>() {
            private final List<StartElement> ancestors = new ArrayList<>(enclosing);

            @Override
            protected Event computeNext() {
                if (!stream.hasNext()) {
                    return endOfData();
                }
                Event event = stream.next();
                if (event.is(EventKind.START)) {
                    ancestors.add(event.startElement());
                    if (!context.has(activeMarker) && pattern.matches(ancestors)) {
                        ancestors.remove(ancestors.size() - 1);
                        List<Event> matched = subtree(event, stream);
                        Directive expansion =
                                (ignored, ctx) -> template.expand(matched, ctx, Map.of(activeMarker, Boolean.TRUE));
                        return Event.sub(List.of(expansion), List.of(), event.position());
                    }
                } else if (event.is(EventKind.END) && ancestors.size() > enclosing.size()) {
                    ancestors.remove(ancestors.size() - 1);
                }
                return event;
            }
        };
    }

    private static List<Event> subtree(Event start, Iterator<Event> stream) {
        List<Event> events = new ArrayList<>();
        events.add(start);
        int depth = 1;
        while (depth > 0 && stream.hasNext()) {
            Event event = stream.next();
            if (event.is(EventKind.START)) {
                depth++;
            } else if (event.is(EventKind.END)) {
                depth--;
            }
            events.add(event);
        }
        return events;
    }

    @Override
    public String toString() {
        return "<MatchFilter \"" + pattern.source() + "\">";
    }
}
