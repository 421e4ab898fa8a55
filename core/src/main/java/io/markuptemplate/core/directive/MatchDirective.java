package io.markuptemplate.core.directive;

import io.markuptemplate.core.error.ExpressionEvalException;
import io.markuptemplate.core.error.TemplateSyntaxException;
import io.markuptemplate.core.filter.MatchFilter;
import io.markuptemplate.core.markup.PathPattern;
import io.markuptemplate.core.model.Context;
import io.markuptemplate.core.model.Event;
import io.markuptemplate.core.model.MarkupStream;
import io.markuptemplate.core.spi.Directive;
import io.markuptemplate.core.spi.DirectiveSite;
import io.markuptemplate.core.spi.TemplateCallable;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Declares a match template. At compile time the directive registers a {@link MatchFilter} for
 * its path pattern; when applied it captures the element's events as the replacement body (once)
 * and produces no output. Matched elements are replaced by the body, evaluated in a frame that
 * binds {@code select(path)} to a selection over the matched element.
 */
public final class MatchDirective implements Directive {

    public static final String SELECT = "select";

    private final PathPattern pattern;
    private final AtomicReference<List<Event>> body = new AtomicReference<>();

    MatchDirective(PathPattern pattern) {
        this.pattern = pattern;
    }

    static MatchDirective create(String value, DirectiveSite site) {
        PathPattern pattern;
        try {
            pattern = PathPattern.compile(value);
        } catch (IllegalArgumentException e) {
            throw new TemplateSyntaxException(
                    "Invalid \"match\" pattern \"" + value + "\": " + e.getMessage(), e, site.position());
        }
        if (!pattern.isElementPattern()) {
            throw new TemplateSyntaxException(
                    "Invalid \"match\" pattern \"" + value + "\": must select elements", site.position());
        }
        MatchDirective directive = new MatchDirective(pattern);
        site.addRuntimeFilter(new MatchFilter(pattern, directive));
        return directive;
    }

    public PathPattern pattern() {
        return pattern;
    }

    @Override
    public Iterator<Event> apply(Iterator<Event> stream, Context context) {
        if (body.get() == null) {
            body.compareAndSet(null, List.copyOf(Streams.drain(stream)));
        }
        return Collections.emptyIterator();
    }

    /**
     * Returns the replacement for a matched element: the captured body replayed in a frame
     * binding {@code select}. Before the match element has been applied the body is empty.
     *
     * @param matched the matched element's events, start to end tag
     * @param frameExtras further bindings for the frame
     */
    public Iterator<Event> expand(List<Event> matched, Context context, Map<String, Object> frameExtras) {
        TemplateCallable select = (args, kwargs) -> {
            if (args.size() != 1) {
                throw new ExpressionEvalException(
                        "select() takes exactly one path argument (" + args.size() + " given)", null);
            }
            PathPattern path;
            try {
                path = PathPattern.compile(String.valueOf(args.get(0)));
            } catch (IllegalArgumentException e) {
                throw new ExpressionEvalException("Invalid path \"" + args.get(0) + "\": " + e.getMessage(), e, null);
            }
            return MarkupStream.of(path.select(matched, true));
        };
        Map<String, Object> frame = new HashMap<>(frameExtras);
        frame.put(SELECT, select);
        List<Event> captured = body.get();
        return Streams.replayInFrame(context, frame, captured != null ? captured : List.of());
    }

    @Override
    public String toString() {
        return "<MatchDirective \"" + pattern.source() + "\">";
    }
}
