package io.markuptemplate.core.filter;

import io.markuptemplate.core.engine.PullIterator;
import io.markuptemplate.core.model.Context;
import io.markuptemplate.core.model.Event;
import io.markuptemplate.core.model.EventKind;
import io.markuptemplate.core.model.Position;
import io.markuptemplate.core.spi.TemplateFilter;
import java.util.Iterator;
import java.util.regex.Pattern;

/**
 * Output post-filter: merges adjacent TEXT events, strips spaces and tabs before line breaks and
 * collapses runs of line breaks into one.
 */
public final class WhitespaceFilter implements TemplateFilter {

    private static final Pattern TRAILING_SPACE = Pattern.compile("[ \\t]+(?=\\n)");
    private static final Pattern LINE_BREAKS = Pattern.compile("\\n{2,}");

    @Override
    public Iterator<Event> apply(Iterator<Event> stream, Context context) {
        return new PullIterator<>() {
            private final StringBuilder text = new StringBuilder();
            private Position textPosition;
            private Event pending;

            @Override
            protected Event computeNext() {
                if (pending != null) {
                    Event event = pending;
                    pending = null;
                    return event;
                }
                while (stream.hasNext()) {
                    Event event = stream.next();
                    if (event.is(EventKind.TEXT)) {
                        if (text.length() == 0) {
                            textPosition = event.position();
                        }
                        text.append(event.text());
                        continue;
                    }
                    Event flushed = flush();
                    if (flushed == null) {
                        return event;
                    }
                    pending = event;
                    return flushed;
                }
                Event flushed = flush();
                return flushed != null ? flushed : endOfData();
            }

            private Event flush() {
                if (text.length() == 0) {
                    return null;
                }
                String collapsed = collapse(text.toString());
                text.setLength(0);
                return collapsed.isEmpty() ? null : Event.text(collapsed, textPosition);
            }
        };
    }

    static String collapse(String text) {
        return LINE_BREAKS.matcher(TRAILING_SPACE.matcher(text).replaceAll("")).replaceAll("\n");
    }
}
