package io.markuptemplate.core.model;

import io.markuptemplate.core.markup.PathPattern;
import io.markuptemplate.core.markup.XmlSerializer;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * A lazily produced, single-pass sequence of events. Nothing upstream is computed until an event
 * is pulled.
 *
 * <p>Streams returned by {@code Template.generate} own a piece of context state: closing the
 * stream before it is exhausted unwinds any frames that directives pushed and have not popped yet.
 * Use try-with-resources when a consumer may stop early.
 */
public final class MarkupStream implements Iterable<Event>, AutoCloseable {

    private final Iterator<Event> events;
    private final Runnable onClose;
    private boolean iterated;
    private boolean closed;

    public MarkupStream(Iterator<Event> events) {
        this(events, null);
    }

    /**
     * @param events  the underlying iterator
     * @param onClose action run once on {@link #close()}, may be null
     */
    public MarkupStream(Iterator<Event> events, Runnable onClose) {
        this.events = events;
        this.onClose = onClose;
    }

    public static MarkupStream of(List<Event> events) {
        return new MarkupStream(List.copyOf(events).iterator());
    }

    /**
     * Returns the underlying iterator.
     *
     * @throws IllegalStateException if the stream has already been iterated
     */
    @Override
    public Iterator<Event> iterator() {
        if (iterated) {
            throw new IllegalStateException("A markup stream can only be iterated once");
        }
        iterated = true;
        return events;
    }

    /** Drains the stream into a list. */
    public List<Event> toList() {
        List<Event> result = new ArrayList<>();
        try {
            iterator().forEachRemaining(result::add);
        } finally {
            close();
        }
        return result;
    }

    /** Serializes the stream as markup text. */
    public String render() {
        try {
            return XmlSerializer.serialize(iterator());
        } finally {
            close();
        }
    }

    /**
     * Returns the events selected by a path expression, evaluated against the top-level nodes of
     * this stream. Selection is deferred until the result is first pulled.
     */
    public MarkupStream select(String path) {
        PathPattern pattern = PathPattern.compile(path);
        return new MarkupStream(new Iterator<>() {
            private Iterator<Event> selected;

            @Override
            public boolean hasNext() {
                return selected().hasNext();
            }

            @Override
            public Event next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return selected().next();
            }

            private Iterator<Event> selected() {
                if (selected == null) {
                    selected = pattern.select(toList(), false).iterator();
                }
                return selected;
            }
        });
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            if (onClose != null) {
                onClose.run();
            }
        }
    }
}
