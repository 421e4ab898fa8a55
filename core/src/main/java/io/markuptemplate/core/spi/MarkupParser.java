package io.markuptemplate.core.spi;

import io.markuptemplate.core.model.Event;
import java.io.Reader;
import java.util.List;

/**
 * Turns markup source text into structural events (START, END, TEXT, START_NS, END_NS, COMMENT,
 * PI, DOCTYPE) with accurate positions. START events carry attributes in source order, each value
 * as a single TEXT fragment.
 */
public interface MarkupParser {

    /**
     * @param source   the markup source
     * @param filename the name reported in positions and errors
     * @return the events in document order
     * @throws io.markuptemplate.core.error.TemplateSyntaxException if the markup is not well-formed
     */
    List<Event> parse(Reader source, String filename);
}
