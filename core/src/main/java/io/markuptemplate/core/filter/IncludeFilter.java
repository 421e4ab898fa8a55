package io.markuptemplate.core.filter;

import io.markuptemplate.core.engine.PullIterator;
import io.markuptemplate.core.error.TemplateNotFoundException;
import io.markuptemplate.core.error.TemplateSyntaxException;
import io.markuptemplate.core.loader.TemplateLoader;
import io.markuptemplate.core.model.Context;
import io.markuptemplate.core.model.Event;
import io.markuptemplate.core.model.EventKind;
import io.markuptemplate.core.model.NamespaceDecl;
import io.markuptemplate.core.model.QName;
import io.markuptemplate.core.spi.TemplateFilter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pre-filter that replaces XInclude {@code include} elements with the output of the referenced
 * template, generated against the same context. When the referenced template cannot be found,
 * the children of an {@code xi:fallback} child element are used instead; without a fallback the
 * lookup error propagates. Declarations of the XInclude namespace are removed from the output.
 */
public final class IncludeFilter implements TemplateFilter {

    public static final String XINCLUDE_NAMESPACE = "http://www.w3.org/2001/XInclude";

    private static final Logger LOG = LoggerFactory.getLogger(IncludeFilter.class);
    private static final QName INCLUDE = new QName(XINCLUDE_NAMESPACE, "include", "xi");
    private static final QName FALLBACK = new QName(XINCLUDE_NAMESPACE, "fallback", "xi");

    private final TemplateLoader loader;

    public IncludeFilter(TemplateLoader loader) {
        this.loader = loader;
    }

    @Override
    public Iterator<Event> apply(Iterator<Event> stream, Context context) {
        return new PullIterator<>() {
            private final Set<String> xincludePrefixes = new HashSet<>();
            private Iterator<Event> included;

            @Override
            protected Event computeNext() {
                while (true) {
                    if (included != null) {
                        if (included.hasNext()) {
                            return included.next();
                        }
                        included = null;
                    }
                    if (!stream.hasNext()) {
                        return endOfData();
                    }
                    Event event = stream.next();
                    if (event.is(EventKind.START_NS)) {
                        NamespaceDecl declaration = (NamespaceDecl) event.data();
                        if (XINCLUDE_NAMESPACE.equals(declaration.uri())) {
                            xincludePrefixes.add(declaration.prefix());
                            continue;
                        }
                    } else if (event.is(EventKind.END_NS) && xincludePrefixes.remove((String) event.data())) {
                        continue;
                    } else if (event.is(EventKind.START) && event.startElement().tag().equals(INCLUDE)) {
                        included = include(event, stream, context);
                        continue;
                    }
                    return event;
                }
            }
        };
    }

    private Iterator<Event> include(Event start, Iterator<Event> stream, Context context) {
        String href = start.startElement().attributes().get("href");
        if (href == null || href.isBlank()) {
            throw new TemplateSyntaxException("Include is missing the \"href\" attribute", start.position());
        }
        List<Event> fallback = readFallback(stream);
        try {
            return loader.load(href).generate(context).iterator();
        } catch (TemplateNotFoundException e) {
            if (fallback == null) {
                throw e;
            }
            LOG.warn("Included template not found, using fallback: href={}, at={}", href, start.position());
            return fallback.iterator();
        }
    }

    // Consumes the include element's children up to its end tag; returns the fallback children,
    // or null if there is no fallback element.
    private static List<Event> readFallback(Iterator<Event> stream) {
        List<Event> fallback = null;
        int depth = 1;
        int fallbackDepth = -1;
        while (stream.hasNext()) {
            Event event = stream.next();
            if (event.is(EventKind.START)) {
                depth++;
                if (depth == 2 && event.startElement().tag().equals(FALLBACK)) {
                    fallback = new ArrayList<>();
                    fallbackDepth = depth;
                    continue;
                }
            } else if (event.is(EventKind.END)) {
                depth--;
                if (depth == 0) {
                    break;
                }
                if (depth == fallbackDepth - 1 && fallbackDepth > 0) {
                    fallbackDepth = -1;
                    continue;
                }
            }
            if (fallbackDepth > 0) {
                fallback.add(event);
            }
        }
        return fallback;
    }
}
