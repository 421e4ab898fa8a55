package io.markuptemplate.core.markup;

import io.markuptemplate.core.model.Attribute;
import io.markuptemplate.core.model.Doctype;
import io.markuptemplate.core.model.Event;
import io.markuptemplate.core.model.EventKind;
import io.markuptemplate.core.model.NamespaceDecl;
import io.markuptemplate.core.model.ProcessingInstruction;
import io.markuptemplate.core.model.StartElement;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Serializes a fully generated event stream as XML text. Elements without content are written in
 * the minimized {@code <tag/>} form; namespace declarations are written on the element that
 * follows their START_NS event.
 */
public final class XmlSerializer {

    private XmlSerializer() {}

    /**
     * Serializes the events to a string.
     *
     * @throws IllegalStateException if the stream still contains EXPR or SUB events
     */
    public static String serialize(Iterator<Event> events) {
        StringBuilder out = new StringBuilder();
        List<NamespaceDecl> pendingNamespaces = new ArrayList<>();
        StartElement openStart = null;

        while (events.hasNext()) {
            Event event = events.next();
            if (openStart != null) {
                if (event.is(EventKind.END)) {
                    out.append("/>");
                    openStart = null;
                    continue;
                }
                out.append('>');
                openStart = null;
            }
            switch (event.kind()) {
                case START -> {
                    openStart = event.startElement();
                    writeStartTag(out, openStart, pendingNamespaces);
                    pendingNamespaces.clear();
                }
                case END -> out.append("</").append(event.endTag().qualifiedName()).append('>');
                case TEXT -> escape(out, event.text(), false);
                case COMMENT -> out.append("<!--").append(event.text()).append("-->");
                case START_NS -> pendingNamespaces.add((NamespaceDecl) event.data());
                case END_NS -> {
                    // declarations are scoped by the element they were written on
                }
                case PI -> {
                    ProcessingInstruction pi = (ProcessingInstruction) event.data();
                    out.append("<?").append(pi.target());
                    if (pi.data() != null && !pi.data().isEmpty()) {
                        out.append(' ').append(pi.data());
                    }
                    out.append("?>");
                }
                case DOCTYPE -> writeDoctype(out, (Doctype) event.data());
                case EXPR, SUB -> throw new IllegalStateException(
                        "Cannot serialize unexpanded " + event.kind() + " event at " + event.position());
            }
        }
        if (openStart != null) {
            out.append('>');
        }
        return out.toString();
    }

    private static void writeStartTag(StringBuilder out, StartElement start, List<NamespaceDecl> namespaces) {
        out.append('<').append(start.tag().qualifiedName());
        for (NamespaceDecl ns : namespaces) {
            out.append(ns.prefix().isEmpty() ? " xmlns" : " xmlns:" + ns.prefix()).append("=\"");
            escape(out, ns.uri(), true);
            out.append('"');
        }
        for (Attribute attribute : start.attributes()) {
            out.append(' ').append(attribute.name().qualifiedName()).append("=\"");
            escape(out, attribute.text(), true);
            out.append('"');
        }
    }

    private static void writeDoctype(StringBuilder out, Doctype doctype) {
        out.append("<!DOCTYPE ").append(doctype.name());
        if (doctype.publicId() != null) {
            out.append(" PUBLIC \"").append(doctype.publicId()).append('"');
            if (doctype.systemId() != null) {
                out.append(" \"").append(doctype.systemId()).append('"');
            }
        } else if (doctype.systemId() != null) {
            out.append(" SYSTEM \"").append(doctype.systemId()).append('"');
        }
        out.append('>');
    }

    static void escape(StringBuilder out, String text, boolean quotes) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append(quotes ? "&quot;" : "\"");
                default -> out.append(c);
            }
        }
    }
}
