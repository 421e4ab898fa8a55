package io.markuptemplate.core.model;

import io.markuptemplate.core.spi.CompiledExpression;
import io.markuptemplate.core.spi.Directive;
import java.util.List;
import java.util.Objects;

/**
 * A single immutable event of a markup stream. The type of {@link #data()} depends on the kind:
 *
 * <ul>
 *   <li>{@link EventKind#START}: {@link StartElement}
 *   <li>{@link EventKind#END}: the element's {@link QName}
 *   <li>{@link EventKind#TEXT}, {@link EventKind#COMMENT}: the text as a {@code String}
 *   <li>{@link EventKind#START_NS}: {@link NamespaceDecl}
 *   <li>{@link EventKind#END_NS}: the prefix as a {@code String}
 *   <li>{@link EventKind#PI}: {@link ProcessingInstruction}
 *   <li>{@link EventKind#DOCTYPE}: {@link Doctype}
 *   <li>{@link EventKind#EXPR}: {@link CompiledExpression}
 *   <li>{@link EventKind#SUB}: {@link SubProgram}
 * </ul>
 *
 * <p>Transforms never mutate events; they create new ones.
 */
public record Event(EventKind kind, Object data, Position position) {

    public Event {
        Objects.requireNonNull(kind, "kind must not be null");
        position = position != null ? position : Position.UNKNOWN;
    }

    public static Event start(QName tag, Attributes attributes, Position position) {
        return new Event(EventKind.START, new StartElement(tag, attributes), position);
    }

    public static Event end(QName tag, Position position) {
        return new Event(EventKind.END, tag, position);
    }

    public static Event text(String text, Position position) {
        return new Event(EventKind.TEXT, text, position);
    }

    public static Event comment(String text, Position position) {
        return new Event(EventKind.COMMENT, text, position);
    }

    public static Event startNs(String prefix, String uri, Position position) {
        return new Event(EventKind.START_NS, new NamespaceDecl(prefix, uri), position);
    }

    public static Event endNs(String prefix, Position position) {
        return new Event(EventKind.END_NS, prefix, position);
    }

    public static Event pi(String target, String data, Position position) {
        return new Event(EventKind.PI, new ProcessingInstruction(target, data), position);
    }

    public static Event doctype(String name, String publicId, String systemId, Position position) {
        return new Event(EventKind.DOCTYPE, new Doctype(name, publicId, systemId), position);
    }

    public static Event expr(CompiledExpression expression, Position position) {
        return new Event(EventKind.EXPR, expression, position);
    }

    public static Event sub(List<Directive> directives, List<Event> events, Position position) {
        return new Event(EventKind.SUB, new SubProgram(directives, events), position);
    }

    public boolean is(EventKind other) {
        return kind == other;
    }

    public StartElement startElement() {
        return as(EventKind.START, StartElement.class);
    }

    public QName endTag() {
        return as(EventKind.END, QName.class);
    }

    /** Text of a TEXT or COMMENT event. */
    public String text() {
        if (kind != EventKind.TEXT && kind != EventKind.COMMENT) {
            throw new IllegalStateException("Not a text event: " + kind);
        }
        return (String) data;
    }

    public CompiledExpression expression() {
        return as(EventKind.EXPR, CompiledExpression.class);
    }

    public SubProgram subProgram() {
        return as(EventKind.SUB, SubProgram.class);
    }

    private <T> T as(EventKind expected, Class<T> type) {
        if (kind != expected) {
            throw new IllegalStateException("Expected " + expected + " event but was " + kind);
        }
        return type.cast(data);
    }
}
