package io.markuptemplate.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A single attribute. The value is a list of fragments: TEXT events for literal parts and EXPR
 * events for interpolated expressions. Once the expression pre-filter has run, the value is a
 * single TEXT fragment.
 */
public record Attribute(QName name, List<Event> value) {

    public Attribute {
        Objects.requireNonNull(name, "name must not be null");
        value = List.copyOf(value);
    }

    /** Creates an attribute with a plain literal value. */
    public static Attribute literal(QName name, String value, Position position) {
        return new Attribute(name, List.of(Event.text(value, position)));
    }

    /** Returns {@code true} if the value has no EXPR fragments. */
    public boolean isLiteral() {
        return value.stream().noneMatch(e -> e.is(EventKind.EXPR));
    }

    /** Concatenation of the literal fragments of the value. */
    public String text() {
        StringBuilder sb = new StringBuilder();
        for (Event fragment : value) {
            if (fragment.is(EventKind.TEXT)) {
                sb.append(fragment.text());
            }
        }
        return sb.toString();
    }
}
