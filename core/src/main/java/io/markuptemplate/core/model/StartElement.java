package io.markuptemplate.core.model;

import java.util.Objects;

/** Payload of a START event. */
public record StartElement(QName tag, Attributes attributes) {

    public StartElement {
        Objects.requireNonNull(tag, "tag must not be null");
        attributes = attributes != null ? attributes : Attributes.EMPTY;
    }

    public StartElement withAttributes(Attributes replacement) {
        return new StartElement(tag, replacement);
    }
}
