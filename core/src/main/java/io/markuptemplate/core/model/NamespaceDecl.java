package io.markuptemplate.core.model;

/** Payload of a START_NS event; the prefix is empty for a default namespace declaration. */
public record NamespaceDecl(String prefix, String uri) {

    public NamespaceDecl {
        prefix = prefix != null ? prefix : "";
        uri = uri != null ? uri : "";
    }
}
