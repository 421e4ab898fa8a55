package io.markuptemplate.core.model;

/** Payload of a DOCTYPE event. Public and system identifiers may be {@code null}. */
public record Doctype(String name, String publicId, String systemId) {}
