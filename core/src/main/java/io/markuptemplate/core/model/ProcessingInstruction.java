package io.markuptemplate.core.model;

/** Payload of a PI event. */
public record ProcessingInstruction(String target, String data) {}
