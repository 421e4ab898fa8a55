package io.markuptemplate.core.engine.simple;

/** A method looked up on a value but not yet called, as produced by {@code obj.method}. */
record BoundMethod(Object target, String name) {

    @Override
    public String toString() {
        return "<bound method " + target.getClass().getSimpleName() + "." + name + ">";
    }
}
