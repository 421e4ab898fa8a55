package io.markuptemplate.core.model;

/**
 * Sentinel returned for names that no context frame defines. Lookup misses are not errors:
 * directives decide what an undefined value means (no iterations, false condition, no output).
 */
public enum Undefined {
    INSTANCE;

    public static boolean isUndefined(Object value) {
        return value == INSTANCE;
    }

    /** Returns {@code true} for {@code null} and {@link #INSTANCE}. */
    public static boolean isAbsent(Object value) {
        return value == null || value == INSTANCE;
    }

    @Override
    public String toString() {
        return "Undefined";
    }
}
