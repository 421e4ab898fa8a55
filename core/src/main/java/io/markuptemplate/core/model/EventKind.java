package io.markuptemplate.core.model;

/**
 * Kinds of events flowing through the template pipeline. All kinds except {@link #EXPR} and
 * {@link #SUB} are produced by the markup parser; those two only exist between the compile and the
 * generate stage.
 */
public enum EventKind {
    START,
    END,
    TEXT,
    START_NS,
    END_NS,
    COMMENT,
    PI,
    DOCTYPE,
    /** An expression to be evaluated at generate time. */
    EXPR,
    /** A directive scope: directives plus the events they apply to. */
    SUB
}
