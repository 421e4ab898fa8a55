package io.markuptemplate.core.directive;

import io.markuptemplate.core.spi.DirectiveFactory;

/**
 * The built-in directives, in priority order. When an element carries several directives they
 * are sorted by this order; the generate stage applies them from the last to the first, so the
 * first listed directive ends up outermost in the application chain.
 */
public enum DirectiveKind {
    DEF("def", DefDirective::create),
    MATCH("match", MatchDirective::create),
    FOR("for", ForDirective::create),
    IF("if", IfDirective::create),
    REPLACE("replace", ReplaceDirective::create),
    CONTENT("content", ContentDirective::create),
    ATTRS("attrs", AttrsDirective::create),
    STRIP("strip", StripDirective::create);

    private final String localName;
    private final DirectiveFactory factory;

    DirectiveKind(String localName, DirectiveFactory factory) {
        this.localName = localName;
        this.factory = factory;
    }

    /** Attribute local name in the directive namespace. */
    public String localName() {
        return localName;
    }

    public DirectiveFactory factory() {
        return factory;
    }
}
