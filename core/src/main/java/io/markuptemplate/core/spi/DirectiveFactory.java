package io.markuptemplate.core.spi;

/** Creates a directive from the value of its attribute. Called once per attribute at compile time. */
@FunctionalInterface
public interface DirectiveFactory {

    /**
     * @param value the raw attribute value
     * @param site  compile-time services for the element carrying the directive
     * @return the directive
     * @throws io.markuptemplate.core.error.TemplateSyntaxException if the value is malformed
     */
    Directive create(String value, DirectiveSite site);
}
