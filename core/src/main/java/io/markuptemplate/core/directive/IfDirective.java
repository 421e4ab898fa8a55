package io.markuptemplate.core.directive;

import io.markuptemplate.core.engine.Values;
import io.markuptemplate.core.model.Context;
import io.markuptemplate.core.model.Event;
import io.markuptemplate.core.spi.CompiledExpression;
import io.markuptemplate.core.spi.Directive;
import io.markuptemplate.core.spi.DirectiveSite;
import java.util.Collections;
import java.util.Iterator;

/** Keeps the element only if the test expression is truthy. Evaluated once, when applied. */
public final class IfDirective implements Directive {

    private final CompiledExpression test;

    IfDirective(CompiledExpression test) {
        this.test = test;
    }

    static IfDirective create(String value, DirectiveSite site) {
        return new IfDirective(site.compile(value));
    }

    @Override
    public Iterator<Event> apply(Iterator<Event> stream, Context context) {
        return Values.isTruthy(test.evaluate(context)) ? stream : Collections.emptyIterator();
    }

    @Override
    public String toString() {
        return "<IfDirective \"" + test.source() + "\">";
    }
}
