package io.markuptemplate.core.directive;

import io.markuptemplate.core.engine.PullIterator;
import io.markuptemplate.core.model.Context;
import io.markuptemplate.core.model.Event;
import io.markuptemplate.core.spi.CompiledExpression;
import io.markuptemplate.core.spi.Directive;
import io.markuptemplate.core.spi.DirectiveSite;
import java.util.Iterator;

/**
 * Replaces the whole element with the result of an expression. An empty value removes the
 * element.
 */
public final class ReplaceDirective implements Directive {

    private final CompiledExpression replacement;

    ReplaceDirective(CompiledExpression replacement) {
        this.replacement = replacement;
    }

    static ReplaceDirective create(String value, DirectiveSite site) {
        return new ReplaceDirective(value.isBlank() ? null : site.compile(value));
    }

    @Override
    public Iterator<Event> apply(Iterator<Event> stream, Context context) {
        return new PullIterator<>() {
            private boolean done;

            @Override
            protected Event computeNext() {
                if (done || !stream.hasNext()) {
                    return endOfData();
                }
                done = true;
                Event first = stream.next();
                return replacement != null ? Event.expr(replacement, first.position()) : endOfData();
            }
        };
    }

    @Override
    public String toString() {
        return "<ReplaceDirective \"" + (replacement != null ? replacement.source() : "") + "\">";
    }
}
