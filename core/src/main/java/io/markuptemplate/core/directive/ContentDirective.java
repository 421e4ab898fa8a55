package io.markuptemplate.core.directive;

import io.markuptemplate.core.engine.PullIterator;
import io.markuptemplate.core.model.Context;
import io.markuptemplate.core.model.Event;
import io.markuptemplate.core.model.EventKind;
import io.markuptemplate.core.spi.CompiledExpression;
import io.markuptemplate.core.spi.Directive;
import io.markuptemplate.core.spi.DirectiveSite;
import java.util.Iterator;

/** Replaces the children of the element with the result of an expression. */
public final class ContentDirective implements Directive {

    private enum Step {
        OPEN,
        CONTENT,
        CLOSE,
        DONE
    }

    private final CompiledExpression content;

    ContentDirective(CompiledExpression content) {
        this.content = content;
    }

    static ContentDirective create(String value, DirectiveSite site) {
        return new ContentDirective(site.compile(value));
    }

    @Override
    public Iterator<Event> apply(Iterator<Event> stream, Context context) {
        return new PullIterator<>() {
            private Step step = Step.OPEN;
            private Event open;

            @Override
            protected Event computeNext() {
                switch (step) {
                    case OPEN -> {
                        if (!stream.hasNext()) {
                            return endOfData();
                        }
                        open = stream.next();
                        step = Step.CONTENT;
                        if (open.is(EventKind.START)) {
                            return open;
                        }
                        return computeNext();
                    }
                    case CONTENT -> {
                        step = Step.CLOSE;
                        return Event.expr(content, open.position());
                    }
                    case CLOSE -> {
                        step = Step.DONE;
                        Event last = null;
                        while (stream.hasNext()) {
                            last = stream.next();
                        }
                        return last != null && last.is(EventKind.END) ? last : endOfData();
                    }
                    default -> {
                        return endOfData();
                    }
                }
            }
        };
    }

    @Override
    public String toString() {
        return "<ContentDirective \"" + content.source() + "\">";
    }
}
