package io.markuptemplate.core.directive;

import io.markuptemplate.core.engine.PullIterator;
import io.markuptemplate.core.engine.Values;
import io.markuptemplate.core.error.TemplateSyntaxException;
import io.markuptemplate.core.model.Context;
import io.markuptemplate.core.model.Event;
import io.markuptemplate.core.model.Undefined;
import io.markuptemplate.core.spi.CompiledExpression;
import io.markuptemplate.core.spi.Directive;
import io.markuptemplate.core.spi.DirectiveSite;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Repeats the element once per item of an iterable. The value has the form {@code targets in
 * expression}; a single target binds the whole item, several comma-separated targets destructure
 * it. Each iteration runs in its own frame, popped before the next one is pushed.
 */
public final class ForDirective implements Directive {

    private static final String SEPARATOR = " in ";

    private final List<String> targets;
    private final CompiledExpression iterable;

    ForDirective(List<String> targets, CompiledExpression iterable) {
        this.targets = List.copyOf(targets);
        this.iterable = iterable;
    }

    static ForDirective create(String value, DirectiveSite site) {
        int split = value.indexOf(SEPARATOR);
        if (split < 0) {
            throw new TemplateSyntaxException(
                    "Invalid \"for\" directive \"" + value + "\": expected \"<names> in <expression>\"",
                    site.position());
        }
        List<String> targets = new ArrayList<>();
        for (String target : value.substring(0, split).replace("(", "").replace(")", "").split(",")) {
            String name = target.strip();
            if (!name.isEmpty()) {
                targets.add(name);
            }
        }
        if (targets.isEmpty()) {
            throw new TemplateSyntaxException(
                    "Invalid \"for\" directive \"" + value + "\": no loop variable", site.position());
        }
        return new ForDirective(targets, site.compile(value.substring(split + SEPARATOR.length()).strip()));
    }

    public List<String> targets() {
        return targets;
    }

    @Override
    public Iterator<Event> apply(Iterator<Event> stream, Context context) {
        return new PullIterator<>() {
            private Iterator<?> items;
            private List<Event> body;
            private Iterator<Event> iteration;
            private boolean pushed;

            @Override
            protected Event computeNext() {
                if (items == null) {
                    Object value = iterable.evaluate(context);
                    if (Undefined.isAbsent(value)) {
                        return endOfData();
                    }
                    items = Values.iterate(value);
                    body = Streams.drain(stream);
                }
                while (true) {
                    if (iteration != null && iteration.hasNext()) {
                        return iteration.next();
                    }
                    if (pushed) {
                        context.pop();
                        pushed = false;
                    }
                    if (!items.hasNext()) {
                        return endOfData();
                    }
                    context.push(bind(items.next()));
                    pushed = true;
                    iteration = body.iterator();
                }
            }
        };
    }

    private Map<String, Object> bind(Object item) {
        Map<String, Object> frame = new HashMap<>();
        if (targets.size() == 1) {
            frame.put(targets.get(0), item);
        } else {
            List<Object> parts = Values.unpack(item, targets.size());
            for (int i = 0; i < targets.size(); i++) {
                frame.put(targets.get(i), parts.get(i));
            }
        }
        return frame;
    }

    @Override
    public String toString() {
        return "<ForDirective \"" + String.join(", ", targets) + " in " + iterable.source() + "\">";
    }
}
