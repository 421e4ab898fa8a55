package io.markuptemplate.core.directive;

import io.markuptemplate.core.model.Context;
import io.markuptemplate.core.model.Event;
import io.markuptemplate.core.model.MarkupStream;
import io.markuptemplate.core.spi.CompiledExpression;
import io.markuptemplate.core.spi.Directive;
import io.markuptemplate.core.spi.DirectiveSite;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Defines a template function. Applying the directive captures the element's events (once, on
 * first application), binds a {@link TemplateFunction} under the function name in the current
 * frame and produces no output. Calling the function replays the captured events in a frame
 * holding the bound parameters.
 */
public final class DefDirective implements Directive {

    private final FunctionSignature signature;
    private final AtomicReference<List<Event>> body = new AtomicReference<>();

    DefDirective(FunctionSignature signature) {
        this.signature = signature;
    }

    static DefDirective create(String value, DirectiveSite site) {
        return new DefDirective(FunctionSignature.parse(value, site));
    }

    public FunctionSignature signature() {
        return signature;
    }

    @Override
    public Iterator<Event> apply(Iterator<Event> stream, Context context) {
        if (body.get() == null) {
            body.compareAndSet(null, List.copyOf(Streams.drain(stream)));
        }
        context.set(signature.name(), new TemplateFunction(this, context));
        return Collections.emptyIterator();
    }

    /**
     * Binds the arguments and returns the function body as a lazy stream: positional arguments
     * first, then keyword arguments, then defaults; unbound parameters are {@code null}.
     */
    MarkupStream invoke(Context context, List<Object> args, Map<String, Object> kwargs) {
        Map<String, Object> frame = new HashMap<>();
        List<String> parameters = signature.parameters();
        for (int i = 0; i < parameters.size(); i++) {
            String parameter = parameters.get(i);
            if (i < args.size()) {
                frame.put(parameter, args.get(i));
            } else if (kwargs.containsKey(parameter)) {
                frame.put(parameter, kwargs.get(parameter));
            } else {
                CompiledExpression fallback = signature.defaults().get(parameter);
                frame.put(parameter, fallback != null ? fallback.evaluate(context) : null);
            }
        }
        List<Event> captured = body.get();
        return new MarkupStream(Streams.replayInFrame(context, frame, captured != null ? captured : List.of()));
    }

    @Override
    public String toString() {
        return "<DefDirective \"" + signature.name() + "\">";
    }
}
