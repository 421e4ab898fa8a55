package io.markuptemplate.core.directive;

import io.markuptemplate.core.engine.PullIterator;
import io.markuptemplate.core.model.Context;
import io.markuptemplate.core.model.Event;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/** Stream helpers shared by the directives. */
final class Streams {

    private Streams() {}

    static List<Event> drain(Iterator<Event> stream) {
        List<Event> events = new ArrayList<>();
        stream.forEachRemaining(events::add);
        return events;
    }

    /**
     * Replays {@code events} inside a frame. The frame is pushed when the first event is pulled
     * and popped when the replay is asked for the event after the last one.
     */
    static Iterator<Event> replayInFrame(Context context, Map<String, ?> frame, List<Event> events) {
        return new PullIterator<>() {
            private Context.Scope scope;
            private Iterator<Event> body;

            @Override
            protected Event computeNext() {
                if (body == null) {
                    scope = context.scope(frame);
                    body = events.iterator();
                }
                if (body.hasNext()) {
                    return body.next();
                }
                scope.close();
                return endOfData();
            }
        };
    }
}
