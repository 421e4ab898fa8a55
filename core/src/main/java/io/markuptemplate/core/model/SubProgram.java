package io.markuptemplate.core.model;

import io.markuptemplate.core.spi.Directive;
import java.util.List;

/**
 * Payload of a SUB event: the directives attached to an element, sorted by priority, and the
 * element's events from its START through its END.
 */
public record SubProgram(List<Directive> directives, List<Event> events) {

    public SubProgram {
        directives = List.copyOf(directives);
        events = List.copyOf(events);
    }
}
