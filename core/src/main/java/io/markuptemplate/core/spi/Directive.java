package io.markuptemplate.core.spi;

import io.markuptemplate.core.model.Context;
import io.markuptemplate.core.model.Event;
import java.util.Iterator;

/**
 * A transform attached to an element. The stream passed to {@link #apply} starts with the
 * element's own START event and ends with its END event; the directive returns the events that
 * should take the element's place.
 *
 * <p>Directives are created once per template at compile time and shared by all evaluations.
 * Anonymous directives (lambdas) are used by filters that need to defer work to the generate
 * stage.
 */
@FunctionalInterface
public interface Directive {

    Iterator<Event> apply(Iterator<Event> stream, Context context);
}
