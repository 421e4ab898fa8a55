package io.markuptemplate.core.engine;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Base class for the lazy stages of the pipeline. Subclasses implement {@link #computeNext()},
 * which is only called when the consumer asks for the next element, and signal exhaustion with
 * {@link #endOfData()}.
 *
 * <p>Stages that push context frames rely on this contract: an element is computed (and, for
 * expressions, evaluated) before the stage is asked for the element after it.
 */
public abstract class PullIterator<T> implements Iterator<T> {

    private enum State {
        READY,
        NOT_READY,
        DONE
    }

    private State state = State.NOT_READY;
    private T next;

    /** Produces the next element, or returns {@link #endOfData()} when there is none. */
    protected abstract T computeNext();

    protected final T endOfData() {
        state = State.DONE;
        return null;
    }

    @Override
    public final boolean hasNext() {
        if (state == State.DONE) {
            return false;
        }
        if (state == State.READY) {
            return true;
        }
        T computed = computeNext();
        if (state != State.DONE) {
            next = computed;
            state = State.READY;
        }
        return state == State.READY;
    }

    @Override
    public final T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        state = State.NOT_READY;
        T result = next;
        next = null;
        return result;
    }
}
