package io.markuptemplate.core.model;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Template input data organized as a stack of scope frames.
 *
 * <p>Directives that introduce variables (loop iterations, template function calls, match
 * expansions) push a frame and pop it again when they are done. Lookups walk the frames from the
 * most recently pushed one down to the base frame; a miss yields {@link Undefined#INSTANCE}.
 * Assignments always go to the top frame.
 *
 * <p>Not thread-safe: a context is the state of a single evaluation.
 */
public final class Context {

    private final Deque<Map<String, Object>> frames = new ArrayDeque<>();

    /** Creates a context with an empty base frame. */
    public Context() {
        this(Map.of());
    }

    /** Creates a context whose base frame holds a copy of the given data. */
    public Context(Map<String, ?> data) {
        frames.push(new HashMap<>(data));
    }

    /** Returns the value bound to {@code name} in the nearest frame, or {@link Undefined#INSTANCE}. */
    public Object get(String name) {
        for (Map<String, Object> frame : frames) {
            if (frame.containsKey(name)) {
                return frame.get(name);
            }
        }
        return Undefined.INSTANCE;
    }

    public boolean has(String name) {
        for (Map<String, Object> frame : frames) {
            if (frame.containsKey(name)) {
                return true;
            }
        }
        return false;
    }

    /** Binds {@code name} in the top frame. */
    public void set(String name, Object value) {
        frames.peek().put(name, value);
    }

    public void push(Map<String, ?> frame) {
        frames.push(new HashMap<>(frame));
    }

    /**
     * Removes the top frame.
     *
     * @throws IllegalStateException if only the base frame is left, which means a directive popped
     *     a frame it did not push
     */
    public void pop() {
        if (frames.size() <= 1) {
            throw new IllegalStateException("Pop from empty context stack");
        }
        frames.pop();
    }

    /**
     * Returns the visible bindings as one map: every name mapped to the value {@link #get}
     * would return.
     */
    public Map<String, Object> snapshot() {
        Map<String, Object> merged = new HashMap<>();
        Iterator<Map<String, Object>> bottomUp = frames.descendingIterator();
        while (bottomUp.hasNext()) {
            merged.putAll(bottomUp.next());
        }
        return merged;
    }

    /** Number of frames, including the base frame. */
    public int depth() {
        return frames.size();
    }

    /**
     * Pops frames until the stack is back at {@code targetDepth}. Used to restore a consistent
     * stack when a consumer abandons a partially consumed stream.
     */
    public void unwind(int targetDepth) {
        if (targetDepth < 1) {
            throw new IllegalArgumentException("targetDepth must be at least 1, got: " + targetDepth);
        }
        while (frames.size() > targetDepth) {
            frames.pop();
        }
    }

    /**
     * Pushes {@code frame} and returns a handle that pops it on {@link Scope#close()}, for use in
     * try-with-resources blocks.
     */
    public Scope scope(Map<String, ?> frame) {
        int before = depth();
        push(frame);
        return new Scope(before);
    }

    @Override
    public String toString() {
        return frames.toString();
    }

    /** Handle for a pushed frame; closing it restores the depth from before the push. */
    public final class Scope implements AutoCloseable {

        private final int restoreDepth;
        private boolean closed;

        private Scope(int restoreDepth) {
            this.restoreDepth = restoreDepth;
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                unwind(restoreDepth);
            }
        }
    }
}
