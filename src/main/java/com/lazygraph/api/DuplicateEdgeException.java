package com.lazygraph.api;

/** Thrown when a second edge is requested between the same start and end. */
public class DuplicateEdgeException extends GraphException {
    private final transient Object start;
    private final transient Object end;

    public DuplicateEdgeException(Object start, Object end) {
        super("Edge already exists: " + start + " -> " + end);
        this.start = start;
        this.end = end;
    }

    public Object start() {
        return start;
    }

    public Object end() {
        return end;
    }
}
