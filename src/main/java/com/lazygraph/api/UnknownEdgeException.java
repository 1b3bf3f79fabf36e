package com.lazygraph.api;

/** Thrown when unlinking two nodes that have no edge between them. */
public class UnknownEdgeException extends GraphException {
    private final transient Object start;
    private final transient Object end;

    public UnknownEdgeException(Object start, Object end) {
        super("No edge exists between " + start + " and " + end);
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
