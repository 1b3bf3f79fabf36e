package com.lazygraph.api;

/** Thrown when an operation names a node that is not in the graph. */
public class UnknownNodeException extends GraphException {
    private final transient Object key;

    public UnknownNodeException(Object key) {
        super("Unknown node: " + key);
        this.key = key;
    }

    public Object key() {
        return key;
    }
}
