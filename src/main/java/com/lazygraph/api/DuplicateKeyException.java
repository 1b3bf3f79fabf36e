package com.lazygraph.api;

/** Thrown when a node is created under a name the graph already holds. */
public class DuplicateKeyException extends GraphException {
    private final transient Object key;

    public DuplicateKeyException(Object key) {
        super("Duplicate node name: " + key);
        this.key = key;
    }

    public Object key() {
        return key;
    }
}
