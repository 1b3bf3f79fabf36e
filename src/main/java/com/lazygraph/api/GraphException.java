package com.lazygraph.api;

/**
 * Root of the errors raised when a caller asks a graph for something it cannot
 * do: a name that is already taken, a node that does not exist, a bad weight.
 *
 * These are programming or input errors in the request, raised synchronously
 * at the offending call. The library never retries them.
 */
public class GraphException extends IllegalArgumentException {

    public GraphException(String message) {
        super(message);
    }
}
