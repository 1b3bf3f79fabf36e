package com.lazygraph.api;

/**
 * Thrown when an edge weight is not a finite, strictly positive number.
 * Dijkstra's ordering guarantee depends on it.
 */
public class InvalidWeightException extends GraphException {
    private final double weight;

    public InvalidWeightException(double weight) {
        super("Edge weights must be finite and positive, got: " + weight);
        this.weight = weight;
    }

    public double weight() {
        return weight;
    }
}
