package com.lazygraph.engine;

import com.lazygraph.api.PathStep;
import com.lazygraph.api.TraversalListener;
import com.lazygraph.graph.Graph;
import com.lazygraph.graph.GraphNode;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Pull-based skeleton shared by the graph traversals.
 *
 * A subclass implements {@link #increment()}, one unit of work that either
 * produces the next step or reports the end with null. This class turns it
 * into the {@link Iterator} protocol while guaranteeing that:
 * - at most one increment runs per requested step; {@code hasNext()} runs the
 * pending increment and caches its result for {@code next()}.
 * - once an increment reports the end, no further increments run and every
 * later query answers "no more" without throwing.
 * - structural changes to the graph since construction fail the next pull
 * with ConcurrentModificationException.
 *
 * A traversal is one-shot. Obtain a new instance to start over.
 *
 * @param <T> node name type
 */
public abstract class AbstractTraversal<T> implements Iterator<PathStep<T>> {
    protected final Graph<T> graph;
    protected final GraphNode<T> source;
    private final int expectedVersion;

    private PathStep<T> pending;
    private boolean terminal;
    private long increments;
    private long steps;
    private TraversalListener<T> listener;

    /**
     * @throws com.lazygraph.api.UnknownNodeException if the source is absent.
     */
    protected AbstractTraversal(Graph<T> graph, T source) {
        this.graph = graph;
        this.source = graph.node(source);
        this.expectedVersion = graph.version();
    }

    /**
     * Performs one unit of work.
     *
     * @return the next step, or null when nothing further can be produced.
     */
    protected abstract PathStep<T> increment();

    public void setListener(TraversalListener<T> listener) {
        this.listener = listener;
    }

    /**
     * Returns the next step, running one increment if none is pending, or
     * null once the traversal is exhausted.
     */
    public PathStep<T> advance() {
        if (pending != null) {
            PathStep<T> step = pending;
            pending = null;
            return step;
        }
        return pull();
    }

    @Override
    public boolean hasNext() {
        if (pending == null)
            pending = pull();
        return pending != null;
    }

    @Override
    public PathStep<T> next() {
        if (!hasNext())
            throw new NoSuchElementException("Traversal from " + source.name() + " is exhausted");
        PathStep<T> step = pending;
        pending = null;
        return step;
    }

    private PathStep<T> pull() {
        if (terminal)
            return null;
        if (graph.version() != expectedVersion)
            throw new ConcurrentModificationException("Graph was modified during traversal from " + source.name());

        PathStep<T> step = increment();
        if (step == null) {
            terminal = true;
            if (listener != null)
                listener.onTerminal(steps, increments);
            return null;
        }
        if (listener != null)
            listener.onStep(steps, step);
        steps++;
        return step;
    }

    /** Subclasses call this once per unit of work actually performed. */
    protected final void countIncrement() {
        increments++;
    }

    /** Number of increments executed so far. */
    public long increments() {
        return increments;
    }

    /** Number of steps produced so far, including one cached by hasNext(). */
    public long steps() {
        return steps;
    }

    /** True once the traversal has established that no step remains. */
    public boolean isTerminal() {
        return terminal;
    }

    public GraphNode<T> source() {
        return source;
    }

    /** A lazy, sequential view of the remaining steps. */
    public Stream<PathStep<T>> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }
}
