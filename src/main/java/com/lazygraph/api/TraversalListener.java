package com.lazygraph.api;

/**
 * Observability hook for a traversal.
 *
 * Callbacks run synchronously inside the pull that produced them, on the
 * caller's thread. Keep them cheap: they sit on the traversal's hot path.
 *
 * @param <T> node name type
 */
public interface TraversalListener<T> {

    /**
     * Called when a traversal yields a step.
     *
     * @param ordinal zero-based position of the step in the sequence.
     * @param step    the step about to be returned.
     */
    void onStep(long ordinal, PathStep<T> step);

    /**
     * Called once, when the traversal finds it has nothing more to yield.
     *
     * @param steps      number of steps yielded in total.
     * @param increments number of engine increments executed.
     */
    void onTerminal(long steps, long increments);
}
