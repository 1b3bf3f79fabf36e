package com.lazygraph.util;

import com.lazygraph.api.PathStep;
import com.lazygraph.api.TraversalListener;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Logs every traversal step and the final tally.
 */
public final class LoggingTraversalListener<T> implements TraversalListener<T> {
    private static final Logger log = LogManager.getLogger(LoggingTraversalListener.class);

    private final Level level;

    public LoggingTraversalListener() {
        this(Level.INFO);
    }

    public LoggingTraversalListener(Level level) {
        this.level = level;
    }

    @Override
    public void onStep(long ordinal, PathStep<T> step) {
        log.log(level, "#{} {} at {} via {}", ordinal, step.name(), step.distance(),
                step.hasPredecessor() ? step.predecessorName() : "-");
    }

    @Override
    public void onTerminal(long steps, long increments) {
        log.log(level, "Traversal finished: {} step(s), {} increment(s)", steps, increments);
    }
}
