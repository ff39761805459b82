package com.kawari.proxy.core.selection;

import com.kawari.proxy.spi.SelectionStrategy;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Round-Robin selection. The cursor advances exactly once per call, across all threads,
 * and the i-th call picks index {@code i mod size}.
 *
 * @param <T> candidate type.
 */
public class RoundRobinSelector<T> implements SelectionStrategy<T> {
    private final AtomicLong counter;

    public RoundRobinSelector() {
        this(0);
    }

    RoundRobinSelector(long start) {
        this.counter = new AtomicLong(start);
    }

    @Override
    public T select(List<T> candidates) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("No candidates to select from");
        }
        int index = (int) Math.floorMod(counter.getAndIncrement(), (long) candidates.size());
        return candidates.get(index);
    }

    /**
     * Number of selections made so far.
     *
     * @return the current cursor position.
     */
    public long position() {
        return counter.get();
    }
}
