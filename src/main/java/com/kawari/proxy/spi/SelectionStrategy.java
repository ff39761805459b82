package com.kawari.proxy.spi;

import java.util.List;

/**
 * Strategy for choosing one element among rotation candidates.
 * Implementations can be stateful (e.g. a Round Robin cursor) and must be thread-safe.
 *
 * @param <T> candidate type (identity strings, backend descriptors).
 */
public interface SelectionStrategy<T> {
    /**
     * Selects one candidate.
     *
     * @param candidates non-empty list of eligible candidates.
     * @return the selected candidate.
     * @throws IllegalArgumentException if {@code candidates} is empty.
     */
    T select(List<T> candidates);
}
