package com.kawari.proxy.core.selection;

import com.kawari.proxy.spi.SelectionStrategy;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Uniform random selection.
 *
 * @param <T> candidate type.
 */
public class RandomSelector<T> implements SelectionStrategy<T> {

    @Override
    public T select(List<T> candidates) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("No candidates to select from");
        }
        return candidates.get(ThreadLocalRandom.current().nextInt(candidates.size()));
    }
}
