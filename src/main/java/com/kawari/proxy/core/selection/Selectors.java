package com.kawari.proxy.core.selection;

import com.kawari.proxy.core.constants.RotationStrategy;
import com.kawari.proxy.spi.SelectionStrategy;

/**
 * Factory mapping a {@link RotationStrategy} to a fresh selector with its own cursor.
 */
public final class Selectors {
    private Selectors() {
        // Utility class
    }

    public static <T> SelectionStrategy<T> forStrategy(RotationStrategy strategy) {
        return switch (strategy) {
            case RANDOM -> new RandomSelector<>();
            case ROUND_ROBIN -> new RoundRobinSelector<>();
        };
    }
}
