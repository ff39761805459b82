package com.kawari.proxy.core.selection;

import com.kawari.proxy.core.constants.RotationStrategy;
import com.kawari.proxy.spi.SelectionStrategy;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SelectionStrategyTest {

    private final List<String> candidates = List.of("a", "b", "c");

    @Test
    void testRoundRobinCyclesInOrder() {
        RoundRobinSelector<String> selector = new RoundRobinSelector<>();
        List<String> picked = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            picked.add(selector.select(candidates));
        }
        assertThat(picked).containsExactly("a", "b", "c", "a", "b", "c", "a");
        assertThat(selector.position()).isEqualTo(7L);
    }

    @Test
    void testRoundRobinKeepsSequencePastIntegerRange() {
        long start = Integer.MAX_VALUE - 1L;
        RoundRobinSelector<String> selector = new RoundRobinSelector<>(start);
        for (long i = start; i < start + 6; i++) {
            assertThat(selector.select(candidates)).as("call %d", i).isEqualTo(candidates.get((int) (i % 3)));
        }
        assertThat(selector.position()).isEqualTo(start + 6);
    }

    @Test
    void testRoundRobinCursorSurvivesShrinkingList() {
        RoundRobinSelector<String> selector = new RoundRobinSelector<>();
        selector.select(candidates);
        selector.select(candidates);
        // cursor is at 2; a two-element list wraps to index 0
        assertThat(selector.select(List.of("x", "y"))).isEqualTo("x");
    }

    @Test
    void testRoundRobinIsFairUnderConcurrency() throws InterruptedException {
        RoundRobinSelector<String> selector = new RoundRobinSelector<>();
        int threads = 8;
        int perThread = 300;
        Map<String, AtomicInteger> counts = new ConcurrentHashMap<>();
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        counts.computeIfAbsent(selector.select(candidates), k -> new AtomicInteger())
                                .incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdownNow();

        // 2400 selections over 3 candidates: exactly 800 each
        assertThat(counts).hasSize(3);
        counts.values().forEach(c -> assertThat(c.get()).isEqualTo(threads * perThread / 3));
    }

    @Test
    void testRandomOnlyReturnsCandidates() {
        RandomSelector<String> selector = new RandomSelector<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 300; i++) {
            seen.add(selector.select(candidates));
        }
        assertThat(seen).containsExactlyInAnyOrder("a", "b", "c");
    }

    @Test
    void testEmptyCandidatesRejected() {
        assertThatThrownBy(() -> new RandomSelector<String>().select(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RoundRobinSelector<String>().select(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testFactoryReturnsFreshSelectors() {
        SelectionStrategy<String> first = Selectors.forStrategy(RotationStrategy.ROUND_ROBIN);
        SelectionStrategy<String> second = Selectors.forStrategy(RotationStrategy.ROUND_ROBIN);
        first.select(candidates);

        assertThat(first).isInstanceOf(RoundRobinSelector.class).isNotSameAs(second);
        assertThat(second.select(candidates)).isEqualTo("a");
        assertThat(Selectors.<String>forStrategy(RotationStrategy.RANDOM)).isInstanceOf(RandomSelector.class);
    }
}
