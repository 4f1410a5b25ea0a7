package com.pathway.engine.random;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;
import java.util.function.ToDoubleFunction;

/**
 * Seeded draws used by ordering and pick selection. All methods are pure functions of their inputs and the
 * generator state, so equal seeds give equal results.
 */
public final class Sampling {

    private Sampling() {
    }

    /** Fisher-Yates shuffle into a new list. */
    public static <T> List<T> shuffle(List<T> items, SplittableRandom rng) {
        List<T> out = new ArrayList<>(items);
        for (int i = out.size() - 1; i > 0; i--) {
            int j = rng.nextInt(i + 1);
            T tmp = out.get(i);
            out.set(i, out.get(j));
            out.set(j, tmp);
        }
        return out;
    }

    /**
     * Weighted sampling without replacement: each draw picks an item with probability proportional to its weight
     * among the remaining items, then removes it. Non-positive weights are drawn last in declared order.
     *
     * @param draws number of items to draw; clamped to the item count
     */
    public static <T> List<T> weightedWithoutReplacement(List<T> items, ToDoubleFunction<T> weight,
                                                         SplittableRandom rng, int draws) {
        List<T> remaining = new ArrayList<>(items);
        List<T> out = new ArrayList<>();
        int n = Math.min(Math.max(draws, 0), items.size());
        while (out.size() < n) {
            double total = 0;
            for (T item : remaining) total += Math.max(0, weight.applyAsDouble(item));
            if (total <= 0) {
                out.addAll(remaining.subList(0, n - out.size()));
                break;
            }
            double target = rng.nextDouble() * total;
            int chosen = remaining.size() - 1;
            double cumulative = 0;
            for (int i = 0; i < remaining.size(); i++) {
                double w = Math.max(0, weight.applyAsDouble(remaining.get(i)));
                cumulative += w;
                if (w > 0 && target < cumulative) {
                    chosen = i;
                    break;
                }
            }
            out.add(remaining.remove(chosen));
        }
        return out;
    }
}
