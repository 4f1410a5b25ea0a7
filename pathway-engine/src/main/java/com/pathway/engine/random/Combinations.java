package com.pathway.engine.random;

import java.util.ArrayList;
import java.util.List;

/**
 * Ranked k-subsets of {0..n-1} in lexicographic order, so a running counter can rotate through every subset.
 */
public final class Combinations {

    private Combinations() {
    }

    /** Binomial coefficient, saturating at {@link Long#MAX_VALUE}. */
    public static long count(int n, int k) {
        if (k < 0 || k > n) return 0;
        k = Math.min(k, n - k);
        long result = 1;
        for (int i = 1; i <= k; i++) {
            long num = n - k + i;
            if (result > Long.MAX_VALUE / num) return Long.MAX_VALUE;
            result = result * num / i;
        }
        return result;
    }

    /**
     * The {@code index}-th k-subset (indexes wrap around after all subsets), as ascending positions.
     */
    public static List<Integer> nth(int n, int k, long index) {
        if (k <= 0 || n <= 0) return List.of();
        if (k >= n) {
            List<Integer> all = new ArrayList<>();
            for (int i = 0; i < n; i++) all.add(i);
            return all;
        }
        long total = count(n, k);
        long rank = Math.floorMod(index, total);
        List<Integer> out = new ArrayList<>(k);
        int next = 0;
        for (int remaining = k; remaining > 0; remaining--) {
            while (true) {
                long withNext = count(n - next - 1, remaining - 1);
                if (rank < withNext) {
                    out.add(next);
                    next++;
                    break;
                }
                rank -= withNext;
                next++;
            }
        }
        return out;
    }
}
