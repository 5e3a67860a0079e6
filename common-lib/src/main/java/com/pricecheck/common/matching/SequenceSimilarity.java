package com.pricecheck.common.matching;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Character-level similarity ratio in the Ratcliff/Obershelp style: {@code 2M / T} where
 * {@code M} is the number of characters in the recursively found longest common blocks and
 * {@code T} the combined length of both strings.
 *
 * <p>Ties between equally long blocks resolve to the one starting earliest in {@code a},
 * then earliest in {@code b}, so the ratio is deterministic.
 */
public final class SequenceSimilarity {

    private SequenceSimilarity() { /* utility class */ }

    /**
     * @return ratio in [0.0, 1.0]; 1.0 when both strings are empty
     */
    public static double ratio(String a, String b) {
        String left  = a == null ? "" : a;
        String right = b == null ? "" : b;
        int total = left.length() + right.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(left, right) / total;
    }

    static int matchingCharacters(String a, String b) {
        int matched = 0;
        Deque<int[]> pending = new ArrayDeque<>();
        pending.push(new int[]{0, a.length(), 0, b.length()});

        while (!pending.isEmpty()) {
            int[] range = pending.pop();
            int alo = range[0], ahi = range[1], blo = range[2], bhi = range[3];
            int[] block = longestMatch(a, b, alo, ahi, blo, bhi);
            int i = block[0], j = block[1], size = block[2];
            if (size == 0) {
                continue;
            }
            matched += size;
            if (alo < i && blo < j) {
                pending.push(new int[]{alo, i, blo, j});
            }
            if (i + size < ahi && j + size < bhi) {
                pending.push(new int[]{i + size, ahi, j + size, bhi});
            }
        }
        return matched;
    }

    /** Returns {@code {start in a, start in b, length}} of the longest common block. */
    private static int[] longestMatch(String a, String b, int alo, int ahi, int blo, int bhi) {
        int bestI = alo, bestJ = blo, bestSize = 0;
        // lengths[j + 1] = length of the common suffix ending at (i - 1, j)
        int[] previous = new int[b.length() + 1];

        for (int i = alo; i < ahi; i++) {
            int[] current = new int[b.length() + 1];
            char ch = a.charAt(i);
            for (int j = blo; j < bhi; j++) {
                if (ch != b.charAt(j)) {
                    continue;
                }
                int k = previous[j] + 1;
                current[j + 1] = k;
                if (k > bestSize) {
                    bestI = i - k + 1;
                    bestJ = j - k + 1;
                    bestSize = k;
                }
            }
            previous = current;
        }
        return new int[]{bestI, bestJ, bestSize};
    }
}
