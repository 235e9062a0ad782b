package com.example.doccompare.alignment;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Character level similarity of two strings, {@code 2 * M / T}.
 *
 * <p>{@code M} is the number of characters covered by matching blocks, found by taking the
 * longest common block and recursing on the unmatched text to its left and right. {@code T} is
 * the combined length of both strings. When the second string has 200 or more characters, a
 * character occurring in it more than {@code 1% + 1} times does not start a block (it can still
 * extend one).
 *
 * <p>Strings are compared as code points. Every call builds its own index, so instances hold no
 * state and can be shared between threads.
 */
public final class CharacterSimilarity {
    private static final int POPULAR_MIN_LENGTH = 200;

    public double ratio(String first, String second) {
        int[] a = first.codePoints().toArray();
        int[] b = second.codePoints().toArray();
        int total = a.length + b.length;
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * new BlockMatcher(a, b).matchingCharacters() / total;
    }

    private static final class BlockMatcher {
        private final int[] a;
        private final int[] b;
        private final Map<Integer, int[]> positionsInB;

        BlockMatcher(int[] a, int[] b) {
            this.a = a;
            this.b = b;
            this.positionsInB = indexSecond(b);
        }

        private static Map<Integer, int[]> indexSecond(int[] b) {
            Map<Integer, List<Integer>> positions = new HashMap<>();
            for (int j = 0; j < b.length; j++) {
                positions.computeIfAbsent(b[j], key -> new ArrayList<>()).add(j);
            }
            int popularLimit = b.length / 100 + 1;
            Map<Integer, int[]> index = new HashMap<>(positions.size() * 2);
            for (Map.Entry<Integer, List<Integer>> entry : positions.entrySet()) {
                List<Integer> list = entry.getValue();
                if (b.length >= POPULAR_MIN_LENGTH && list.size() > popularLimit) {
                    continue;
                }
                index.put(entry.getKey(), list.stream().mapToInt(Integer::intValue).toArray());
            }
            return index;
        }

        int matchingCharacters() {
            int matched = 0;
            Deque<int[]> pending = new ArrayDeque<>();
            pending.push(new int[] {0, a.length, 0, b.length});
            while (!pending.isEmpty()) {
                int[] range = pending.pop();
                int alo = range[0];
                int ahi = range[1];
                int blo = range[2];
                int bhi = range[3];
                int[] block = longestBlock(alo, ahi, blo, bhi);
                int i = block[0];
                int j = block[1];
                int size = block[2];
                if (size == 0) {
                    continue;
                }
                matched += size;
                if (alo < i && blo < j) {
                    pending.push(new int[] {alo, i, blo, j});
                }
                if (i + size < ahi && j + size < bhi) {
                    pending.push(new int[] {i + size, ahi, j + size, bhi});
                }
            }
            return matched;
        }

        /**
         * Longest block in {@code a[alo:ahi]} and {@code b[blo:bhi]}; ties go to the block that
         * starts earliest in {@code a}, then earliest in {@code b}.
         */
        private int[] longestBlock(int alo, int ahi, int blo, int bhi) {
            int bestI = alo;
            int bestJ = blo;
            int bestSize = 0;
            // runLength[j + 1] is the length of the run ending at b[j] for the previous row of a
            int[] runLength = new int[b.length + 1];
            int[] nextRunLength = new int[b.length + 1];
            int[] touched = new int[b.length];
            int[] nextTouched = new int[b.length];
            int touchedCount = 0;
            for (int i = alo; i < ahi; i++) {
                int nextTouchedCount = 0;
                int[] positions = positionsInB.get(a[i]);
                if (positions != null) {
                    for (int j : positions) {
                        if (j < blo) {
                            continue;
                        }
                        if (j >= bhi) {
                            break;
                        }
                        int k = runLength[j] + 1;
                        nextRunLength[j + 1] = k;
                        nextTouched[nextTouchedCount++] = j + 1;
                        if (k > bestSize) {
                            bestI = i - k + 1;
                            bestJ = j - k + 1;
                            bestSize = k;
                        }
                    }
                }
                for (int t = 0; t < touchedCount; t++) {
                    runLength[touched[t]] = 0;
                }
                int[] swap = runLength;
                runLength = nextRunLength;
                nextRunLength = swap;
                swap = touched;
                touched = nextTouched;
                nextTouched = swap;
                touchedCount = nextTouchedCount;
            }
            while (bestI > alo && bestJ > blo && a[bestI - 1] == b[bestJ - 1]) {
                bestI--;
                bestJ--;
                bestSize++;
            }
            while (bestI + bestSize < ahi
                    && bestJ + bestSize < bhi
                    && a[bestI + bestSize] == b[bestJ + bestSize]) {
                bestSize++;
            }
            return new int[] {bestI, bestJ, bestSize};
        }
    }
}
