/*
 * This file is part of JROBDD.
 * Copyright (c) 2023 Tobias Meggendorfer.
 *
 * JROBDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JROBDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JROBDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.robdd;

/*
 * Unlike a computed-table cache, entries are never evicted: every pair of nodes is combined at
 * most once per operation. Keys are node identifiers, i.e. non-negative.
 */
final class MemoTable {
    private static final int EMPTY = -1;
    private static final int UNARY_KEY = -2;
    private static final int MAXIMAL_KEY_COUNT = Integer.MAX_VALUE / 3 - 8;

    private final double growthFactor;

    /* Layout: first key, second key, result. */
    private int[] entries;
    private int keyCount;
    private int size = 0;

    private int lookupResult = EMPTY;

    // Statistics
    private long lookupCount = 0;
    private long hitCount = 0;
    private long growCount = 0;

    MemoTable(int initialSize, double growthFactor) {
        this.growthFactor = growthFactor;
        allocate(MathUtil.nextPrime(initialSize));
    }

    private void allocate(int keyCount) {
        this.keyCount = keyCount;
        this.entries = new int[3 * keyCount];
        for (int i = 0; i < entries.length; i += 3) {
            entries[i] = EMPTY;
        }
    }

    boolean lookup(int node) {
        return lookup(node, UNARY_KEY);
    }

    /**
     * Looks up the result stored for the given pair. If present, the result is available through
     * {@link #lookupResult()} until the next lookup.
     */
    boolean lookup(int first, int second) {
        assert first >= 0;
        lookupCount += 1;

        int[] entries = this.entries;
        int position = position(first, second);
        while (entries[position] != EMPTY) {
            if (entries[position] == first && entries[position + 1] == second) {
                hitCount += 1;
                lookupResult = entries[position + 2];
                return true;
            }
            position = next(position);
        }
        return false;
    }

    int lookupResult() {
        assert lookupResult != EMPTY;
        return lookupResult;
    }

    void put(int node, int result) {
        put(node, UNARY_KEY, result);
    }

    void put(int first, int second, int result) {
        assert first >= 0 && result >= 0;

        // Keep the load below one half so probe sequences stay short
        if (2 * (size + 1) > keyCount) {
            grow();
        }

        int[] entries = this.entries;
        int position = position(first, second);
        while (entries[position] != EMPTY) {
            if (entries[position] == first && entries[position + 1] == second) {
                entries[position + 2] = result;
                return;
            }
            position = next(position);
        }
        entries[position] = first;
        entries[position + 1] = second;
        entries[position + 2] = result;
        size += 1;
    }

    private void grow() {
        Util.checkInvariant(keyCount < MAXIMAL_KEY_COUNT, "Memo table is full");
        int[] oldEntries = this.entries;
        allocate(MathUtil.grownSize(keyCount, Math.max(growthFactor, 2.0d), MAXIMAL_KEY_COUNT));
        growCount += 1;
        size = 0;

        for (int i = 0; i < oldEntries.length; i += 3) {
            if (oldEntries[i] != EMPTY) {
                put(oldEntries[i], oldEntries[i + 1], oldEntries[i + 2]);
            }
        }
    }

    private int position(int first, int second) {
        int mod = HashUtil.hash(first, second) % keyCount;
        return 3 * (mod < 0 ? mod + keyCount : mod);
    }

    private int next(int position) {
        int next = position + 3;
        return next == entries.length ? 0 : next;
    }

    int size() {
        return size;
    }

    long lookupCount() {
        return lookupCount;
    }

    long hitCount() {
        return hitCount;
    }

    @Override
    public String toString() {
        return String.format(
                "Memo table: keys=%d, entries=%d, lookups=%d, hits=%d, grown=%d times",
                keyCount, size, lookupCount, hitCount, growCount);
    }
}
