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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import org.junit.jupiter.api.Test;

public class MemoTableTest {
    @Test
    public void testLookupAfterPut() {
        MemoTable memo = new MemoTable(1, 1.5d);
        assertThat(memo.lookup(4, 7), is(false));

        memo.put(4, 7, 12);
        assertThat(memo.lookup(4, 7), is(true));
        assertThat(memo.lookupResult(), is(12));
        assertThat(memo.lookup(7, 4), is(false));
        assertThat(memo.lookupCount(), is(3L));
        assertThat(memo.hitCount(), is(1L));
    }

    @Test
    public void testUnaryAndBinaryKeysAreDistinct() {
        MemoTable memo = new MemoTable(1, 1.5d);
        memo.put(5, 0, 1);
        assertThat(memo.lookup(5), is(false));

        memo.put(5, 8);
        assertThat(memo.lookup(5), is(true));
        assertThat(memo.lookupResult(), is(8));
        assertThat(memo.lookup(5, 0), is(true));
        assertThat(memo.lookupResult(), is(1));
    }

    @Test
    public void testPutOverwrites() {
        MemoTable memo = new MemoTable(8, 1.5d);
        memo.put(2, 3, 4);
        memo.put(2, 3, 6);
        assertThat(memo.size(), is(1));
        assertThat(memo.lookup(2, 3), is(true));
        assertThat(memo.lookupResult(), is(6));
    }

    @Test
    public void testNoEntryIsLostOnGrowth() {
        MemoTable memo = new MemoTable(1, 1.5d);
        for (int first = 0; first < 100; first++) {
            for (int second = 0; second < 100; second++) {
                memo.put(first, second, first * 100 + second);
            }
        }
        assertThat(memo.size(), is(10_000));

        for (int first = 0; first < 100; first++) {
            for (int second = 0; second < 100; second++) {
                assertThat(memo.lookup(first, second), is(true));
                assertThat(memo.lookupResult(), is(first * 100 + second));
            }
        }
    }
}
