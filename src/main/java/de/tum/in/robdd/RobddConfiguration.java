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

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class RobddConfiguration {
    public static final int DEFAULT_INITIAL_TABLE_SIZE = 64;
    public static final int DEFAULT_INITIAL_MEMO_SIZE = 64;
    public static final double DEFAULT_GROWTH_FACTOR = 1.5d;

    public static RobddConfiguration defaults() {
        return ImmutableRobddConfiguration.builder().build();
    }

    /**
     * Initial number of slots of a unique table created for an operation. Rounded up to a prime.
     */
    @Value.Default
    public int initialTableSize() {
        return DEFAULT_INITIAL_TABLE_SIZE;
    }

    /**
     * Initial number of slots of the memo table of an operation. Rounded up to a prime.
     */
    @Value.Default
    public int initialMemoSize() {
        return DEFAULT_INITIAL_MEMO_SIZE;
    }

    @Value.Default
    public double growthFactor() {
        return DEFAULT_GROWTH_FACTOR;
    }

    /**
     * Whether every constructed diagram is checked for being reduced, ordered and free of
     * duplicates. Expensive, intended for debugging.
     */
    @Value.Default
    public boolean checkInvariants() {
        return false;
    }

    @Value.Default
    public boolean logStatisticsOnShutdown() {
        return false;
    }

    @Value.Check
    protected void check() {
        Util.checkArgument(initialTableSize() > 0, "Non-positive table size %d", initialTableSize());
        Util.checkArgument(initialMemoSize() > 0, "Non-positive memo size %d", initialMemoSize());
        Util.checkArgument(growthFactor() > 1.0d, "Growth factor %s has to be bigger than 1", growthFactor());
    }
}
