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

import com.google.common.math.LongMath;

final class MathUtil {
    private MathUtil() {}

    static int nextPrime(int number) {
        int nextPrime = Math.max(3, number | 1);

        while (!LongMath.isPrime(nextPrime)) {
            nextPrime += 2;
        }

        return nextPrime;
    }

    /**
     * Computes the size of a table after growing from {@code size} by {@code growthFactor}, always
     * growing by at least one and never exceeding {@code maximum}.
     */
    static int grownSize(int size, double growthFactor, int maximum) {
        @SuppressWarnings("NumericCastThatLosesPrecision")
        int grown = (int) Math.min(maximum, Math.ceil(size * growthFactor));
        return Math.min(maximum, nextPrime(Math.max(grown, size + 1)));
    }
}
