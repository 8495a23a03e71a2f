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

final class HashUtil {
    // FNV prime, used as multiplier of a polynomial hash.
    private static final int PRIME = 0x1000193;

    private HashUtil() {}

    static int hash(int firstKey, int secondKey) {
        return firstKey * PRIME + secondKey;
    }

    static int hash(int variable, int low, int high) {
        return (variable * PRIME + low) * PRIME + high;
    }
}
