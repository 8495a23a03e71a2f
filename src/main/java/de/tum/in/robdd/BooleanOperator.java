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

/**
 * A binary Boolean function, used by {@link RobddFactory#apply(BooleanOperator, Robdd, Robdd)} to
 * combine the terminals of two diagrams. Implementations must be pure.
 *
 * @see Connective
 */
@FunctionalInterface
public interface BooleanOperator {
    boolean apply(boolean left, boolean right);
}
