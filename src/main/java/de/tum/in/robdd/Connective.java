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
 * The standard binary connectives. Each one is given by its truth table, listed in the order
 * {@code (true, true), (true, false), (false, true), (false, false)}.
 */
public enum Connective implements BooleanOperator {
    AND(true, false, false, false),
    OR(true, true, true, false),
    XOR(false, true, true, false),
    IMPLICATION(true, false, true, true),
    BIIMPLICATION(true, false, false, true),
    NAND(false, true, true, true),
    NOR(false, false, false, true);

    private final boolean trueTrue;
    private final boolean trueFalse;
    private final boolean falseTrue;
    private final boolean falseFalse;

    Connective(boolean trueTrue, boolean trueFalse, boolean falseTrue, boolean falseFalse) {
        this.trueTrue = trueTrue;
        this.trueFalse = trueFalse;
        this.falseTrue = falseTrue;
        this.falseFalse = falseFalse;
    }

    @Override
    public boolean apply(boolean left, boolean right) {
        if (left) {
            return right ? trueTrue : trueFalse;
        }
        return right ? falseTrue : falseFalse;
    }
}
