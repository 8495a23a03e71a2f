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
 * A variable together with a truth value.
 */
public final class Literal {
    private final int variable;
    private final boolean value;

    public Literal(int variable, boolean value) {
        this.variable = variable;
        this.value = value;
    }

    public static Literal of(int variable, boolean value) {
        return new Literal(variable, value);
    }

    public int variable() {
        return variable;
    }

    public boolean value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Literal)) {
            return false;
        }
        Literal literal = (Literal) o;
        return variable == literal.variable && value == literal.value;
    }

    @Override
    public int hashCode() {
        return HashUtil.hash(variable, value ? 1 : 0);
    }

    @Override
    public String toString() {
        return value ? String.valueOf(variable) : "!" + variable;
    }
}
