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

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Constructs and combines {@link Robdd}s.
 *
 * <p>Each call to {@link #apply(BooleanOperator, Robdd, Robdd)} or {@link #negate(Robdd)} builds
 * its result in a fresh unique table, {@link #restrict(Robdd, int, boolean)} continues (a copy of)
 * the table of its argument. Diagrams built by different factories may be combined freely, as long
 * as variables are numbered consistently.</p>
 *
 * <p>Implementations are not thread-safe.</p>
 */
public interface RobddFactory {
    static RobddFactory create() {
        return new RobddFactoryImpl(RobddConfiguration.defaults());
    }

    static RobddFactory create(RobddConfiguration configuration) {
        return new RobddFactoryImpl(configuration);
    }

    RobddConfiguration configuration();

    /**
     * Returns the diagram of the constant {@code true}.
     */
    Robdd makeTrue();

    /**
     * Returns the diagram of the constant {@code false}.
     */
    Robdd makeFalse();

    /**
     * Returns the diagram of the constant {@code value}.
     */
    default Robdd makeConstant(boolean value) {
        return value ? makeTrue() : makeFalse();
    }

    /**
     * Returns the diagram of the literal {@code variable}, i.e. a single node with low child
     * {@code Zero} and high child {@code One}.
     */
    Robdd makeVar(int variable);

    /**
     * Constructs the diagram of {@code operator(left, right)}. The result is built in a new unique
     * table, the tables of the inputs are only read.
     *
     * @param operator The function applied to the terminals.
     * @param left The first argument.
     * @param right The second argument.
     * @return The combined diagram.
     */
    Robdd apply(BooleanOperator operator, Robdd left, Robdd right);

    /**
     * Constructs the diagram representing {@code left AND right}.
     */
    default Robdd and(Robdd left, Robdd right) {
        return apply(Connective.AND, left, right);
    }

    /**
     * Constructs the diagram representing {@code left OR right}.
     */
    default Robdd or(Robdd left, Robdd right) {
        return apply(Connective.OR, left, right);
    }

    /**
     * Constructs the diagram representing {@code left XOR right}.
     */
    default Robdd xor(Robdd left, Robdd right) {
        return apply(Connective.XOR, left, right);
    }

    /**
     * Constructs the diagram representing {@code left IMPLIES right}.
     */
    default Robdd implication(Robdd left, Robdd right) {
        return apply(Connective.IMPLICATION, left, right);
    }

    /**
     * Constructs the diagram representing {@code left EQUIVALENT right}.
     */
    default Robdd biimplication(Robdd left, Robdd right) {
        return apply(Connective.BIIMPLICATION, left, right);
    }

    /**
     * Constructs the diagram representing {@code left NAND right}.
     */
    default Robdd nand(Robdd left, Robdd right) {
        return apply(Connective.NAND, left, right);
    }

    /**
     * Constructs the diagram representing {@code left NOR right}.
     */
    default Robdd nor(Robdd left, Robdd right) {
        return apply(Connective.NOR, left, right);
    }

    /**
     * Constructs the diagram representing {@code NOT diagram}, using a single traversal of the
     * argument.
     */
    Robdd negate(Robdd diagram);

    /**
     * Computes the restriction of {@code diagram} where {@code variable} is replaced by {@code value}.
     * Nodes which are not affected by the restriction keep their identifiers.
     *
     * @param diagram The diagram to be restricted.
     * @param variable The restricted variable.
     * @param value The value of the restricted variable.
     * @return The restricted diagram.
     */
    default Robdd restrict(Robdd diagram, int variable, boolean value) {
        return restrictAll(diagram, List.of(Literal.of(variable, value)));
    }

    /**
     * Computes the restriction of {@code diagram} where every variable of {@code literals} is replaced
     * by the respective value, in a single traversal. This is semantically equivalent to restricting
     * the variables one after another.
     *
     * @throws IllegalArgumentException if the same variable is given two different values.
     */
    Robdd restrictAll(Robdd diagram, Collection<Literal> literals);

    /**
     * Returns any satisfying assignment, listing the variables along a path from the root to
     * {@code One}. Variables not listed may take any value. Where both branches are satisfiable, the
     * high branch is chosen.
     *
     * @return An unmodifiable satisfying path, empty if {@code diagram} is {@code Zero}.
     */
    Optional<List<Literal>> anySat(Robdd diagram);

    /**
     * Projects the diagram onto an explicit graph, e.g. for visualisation.
     */
    DiagramGraph makeDag(Robdd diagram);

    /**
     * Returns a string containing some statistics about the operations run by this factory. The
     * content and formatting of this string may change drastically and are only intended as
     * human-readable output.
     */
    String statistics();
}
