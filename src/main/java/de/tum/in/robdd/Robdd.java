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

import java.util.BitSet;
import java.util.List;
import java.util.Optional;
import java.util.function.IntPredicate;

/**
 * A reduced ordered binary decision diagram: a unique table together with a designated root node.
 *
 * <p>Nodes are plain {@code int} identifiers which are only meaningful relative to the diagram they
 * were obtained from. {@link #falseNode()} ({@code 0}) and {@link #trueNode()} ({@code 1}) denote the
 * terminals, every other identifier an internal node testing a variable. Two nodes of the same
 * diagram are the same node iff their identifiers are equal. Variables are arbitrary {@code int}s,
 * smaller variables are tested closer to the root.</p>
 *
 * <p>Diagrams are immutable. All operations return new diagrams, which in general do not share
 * nodes with their inputs.</p>
 */
public interface Robdd {
    RobddFactory factory();

    /**
     * Returns the root node of this diagram.
     */
    int root();

    default int falseNode() {
        return NodeTable.FALSE_NODE;
    }

    default int trueNode() {
        return NodeTable.TRUE_NODE;
    }

    default boolean isFalse() {
        return root() == falseNode();
    }

    default boolean isTrue() {
        return root() == trueNode();
    }

    /**
     * Determines whether the given {@code node} represents a constant.
     *
     * @param node The node to be checked.
     * @return If the {@code node} represents a constant.
     */
    boolean isLeaf(int node);

    /**
     * Gets the variable tested by the given internal {@code node}.
     *
     * @throws IllegalArgumentException if {@code node} is not a node of this diagram.
     * @throws InvariantViolationException if {@code node} is a terminal.
     */
    int variableOf(int node);

    /**
     * Gets the successor of {@code node} if its variable is false.
     *
     * @throws IllegalArgumentException if {@code node} is not a node of this diagram.
     * @throws InvariantViolationException if {@code node} is a terminal.
     */
    int low(int node);

    /**
     * Gets the successor of {@code node} if its variable is true.
     *
     * @throws IllegalArgumentException if {@code node} is not a node of this diagram.
     * @throws InvariantViolationException if {@code node} is a terminal.
     */
    int high(int node);

    /**
     * Orders two nodes of this diagram by their variable: internal nodes by variable index, all of
     * them before {@code One}, which comes before {@code Zero}. This is <b>not</b> the identity of
     * nodes, two distinct nodes testing the same variable compare as equal.
     */
    int compareVariables(int node1, int node2);

    /**
     * Checks whether the represented function evaluates to {@code true} under the given assignment,
     * where {@code assignment.test(v)} is the value of variable {@code v}.
     *
     * @param assignment The variable assignment.
     * @return The truth value of the function under the given assignment.
     */
    boolean evaluate(IntPredicate assignment);

    /**
     * Checks whether the represented function evaluates to {@code true} under the given assignment.
     * Only usable if all variables are non-negative.
     *
     * @param assignment The variable assignment, bit {@code v} is the value of variable {@code v}.
     * @return The truth value of the function under the given assignment.
     */
    default boolean evaluate(BitSet assignment) {
        return evaluate(assignment::get);
    }

    /**
     * Computes the <b>support</b> of the represented function, i.e. all variables occurring in the
     * diagram, sorted ascending.
     */
    int[] support();

    /**
     * Counts the internal nodes reachable from the root.
     */
    int nodeCount();

    /**
     * Counts the internal nodes held by the unique table of this diagram. Since nodes are never
     * reclaimed, this may be larger than {@link #nodeCount()}.
     */
    int tableSize();

    /**
     * Performs the integrity checks of the diagram: reduced, ordered and no duplicate nodes.
     *
     * @return True. This way, check can easily be called by an {@code assert} statement.
     * @throws InvariantViolationException if a check fails.
     */
    boolean check();

    // Forwarding to the factory

    default Robdd apply(BooleanOperator operator, Robdd other) {
        return factory().apply(operator, this, other);
    }

    default Robdd and(Robdd other) {
        return factory().and(this, other);
    }

    default Robdd or(Robdd other) {
        return factory().or(this, other);
    }

    default Robdd xor(Robdd other) {
        return factory().xor(this, other);
    }

    default Robdd implication(Robdd other) {
        return factory().implication(this, other);
    }

    default Robdd biimplication(Robdd other) {
        return factory().biimplication(this, other);
    }

    default Robdd nand(Robdd other) {
        return factory().nand(this, other);
    }

    default Robdd nor(Robdd other) {
        return factory().nor(this, other);
    }

    default Robdd negate() {
        return factory().negate(this);
    }

    default Robdd restrict(int variable, boolean value) {
        return factory().restrict(this, variable, value);
    }

    default Optional<List<Literal>> anySat() {
        return factory().anySat(this);
    }
}
