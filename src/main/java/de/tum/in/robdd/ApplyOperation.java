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

import static de.tum.in.robdd.NodeTable.FALSE_NODE;
import static de.tum.in.robdd.NodeTable.TRUE_NODE;

/**
 * Combines two diagrams under a binary operator by co-traversing them. The inputs are read from
 * their own tables, the result is built in the table of the given context.
 *
 * <p>Every pair of input nodes is combined at most once, so the running time is bounded by the
 * product of the input sizes.</p>
 */
final class ApplyOperation {
    private final BooleanOperator operator;
    private final NodeTable leftTable;
    private final NodeTable rightTable;
    private final BuildContext context;

    ApplyOperation(BooleanOperator operator, NodeTable leftTable, NodeTable rightTable, BuildContext context) {
        this.operator = operator;
        this.leftTable = leftTable;
        this.rightTable = rightTable;
        this.context = context;
    }

    int apply(int leftNode, int rightNode) {
        MemoTable memo = context.memo();
        if (memo.lookup(leftNode, rightNode)) {
            return memo.lookupResult();
        }
        if (NodeTable.isLeaf(leftNode) && NodeTable.isLeaf(rightNode)) {
            return operator.apply(leftNode == TRUE_NODE, rightNode == TRUE_NODE) ? TRUE_NODE : FALSE_NODE;
        }

        int comparison = NodeTable.compareVariables(leftTable, leftNode, rightTable, rightNode);
        int variable;
        int lowNode;
        int highNode;
        if (comparison == 0) {
            variable = leftTable.variableOf(leftNode);
            lowNode = apply(leftTable.low(leftNode), rightTable.low(rightNode));
            highNode = apply(leftTable.high(leftNode), rightTable.high(rightNode));
        } else if (comparison < 0) { // Left variable is tested first, or right is a terminal
            variable = leftTable.variableOf(leftNode);
            lowNode = apply(leftTable.low(leftNode), rightNode);
            highNode = apply(leftTable.high(leftNode), rightNode);
        } else {
            variable = rightTable.variableOf(rightNode);
            lowNode = apply(leftNode, rightTable.low(rightNode));
            highNode = apply(leftNode, rightTable.high(rightNode));
        }
        int resultNode = context.mk(variable, lowNode, highNode);
        memo.put(leftNode, rightNode, resultNode);
        return resultNode;
    }
}
