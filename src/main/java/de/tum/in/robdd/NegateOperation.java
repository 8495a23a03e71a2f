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
 * Rebuilds a diagram with swapped terminals in a single traversal.
 */
final class NegateOperation {
    private final NodeTable inputTable;
    private final BuildContext context;

    NegateOperation(NodeTable inputTable, BuildContext context) {
        this.inputTable = inputTable;
        this.context = context;
    }

    int negate(int node) {
        if (node == FALSE_NODE) {
            return TRUE_NODE;
        }
        if (node == TRUE_NODE) {
            return FALSE_NODE;
        }

        MemoTable memo = context.memo();
        if (memo.lookup(node)) {
            return memo.lookupResult();
        }

        int lowNode = negate(inputTable.low(node));
        int highNode = negate(inputTable.high(node));
        int resultNode = context.mk(inputTable.variableOf(node), lowNode, highNode);
        memo.put(node, resultNode);
        return resultNode;
    }
}
