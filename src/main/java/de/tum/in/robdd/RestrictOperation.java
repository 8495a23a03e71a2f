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

import java.util.Arrays;

/**
 * Replaces a set of variables by constants. The context has to be seeded with (a copy of) the table
 * of the restricted diagram, as all nodes below the restricted variables are returned as is.
 */
final class RestrictOperation {
    private final BuildContext context;
    private final NodeTable table;
    /* Sorted ascending, values[i] is the value of restrictedVariables[i]. */
    private final int[] restrictedVariables;
    private final boolean[] values;
    private final int highestRestrictedVariable;

    RestrictOperation(BuildContext context, int[] restrictedVariables, boolean[] values) {
        assert restrictedVariables.length == values.length && restrictedVariables.length > 0;
        this.context = context;
        this.table = context.table();
        this.restrictedVariables = restrictedVariables;
        this.values = values;
        this.highestRestrictedVariable = restrictedVariables[restrictedVariables.length - 1];
    }

    int restrict(int node) {
        if (NodeTable.isLeaf(node)) {
            return node;
        }
        int variable = table.variableOf(node);
        if (variable > highestRestrictedVariable) {
            // By ordering, no restricted variable occurs below
            return node;
        }

        MemoTable memo = context.memo();
        if (memo.lookup(node)) {
            return memo.lookupResult();
        }

        int resultNode;
        int index = Arrays.binarySearch(restrictedVariables, variable);
        if (index >= 0) {
            resultNode = restrict(values[index] ? table.high(node) : table.low(node));
        } else {
            int lowNode = restrict(table.low(node));
            int highNode = restrict(table.high(node));
            resultNode = context.mk(variable, lowNode, highNode);
        }
        memo.put(node, resultNode);
        return resultNode;
    }
}
