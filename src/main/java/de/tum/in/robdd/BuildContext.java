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
 * The mutable state of a single construction pass: the unique table the result is built in
 * (which also acts as identifier generator) and the memo table of the running operation.
 *
 * <p>A context is owned by exactly one operation. When the operation finishes, its table is
 * handed over to the resulting diagram and the context must not be used anymore.</p>
 */
final class BuildContext {
    private final NodeTable table;
    private final MemoTable memo;
    private boolean finished = false;

    private BuildContext(NodeTable table, RobddConfiguration configuration) {
        this.table = table;
        this.memo = new MemoTable(configuration.initialMemoSize(), configuration.growthFactor());
    }

    static BuildContext fresh(RobddConfiguration configuration) {
        return new BuildContext(
                new NodeTable(configuration.initialTableSize(), configuration.growthFactor()), configuration);
    }

    /**
     * Creates a context continuing the given table. The table itself is left untouched, all new nodes
     * are created in a copy.
     */
    static BuildContext seededFrom(NodeTable table, RobddConfiguration configuration) {
        return new BuildContext(table.copy(), configuration);
    }

    int mk(int variable, int low, int high) {
        assert !finished;
        return table.makeNode(variable, low, high);
    }

    MemoTable memo() {
        assert !finished;
        return memo;
    }

    NodeTable table() {
        return table;
    }

    /**
     * Ends the construction pass and returns the table, which from now on belongs to the result.
     */
    NodeTable finish() {
        Util.checkInvariant(!finished, "Context already finished");
        finished = true;
        return table;
    }
}
