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
import static de.tum.in.robdd.NodeTable.FIRST_NODE;
import static de.tum.in.robdd.NodeTable.TRUE_NODE;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public class NodeTableTest {
    private static NodeTable table() {
        return new NodeTable(1, 1.5d);
    }

    @Test
    public void testIdentifiersStartAfterTerminals() {
        NodeTable table = table();
        assertThat(table.size(), is(0));

        int first = table.makeNode(3, FALSE_NODE, TRUE_NODE);
        int second = table.makeNode(2, first, TRUE_NODE);
        assertThat(first, is(FIRST_NODE));
        assertThat(second, is(FIRST_NODE + 1));
        assertThat(table.size(), is(2));
    }

    @Test
    public void testRedundantNodeIsNotCreated() {
        NodeTable table = table();
        int node = table.makeNode(5, FALSE_NODE, TRUE_NODE);

        assertThat(table.makeNode(1, node, node), is(node));
        assertThat(table.makeNode(1, TRUE_NODE, TRUE_NODE), is(TRUE_NODE));
        assertThat(table.size(), is(1));
        assertThat(table.createdNodes(), is(1L));
    }

    @Test
    public void testNodesAreUnique() {
        NodeTable table = table();
        int node = table.makeNode(4, FALSE_NODE, TRUE_NODE);
        int negated = table.makeNode(4, TRUE_NODE, FALSE_NODE);
        assertThat(node, not(is(negated)));

        assertThat(table.makeNode(4, FALSE_NODE, TRUE_NODE), is(node));
        assertThat(table.makeNode(4, TRUE_NODE, FALSE_NODE), is(negated));
        assertThat(table.size(), is(2));
        assertThat(table.check(), is(true));
    }

    @Test
    public void testAccessors() {
        NodeTable table = table();
        int low = table.makeNode(-7, FALSE_NODE, TRUE_NODE);
        int node = table.makeNode(-9, low, TRUE_NODE);

        assertThat(table.variableOf(node), is(-9));
        assertThat(table.low(node), is(low));
        assertThat(table.high(node), is(TRUE_NODE));
        assertThat(NodeTable.isLeaf(node), is(false));
        assertThat(NodeTable.isLeaf(TRUE_NODE), is(true));
        assertThat(table.isNodeValid(node + 1), is(false));
    }

    @Test
    public void testTerminalsHaveNoChildren() {
        NodeTable table = table();
        assertThrows(InvariantViolationException.class, () -> table.variableOf(TRUE_NODE));
        assertThrows(InvariantViolationException.class, () -> table.low(FALSE_NODE));
        assertThrows(InvariantViolationException.class, () -> table.high(TRUE_NODE));
        assertThrows(InvariantViolationException.class, () -> table.low(FIRST_NODE));
    }

    @Test
    public void testVariableOrder() {
        NodeTable table = table();
        int small = table.makeNode(1, FALSE_NODE, TRUE_NODE);
        int big = table.makeNode(8, FALSE_NODE, TRUE_NODE);
        int sameVariable = table.makeNode(8, TRUE_NODE, FALSE_NODE);

        assertThat(NodeTable.compareVariables(table, small, table, big), lessThan(0));
        assertThat(NodeTable.compareVariables(table, big, table, sameVariable), is(0));
        assertThat(NodeTable.compareVariables(table, big, table, TRUE_NODE), lessThan(0));
        assertThat(NodeTable.compareVariables(table, TRUE_NODE, table, FALSE_NODE), lessThan(0));
        assertThat(NodeTable.compareVariables(table, FALSE_NODE, table, small), greaterThan(0));
        assertThat(NodeTable.compareVariables(table, FALSE_NODE, table, FALSE_NODE), is(0));

        NodeTable other = table();
        int otherNode = other.makeNode(8, FALSE_NODE, TRUE_NODE);
        assertThat(NodeTable.compareVariables(table, small, other, otherNode), lessThan(0));
    }

    @Test
    public void testGrowthKeepsNodes() {
        NodeTable table = table();
        int initialSize = table.tableSize();

        // A chain of nodes testing decreasing variables, each on top of the previous one
        List<Integer> nodes = new ArrayList<>();
        int current = TRUE_NODE;
        for (int variable = 1000; variable > 0; variable--) {
            current = table.makeNode(variable, FALSE_NODE, current);
            nodes.add(current);
        }
        assertThat(table.tableSize(), greaterThan(initialSize));
        assertThat(table.growCount(), greaterThan(0L));
        assertThat(table.size(), is(1000));

        int child = TRUE_NODE;
        for (int i = 0; i < nodes.size(); i++) {
            assertThat(table.makeNode(1000 - i, FALSE_NODE, child), is(nodes.get(i)));
            child = nodes.get(i);
        }
        assertThat(table.size(), is(1000));
        assertThat(table.check(), is(true));
    }

    @Test
    public void testCopyIsIndependent() {
        NodeTable table = table();
        int node = table.makeNode(3, FALSE_NODE, TRUE_NODE);

        NodeTable copy = table.copy();
        assertThat(copy.makeNode(3, FALSE_NODE, TRUE_NODE), is(node));
        assertThat(copy.variableOf(node), is(3));

        int created = copy.makeNode(2, node, TRUE_NODE);
        assertThat(created, is(node + 1));
        assertThat(copy.size(), is(2));
        assertThat(table.size(), is(1));
        assertThat(table.isNodeValid(created), is(false));

        // The original continues independently and reuses the identifier
        assertThat(table.makeNode(1, TRUE_NODE, node), is(created));
        assertThat(copy.low(created), is(node));
        assertThat(table.low(created), is(TRUE_NODE));
        assertThat(table.check() && copy.check(), is(true));
    }
}
