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

import static de.tum.in.robdd.Util.checkInvariant;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The unique table: an arena of internal nodes, where a node is identified by its index. The
 * identifiers {@link #FALSE_NODE} and {@link #TRUE_NODE} are reserved for the terminals, internal
 * nodes are numbered consecutively starting from {@link #FIRST_NODE}.
 *
 * <p>Nodes are only ever added, never removed, so an identifier stays valid for the lifetime of the
 * table.</p>
 */
final class NodeTable {
    private static final Logger logger = Logger.getLogger(NodeTable.class.getName());

    static final int FALSE_NODE = 0;
    static final int TRUE_NODE = 1;
    static final int FIRST_NODE = 2;

    // Terminals never appear in a hash chain, hence 0 can be used as "end of chain"
    private static final int NOT_A_NODE = FALSE_NODE;
    private static final int MINIMUM_TABLE_SIZE = 17;
    private static final int MAXIMAL_NODE_COUNT = Integer.MAX_VALUE / 2 - 8;

    private final double growthFactor;

    /* Variable of each node. Entries below FIRST_NODE are unused. */
    private int[] variables;
    /* Children of each node, low child at 2 * node, high child at 2 * node + 1. */
    private int[] tree;

    /* Hash map from (variable, low, high) to the node, realized by chaining through the node array:
     * hashToChainStart gives the first node of a bucket, hashChain the next node of the same bucket. */
    private int[] hashToChainStart;
    private int[] hashChain;

    /* The identifier given to the next created node. Strictly increasing. */
    private int nextNode;

    // Statistics
    private long createdNodes = 0;
    private long hashChainLookups = 0;
    private long hashChainLookupLength = 0;
    private long hashChainLookupHit = 0;
    private long growCount = 0;

    NodeTable(int initialSize, double growthFactor) {
        this.growthFactor = growthFactor;
        int tableSize = Math.max(MathUtil.nextPrime(initialSize), MINIMUM_TABLE_SIZE);

        variables = new int[tableSize];
        tree = new int[2 * tableSize];
        hashToChainStart = new int[tableSize];
        hashChain = new int[tableSize];
        nextNode = FIRST_NODE;
    }

    private NodeTable(NodeTable other) {
        this.growthFactor = other.growthFactor;
        this.variables = other.variables.clone();
        this.tree = other.tree.clone();
        this.hashToChainStart = other.hashToChainStart.clone();
        this.hashChain = other.hashChain.clone();
        this.nextNode = other.nextNode;
    }

    /**
     * Creates an independent copy of this table. Nodes present in this table have the same identifier
     * in the copy, nodes created in either table afterwards are not visible to the other one.
     */
    NodeTable copy() {
        logger.log(Level.FINE, "Copying table {0} with {1} nodes", new Object[] {this, size()});
        return new NodeTable(this);
    }

    static boolean isLeaf(int node) {
        return node == FALSE_NODE || node == TRUE_NODE;
    }

    boolean isNodeValid(int node) {
        return FIRST_NODE <= node && node < nextNode;
    }

    boolean isNodeValidOrLeaf(int node) {
        return isLeaf(node) || isNodeValid(node);
    }

    int variableOf(int node) {
        checkNode(node, "variable");
        return variables[node];
    }

    int low(int node) {
        checkNode(node, "low child");
        return tree[2 * node];
    }

    int high(int node) {
        checkNode(node, "high child");
        return tree[2 * node + 1];
    }

    private void checkNode(int node, String accessed) {
        if (isLeaf(node)) {
            throw new InvariantViolationException(
                    String.format("Terminal %s has no %s", terminalName(node), accessed));
        }
        checkInvariant(isNodeValid(node), "Node %d is not part of table %s", node, this);
    }

    static String terminalName(int node) {
        assert isLeaf(node);
        return node == TRUE_NODE ? "One" : "Zero";
    }

    /**
     * Orders two nodes by their variable, possibly stored in different tables. Internal nodes are
     * ordered by variable index and come before all terminals, {@code One} comes before {@code Zero}.
     * A result of zero only means that both nodes test the same variable (or are the same terminal),
     * not that they are the same node.
     */
    static int compareVariables(NodeTable firstTable, int first, NodeTable secondTable, int second) {
        boolean firstLeaf = isLeaf(first);
        boolean secondLeaf = isLeaf(second);
        if (firstLeaf && secondLeaf) {
            // One < Zero, i.e. TRUE_NODE < FALSE_NODE
            return Integer.compare(second, first);
        }
        if (firstLeaf) {
            return 1;
        }
        if (secondLeaf) {
            return -1;
        }
        return Integer.compare(firstTable.variables[first], secondTable.variables[second]);
    }

    /**
     * Returns the unique node {@code (variable, low, high)}, creating it if it does not exist yet.
     * If both children are equal, that child is returned instead and nothing is created.
     */
    int makeNode(int variable, int low, int high) {
        assert isNodeValidOrLeaf(low) && isNodeValidOrLeaf(high);
        assert isLeaf(low) || variable < variables[low];
        assert isLeaf(high) || variable < variables[high];

        if (low == high) {
            return low;
        }

        int hashCode = HashUtil.hash(variable, low, high);
        int[] variables = this.variables;
        int[] tree = this.tree;

        int currentLookupNode = hashToChainStart[hashToTable(hashCode)];
        int chainLookups = 1;
        this.hashChainLookups += 1;
        while (currentLookupNode != NOT_A_NODE) {
            if (variables[currentLookupNode] == variable
                    && tree[2 * currentLookupNode] == low
                    && tree[2 * currentLookupNode + 1] == high) {
                this.hashChainLookupLength += chainLookups;
                this.hashChainLookupHit += 1;
                return currentLookupNode;
            }
            int next = hashChain[currentLookupNode];
            assert next != currentLookupNode;
            currentLookupNode = next;
            chainLookups += 1;
        }
        this.hashChainLookupLength += chainLookups;

        if (nextNode == tableSize()) {
            grow();
        }

        int node = nextNode;
        nextNode += 1;
        createdNodes += 1;

        this.variables[node] = variable;
        this.tree[2 * node] = low;
        this.tree[2 * node + 1] = high;
        connectHashList(node, hashCode);
        return node;
    }

    private void grow() {
        int oldSize = tableSize();
        checkInvariant(oldSize < MAXIMAL_NODE_COUNT, "Table %s is full", this);
        int newSize = MathUtil.grownSize(oldSize, growthFactor, MAXIMAL_NODE_COUNT);
        logger.log(Level.FINE, "Growing the table of {0} from {1} to {2}", new Object[] {this, oldSize, newSize});
        growCount += 1;

        variables = Arrays.copyOf(variables, newSize);
        tree = Arrays.copyOf(tree, 2 * newSize);
        // Bucket positions depend on the size, so the chains are rebuilt from scratch
        hashToChainStart = new int[newSize];
        hashChain = new int[newSize];

        for (int node = FIRST_NODE; node < nextNode; node++) {
            connectHashList(node, hashCode(node));
        }
    }

    private void connectHashList(int node, int hashCode) {
        int position = hashToTable(hashCode);
        hashChain[node] = hashToChainStart[position];
        hashToChainStart[position] = node;
    }

    private int hashToTable(int hashCode) {
        int mod = hashCode % hashToChainStart.length;
        return mod < 0 ? mod + hashToChainStart.length : mod;
    }

    private int hashCode(int node) {
        return HashUtil.hash(variables[node], tree[2 * node], tree[2 * node + 1]);
    }

    // Reading

    int tableSize() {
        return variables.length;
    }

    /**
     * Number of internal nodes stored in this table, reachable or not.
     */
    int size() {
        return nextNode - FIRST_NODE;
    }

    long createdNodes() {
        return createdNodes;
    }

    long growCount() {
        return growCount;
    }

    // Integrity checks and utility

    /**
     * Checks that every node of the table is reduced, ordered, unique and findable through its hash
     * chain.
     *
     * @return True. This way, check can easily be called by an {@code assert} statement.
     * @throws InvariantViolationException if any of the checks fails.
     */
    boolean check() {
        logger.log(Level.FINER, "Running integrity check on {0}", this);

        Set<Node> seen = new HashSet<>();
        for (int node = FIRST_NODE; node < nextNode; node++) {
            int variable = variables[node];
            int low = tree[2 * node];
            int high = tree[2 * node + 1];

            checkInvariant(low != high, "Node (%s) is redundant", string(node));
            for (int child : new int[] {low, high}) {
                checkInvariant(
                        isNodeValidOrLeaf(child) && child < node,
                        "Invalid child entry (%s) -> %d",
                        string(node),
                        child);
                checkInvariant(
                        isLeaf(child) || variable < variables[child],
                        "(%s) -> (%s) does not descend tree",
                        string(node),
                        string(child));
            }

            Node nodeObject = new Node(variable, low, high);
            checkInvariant(seen.add(nodeObject), "Duplicate entry (%s)", string(node));

            int chainNode = hashToChainStart[hashToTable(hashCode(node))];
            while (chainNode != NOT_A_NODE && chainNode != node) {
                chainNode = hashChain[chainNode];
            }
            checkInvariant(chainNode == node, "Node (%s) is not in its hash chain", string(node));
        }
        return true;
    }

    String string(int node) {
        if (isLeaf(node)) {
            return terminalName(node);
        }
        return String.format("%6d %5d %6d %6d", node, variables[node], tree[2 * node], tree[2 * node + 1]);
    }

    String getStatistics() {
        return String.format(
                "Unique table: size=%d, nodes=%d, created=%d, grown=%d times%n"
                        + "      hash lookups=%d, hits=%d, average chain length=%3.3f",
                tableSize(),
                size(),
                createdNodes,
                growCount,
                hashChainLookups,
                hashChainLookupHit,
                (double) hashChainLookupLength / Math.max(hashChainLookups, 1L));
    }

    @Override
    public String toString() {
        return String.format("T%d@%d", tableSize(), System.identityHashCode(this));
    }

    private static final class Node {
        final int variable;
        final int low;
        final int high;

        Node(int variable, int low, int high) {
            this.variable = variable;
            this.low = low;
            this.high = high;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Node)) {
                return false;
            }
            Node node = (Node) o;
            return variable == node.variable && low == node.low && high == node.high;
        }

        @Override
        public int hashCode() {
            return Objects.hash(variable, low, high);
        }
    }
}
