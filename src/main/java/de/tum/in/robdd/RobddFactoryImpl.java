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
import static de.tum.in.robdd.Util.checkArgument;
import static de.tum.in.robdd.Util.checkInvariant;

import com.google.common.collect.ImmutableList;
import java.util.BitSet;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.function.IntPredicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.IntStream;
import javax.annotation.Nullable;

final class RobddFactoryImpl implements RobddFactory {
    private static final Logger logger = Logger.getLogger(RobddFactoryImpl.class.getName());

    @SuppressWarnings("StaticCollection")
    private static final Collection<RobddFactoryImpl> factoryShutdownHook = new ConcurrentLinkedDeque<>();

    private final RobddConfiguration configuration;
    private final RobddImpl falseDiagram;
    private final RobddImpl trueDiagram;

    // Statistics
    private long applyCount = 0;
    private long negateCount = 0;
    private long restrictCount = 0;
    private long createdNodes = 0;
    private long memoLookups = 0;
    private long memoHits = 0;
    private long tableGrowths = 0;

    RobddFactoryImpl(RobddConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration);

        // Tables are never modified once they belong to a diagram, so the constants can share one
        NodeTable emptyTable = new NodeTable(1, configuration.growthFactor());
        this.falseDiagram = new RobddImpl(this, emptyTable, FALSE_NODE);
        this.trueDiagram = new RobddImpl(this, emptyTable, TRUE_NODE);

        if (logger.isLoggable(Level.INFO) && configuration.logStatisticsOnShutdown()) {
            logger.log(Level.FINER, "Adding {0} to shutdown hook", this);
            addToShutdownHook(this);
        }
    }

    private static void addToShutdownHook(RobddFactoryImpl factory) {
        ShutdownHookLazyHolder.init();
        factoryShutdownHook.add(factory);
    }

    private RobddImpl cast(Robdd diagram) {
        Objects.requireNonNull(diagram);
        checkArgument(diagram instanceof RobddImpl, "Unsupported diagram %s", diagram);
        return (RobddImpl) diagram;
    }

    private RobddImpl finish(String operation, BuildContext context, int root) {
        MemoTable memo = context.memo();
        memoLookups += memo.lookupCount();
        memoHits += memo.hitCount();
        int memoSize = memo.size();

        NodeTable table = context.finish();
        createdNodes += table.createdNodes();
        tableGrowths += table.growCount();

        RobddImpl result = new RobddImpl(this, table, root);
        logger.log(Level.FINER, "{0} built root {1} in {2} with {3} new nodes and {4} memo entries", new Object[] {
            operation, root, table, table.createdNodes(), memoSize
        });
        if (logger.isLoggable(Level.FINEST)) {
            logger.log(Level.FINEST, table.getStatistics());
        }
        if (configuration.checkInvariants()) {
            result.check();
        }
        return result;
    }

    @Override
    public RobddConfiguration configuration() {
        return configuration;
    }

    @Override
    public Robdd makeTrue() {
        return trueDiagram;
    }

    @Override
    public Robdd makeFalse() {
        return falseDiagram;
    }

    @Override
    public Robdd makeVar(int variable) {
        BuildContext context = BuildContext.fresh(configuration);
        int root = context.mk(variable, FALSE_NODE, TRUE_NODE);
        return new RobddImpl(this, context.finish(), root);
    }

    @Override
    public Robdd apply(BooleanOperator operator, Robdd left, Robdd right) {
        Objects.requireNonNull(operator);
        RobddImpl leftDiagram = cast(left);
        RobddImpl rightDiagram = cast(right);

        applyCount += 1;
        BuildContext context = BuildContext.fresh(configuration);
        int root = new ApplyOperation(operator, leftDiagram.table, rightDiagram.table, context)
                .apply(leftDiagram.root, rightDiagram.root);
        return finish("Apply", context, root);
    }

    @Override
    public Robdd negate(Robdd diagram) {
        RobddImpl input = cast(diagram);
        if (input.root == FALSE_NODE) {
            return trueDiagram;
        }
        if (input.root == TRUE_NODE) {
            return falseDiagram;
        }

        negateCount += 1;
        BuildContext context = BuildContext.fresh(configuration);
        int root = new NegateOperation(input.table, context).negate(input.root);
        return finish("Negate", context, root);
    }

    @Override
    public Robdd restrictAll(Robdd diagram, Collection<Literal> literals) {
        RobddImpl input = cast(diagram);
        Objects.requireNonNull(literals);

        Map<Integer, Boolean> restriction = new TreeMap<>();
        for (Literal literal : literals) {
            Boolean previous = restriction.put(literal.variable(), literal.value());
            checkArgument(
                    previous == null || previous == literal.value(),
                    "Variable %d restricted to both values",
                    literal.variable());
        }
        if (restriction.isEmpty() || input.isLeaf(input.root)) {
            return input;
        }

        int[] variables = new int[restriction.size()];
        boolean[] values = new boolean[restriction.size()];
        int index = 0;
        for (Map.Entry<Integer, Boolean> entry : restriction.entrySet()) {
            variables[index] = entry.getKey();
            values[index] = entry.getValue();
            index += 1;
        }

        restrictCount += 1;
        BuildContext context = BuildContext.seededFrom(input.table, configuration);
        int root = new RestrictOperation(context, variables, values).restrict(input.root);
        return finish("Restrict", context, root);
    }

    @Override
    public Optional<List<Literal>> anySat(Robdd diagram) {
        RobddImpl input = cast(diagram);
        if (input.root == FALSE_NODE) {
            return Optional.empty();
        }

        NodeTable table = input.table;
        ImmutableList.Builder<Literal> path = ImmutableList.builder();
        int currentNode = input.root;
        while (currentNode != TRUE_NODE) {
            checkInvariant(currentNode != FALSE_NODE, "Reached Zero from satisfiable root %d", input.root);
            int highNode = table.high(currentNode);
            boolean value = highNode != FALSE_NODE;
            path.add(Literal.of(table.variableOf(currentNode), value));
            currentNode = value ? highNode : table.low(currentNode);
        }
        return Optional.of(path.build());
    }

    @Override
    public DiagramGraph makeDag(Robdd diagram) {
        return DiagramGraph.of(cast(diagram));
    }

    @Override
    public String statistics() {
        return String.format(
                "Operations: apply=%d, negate=%d, restrict=%d%n"
                        + "Nodes: created=%d, table growths=%d%n"
                        + "Memo: lookups=%d, hits=%d",
                applyCount, negateCount, restrictCount, createdNodes, tableGrowths, memoLookups, memoHits);
    }

    @Override
    public String toString() {
        return String.format("F@%d", System.identityHashCode(this));
    }

    static final class RobddImpl implements Robdd {
        private final RobddFactoryImpl factory;
        private final NodeTable table;
        private final int root;

        @Nullable
        private int[] supportCache;

        RobddImpl(RobddFactoryImpl factory, NodeTable table, int root) {
            assert table.isNodeValidOrLeaf(root);
            this.factory = factory;
            this.table = table;
            this.root = root;
        }

        @Override
        public RobddFactory factory() {
            return factory;
        }

        @Override
        public int root() {
            return root;
        }

        @Override
        public boolean isLeaf(int node) {
            return NodeTable.isLeaf(node);
        }

        @Override
        public int variableOf(int node) {
            checkArgument(table.isNodeValidOrLeaf(node), "Unknown node %d", node);
            return table.variableOf(node);
        }

        @Override
        public int low(int node) {
            checkArgument(table.isNodeValidOrLeaf(node), "Unknown node %d", node);
            return table.low(node);
        }

        @Override
        public int high(int node) {
            checkArgument(table.isNodeValidOrLeaf(node), "Unknown node %d", node);
            return table.high(node);
        }

        @Override
        public int compareVariables(int node1, int node2) {
            checkArgument(table.isNodeValidOrLeaf(node1), "Unknown node %d", node1);
            checkArgument(table.isNodeValidOrLeaf(node2), "Unknown node %d", node2);
            return NodeTable.compareVariables(table, node1, table, node2);
        }

        @Override
        public boolean evaluate(IntPredicate assignment) {
            int current = root;
            while (!NodeTable.isLeaf(current)) {
                current = assignment.test(table.variableOf(current)) ? table.high(current) : table.low(current);
            }
            return current == TRUE_NODE;
        }

        @Override
        public int[] support() {
            if (supportCache == null) {
                IntStream.Builder variables = IntStream.builder();
                forEachNodeBelowOnce(root, (node, variable) -> variables.add(variable));
                supportCache = variables.build().distinct().sorted().toArray();
            }
            return supportCache.clone();
        }

        @Override
        public int nodeCount() {
            int[] count = {0};
            forEachNodeBelowOnce(root, (node, variable) -> count[0] += 1);
            return count[0];
        }

        @Override
        public int tableSize() {
            return table.size();
        }

        @Override
        public boolean check() {
            checkInvariant(table.isNodeValidOrLeaf(root), "Root %d is not part of table %s", root, table);
            return table.check();
        }

        void forEachNodeBelowOnce(int node, NodeVisitor action) {
            doForEachNodeBelowOnce(node, action, new BitSet());
        }

        private void doForEachNodeBelowOnce(int node, NodeVisitor action, BitSet visited) {
            if (NodeTable.isLeaf(node) || visited.get(node)) {
                return;
            }
            visited.set(node);
            action.visit(node, table.variableOf(node));
            doForEachNodeBelowOnce(table.low(node), action, visited);
            doForEachNodeBelowOnce(table.high(node), action, visited);
        }

        @Override
        public String toString() {
            return isLeaf(root)
                    ? NodeTable.terminalName(root)
                    : String.format("%d@[%s,%s]", root, table, factory);
        }
    }

    @FunctionalInterface
    interface NodeVisitor {
        void visit(int node, int variable);
    }

    private static final class ShutdownHookLazyHolder {
        private static final Runnable shutdownHook = new ShutdownHookPrinter();

        static {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdownHook));
        }

        static void init() {
            // bogus method to force static initialization
        }
    }

    private static final class ShutdownHookPrinter implements Runnable {
        @Override
        public void run() {
            if (!logger.isLoggable(Level.INFO)) {
                return;
            }
            for (RobddFactoryImpl factory : factoryShutdownHook) {
                logger.log(Level.INFO, "Statistics of {0}:\n{1}", new Object[] {factory, factory.statistics()});
            }
        }
    }
}
