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

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.builder.GraphTypeBuilder;

/**
 * An explicit graph view of a diagram, intended to be handed to a graph rendering library.
 *
 * <p>Vertices are keyed by variable, the terminals by {@code 0} ({@code Zero}) and {@code 1}
 * ({@code One}). Consequently, distinct nodes testing the same variable are merged into one vertex,
 * and variables {@code 0} and {@code 1} share their vertex with the respective terminal. Between two
 * vertices there is at most one edge. When several edges connect the same pair of vertices, the
 * flag written last by a depth-first walk (low child, high child, then the node itself, shared
 * nodes being walked again each time they are reached) is kept. The same holds for the label of a
 * vertex shared by a variable and a terminal.</p>
 */
public final class DiagramGraph {
    private static final int FALSE_KEY = 0;
    private static final int TRUE_KEY = 1;

    private final Graph<Integer, DagEdge> graph;
    private final Map<Integer, String> labels;

    private DiagramGraph(Graph<Integer, DagEdge> graph, Map<Integer, String> labels) {
        this.graph = graph;
        this.labels = labels;
    }

    static DiagramGraph of(Robdd diagram) {
        Walk walk = collect(diagram, diagram.root(), new HashMap<>());

        Graph<Integer, DagEdge> graph = GraphTypeBuilder.<Integer, DagEdge>directed()
                .allowingSelfLoops(true)
                .allowingMultipleEdges(false)
                .buildGraph();
        walk.labels.keySet().forEach(graph::addVertex);
        walk.edges.forEach((key, high) -> graph.addEdge(key.source, key.target, new DagEdge(high)));
        return new DiagramGraph(graph, walk.labels);
    }

    /**
     * Computes the final state of a depth-first walk below {@code node} which revisits shared nodes,
     * inserting each node's entries after those of its low and then its high child. Only the last
     * write of each key survives such a walk, so it equals the low walk overwritten by the high walk
     * overwritten by the node's own entries, and can be memoized per node.
     */
    private static Walk collect(Robdd diagram, int node, Map<Integer, Walk> walks) {
        if (node == diagram.falseNode()) {
            return Walk.terminal(FALSE_KEY, "Zero");
        }
        if (node == diagram.trueNode()) {
            return Walk.terminal(TRUE_KEY, "One");
        }
        Walk cached = walks.get(node);
        if (cached != null) {
            return cached;
        }

        int low = diagram.low(node);
        int high = diagram.high(node);
        Walk lowWalk = collect(diagram, low, walks);
        Walk highWalk = collect(diagram, high, walks);

        int variable = diagram.variableOf(node);
        Walk walk = new Walk(new LinkedHashMap<>(lowWalk.labels), new LinkedHashMap<>(lowWalk.edges));
        walk.labels.putAll(highWalk.labels);
        walk.edges.putAll(highWalk.edges);
        walk.labels.put(variable, String.valueOf(variable));
        walk.edges.put(new EdgeKey(variable, key(diagram, low)), false);
        walk.edges.put(new EdgeKey(variable, key(diagram, high)), true);
        walks.put(node, walk);
        return walk;
    }

    private static int key(Robdd diagram, int node) {
        if (node == diagram.falseNode()) {
            return FALSE_KEY;
        }
        if (node == diagram.trueNode()) {
            return TRUE_KEY;
        }
        return diagram.variableOf(node);
    }

    /**
     * Returns the underlying graph. Modifications of the returned graph are not reflected in the
     * labels of this view.
     */
    public Graph<Integer, DagEdge> graph() {
        return graph;
    }

    public String label(int vertex) {
        String label = labels.get(vertex);
        Util.checkArgument(label != null, "No vertex %d", vertex);
        return label;
    }

    /**
     * Returns whether there is an edge from {@code source} to {@code target} and it is a high edge.
     */
    public boolean isHighEdge(int source, int target) {
        DagEdge edge = graph.getEdge(source, target);
        Util.checkArgument(edge != null, "No edge %d -> %d", source, target);
        return edge.isHigh();
    }

    @Override
    public String toString() {
        return graph.toString();
    }

    /**
     * An edge of the graph, labelled with the branch it represents.
     */
    public static final class DagEdge extends DefaultEdge {
        private static final long serialVersionUID = -6129036722834413957L;

        private final boolean high;

        public DagEdge(boolean high) {
            this.high = high;
        }

        public boolean isHigh() {
            return high;
        }

        @Override
        public String toString() {
            return String.format("(%s -%s-> %s)", getSource(), high ? "T" : "F", getTarget());
        }
    }

    private static final class Walk {
        final Map<Integer, String> labels;
        final Map<EdgeKey, Boolean> edges;

        Walk(Map<Integer, String> labels, Map<EdgeKey, Boolean> edges) {
            this.labels = labels;
            this.edges = edges;
        }

        static Walk terminal(int key, String label) {
            Map<Integer, String> labels = new LinkedHashMap<>();
            labels.put(key, label);
            return new Walk(labels, new LinkedHashMap<>());
        }
    }

    private static final class EdgeKey {
        final int source;
        final int target;

        EdgeKey(int source, int target) {
            this.source = source;
            this.target = target;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof EdgeKey)) {
                return false;
            }
            EdgeKey edgeKey = (EdgeKey) o;
            return source == edgeKey.source && target == edgeKey.target;
        }

        @Override
        public int hashCode() {
            return Objects.hash(source, target);
        }
    }
}
