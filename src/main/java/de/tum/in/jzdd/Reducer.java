/*
 * This file is part of JZDD.
 * Copyright (c) 2024 The JZDD authors.
 *
 * JZDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JZDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JZDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jzdd;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns an arbitrary ordered decision graph into the canonical diagram of its function under a
 * {@link ReductionRule}. Levels are processed bottom-up: a vertex whose successors are already
 * canonical is either eliminated by the rule or merged with every other vertex of the same level
 * that has the same pair of successor ids.
 */
final class Reducer {
    private static final Logger logger = Logger.getLogger(Reducer.class.getName());

    private Reducer() {}

    static Node reduce(Node root, ReductionRule rule) {
        if (root.isLeaf()) {
            return Node.constant(root.value());
        }

        List<Node> reachable = Nodes.reachable(root);
        NavigableMap<Integer, List<Node>> levels = new TreeMap<>();
        for (Node node : reachable) {
            if (!node.isLeaf()) {
                levels.computeIfAbsent(node.variable(), k -> new ArrayList<>()).add(node);
            }
        }

        NodeIndex index = new NodeIndex();
        for (Map.Entry<Integer, List<Node>> level : levels.descendingMap().entrySet()) {
            reduceLevel(rule, index, level.getKey(), level.getValue());
        }
        Node reduced = index.node(index.id(root));

        if (logger.isLoggable(Level.FINEST)) {
            logger.log(Level.FINEST, "Reduced {0} vertices on {1} levels to {2} ({3})",
                    new Object[] {reachable.size(), levels.size(), index.size(), rule});
        }
        return reduced;
    }

    private static void reduceLevel(ReductionRule rule, NodeIndex index, int variable, List<Node> vertices) {
        List<Node> staged = new ArrayList<>(vertices.size());
        long[] keys = new long[vertices.size()];

        for (Node vertex : vertices) {
            Node low = vertex.low();
            Node high = vertex.high();
            Util.checkArgument(Nodes.leafToVariable(low) > variable && Nodes.leafToVariable(high) > variable,
                    "Graph is not ordered: vertex on variable %d has successors on %d and %d",
                    variable, low.variable(), high.variable());

            int lowId = index.id(low);
            int highId = index.id(high);
            if (rule.isRedundant(lowId, highId)) {
                index.assign(vertex, lowId);
            } else {
                keys[staged.size()] = HashUtil.key(lowId, highId);
                staged.add(vertex);
            }
        }

        Integer[] order = new Integer[staged.size()];
        Arrays.setAll(order, i -> i);
        Arrays.sort(order, Comparator.comparingLong(i -> keys[i]));

        long currentKey = -1L;
        int currentId = -1;
        for (int position : order) {
            long key = keys[position];
            if (key != currentKey) {
                int lowId = (int) (key >>> 32);
                int highId = (int) key;
                currentId = index.allocate(Node.decision(variable, index.node(lowId), index.node(highId)));
                currentKey = key;
            }
            index.assign(staged.get(position), currentId);
        }
    }

    /**
     * Determines whether the graph rooted at {@code root} already is canonical under {@code rule}.
     */
    static boolean isReduced(Node root, ReductionRule rule) {
        int size = Nodes.reachable(root).size();
        return size == Nodes.reachable(reduce(root, rule)).size();
    }
}
