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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

final class Nodes {
    private Nodes() {}

    /**
     * Lists every node reachable from {@code root} exactly once, in depth-first pre-order with low
     * successors visited before high successors.
     */
    static List<Node> reachable(Node root) {
        Set<Node> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Node> order = new ArrayList<>();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            if (!visited.add(node)) {
                continue;
            }
            order.add(node);
            if (!node.isLeaf()) {
                stack.push(node.high());
                stack.push(node.low());
            }
        }
        return order;
    }

    /**
     * Lists the decision vertices reachable from {@code root} ordered by decreasing variable, so that
     * both successors of a vertex precede it.
     */
    static List<Node> bottomUp(Node root) {
        List<Node> decisions = new ArrayList<>();
        for (Node node : reachable(root)) {
            if (!node.isLeaf()) {
                decisions.add(node);
            }
        }
        decisions.sort(Comparator.comparingInt(Node::variable).reversed());
        return decisions;
    }

    static Set<Node> reachableSet(Node root) {
        Set<Node> set = Collections.newSetFromMap(new IdentityHashMap<>());
        set.addAll(reachable(root));
        return set;
    }

    static int leafToVariable(Node node) {
        return node.isLeaf() ? Integer.MAX_VALUE : node.variable();
    }
}
