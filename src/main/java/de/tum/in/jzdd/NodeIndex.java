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
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bidirectional mapping between nodes and dense integer ids, scoped to a single operation. The ids
 * {@link #FALSE_ID} and {@link #TRUE_ID} are reserved for the terminals: every leaf, no matter which
 * object, maps to the id of its value.
 */
final class NodeIndex {
    static final int FALSE_ID = 0;
    static final int TRUE_ID = 1;

    private final Map<Node, Integer> ids = new IdentityHashMap<>();
    private final List<Node> nodes = new ArrayList<>();

    NodeIndex() {
        nodes.add(Node.constant(false));
        nodes.add(Node.constant(true));
    }

    Node constant(boolean value) {
        return nodes.get(value ? TRUE_ID : FALSE_ID);
    }

    Node falseNode() {
        return nodes.get(FALSE_ID);
    }

    int id(Node node) {
        if (node.isLeaf()) {
            return node.value() ? TRUE_ID : FALSE_ID;
        }
        Integer id = ids.get(node);
        assert id != null : "Node " + node + " is not indexed";
        return id;
    }

    Node node(int id) {
        return nodes.get(id);
    }

    /**
     * Makes {@code node} an alias of the already indexed {@code id}.
     */
    void assign(Node node, int id) {
        assert 0 <= id && id < nodes.size();
        if (!node.isLeaf()) {
            ids.put(node, id);
        }
    }

    /**
     * Registers {@code node} as the canonical representative of a fresh id.
     */
    int allocate(Node node) {
        int id = nodes.size();
        nodes.add(node);
        ids.put(node, id);
        return id;
    }

    /**
     * Gives every node reachable from {@code root} its own id. Already indexed nodes keep theirs.
     */
    void indexAll(Node root) {
        for (Node node : Nodes.reachable(root)) {
            if (!node.isLeaf() && !ids.containsKey(node)) {
                allocate(node);
            }
        }
    }

    int size() {
        return nodes.size();
    }
}
