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

import java.io.IOException;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a decision graph in graphviz DOT syntax.
 *
 * <p>The false and true terminals are always written as the records {@code 0} and {@code 1}, every
 * decision vertex as a record labelled with its variable. A vertex with coinciding successors gets a
 * single bold black edge, otherwise the low edge is dotted red and the high edge solid blue. The
 * point record {@code root} marks the root.</p>
 */
public final class DotWriter {
    static final String ROOT_RECORD = "root";

    private DotWriter() {}

    public static void write(Node root, Appendable sink) throws IOException {
        List<Node> nodes = Nodes.reachable(root);
        Map<Node, Integer> ids = new IdentityHashMap<>();
        int next = NodeIndex.TRUE_ID + 1;
        for (Node node : nodes) {
            if (!node.isLeaf()) {
                ids.put(node, next);
                next += 1;
            }
        }

        sink.append("digraph diagram {\n")
                .append("  fontname=\"Helvetica,Arial,sans-serif\"\n")
                .append("  node [fontname=\"Helvetica,Arial,sans-serif\"]\n")
                .append("  edge [fontname=\"Helvetica,Arial,sans-serif\",color=blue]\n");

        sink.append("  0[style=filled,fillcolor=\"gray80\",label=\"false\",shape=\"box\"];\n");
        sink.append("  1[style=filled,fillcolor=\"gray95\",label=\"true\",shape=\"box\"];\n");
        for (Node node : nodes) {
            if (!node.isLeaf()) {
                sink.append("  ").append(String.valueOf(ids.get(node)))
                        .append("[label=\"").append(String.valueOf(node.variable())).append("\"];\n");
            }
        }

        sink.append("  ").append(ROOT_RECORD).append("[shape=point];\n");
        sink.append("  ").append(ROOT_RECORD).append(" -> ").append(String.valueOf(id(ids, root)))
                .append("[color=black];\n");
        for (Node node : nodes) {
            if (node.isLeaf()) {
                continue;
            }
            int id = ids.get(node);
            int lowId = id(ids, node.low());
            int highId = id(ids, node.high());
            if (lowId == highId) {
                edge(sink, id, lowId, "color=black,penwidth=2");
            } else {
                edge(sink, id, lowId, "color=red,style=\"dotted\"");
                edge(sink, id, highId, "color=blue");
            }
        }
        sink.append("}\n");
    }

    private static void edge(Appendable sink, int source, int target, String attributes) throws IOException {
        sink.append("  ").append(String.valueOf(source)).append(" -> ").append(String.valueOf(target))
                .append('[').append(attributes).append("];\n");
    }

    private static int id(Map<Node, Integer> ids, Node node) {
        if (node.isLeaf()) {
            return node.value() ? NodeIndex.TRUE_ID : NodeIndex.FALSE_ID;
        }
        return ids.get(node);
    }
}
