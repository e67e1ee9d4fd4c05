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
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Shannon expansion of a diagram over an explicit, sorted variable universe, reading the input under
 * one rule. The produced graph tests every universe variable on every path and is reduced by the
 * caller under the target rule.
 */
final class Converter {
    private final ReductionRule source;
    private final int[] variables;
    private final NodeIndex index = new NodeIndex();
    private final Map<Long, Node> computed = new HashMap<>();

    private Converter(ReductionRule source, int[] variables) {
        this.source = source;
        this.variables = variables;
    }

    static Node expand(Node root, ReductionRule source, int[] variables) {
        Converter converter = new Converter(source, variables);
        converter.index.indexAll(root);
        return converter.expand(root);
    }

    @Nullable
    private Node terminalCase(Node node, int position) {
        if (position == variables.length) {
            Util.checkArgument(node.isLeaf(), "Variable %d is not part of the universe", node.variable());
            return index.constant(node.value());
        }
        Util.checkArgument(Nodes.leafToVariable(node) >= variables[position], "Variable %d is not part of the universe",
                node.variable());
        return null;
    }

    // The universe may be arbitrarily long, so the expansion keeps its own stack
    private Node expand(Node root) {
        Node falseNode = index.falseNode();
        Deque<Frame> stack = new ArrayDeque<>();
        Deque<Node> results = new ArrayDeque<>();
        stack.push(new Frame(root, 0));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.expanded) {
                stack.pop();
                Node high = results.pop();
                Node low = results.pop();
                Node result = Node.decision(variables[frame.position], low, high);
                computed.put(frame.key, result);
                results.push(result);
                continue;
            }

            Node terminal = terminalCase(frame.node, frame.position);
            if (terminal == null) {
                frame.key = HashUtil.key(index.id(frame.node), frame.position);
                terminal = computed.get(frame.key);
            }
            if (terminal != null) {
                stack.pop();
                results.push(terminal);
                continue;
            }

            int variable = variables[frame.position];
            frame.expanded = true;
            stack.push(new Frame(source.highCofactor(frame.node, variable, falseNode), frame.position + 1));
            stack.push(new Frame(source.lowCofactor(frame.node, variable), frame.position + 1));
        }
        assert results.size() == 1;
        return results.pop();
    }

    private static final class Frame {
        final Node node;
        final int position;
        long key;
        boolean expanded = false;

        Frame(Node node, int position) {
            this.node = node;
            this.position = position;
        }
    }
}
