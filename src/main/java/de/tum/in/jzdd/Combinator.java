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
 * Pointwise combination of two canonical diagrams of the same rule. The result graph is ordered but
 * not reduced, callers canonicalize it with {@link Reducer}.
 */
final class Combinator {
    private final BooleanOperator operator;
    private final ReductionRule rule;
    private final NodeIndex index = new NodeIndex();
    private final Map<Long, Node> computed = new HashMap<>();

    private Combinator(BooleanOperator operator, ReductionRule rule) {
        this.operator = operator;
        this.rule = rule;
    }

    static Node apply(BooleanOperator operator, ReductionRule rule, Node left, Node right, boolean iterative) {
        Combinator combinator = new Combinator(operator, rule);
        combinator.index.indexAll(left);
        combinator.index.indexAll(right);
        return iterative ? combinator.applyIterative(left, right) : combinator.applyRecursive(left, right);
    }

    @Nullable
    private Node terminalCase(Node left, Node right) {
        if (left.isLeaf() && rule.isUniform(left.value())) {
            int forced = operator.forcedByLeft(left.value());
            if (forced != BooleanOperator.NOT_FORCED) {
                return index.constant(forced == 1);
            }
            if (right.isLeaf()) {
                return index.constant(operator.evaluate(left.value(), right.value()));
            }
            if (passesRight(left.value())) {
                return right;
            }
        }
        if (right.isLeaf() && rule.isUniform(right.value())) {
            int forced = operator.forcedByRight(right.value());
            if (forced != BooleanOperator.NOT_FORCED) {
                return index.constant(forced == 1);
            }
            if (left.isLeaf()) {
                return index.constant(operator.evaluate(left.value(), right.value()));
            }
            if (passesLeft(right.value())) {
                return left;
            }
        }
        if (left.isLeaf() && right.isLeaf()) {
            return index.constant(operator.evaluate(left.value(), right.value()));
        }
        if (index.id(left) == index.id(right)) {
            boolean onFalse = operator.evaluate(false, false);
            boolean onTrue = operator.evaluate(true, true);
            if (!onFalse && onTrue) {
                return left;
            }
            if (onFalse == onTrue && rule.isUniform(onTrue)) {
                return index.constant(onTrue);
            }
        }
        return null;
    }

    // op(x, value) == x for every x
    private boolean passesLeft(boolean rightValue) {
        return !operator.evaluate(false, rightValue) && operator.evaluate(true, rightValue);
    }

    private boolean passesRight(boolean leftValue) {
        return !operator.evaluate(leftValue, false) && operator.evaluate(leftValue, true);
    }

    private static int branchVariable(Node left, Node right) {
        return Math.min(Nodes.leafToVariable(left), Nodes.leafToVariable(right));
    }

    private Node applyRecursive(Node left, Node right) {
        Node terminal = terminalCase(left, right);
        if (terminal != null) {
            return terminal;
        }
        long key = HashUtil.key(index.id(left), index.id(right));
        Node cached = computed.get(key);
        if (cached != null) {
            return cached;
        }

        int variable = branchVariable(left, right);
        Node falseNode = index.falseNode();
        Node low = applyRecursive(rule.lowCofactor(left, variable), rule.lowCofactor(right, variable));
        Node high = applyRecursive(
                rule.highCofactor(left, variable, falseNode), rule.highCofactor(right, variable, falseNode));
        Node result = Node.decision(variable, low, high);
        computed.put(key, result);
        return result;
    }

    private Node applyIterative(Node left, Node right) {
        Node falseNode = index.falseNode();
        Deque<Frame> stack = new ArrayDeque<>();
        Deque<Node> results = new ArrayDeque<>();
        stack.push(new Frame(left, right));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.expanded) {
                stack.pop();
                Node high = results.pop();
                Node low = results.pop();
                Node result = Node.decision(frame.variable, low, high);
                computed.put(frame.key, result);
                results.push(result);
                continue;
            }

            Node terminal = terminalCase(frame.left, frame.right);
            if (terminal == null) {
                frame.key = HashUtil.key(index.id(frame.left), index.id(frame.right));
                terminal = computed.get(frame.key);
            }
            if (terminal != null) {
                stack.pop();
                results.push(terminal);
                continue;
            }

            int variable = branchVariable(frame.left, frame.right);
            frame.variable = variable;
            frame.expanded = true;
            // Low is pushed last so that it is completed first
            stack.push(new Frame(rule.highCofactor(frame.left, variable, falseNode),
                    rule.highCofactor(frame.right, variable, falseNode)));
            stack.push(new Frame(rule.lowCofactor(frame.left, variable), rule.lowCofactor(frame.right, variable)));
        }
        assert results.size() == 1;
        return results.pop();
    }

    private static final class Frame {
        final Node left;
        final Node right;
        long key;
        int variable;
        boolean expanded = false;

        Frame(Node left, Node right) {
            this.left = left;
            this.right = right;
        }
    }
}
