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
 * Substitution of a variable by a function. The descent runs over triples {@code (low, high,
 * replacement)}, where {@code low} and {@code high} are the cofactors of the substituted diagram
 * with respect to the variable and the result is {@code ite(replacement, high, low)}. Until the
 * substituted variable is passed, the first two components are the same node.
 */
final class Substituter {
    private final ReductionRule rule;
    private final int variable;
    private final NodeIndex index = new NodeIndex();
    private final Map<Key, Node> computed = new HashMap<>();

    private Substituter(ReductionRule rule, int variable) {
        this.rule = rule;
        this.variable = variable;
    }

    static Node compose(ReductionRule rule, Node diagram, Node replacement, int variable, boolean iterative) {
        Substituter substituter = new Substituter(rule, variable);
        substituter.index.indexAll(diagram);
        substituter.index.indexAll(replacement);
        return iterative
                ? substituter.composeIterative(diagram, replacement)
                : substituter.composeRecursive(diagram, diagram, replacement, false);
    }

    @Nullable
    private Node terminalCase(Node low, Node high, Node replacement, boolean passed) {
        if (!passed) {
            return null;
        }
        if (index.id(low) == index.id(high)) {
            return low;
        }
        if (replacement.isLeaf()) {
            if (rule.isUniform(replacement.value())) {
                return replacement.value() ? high : low;
            }
            if (low.isLeaf() && high.isLeaf()) {
                return index.constant(replacement.value() ? high.value() : low.value());
            }
        }
        return null;
    }

    private int branchVariable(Node low, Node high, Node replacement, boolean passed) {
        int branch = Util.min(Nodes.leafToVariable(low), Nodes.leafToVariable(high),
                Nodes.leafToVariable(replacement));
        return passed ? branch : Math.min(branch, variable);
    }

    private Node composeRecursive(Node low, Node high, Node replacement, boolean passed) {
        Node terminal = terminalCase(low, high, replacement, passed);
        if (terminal != null) {
            return terminal;
        }
        Key key = new Key(index.id(low), index.id(high), index.id(replacement), passed);
        Node cached = computed.get(key);
        if (cached != null) {
            return cached;
        }

        int branch = branchVariable(low, high, replacement, passed);
        Node falseNode = index.falseNode();
        Node lowResult;
        Node highResult;
        if (branch == variable) {
            assert !passed;
            Node resolvedLow = rule.lowCofactor(low, variable);
            Node resolvedHigh = rule.highCofactor(high, variable, falseNode);
            lowResult = composeRecursive(resolvedLow, resolvedHigh, rule.lowCofactor(replacement, branch), true);
            highResult = composeRecursive(resolvedLow, resolvedHigh,
                    rule.highCofactor(replacement, branch, falseNode), true);
        } else {
            lowResult = composeRecursive(rule.lowCofactor(low, branch), rule.lowCofactor(high, branch),
                    rule.lowCofactor(replacement, branch), passed);
            highResult = composeRecursive(rule.highCofactor(low, branch, falseNode),
                    rule.highCofactor(high, branch, falseNode),
                    rule.highCofactor(replacement, branch, falseNode), passed);
        }
        Node result = Node.decision(branch, lowResult, highResult);
        computed.put(key, result);
        return result;
    }

    private Node composeIterative(Node diagram, Node replacement) {
        Node falseNode = index.falseNode();
        Deque<Frame> stack = new ArrayDeque<>();
        Deque<Node> results = new ArrayDeque<>();
        stack.push(new Frame(diagram, diagram, replacement, false));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.branch >= 0) {
                stack.pop();
                Node highResult = results.pop();
                Node lowResult = results.pop();
                Node result = Node.decision(frame.branch, lowResult, highResult);
                computed.put(frame.key, result);
                results.push(result);
                continue;
            }

            Node terminal = terminalCase(frame.low, frame.high, frame.replacement, frame.passed);
            if (terminal == null) {
                frame.key = new Key(index.id(frame.low), index.id(frame.high), index.id(frame.replacement),
                        frame.passed);
                terminal = computed.get(frame.key);
            }
            if (terminal != null) {
                stack.pop();
                results.push(terminal);
                continue;
            }

            int branch = branchVariable(frame.low, frame.high, frame.replacement, frame.passed);
            frame.branch = branch;
            Frame lowFrame;
            Frame highFrame;
            if (branch == variable) {
                Node resolvedLow = rule.lowCofactor(frame.low, variable);
                Node resolvedHigh = rule.highCofactor(frame.high, variable, falseNode);
                lowFrame = new Frame(resolvedLow, resolvedHigh, rule.lowCofactor(frame.replacement, branch), true);
                highFrame = new Frame(resolvedLow, resolvedHigh,
                        rule.highCofactor(frame.replacement, branch, falseNode), true);
            } else {
                lowFrame = new Frame(rule.lowCofactor(frame.low, branch), rule.lowCofactor(frame.high, branch),
                        rule.lowCofactor(frame.replacement, branch), frame.passed);
                highFrame = new Frame(rule.highCofactor(frame.low, branch, falseNode),
                        rule.highCofactor(frame.high, branch, falseNode),
                        rule.highCofactor(frame.replacement, branch, falseNode), frame.passed);
            }
            stack.push(highFrame);
            stack.push(lowFrame);
        }
        assert results.size() == 1;
        return results.pop();
    }

    private static final class Frame {
        final Node low;
        final Node high;
        final Node replacement;
        final boolean passed;
        @Nullable
        Key key;
        int branch = -1;

        Frame(Node low, Node high, Node replacement, boolean passed) {
            this.low = low;
            this.high = high;
            this.replacement = replacement;
            this.passed = passed;
        }
    }

    private static final class Key {
        private final int low;
        private final int high;
        private final int replacement;
        private final boolean passed;

        Key(int low, int high, int replacement, boolean passed) {
            this.low = low;
            this.high = high;
            this.replacement = replacement;
            this.passed = passed;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Key)) {
                return false;
            }
            Key other = (Key) o;
            return low == other.low && high == other.high && replacement == other.replacement
                    && passed == other.passed;
        }

        @Override
        public int hashCode() {
            return 2 * HashUtil.hash(low, high, replacement) + (passed ? 1 : 0);
        }
    }
}
