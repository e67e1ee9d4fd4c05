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
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * A canonical decision diagram: the root of a reduced graph together with the rule it is reduced
 * under. Instances are created by a {@link DiagramEngine} and are immutable.
 *
 * <p>Under {@link ReductionRule#BDD}, the diagram represents a boolean function in which variables
 * not tested on a path are unconstrained. Under {@link ReductionRule#ZDD}, it represents a family of
 * sets of variables (the assignments evaluating to {@code true}), and variables not tested on a path
 * are absent from the set.</p>
 */
public final class Diagram {
    private final DiagramEngine engine;
    private final Node root;
    private final ReductionRule rule;

    Diagram(DiagramEngine engine, Node root, ReductionRule rule) {
        this.engine = engine;
        this.root = root;
        this.rule = rule;
    }

    public Node root() {
        return root;
    }

    public ReductionRule rule() {
        return rule;
    }

    public DiagramEngine engine() {
        return engine;
    }

    public boolean isFalse() {
        return root.isConstant(false);
    }

    /**
     * Returns all nodes reachable from the root, terminals included.
     */
    public Set<Node> allNodes() {
        return Nodes.reachableSet(root);
    }

    /**
     * Returns the number of reachable nodes, terminals included.
     */
    public int size() {
        return Nodes.reachable(root).size();
    }

    /**
     * Returns the set of variables tested by some reachable vertex.
     */
    public BitSet support() {
        BitSet support = new BitSet();
        for (Node node : Nodes.reachable(root)) {
            if (!node.isLeaf()) {
                support.set(node.variable());
            }
        }
        return support;
    }

    /**
     * Determines whether the true terminal is reachable, i.e. whether the function is satisfiable.
     */
    public boolean satisfyOne() {
        Set<Node> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            if (node.isLeaf()) {
                if (node.value()) {
                    return true;
                }
                continue;
            }
            if (visited.add(node)) {
                stack.push(node.high());
                stack.push(node.low());
            }
        }
        return false;
    }

    /**
     * Counts the root-to-true paths. For a zero-suppressed diagram, this is the number of sets in the
     * represented family; for a binary decision diagram, use {@link
     * #countSatisfyingAssignments(BitSet)} to count assignments.
     */
    public BigInteger satisfyAll() {
        Map<Node, BigInteger> counts = new IdentityHashMap<>();
        for (Node node : Nodes.bottomUp(root)) {
            counts.put(node, count(counts, node.low()).add(count(counts, node.high())));
        }
        return count(counts, root);
    }

    private static BigInteger count(Map<Node, BigInteger> counts, Node node) {
        if (node.isLeaf()) {
            return node.value() ? BigInteger.ONE : BigInteger.ZERO;
        }
        return counts.get(node);
    }

    /**
     * Counts the assignments to exactly the given variables which evaluate to {@code true}.
     *
     * @throws IllegalArgumentException if the diagram tests a variable not contained in {@code
     *     variables}.
     */
    public BigInteger countSatisfyingAssignments(BitSet variables) {
        BitSet support = support();
        Util.checkArgument(BitSets.isSubset(support, variables), "Support %s is not contained in %s",
                support, variables);
        if (!rule.skippedVariablesAreFree()) {
            return satisfyAll();
        }
        // ranks[v] is the number of universe variables below v
        int[] ranks = new int[variables.length() + 1];
        for (int i = 0; i < variables.length(); i++) {
            ranks[i + 1] = ranks[i] + (variables.get(i) ? 1 : 0);
        }
        int universeSize = ranks[variables.length()];
        Map<Node, BigInteger> counts = new IdentityHashMap<>();
        for (Node node : Nodes.bottomUp(root)) {
            int rank = rank(node, ranks, universeSize);
            Node low = node.low();
            Node high = node.high();
            BigInteger lowCount = count(counts, low).shiftLeft(rank(low, ranks, universeSize) - rank - 1);
            BigInteger highCount = count(counts, high).shiftLeft(rank(high, ranks, universeSize) - rank - 1);
            counts.put(node, lowCount.add(highCount));
        }
        return count(counts, root).shiftLeft(rank(root, ranks, universeSize));
    }

    private static int rank(Node node, int[] ranks, int universeSize) {
        return node.isLeaf() ? universeSize : ranks[node.variable()];
    }

    /**
     * Evaluates the function on the assignment mapping exactly the set bits to {@code true}.
     */
    public boolean evaluate(BitSet assignment) {
        return rule.evaluate(root, assignment);
    }

    public boolean evaluate(boolean[] assignment) {
        return rule.evaluate(root, BitSets.of(assignment));
    }

    /**
     * Returns the variables set to {@code true} on some path to the true terminal. Variables not
     * tested on that path are {@code false}, which makes the result a satisfying assignment under
     * both rules.
     *
     * @throws NoSuchElementException if the diagram is unsatisfiable.
     */
    public BitSet getSatisfyingAssignment() {
        if (isFalse()) {
            throw new NoSuchElementException("Diagram is unsatisfiable");
        }
        BitSet path = new BitSet();
        Node current = root;
        while (!current.isLeaf()) {
            // In a canonical diagram, every vertex other than the false terminal reaches the true terminal
            if (current.low().isConstant(false)) {
                path.set(current.variable());
                current = current.high();
            } else {
                current = current.low();
            }
        }
        assert current.value();
        return path;
    }

    /**
     * Calls {@code action} with each path to the true terminal, given as the set of variables taken
     * on a high edge and the set of variables tested along the path. Paths are enumerated with low
     * edges before high edges. The passed sets are reused between calls.
     */
    public void forEachPath(BiConsumer<BitSet, BitSet> action) {
        if (isFalse()) {
            return;
        }
        BitSet path = new BitSet();
        BitSet pathSupport = new BitSet();
        Deque<PathFrame> stack = new ArrayDeque<>();
        stack.push(new PathFrame(root));
        while (!stack.isEmpty()) {
            PathFrame frame = stack.peek();
            Node node = frame.node;
            if (node.isLeaf()) {
                if (node.value()) {
                    action.accept(path, pathSupport);
                }
                stack.pop();
                continue;
            }
            int variable = node.variable();
            switch (frame.visited) {
                case 0:
                    pathSupport.set(variable);
                    frame.visited = 1;
                    stack.push(new PathFrame(node.low()));
                    break;
                case 1:
                    path.set(variable);
                    frame.visited = 2;
                    stack.push(new PathFrame(node.high()));
                    break;
                default:
                    path.clear(variable);
                    pathSupport.clear(variable);
                    stack.pop();
                    break;
            }
        }
    }

    /**
     * Determines whether both diagrams have the same rule and isomorphic graphs. For canonical
     * diagrams, this is equivalent to representing the same function.
     */
    public boolean isIsomorphic(Diagram other) {
        if (rule != other.rule) {
            return false;
        }
        Map<Node, Node> mapping = new IdentityHashMap<>();
        Map<Node, Node> inverse = new IdentityHashMap<>();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        stack.push(other.root);
        while (!stack.isEmpty()) {
            Node theirs = stack.pop();
            Node ours = stack.pop();
            Node mapped = mapping.get(ours);
            if (mapped != null) {
                if (mapped != theirs) {
                    return false;
                }
                continue;
            }
            if (inverse.containsKey(theirs) || ours.isLeaf() != theirs.isLeaf()) {
                return false;
            }
            if (ours.isLeaf()) {
                if (ours.value() != theirs.value()) {
                    return false;
                }
            } else {
                if (ours.variable() != theirs.variable()) {
                    return false;
                }
                stack.push(ours.low());
                stack.push(theirs.low());
                stack.push(ours.high());
                stack.push(theirs.high());
            }
            mapping.put(ours, theirs);
            inverse.put(theirs, ours);
        }
        return true;
    }

    /**
     * Writes this diagram in graphviz DOT syntax.
     *
     * @see DotWriter
     */
    public void export(Appendable sink) throws IOException {
        DotWriter.write(root, sink);
    }

    public Diagram apply(BooleanOperator operator, Diagram other) {
        return engine.apply(operator, this, other);
    }

    public Diagram compose(Diagram replacement, int variable) {
        return engine.compose(this, replacement, variable);
    }

    public Diagram convert(ReductionRule target, BitSet variables) {
        return engine.convert(this, target, variables);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s[%d nodes, root %s]", rule, size(), root);
    }

    private static final class PathFrame {
        final Node node;
        // Number of successors already descended into
        int visited = 0;

        PathFrame(Node node) {
            this.node = node;
        }
    }
}
