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

import java.util.Locale;
import java.util.Objects;

/**
 * A vertex of a decision diagram: either a boolean constant or a decision vertex {@code (variable,
 * low, high)} representing {@code ite(variable, high, low)}.
 *
 * <p>Nodes are immutable. Equality and hashing are reference identity, i.e. two independently
 * constructed vertices with identical contents are distinct until unified by {@link
 * DiagramEngine#reduce(Node, ReductionRule)}. Graphs built from nodes must be ordered: along every
 * path from a vertex to a leaf, the variables strictly increase.</p>
 */
public abstract class Node {
    static final int LEAF_VARIABLE = -1;

    Node() {}

    /**
     * Creates a new terminal representing {@code value}.
     */
    public static Node constant(boolean value) {
        return new Leaf(value);
    }

    /**
     * Creates a new decision vertex branching on {@code variable}: {@code high} is taken if the
     * variable is {@code true}, {@code low} otherwise.
     *
     * @throws IllegalArgumentException if {@code variable} is negative.
     */
    public static Node decision(int variable, Node low, Node high) {
        if (variable < 0) {
            throw new IllegalArgumentException("Negative variable " + variable);
        }
        return new Decision(variable, Objects.requireNonNull(low), Objects.requireNonNull(high));
    }

    /**
     * Determines whether this node is a terminal.
     */
    public abstract boolean isLeaf();

    /**
     * Returns the constant represented by this terminal.
     *
     * @throws IllegalStateException if this node is a decision vertex.
     */
    public abstract boolean value();

    /**
     * Gets the variable tested by this node or {@code -1} for a leaf.
     */
    public abstract int variable();

    /**
     * Returns the successor taken if {@link #variable()} is {@code false}.
     *
     * @throws IllegalStateException if this node is a leaf.
     */
    public abstract Node low();

    /**
     * Returns the successor taken if {@link #variable()} is {@code true}.
     *
     * @throws IllegalStateException if this node is a leaf.
     */
    public abstract Node high();

    /**
     * Returns the level of this node used to select the branching variable when descending several
     * diagrams at once: {@code 0} or {@code 1} for the constants and {@code variable + 2} otherwise.
     */
    public abstract int unifiedKey();

    /**
     * Determines whether this node is the given constant.
     */
    public boolean isConstant(boolean constant) {
        return isLeaf() && value() == constant;
    }

    static final class Leaf extends Node {
        private final boolean value;

        Leaf(boolean value) {
            this.value = value;
        }

        @Override
        public boolean isLeaf() {
            return true;
        }

        @Override
        public boolean value() {
            return value;
        }

        @Override
        public int variable() {
            return LEAF_VARIABLE;
        }

        @Override
        public Node low() {
            throw new IllegalStateException("Leaf " + value + " has no successors");
        }

        @Override
        public Node high() {
            throw new IllegalStateException("Leaf " + value + " has no successors");
        }

        @Override
        public int unifiedKey() {
            return value ? 1 : 0;
        }

        @Override
        public String toString() {
            return value ? "T" : "F";
        }
    }

    static final class Decision extends Node {
        private final int variable;
        private final Node low;
        private final Node high;

        Decision(int variable, Node low, Node high) {
            this.variable = variable;
            this.low = low;
            this.high = high;
        }

        @Override
        public boolean isLeaf() {
            return false;
        }

        @Override
        public boolean value() {
            throw new IllegalStateException("Decision vertex on " + variable + " is not a constant");
        }

        @Override
        public int variable() {
            return variable;
        }

        @Override
        public Node low() {
            return low;
        }

        @Override
        public Node high() {
            return high;
        }

        @Override
        public int unifiedKey() {
            return variable + 2;
        }

        @Override
        public String toString() {
            // Not recursive, shared subgraphs would be expanded exponentially
            return String.format(Locale.ROOT, "D%d@%08x", variable, System.identityHashCode(this));
        }
    }
}
