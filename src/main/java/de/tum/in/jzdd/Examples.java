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

import java.util.BitSet;
import java.util.function.Predicate;

/**
 * Raw decision trees of some classic example functions. Every call builds a fresh, unreduced graph.
 */
public final class Examples {
    private Examples() {}

    /**
     * Builds the complete decision tree over the variables {@code first} to {@code last} (inclusive)
     * whose leaves are the values of {@code predicate} on the assignment of the respective path. The
     * tree has {@code 2^(last - first + 2) - 1} nodes and no sharing.
     */
    public static Node completeTree(int first, int last, Predicate<BitSet> predicate) {
        Util.checkArgument(0 <= first && first <= last + 1, "Invalid variable range [%d, %d]", first, last);
        return completeTree(first, last, new BitSet(), predicate);
    }

    private static Node completeTree(int variable, int last, BitSet assignment, Predicate<BitSet> predicate) {
        if (variable > last) {
            return Node.constant(predicate.test(assignment));
        }
        Node low = completeTree(variable + 1, last, assignment, predicate);
        assignment.set(variable);
        Node high = completeTree(variable + 1, last, assignment, predicate);
        assignment.clear(variable);
        return Node.decision(variable, low, high);
    }

    /**
     * The independent sets of the cycle with vertices {@code 1} to {@code 6}.
     */
    public static Node independentSet() {
        return independentSet(6);
    }

    /**
     * The independent sets of the cycle with vertices {@code 1} to {@code length}, where {@code i} is
     * adjacent to {@code i + 1} and {@code length} to {@code 1}.
     */
    public static Node independentSet(int length) {
        Util.checkArgument(length >= 3, "Cycle of length %d", length);
        return completeTree(1, length, set -> isIndependent(set, length));
    }

    /**
     * The kernels (maximal independent sets) of the cycle with vertices {@code 1} to {@code 6}.
     */
    public static Node kernels() {
        return kernels(6);
    }

    public static Node kernels(int length) {
        Util.checkArgument(length >= 3, "Cycle of length %d", length);
        return completeTree(1, length, set -> isKernel(set, length));
    }

    static boolean isIndependent(BitSet set, int length) {
        for (int vertex = 1; vertex <= length; vertex++) {
            if (set.get(vertex) && set.get(successor(vertex, length))) {
                return false;
            }
        }
        return true;
    }

    static boolean isKernel(BitSet set, int length) {
        if (!isIndependent(set, length)) {
            return false;
        }
        for (int vertex = 1; vertex <= length; vertex++) {
            if (!set.get(vertex) && !set.get(successor(vertex, length)) && !set.get(predecessor(vertex, length))) {
                return false;
            }
        }
        return true;
    }

    private static int successor(int vertex, int length) {
        return vertex % length + 1;
    }

    private static int predecessor(int vertex, int length) {
        return (vertex + length - 2) % length + 1;
    }

    /**
     * At least two of the variables {@code 1}, {@code 2} and {@code 3} are true.
     */
    public static Node majority() {
        return Node.decision(1,
                Node.decision(2, Node.constant(false), Node.decision(3, Node.constant(false), Node.constant(true))),
                Node.decision(2, Node.decision(3, Node.constant(false), Node.constant(true)), Node.constant(true)));
    }

    // x1x3 and x2x3 are the operands of figure 7 in R. E. Bryant, Graph-Based Algorithms for Boolean
    // Function Manipulation, IEEE Trans. on Computers C-35(8), 1986

    /**
     * {@code !x1 | !x3}.
     */
    public static Node x1x3() {
        return Node.decision(1, Node.constant(true), Node.decision(3, Node.constant(true), Node.constant(false)));
    }

    /**
     * {@code x2 & x3}.
     */
    public static Node x2x3() {
        return Node.decision(2, Node.constant(false), Node.decision(3, Node.constant(false), Node.constant(true)));
    }

    /**
     * {@code (!x1 & (!x2 | !x4)) | (x1 & x2)}.
     */
    public static Node x1x2x4() {
        return Node.decision(1,
                Node.decision(2, Node.constant(true), Node.decision(4, Node.constant(true), Node.constant(false))),
                Node.decision(2, Node.constant(false), Node.constant(true)));
    }
}
