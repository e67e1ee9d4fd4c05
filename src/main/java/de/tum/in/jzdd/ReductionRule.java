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

/**
 * The reading of a decision diagram, fixing when a vertex is redundant and what an untested
 * variable means.
 */
public enum ReductionRule {
    /**
     * Binary decision diagrams: a vertex with identical successors is eliminated and a variable not
     * tested along a path may take either value.
     */
    BDD {
        @Override
        boolean isRedundant(int lowId, int highId) {
            return lowId == highId;
        }

        @Override
        Node highCofactor(Node node, int variable, Node falseNode) {
            return node.variable() == variable ? node.high() : node;
        }

        @Override
        boolean isUniform(boolean leafValue) {
            return true;
        }

        @Override
        boolean skippedVariablesAreFree() {
            return true;
        }
    },
    /**
     * Zero-suppressed decision diagrams: a vertex whose high successor is the false terminal is
     * eliminated and a variable not tested along a path must be {@code false}.
     */
    ZDD {
        @Override
        boolean isRedundant(int lowId, int highId) {
            return highId == NodeIndex.FALSE_ID;
        }

        @Override
        Node highCofactor(Node node, int variable, Node falseNode) {
            return node.variable() == variable ? node.high() : falseNode;
        }

        @Override
        boolean isUniform(boolean leafValue) {
            return !leafValue;
        }

        @Override
        boolean skippedVariablesAreFree() {
            return false;
        }
    };

    abstract boolean isRedundant(int lowId, int highId);

    /**
     * Returns the function represented by {@code node} with {@code variable} fixed to {@code false},
     * provided no variable smaller than {@code variable} is tested at {@code node}.
     */
    Node lowCofactor(Node node, int variable) {
        return node.variable() == variable ? node.low() : node;
    }

    /**
     * Returns the function represented by {@code node} with {@code variable} fixed to {@code true},
     * provided no variable smaller than {@code variable} is tested at {@code node}.
     */
    abstract Node highCofactor(Node node, int variable, Node falseNode);

    /**
     * Determines whether a terminal with the given value represents the same constant on every
     * assignment. A ZDD true terminal only accepts the assignment setting every remaining variable to
     * {@code false}.
     */
    abstract boolean isUniform(boolean leafValue);

    abstract boolean skippedVariablesAreFree();

    /**
     * Evaluates the function rooted at {@code node} on the assignment given by the set bits.
     */
    boolean evaluate(Node node, BitSet assignment) {
        Node current = node;
        int consumed = 0;
        while (!current.isLeaf()) {
            if (assignment.get(current.variable())) {
                consumed += 1;
                current = current.high();
            } else {
                current = current.low();
            }
        }
        return current.value() && (skippedVariablesAreFree() || consumed == assignment.cardinality());
    }
}
