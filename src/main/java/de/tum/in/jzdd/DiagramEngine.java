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
 * Entry point for building and combining canonical decision diagrams.
 *
 * <p>An engine holds configuration only. Every operation is a pure function of its arguments and
 * returns a freshly allocated, canonical {@link Diagram}; no structure is shared between results of
 * different calls. Diagrams of different {@link ReductionRule rules} cannot be combined without an
 * explicit {@link #convert(Diagram, ReductionRule, BitSet) conversion}.</p>
 */
public interface DiagramEngine {
    DiagramConfiguration configuration();

    /**
     * Canonicalizes the ordered graph rooted at {@code root} under {@code rule}. The input graph is
     * not modified and may share no structure with the result.
     *
     * @throws IllegalArgumentException if the graph is not ordered.
     */
    Diagram reduce(Node root, ReductionRule rule);

    /**
     * Returns the diagram of the given constant function. For {@link ReductionRule#ZDD}, {@code true}
     * is the family containing only the empty set.
     */
    default Diagram constant(boolean value, ReductionRule rule) {
        return reduce(Node.constant(value), rule);
    }

    /**
     * Computes {@code operator(left, right)} pointwise.
     *
     * @throws IllegalArgumentException if the operands use different rules, or if they are
     *     zero-suppressed and {@code operator} maps two {@code false} operands to {@code true}.
     */
    Diagram apply(BooleanOperator operator, Diagram left, Diagram right);

    /**
     * Computes {@code function(left, right)} pointwise, where {@code absorbingValue} decides the
     * result whenever it occurs as an operand.
     *
     * @see BooleanOperator#of(BooleanOperator.BooleanFunction, boolean)
     */
    default Diagram apply(BooleanOperator.BooleanFunction function, boolean absorbingValue, Diagram left,
            Diagram right) {
        return apply(BooleanOperator.of(function, absorbingValue), left, right);
    }

    default Diagram and(Diagram left, Diagram right) {
        return apply(BooleanOperator.AND, left, right);
    }

    default Diagram or(Diagram left, Diagram right) {
        return apply(BooleanOperator.OR, left, right);
    }

    default Diagram xor(Diagram left, Diagram right) {
        return apply(BooleanOperator.XOR, left, right);
    }

    /**
     * Substitutes {@code replacement} for {@code variable} in {@code diagram}, i.e. computes {@code
     * ite(replacement, diagram[variable := true], diagram[variable := false])}.
     *
     * @throws IllegalArgumentException if the diagrams use different rules or {@code variable} is
     *     negative.
     */
    Diagram compose(Diagram diagram, Diagram replacement, int variable);

    /**
     * Translates {@code diagram} into the canonical diagram of the same function under {@code target},
     * where the function is read over exactly the given variables.
     *
     * @throws IllegalArgumentException if {@code diagram} tests a variable outside of {@code
     *     variables}.
     */
    Diagram convert(Diagram diagram, ReductionRule target, BitSet variables);
}
