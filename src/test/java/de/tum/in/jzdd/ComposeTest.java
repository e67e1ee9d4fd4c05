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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import java.util.BitSet;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

public class ComposeTest {
    private static final BitSet ONE_TO_THREE = BitSet.valueOf(new long[] {0b1110});

    public static Stream<DiagramEngine> engines() {
        return Stream.of(DiagramFactory.buildEngineRecursive(), DiagramFactory.buildEngineIterative());
    }

    private static void check(Diagram diagram, int size, int paths, int assignments) {
        assertThat(diagram.size(), is(size));
        assertThat(diagram.satisfyAll(), is(BigInteger.valueOf(paths)));
        assertThat(diagram.countSatisfyingAssignments(ONE_TO_THREE), is(BigInteger.valueOf(assignments)));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("engines")
    public void testMajority(DiagramEngine engine) {
        Diagram majority = engine.reduce(Examples.majority(), ReductionRule.BDD);
        Diagram x1x3 = engine.reduce(Examples.x1x3(), ReductionRule.BDD);

        check(engine.compose(majority, x1x3, 1), 6, 3, 5);
        check(engine.compose(majority, x1x3, 2), 4, 2, 6);
        check(engine.compose(majority, x1x3, 3), 6, 3, 5);

        check(engine.compose(majority, engine.constant(true, ReductionRule.BDD), 2), 4, 2, 6);
        check(engine.compose(majority, engine.constant(false, ReductionRule.BDD), 2), 4, 1, 2);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("engines")
    public void testZddRestriction(DiagramEngine engine) {
        Diagram independent = engine.reduce(Examples.independentSet(), ReductionRule.ZDD);
        Diagram restricted = engine.compose(independent, engine.constant(false, ReductionRule.ZDD), 1);
        // Independent sets of the path 2 - ... - 6, with or without 1
        assertThat(restricted.size(), is(7));
        assertThat(restricted.satisfyAll(), is(BigInteger.valueOf(26)));
        BitSet oneToSix = new BitSet();
        oneToSix.set(1, 7);
        assertThat(restricted.countSatisfyingAssignments(oneToSix), is(BigInteger.valueOf(26)));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("engines")
    public void testUnusedVariable(DiagramEngine engine) {
        for (ReductionRule rule : ReductionRule.values()) {
            Diagram majority = engine.reduce(Examples.majority(), rule);
            Diagram x2x3 = engine.reduce(Examples.x2x3(), rule);
            Diagram composed = engine.compose(majority, x2x3, 7);
            assertThat(TreeGenerator.truthTable(composed, 8), is(expected(majority, x2x3, 7, 8)));
            if (rule == ReductionRule.BDD) {
                assertThat(composed.isIsomorphic(majority), is(true));
            }
        }
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("engines")
    public void testSelfSubstitution(DiagramEngine engine) {
        for (ReductionRule rule : ReductionRule.values()) {
            Diagram majority = engine.reduce(Examples.majority(), rule);
            Diagram x1x2x4 = engine.reduce(Examples.x1x2x4(), rule);
            for (int variable = 0; variable <= 5; variable++) {
                assertThat(TreeGenerator.truthTable(engine.compose(majority, x1x2x4, variable), 6),
                        is(expected(majority, x1x2x4, variable, 6)));
                assertThat(TreeGenerator.truthTable(engine.compose(x1x2x4, majority, variable), 6),
                        is(expected(x1x2x4, majority, variable, 6)));
            }
        }
    }

    static boolean[] expected(Diagram diagram, Diagram replacement, int variable, int variableCount) {
        boolean[] table = new boolean[1 << variableCount];
        for (int mask = 0; mask < table.length; mask++) {
            BitSet assignment = TreeGenerator.assignment(mask);
            BitSet substituted = TreeGenerator.assignment(mask);
            substituted.set(variable, replacement.evaluate(assignment));
            table[mask] = diagram.evaluate(substituted);
        }
        return table;
    }

    @Test
    public void testInvalidArguments() {
        DiagramEngine engine = DiagramFactory.buildEngine();
        Diagram bdd = engine.reduce(Examples.majority(), ReductionRule.BDD);
        Diagram zdd = engine.reduce(Examples.majority(), ReductionRule.ZDD);
        assertThrows(IllegalArgumentException.class, () -> engine.compose(bdd, zdd, 1));
        assertThrows(IllegalArgumentException.class, () -> engine.compose(bdd, bdd, -1));
    }
}
