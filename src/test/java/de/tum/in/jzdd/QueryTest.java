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
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class QueryTest {
    private static final BitSet ONE_TO_THREE = BitSet.valueOf(new long[] {0b1110});

    private final DiagramEngine engine = DiagramFactory.buildEngine();

    private static BitSet toBitSet(Set<Integer> set) {
        BitSet bitSet = new BitSet();
        set.forEach(bitSet::set);
        return bitSet;
    }

    @Test
    public void testConstants() {
        for (ReductionRule rule : ReductionRule.values()) {
            Diagram falseDiagram = engine.constant(false, rule);
            assertThat(falseDiagram.size(), is(1));
            assertThat(falseDiagram.allNodes().contains(falseDiagram.root()), is(true));
            assertThat(falseDiagram.satisfyOne(), is(false));
            assertThat(falseDiagram.satisfyAll(), is(BigInteger.ZERO));
            assertThat(falseDiagram.support().isEmpty(), is(true));
            assertThrows(NoSuchElementException.class, falseDiagram::getSatisfyingAssignment);

            Diagram trueDiagram = engine.constant(true, rule);
            assertThat(trueDiagram.satisfyOne(), is(true));
            assertThat(trueDiagram.satisfyAll(), is(BigInteger.ONE));
            assertThat(trueDiagram.getSatisfyingAssignment().isEmpty(), is(true));
        }
        assertThat(engine.constant(true, ReductionRule.BDD).countSatisfyingAssignments(ONE_TO_THREE),
                is(BigInteger.valueOf(8)));
        assertThat(engine.constant(true, ReductionRule.ZDD).countSatisfyingAssignments(ONE_TO_THREE),
                is(BigInteger.ONE));
    }

    @Test
    public void testSatisfyOneMatchesSatisfyAll() {
        TreeGenerator generator = new TreeGenerator(11L, 6);
        for (int i = 0; i < 100; i++) {
            Node graph = generator.randomGraph();
            for (ReductionRule rule : ReductionRule.values()) {
                Diagram diagram = engine.reduce(graph, rule);
                assertThat(diagram.satisfyOne(), is(diagram.satisfyAll().signum() > 0));
                assertThat(diagram.satisfyOne(), is(!diagram.isFalse()));
            }
        }
    }

    @Test
    public void testEvaluate() {
        Set<Integer> vertices = ImmutableSet.of(1, 2, 3, 4, 5, 6);
        for (ReductionRule rule : ReductionRule.values()) {
            Diagram independent = engine.reduce(Examples.independentSet(), rule);
            for (Set<Integer> subset : Sets.powerSet(vertices)) {
                BitSet assignment = toBitSet(subset);
                assertThat(independent.evaluate(assignment), is(Examples.isIndependent(assignment, 6)));
            }
        }

        Diagram majority = engine.reduce(Examples.majority(), ReductionRule.BDD);
        assertThat(majority.evaluate(new boolean[] {false, true, false, true}), is(true));
        assertThat(majority.evaluate(new boolean[] {true, true, false, false}), is(false));
    }

    @Test
    public void testZddUntestedVariables() {
        Diagram zdd = engine.reduce(Examples.x2x3(), ReductionRule.ZDD);
        assertThat(zdd.evaluate(toBitSet(ImmutableSet.of(2, 3))), is(true));
        // Variable 1 is not tested and therefore absent from every member
        assertThat(zdd.evaluate(toBitSet(ImmutableSet.of(1, 2, 3))), is(false));

        Diagram bdd = engine.reduce(Examples.x2x3(), ReductionRule.BDD);
        assertThat(bdd.evaluate(toBitSet(ImmutableSet.of(1, 2, 3))), is(true));
    }

    @Test
    public void testCountSatisfyingAssignments() {
        Diagram x1x3 = engine.reduce(Examples.x1x3(), ReductionRule.BDD);
        assertThat(x1x3.countSatisfyingAssignments(ONE_TO_THREE), is(BigInteger.valueOf(6)));
        BitSet wider = BitSet.valueOf(new long[] {0b111110});
        assertThat(x1x3.countSatisfyingAssignments(wider), is(BigInteger.valueOf(24)));
        assertThrows(IllegalArgumentException.class, () -> x1x3.countSatisfyingAssignments(new BitSet()));

        Diagram majority = engine.reduce(Examples.majority(), ReductionRule.BDD);
        assertThat(majority.countSatisfyingAssignments(ONE_TO_THREE), is(BigInteger.valueOf(4)));
        assertThat(majority.allNodes().size(), is(6));
        Diagram x2x3 = engine.reduce(Examples.x2x3(), ReductionRule.BDD);
        assertThat(x2x3.countSatisfyingAssignments(ONE_TO_THREE), is(BigInteger.TWO));
    }

    @Test
    public void testSupport() {
        assertThat(engine.reduce(Examples.x1x2x4(), ReductionRule.BDD).support(),
                is(toBitSet(ImmutableSet.of(1, 2, 4))));
        // The ZDD of x1x3 does not need to test 3
        assertThat(engine.reduce(Examples.x1x3(), ReductionRule.ZDD).support(), is(toBitSet(ImmutableSet.of(1))));
    }

    @Test
    public void testSatisfyingAssignment() {
        TreeGenerator generator = new TreeGenerator(3L, 6);
        for (int i = 0; i < 100; i++) {
            Node graph = generator.randomGraph();
            for (ReductionRule rule : ReductionRule.values()) {
                Diagram diagram = engine.reduce(graph, rule);
                if (diagram.isFalse()) {
                    continue;
                }
                assertThat(diagram.evaluate(diagram.getSatisfyingAssignment()), is(true));
            }
        }
    }

    @Test
    public void testForEachPath() {
        Diagram majority = engine.reduce(Examples.majority(), ReductionRule.BDD);
        List<BitSet> paths = new ArrayList<>();
        List<BitSet> supports = new ArrayList<>();
        majority.forEachPath((path, support) -> {
            paths.add(BitSets.copyOf(path));
            supports.add(BitSets.copyOf(support));
        });
        assertThat(paths, contains(toBitSet(ImmutableSet.of(2, 3)), toBitSet(ImmutableSet.of(1, 3)),
                toBitSet(ImmutableSet.of(1, 2))));
        assertThat(supports, contains(toBitSet(ImmutableSet.of(1, 2, 3)), toBitSet(ImmutableSet.of(1, 2, 3)),
                toBitSet(ImmutableSet.of(1, 2))));

        Diagram kernels = engine.reduce(Examples.kernels(), ReductionRule.ZDD);
        List<BitSet> members = new ArrayList<>();
        kernels.forEachPath((path, support) -> members.add(BitSets.copyOf(path)));
        assertThat(members.size(), is(5));
        for (BitSet member : members) {
            assertThat(Examples.isKernel(member, 6), is(true));
            assertThat(kernels.evaluate(member), is(true));
        }
    }
}
