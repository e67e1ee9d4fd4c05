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
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import java.util.BitSet;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

public class ReducerTest {
    private final DiagramEngine engine = DiagramFactory.buildEngine();

    private static BitSet variables(int first, int last) {
        BitSet set = new BitSet();
        set.set(first, last + 1);
        return set;
    }

    // name, tree, BDD size, BDD paths, ZDD size, ZDD paths
    public static Stream<Arguments> fixtures() {
        return Stream.of(
                Arguments.of("independent set", (Supplier<Node>) Examples::independentSet, 16, 11, 10, 18),
                Arguments.of("kernels", (Supplier<Node>) Examples::kernels, 17, 5, 10, 5),
                Arguments.of("majority", (Supplier<Node>) Examples::majority, 6, 3, 6, 3),
                Arguments.of("x1x3", (Supplier<Node>) Examples::x1x3, 4, 2, 2, 2),
                Arguments.of("x2x3", (Supplier<Node>) Examples::x2x3, 4, 1, 4, 1),
                Arguments.of("x1x2x4", (Supplier<Node>) Examples::x1x2x4, 6, 3, 5, 3));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("fixtures")
    public void testFixtures(String name, Supplier<Node> tree, int bddSize, int bddPaths, int zddSize,
            int zddPaths) {
        Diagram bdd = engine.reduce(tree.get(), ReductionRule.BDD);
        assertThat(bdd.size(), is(bddSize));
        assertThat(bdd.satisfyAll(), is(BigInteger.valueOf(bddPaths)));

        Diagram zdd = engine.reduce(tree.get(), ReductionRule.ZDD);
        assertThat(zdd.size(), is(zddSize));
        assertThat(zdd.satisfyAll(), is(BigInteger.valueOf(zddPaths)));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("fixtures")
    public void testIdempotent(String name, Supplier<Node> tree, int bddSize, int bddPaths, int zddSize,
            int zddPaths) {
        for (ReductionRule rule : ReductionRule.values()) {
            Diagram reduced = engine.reduce(tree.get(), rule);
            Diagram again = engine.reduce(reduced.root(), rule);
            assertThat(again.size(), is(reduced.size()));
            assertThat(again.isIsomorphic(reduced), is(true));
            assertThat(again.root(), not(sameInstance(reduced.root())));
            assertThat(Reducer.isReduced(reduced.root(), rule), is(true));
        }
    }

    @Test
    public void testIndependentSet() {
        Node tree = Examples.independentSet();
        assertThat(Nodes.reachable(tree).size(), is(127));

        Diagram raw = new Diagram(engine, tree, ReductionRule.BDD);
        assertThat(raw.satisfyAll(), is(BigInteger.valueOf(18)));
        assertThat(raw.countSatisfyingAssignments(variables(1, 6)), is(BigInteger.valueOf(18)));

        Diagram bdd = engine.reduce(tree, ReductionRule.BDD);
        assertThat(bdd.countSatisfyingAssignments(variables(1, 6)), is(BigInteger.valueOf(18)));
        Diagram zdd = engine.reduce(tree, ReductionRule.ZDD);
        assertThat(zdd.countSatisfyingAssignments(variables(1, 6)), is(BigInteger.valueOf(18)));

        // The input is left untouched
        assertThat(Nodes.reachable(tree).size(), is(127));
        assertThat(Reducer.isReduced(tree, ReductionRule.BDD), is(false));
    }

    @Test
    public void testKernelsAreMaximalIndependentSets() {
        Diagram kernels = engine.reduce(Examples.kernels(), ReductionRule.BDD);
        Diagram independent = engine.reduce(Examples.independentSet(), ReductionRule.BDD);
        Diagram both = engine.and(kernels, independent);
        assertThat(both.isIsomorphic(kernels), is(true));
        assertThat(kernels.countSatisfyingAssignments(variables(1, 6)), is(BigInteger.valueOf(5)));

        // Kernels of longer cycles are counted by the Perrin numbers
        Diagram cycle = engine.reduce(Examples.kernels(10), ReductionRule.ZDD);
        assertThat(cycle.satisfyAll(), is(BigInteger.valueOf(17)));
        assertThat(engine.reduce(Examples.independentSet(10), ReductionRule.ZDD).satisfyAll(),
                is(BigInteger.valueOf(123)));
    }

    @Test
    public void testRedundantVertices() {
        Node bothFalse = Node.decision(2, Node.constant(false), Node.constant(false));
        for (ReductionRule rule : ReductionRule.values()) {
            Diagram diagram = engine.reduce(bothFalse, rule);
            assertThat(diagram.size(), is(1));
            assertThat(diagram.isFalse(), is(true));
            assertThat(diagram.satisfyOne(), is(false));
        }

        Node bothTrue = Node.decision(2, Node.constant(true), Node.constant(true));
        Diagram bdd = engine.reduce(bothTrue, ReductionRule.BDD);
        assertThat(bdd.size(), is(1));
        assertThat(bdd.root().isConstant(true), is(true));

        // {{}, {2}} needs a vertex in a ZDD
        Diagram zdd = engine.reduce(bothTrue, ReductionRule.ZDD);
        assertThat(zdd.size(), is(2));
        assertThat(zdd.satisfyAll(), is(BigInteger.TWO));

        Node highFalse = Node.decision(2, Node.constant(true), Node.constant(false));
        assertThat(engine.reduce(highFalse, ReductionRule.ZDD).size(), is(1));
        assertThat(engine.reduce(highFalse, ReductionRule.BDD).size(), is(3));
    }

    @Test
    public void testSharing() {
        Node first = Node.decision(5, Node.constant(false), Node.constant(true));
        Node second = Node.decision(5, Node.constant(false), Node.constant(true));
        Node root = Node.decision(1, first, Node.decision(3, second, Node.constant(false)));
        Diagram bdd = engine.reduce(root, ReductionRule.BDD);
        assertThat(bdd.size(), is(5));
        assertThat(bdd.root().low(), sameInstance(bdd.root().high().low()));
    }

    @Test
    public void testTerminalRoot() {
        Node leaf = Node.constant(true);
        Diagram diagram = engine.reduce(leaf, ReductionRule.ZDD);
        assertThat(diagram.root().isConstant(true), is(true));
        assertThat(diagram.root(), not(sameInstance(leaf)));
        assertThat(diagram.size(), is(1));
        assertThat(diagram.satisfyAll(), is(BigInteger.ONE));
    }

    @Test
    public void testUnordered() {
        Node inner = Node.decision(1, Node.constant(false), Node.constant(true));
        assertThrows(IllegalArgumentException.class,
                () -> engine.reduce(Node.decision(2, inner, Node.constant(true)), ReductionRule.BDD));
        Node same = Node.decision(2, Node.constant(false), Node.constant(true));
        assertThrows(IllegalArgumentException.class,
                () -> engine.reduce(Node.decision(2, same, Node.constant(false)), ReductionRule.ZDD));
    }

    @Test
    public void testCanonicalAcrossConstructions() {
        TreeGenerator generator = new TreeGenerator(7L, 5);
        for (int i = 0; i < 50; i++) {
            Node graph = generator.randomGraph();
            for (ReductionRule rule : ReductionRule.values()) {
                Diagram reduced = engine.reduce(graph, rule);
                Diagram fromTable = engine.reduce(TreeGenerator.tree(TreeGenerator.truthTable(graph, rule, 5), 5),
                        rule);
                assertThat(reduced.isIsomorphic(fromTable), is(true));
                assertThat(TreeGenerator.truthTable(reduced, 5), is(TreeGenerator.truthTable(graph, rule, 5)));
            }
        }
    }
}
