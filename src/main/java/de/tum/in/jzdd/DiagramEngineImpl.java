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
import java.util.logging.Level;
import java.util.logging.Logger;

final class DiagramEngineImpl implements DiagramEngine {
    private static final Logger logger = Logger.getLogger(DiagramEngineImpl.class.getName());

    private final DiagramConfiguration configuration;
    private final boolean iterative;
    private final Level statisticsLevel;

    DiagramEngineImpl(DiagramConfiguration configuration) {
        this.configuration = configuration;
        this.iterative = configuration.iterative();
        this.statisticsLevel = configuration.logStatistics() ? Level.INFO : Level.FINE;
    }

    @Override
    public DiagramConfiguration configuration() {
        return configuration;
    }

    @Override
    public Diagram reduce(Node root, ReductionRule rule) {
        return new Diagram(this, Reducer.reduce(root, rule), rule);
    }

    @Override
    public Diagram apply(BooleanOperator operator, Diagram left, Diagram right) {
        ReductionRule rule = checkCompatible(left, right);
        Util.checkArgument(rule == ReductionRule.BDD || operator.preservesEmptiness(),
                "%s maps (false, false) to true, which has no zero-suppressed representation", operator);

        Node combined = Combinator.apply(operator, rule, left.root(), right.root(), iterative);
        Diagram result = reduce(combined, rule);
        if (logger.isLoggable(statisticsLevel)) {
            logger.log(statisticsLevel, "{0} {1} of {2} and {3} nodes: {4} intermediate, {5} reduced",
                    new Object[] {rule, operator, left.size(), right.size(), Nodes.reachable(combined).size(),
                        result.size()});
        }
        return result;
    }

    @Override
    public Diagram compose(Diagram diagram, Diagram replacement, int variable) {
        ReductionRule rule = checkCompatible(diagram, replacement);
        Util.checkArgument(variable >= 0, "Negative variable %d", variable);

        Node composed = Substituter.compose(rule, diagram.root(), replacement.root(), variable, iterative);
        Diagram result = reduce(composed, rule);
        if (logger.isLoggable(statisticsLevel)) {
            logger.log(statisticsLevel, "{0} compose of {1} nodes at variable {2} with {3} nodes: {4} reduced",
                    new Object[] {rule, diagram.size(), variable, replacement.size(), result.size()});
        }
        return result;
    }

    @Override
    public Diagram convert(Diagram diagram, ReductionRule target, BitSet variables) {
        Node expanded = Converter.expand(diagram.root(), diagram.rule(), BitSets.toArray(variables));
        Diagram result = reduce(expanded, target);
        if (logger.isLoggable(statisticsLevel)) {
            logger.log(statisticsLevel, "Converted {0} nodes from {1} to {2} nodes in {3} over {4}",
                    new Object[] {diagram.size(), diagram.rule(), result.size(), target, variables});
        }
        return result;
    }

    private ReductionRule checkCompatible(Diagram first, Diagram second) {
        Util.checkArgument(first.rule() == second.rule(), "Cannot combine a %s with a %s without conversion",
                first.rule(), second.rule());
        if (configuration.validateInputs()) {
            Util.checkArgument(Reducer.isReduced(first.root(), first.rule()), "Operand %s is not canonical", first);
            Util.checkArgument(Reducer.isReduced(second.root(), second.rule()), "Operand %s is not canonical",
                    second);
        }
        return first.rule();
    }

    @Override
    public String toString() {
        return "DiagramEngine" + (iterative ? "[iterative]" : "[recursive]");
    }
}
