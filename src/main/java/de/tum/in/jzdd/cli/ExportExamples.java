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
package de.tum.in.jzdd.cli;

import de.tum.in.jzdd.BooleanOperator;
import de.tum.in.jzdd.Diagram;
import de.tum.in.jzdd.DiagramEngine;
import de.tum.in.jzdd.DiagramFactory;
import de.tum.in.jzdd.Examples;
import de.tum.in.jzdd.ReductionRule;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.helper.HelpScreenException;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

/**
 * Reduces the example functions and writes each resulting diagram as {@code <name>.<rule>.gv}.
 */
public final class ExportExamples {
    private static final Logger logger = Logger.getLogger(ExportExamples.class.getName());

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private ExportExamples() {}

    public static void main(String[] args) {
        int status = run(args);
        if (status != EXIT_SUCCESS) {
            System.exit(status);
        }
    }

    static int run(String... args) {
        ArgumentParser parser = ArgumentParsers
                .newFor("jzdd-examples").build()
                .defaultHelp(true)
                .description("Export the example decision diagrams in graphviz format");
        parser.addArgument("directory").nargs("?").setDefault(".").help("Output directory");
        parser.addArgument("-r", "--rule").choices("bdd", "zdd", "both").setDefault("both")
                .help("Reduction rules to export");
        parser.addArgument("--iterative").action(Arguments.storeTrue())
                .help("Use the explicit-stack algorithms");

        Namespace namespace;
        try {
            namespace = parser.parseArgs(args);
        } catch (HelpScreenException e) {
            return EXIT_SUCCESS;
        } catch (ArgumentParserException e) {
            parser.handleError(e);
            return EXIT_USAGE;
        }

        String rule = namespace.getString("rule");
        Set<ReductionRule> rules = "both".equals(rule)
                ? EnumSet.allOf(ReductionRule.class)
                : EnumSet.of(ReductionRule.valueOf(rule.toUpperCase(Locale.ROOT)));
        DiagramEngine engine = namespace.getBoolean("iterative")
                ? DiagramFactory.buildEngineIterative()
                : DiagramFactory.buildEngineRecursive();
        return export(engine, rules, Path.of(namespace.getString("directory")));
    }

    static int export(DiagramEngine engine, Set<ReductionRule> rules, Path directory) {
        try {
            Files.createDirectories(directory);
            for (ReductionRule rule : rules) {
                String suffix = "." + rule.name().toLowerCase(Locale.ROOT) + ".gv";
                for (Map.Entry<String, Diagram> entry : diagrams(engine, rule).entrySet()) {
                    Path file = directory.resolve(entry.getKey() + suffix);
                    try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                        entry.getValue().export(writer);
                    }
                    logger.log(Level.FINE, "Wrote {0}", file);
                }
            }
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to export diagrams to " + directory, e);
            return EXIT_FAILURE;
        }
        return EXIT_SUCCESS;
    }

    static Map<String, Diagram> diagrams(DiagramEngine engine, ReductionRule rule) {
        Map<String, Diagram> diagrams = new LinkedHashMap<>();
        diagrams.put("independent_set", engine.reduce(Examples.independentSet(), rule));
        diagrams.put("kernels", engine.reduce(Examples.kernels(), rule));
        diagrams.put("majority", engine.reduce(Examples.majority(), rule));
        diagrams.put("x1x3", engine.reduce(Examples.x1x3(), rule));
        diagrams.put("x2x3", engine.reduce(Examples.x2x3(), rule));
        diagrams.put("x1x2x4", engine.reduce(Examples.x1x2x4(), rule));

        Diagram x1x3 = diagrams.get("x1x3");
        Diagram x2x3 = diagrams.get("x2x3");
        diagrams.put("x1x3_or_x2x3", engine.apply(BooleanOperator.OR, x1x3, x2x3));
        diagrams.put("x1x3_and_x2x3", engine.apply(BooleanOperator.AND, x1x3, x2x3));
        diagrams.put("independent_set_diff_kernels",
                engine.apply(BooleanOperator.DIFFERENCE, diagrams.get("independent_set"), diagrams.get("kernels")));
        diagrams.put("majority_x2_by_x1x3", engine.compose(diagrams.get("majority"), x1x3, 2));
        return diagrams;
    }
}
