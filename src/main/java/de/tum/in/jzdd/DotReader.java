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

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * Reads the graphs written by {@link DotWriter} back into raw nodes. Shared vertices stay shared;
 * the result is not reduced.
 */
public final class DotReader {
    private static final Pattern HEADER = Pattern.compile("digraph\\s+\\w+\\s*\\{");
    private static final Pattern GRAPH_ATTRIBUTE = Pattern.compile("(\\w+\\s*=.*|(node|edge|graph)\\s*\\[.*])");
    private static final Pattern RECORD = Pattern.compile("(\\w+)\\s*\\[(.*)];?");
    private static final Pattern EDGE = Pattern.compile("(\\w+)\\s*->\\s*(\\w+)\\s*\\[(.*)];?");
    private static final Pattern ATTRIBUTE = Pattern.compile("(\\w+)\\s*=\\s*(\"([^\"]*)\"|[^,\\s]+)");

    private DotReader() {}

    @Nullable
    private static String nextLine(BufferedReader reader) throws IOException {
        while (true) {
            String line = reader.readLine();
            if (line == null) {
                return null;
            }
            String stripped = line.strip();
            if (!stripped.isEmpty() && !stripped.startsWith("//")) {
                return stripped;
            }
        }
    }

    private static Map<String, String> attributes(String list) {
        Map<String, String> attributes = new HashMap<>();
        Matcher matcher = ATTRIBUTE.matcher(list);
        while (matcher.find()) {
            String quoted = matcher.group(3);
            attributes.put(matcher.group(1), quoted == null ? matcher.group(2) : quoted);
        }
        return attributes;
    }

    public static Node read(BufferedReader reader) throws IOException, InvalidFormatException {
        String header = nextLine(reader);
        if (header == null) {
            throw new InvalidFormatException("Stream is empty");
        }
        if (!HEADER.matcher(header).matches()) {
            throw new InvalidFormatException("Invalid header " + header);
        }

        Graph graph = new Graph();
        while (true) {
            String line = nextLine(reader);
            if (line == null) {
                throw new InvalidFormatException("Missing closing brace");
            }
            if ("}".equals(line)) {
                break;
            }
            Matcher edge = EDGE.matcher(line);
            if (edge.matches()) {
                graph.addEdge(edge.group(1), edge.group(2), attributes(edge.group(3)), line);
                continue;
            }
            if (GRAPH_ATTRIBUTE.matcher(line).matches()) {
                continue;
            }
            Matcher record = RECORD.matcher(line);
            if (!record.matches()) {
                throw new InvalidFormatException("Unrecognized line " + line);
            }
            graph.addRecord(record.group(1), attributes(record.group(2)), line);
        }
        return graph.build();
    }

    private static final class Graph {
        private final Map<String, Integer> variables = new LinkedHashMap<>();
        private final Map<String, String> lowEdges = new HashMap<>();
        private final Map<String, String> highEdges = new HashMap<>();
        private final Set<String> targets = new HashSet<>();
        private final Map<String, Node> built = new HashMap<>();
        private final Set<String> inProgress = new HashSet<>();
        private boolean hasRootRecord = false;
        @Nullable
        private String root = null;

        Graph() {
            built.put(String.valueOf(NodeIndex.FALSE_ID), Node.constant(false));
            built.put(String.valueOf(NodeIndex.TRUE_ID), Node.constant(true));
        }

        void addRecord(String id, Map<String, String> attributes, String line) throws InvalidFormatException {
            if (built.containsKey(id)) {
                return;
            }
            if (DotWriter.ROOT_RECORD.equals(id)) {
                hasRootRecord = true;
                return;
            }
            String label = attributes.get("label");
            if (label == null) {
                throw new InvalidFormatException("Record without label: " + line);
            }
            int variable;
            try {
                variable = Integer.parseInt(label);
            } catch (NumberFormatException e) {
                throw new InvalidFormatException("Invalid variable in " + line, e);
            }
            if (variable < 0 || variables.put(id, variable) != null) {
                throw new InvalidFormatException("Invalid record " + line);
            }
        }

        void addEdge(String source, String target, Map<String, String> attributes, String line)
                throws InvalidFormatException {
            if (DotWriter.ROOT_RECORD.equals(source)) {
                if (root != null) {
                    throw new InvalidFormatException("Duplicate root edge " + line);
                }
                root = target;
                return;
            }
            targets.add(target);
            boolean isLow = "dotted".equals(attributes.get("style"));
            boolean isBoth = "black".equals(attributes.get("color"));
            if ((isLow || isBoth) && lowEdges.putIfAbsent(source, target) != null) {
                throw new InvalidFormatException("Duplicate low edge " + line);
            }
            if (!isLow && highEdges.putIfAbsent(source, target) != null) {
                throw new InvalidFormatException("Duplicate high edge " + line);
            }
        }

        Node build() throws InvalidFormatException {
            String rootId = root;
            if (rootId == null) {
                if (hasRootRecord) {
                    throw new InvalidFormatException("Root record without edge");
                }
                Set<String> sources = new HashSet<>(variables.keySet());
                sources.removeAll(targets);
                if (sources.size() != 1) {
                    throw new InvalidFormatException("Cannot determine root among " + sources);
                }
                rootId = sources.iterator().next();
            }
            for (String source : lowEdges.keySet()) {
                checkKnown(source);
            }
            for (String source : highEdges.keySet()) {
                checkKnown(source);
            }
            return node(rootId);
        }

        private void checkKnown(String id) throws InvalidFormatException {
            if (!variables.containsKey(id) && !built.containsKey(id)) {
                throw new InvalidFormatException("Edge from undeclared record " + id);
            }
        }

        private Node node(String rootId) throws InvalidFormatException {
            Deque<String> stack = new ArrayDeque<>();
            stack.push(rootId);
            while (!stack.isEmpty()) {
                String id = stack.peek();
                if (built.containsKey(id)) {
                    stack.pop();
                    continue;
                }
                Integer variable = variables.get(id);
                if (variable == null) {
                    throw new InvalidFormatException("Edge to undeclared record " + id);
                }
                String low = lowEdges.get(id);
                String high = highEdges.get(id);
                if (low == null || high == null) {
                    throw new InvalidFormatException("Record " + id + " is missing an outgoing edge");
                }
                Node lowNode = built.get(low);
                Node highNode = built.get(high);
                if (lowNode != null && highNode != null) {
                    built.put(id, Node.decision(variable, lowNode, highNode));
                    inProgress.remove(id);
                    stack.pop();
                    continue;
                }
                // Revisiting a record before its successors are built means it is reachable from one of them
                if (!inProgress.add(id)) {
                    throw new InvalidFormatException("Cycle through record " + id);
                }
                if (highNode == null) {
                    stack.push(high);
                }
                if (lowNode == null) {
                    stack.push(low);
                }
            }
            return built.get(rootId);
        }
    }

    public static class InvalidFormatException extends Exception {
        public InvalidFormatException(String message) {
            super(message);
        }

        public InvalidFormatException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
