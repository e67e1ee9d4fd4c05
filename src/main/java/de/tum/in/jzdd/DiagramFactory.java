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

public final class DiagramFactory {
    private DiagramFactory() {}

    public static DiagramEngine buildEngine() {
        return buildEngine(ImmutableDiagramConfiguration.builder().build());
    }

    public static DiagramEngine buildEngineRecursive() {
        return buildEngine(ImmutableDiagramConfiguration.builder().iterative(false).build());
    }

    public static DiagramEngine buildEngineIterative() {
        return buildEngine(ImmutableDiagramConfiguration.builder().iterative(true).build());
    }

    public static DiagramEngine buildEngine(DiagramConfiguration configuration) {
        return new DiagramEngineImpl(configuration);
    }
}
