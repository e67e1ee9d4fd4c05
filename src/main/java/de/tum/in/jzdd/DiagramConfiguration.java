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

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class DiagramConfiguration {
    /**
     * Whether apply and compose descend with an explicit stack instead of the call stack. Needed for
     * diagrams deeper than the thread stack allows.
     */
    @Value.Default
    public boolean iterative() {
        return false;
    }

    /**
     * Whether apply and compose check that their operands are canonical before combining them.
     */
    @Value.Default
    public boolean validateInputs() {
        return false;
    }

    /**
     * Whether per-operation node counts are logged at {@code INFO} instead of {@code FINE}.
     */
    @Value.Default
    public boolean logStatistics() {
        return false;
    }
}
