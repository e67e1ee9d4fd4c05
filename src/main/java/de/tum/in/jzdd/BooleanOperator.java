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

/**
 * A binary boolean operator as used by {@link DiagramEngine#apply(BooleanOperator, Diagram,
 * Diagram)}, stored as its truth table.
 *
 * <p>Besides evaluation, the operator knows for each side which operand value (if any) determines
 * the result regardless of the other operand. This drives the early termination of apply.</p>
 */
public final class BooleanOperator {
    /** Function evaluated pointwise by an operator. */
    @FunctionalInterface
    public interface BooleanFunction {
        boolean apply(boolean left, boolean right);
    }

    static final int NOT_FORCED = -1;

    public static final BooleanOperator AND = new BooleanOperator("AND", 0b1000);
    public static final BooleanOperator OR = new BooleanOperator("OR", 0b1110);
    public static final BooleanOperator XOR = new BooleanOperator("XOR", 0b0110);
    public static final BooleanOperator NAND = new BooleanOperator("NAND", 0b0111);
    public static final BooleanOperator NOR = new BooleanOperator("NOR", 0b0001);
    public static final BooleanOperator IMPLIES = new BooleanOperator("IMPLIES", 0b1011);
    public static final BooleanOperator EQUIVALENCE = new BooleanOperator("EQUIVALENCE", 0b1001);
    public static final BooleanOperator DIFFERENCE = new BooleanOperator("DIFFERENCE", 0b0100);
    public static final BooleanOperator LEFT = new BooleanOperator("LEFT", 0b1100);
    public static final BooleanOperator RIGHT = new BooleanOperator("RIGHT", 0b1010);

    private final String name;
    // Bit (left ? 2 : 0) + (right ? 1 : 0) holds the result
    private final int truthTable;
    private final int[] forcedByLeft = new int[2];
    private final int[] forcedByRight = new int[2];

    private BooleanOperator(String name, int truthTable) {
        assert 0 <= truthTable && truthTable < 16;
        this.name = name;
        this.truthTable = truthTable;
        for (int value = 0; value < 2; value++) {
            boolean operand = value == 1;
            forcedByLeft[value] = forced(evaluate(operand, false), evaluate(operand, true));
            forcedByRight[value] = forced(evaluate(false, operand), evaluate(true, operand));
        }
    }

    private static int forced(boolean onFalse, boolean onTrue) {
        if (onFalse != onTrue) {
            return NOT_FORCED;
        }
        return onFalse ? 1 : 0;
    }

    private static int tableOf(BooleanFunction function) {
        int table = 0;
        for (int index = 0; index < 4; index++) {
            if (function.apply((index & 2) != 0, (index & 1) != 0)) {
                table |= 1 << index;
            }
        }
        return table;
    }

    /**
     * Creates the operator computing {@code function}.
     */
    public static BooleanOperator of(BooleanFunction function) {
        return new BooleanOperator("OP" + Integer.toBinaryString(tableOf(function) | 16).substring(1),
                tableOf(function));
    }

    /**
     * Creates the operator computing {@code function}, given a value which decides the result when
     * it occurs as either operand, e.g. {@code false} for conjunction.
     *
     * @throws IllegalArgumentException if {@code absorbingValue} does not decide the result of {@code
     *     function} on both sides.
     */
    public static BooleanOperator of(BooleanFunction function, boolean absorbingValue) {
        BooleanOperator operator = of(function);
        Util.checkArgument(operator.isAbsorbing(absorbingValue), "%s is not absorbing for %s",
                absorbingValue, operator);
        return operator;
    }

    public boolean evaluate(boolean left, boolean right) {
        return (truthTable & (1 << ((left ? 2 : 0) + (right ? 1 : 0)))) != 0;
    }

    /**
     * Determines whether the given value, occurring as either operand, yields itself.
     */
    public boolean isAbsorbing(boolean value) {
        int expected = value ? 1 : 0;
        int index = value ? 1 : 0;
        return forcedByLeft[index] == expected && forcedByRight[index] == expected;
    }

    /**
     * Determines whether combining two {@code false} operands yields {@code false}. Only such
     * operators can be applied to zero-suppressed diagrams.
     */
    public boolean preservesEmptiness() {
        return !evaluate(false, false);
    }

    /**
     * Returns {@code 0} or {@code 1} if a left operand {@code value} forces that result, or {@link
     * #NOT_FORCED}.
     */
    int forcedByLeft(boolean value) {
        return forcedByLeft[value ? 1 : 0];
    }

    int forcedByRight(boolean value) {
        return forcedByRight[value ? 1 : 0];
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof BooleanOperator && truthTable == ((BooleanOperator) o).truthTable);
    }

    @Override
    public int hashCode() {
        return truthTable;
    }

    @Override
    public String toString() {
        return name;
    }
}
