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

final class BitSets {
    private BitSets() {}

    @SuppressWarnings("UseOfClone")
    static BitSet copyOf(BitSet set) {
        return (BitSet) set.clone();
    }

    static boolean isSubset(BitSet set, BitSet of) {
        if (set.cardinality() > of.cardinality()) {
            return false;
        }
        BitSet copy = copyOf(set);
        copy.andNot(of);
        return copy.isEmpty();
    }

    /**
     * Returns the number of elements of {@code set} smaller than {@code bit}.
     */
    static BitSet of(boolean[] values) {
        BitSet set = new BitSet(values.length);
        for (int i = 0; i < values.length; i++) {
            if (values[i]) {
                set.set(i);
            }
        }
        return set;
    }

    static int[] toArray(BitSet set) {
        int[] array = new int[set.cardinality()];
        int position = 0;
        for (int bit = set.nextSetBit(0); bit >= 0; bit = set.nextSetBit(bit + 1)) {
            array[position] = bit;
            position += 1;
        }
        return array;
    }
}
