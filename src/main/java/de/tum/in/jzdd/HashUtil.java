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

final class HashUtil {
    // Cheap hashes, the memo tables are hit once per visited operand combination

    static final int PRIME = 0x1000193;

    private HashUtil() {}

    static long key(int firstId, int secondId) {
        return ((long) firstId << 32) | (secondId & 0xFFFF_FFFFL);
    }

    static int hash(int firstKey, int secondKey, int thirdKey) {
        return (PRIME * (PRIME * firstKey + secondKey)) + thirdKey;
    }
}
