/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.bittrie.fp.data;

/**
 * Bit twiddling on 32-bit trie keys. All keys, prefixes and masks are
 * treated as unsigned bit patterns.
 */
final class BitOps {
    private BitOps() {}

    /**
     * Returns {@code true} if the bit selected by mask {@code m} is clear
     * in {@code k}.
     */
    static boolean zeroBit(int k, int m) {
        return (k & m) == 0;
    }

    /**
     * Computes the prefix of {@code k} above mask bit {@code m}. The mask bit
     * itself is cleared and every bit below it is set, so a key routes left
     * exactly when it is unsigned-less-or-equal to the prefix.
     */
    static int mask(int k, int m) {
        return (k | (m - 1)) & ~m;
    }

    static boolean matchPrefix(int k, int p, int m) {
        return mask(k, m) == p;
    }

    /**
     * Finds the highest bit at which {@code p0} and {@code p1} disagree.
     * Returns a power of two containing this (and only this) bit.
     */
    static int branchingBit(int p0, int p1) {
        return Integer.highestOneBit(p0 ^ p1);
    }

    /**
     * Returns {@code true} if a branch on mask {@code m1} sits above a branch
     * on mask {@code m2}, i.e. {@code m1} covers a shorter prefix.
     */
    static boolean shorter(int m1, int m2) {
        return Integer.compareUnsigned(m1, m2) > 0;
    }
}
