/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.bittrie.fp.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Random;

import org.junit.Test;
import static org.junit.Assert.*;
import static org.hamcrest.Matchers.*;

import com.bittrie.fp.data.PatriciaTrie.Branch;
import com.bittrie.fp.data.PatriciaTrie.Leaf;
import com.bittrie.fp.data.PatriciaTrie.Node;

public class PatriciaTrieTest {
    private static Node<String> build(int... keys) {
        Node<String> t = PatriciaTrie.empty();
        for (int k : keys) {
            t = PatriciaTrie.insert(t, k, "v" + k, (old, v) -> v);
        }
        return t;
    }

    /**
     * Checks the shape of a trie: branches have two non-empty children,
     * a single-bit mask, and every key below them agrees with the prefix
     * and is routed by the mask bit.
     */
    static void validate(Node<?> t) {
        if (t instanceof Branch) {
            Branch<?> b = (Branch<?>)t;
            assertEquals("mask must be a single bit", 1, Integer.bitCount(b.mask));
            assertFalse(b.left.isEmpty());
            assertFalse(b.right.isEmpty());
            for (int k : keysOf(b.left)) {
                assertTrue(BitOps.matchPrefix(k, b.prefix, b.mask));
                assertTrue(BitOps.zeroBit(k, b.mask));
            }
            for (int k : keysOf(b.right)) {
                assertTrue(BitOps.matchPrefix(k, b.prefix, b.mask));
                assertFalse(BitOps.zeroBit(k, b.mask));
            }
            if (b.left instanceof Branch)
                assertThat(Integer.compareUnsigned(((Branch<?>)b.left).mask, b.mask), lessThan(0));
            if (b.right instanceof Branch)
                assertThat(Integer.compareUnsigned(((Branch<?>)b.right).mask, b.mask), lessThan(0));
            validate(b.left);
            validate(b.right);
        }
    }

    static List<Integer> keysOf(Node<?> t) {
        List<Integer> keys = new ArrayList<>();
        Iterator<? extends Leaf<?>> it = PatriciaTrie.iterator(t, false);
        while (it.hasNext()) {
            keys.add(it.next().key);
        }
        return keys;
    }

    @Test
    public void empty_trie() {
        Node<String> t = PatriciaTrie.empty();
        assertTrue(t.isEmpty());
        assertEquals(0, PatriciaTrie.count(t));
        assertNull(PatriciaTrie.lookup(t, 0));
        assertNull(PatriciaTrie.first(t));
        assertNull(PatriciaTrie.last(t));
        assertFalse(PatriciaTrie.iterator(t, false).hasNext());
        assertSame(t, PatriciaTrie.remove(t, 42));
    }

    @Test
    public void shape_is_valid_after_random_inserts() {
        Random rnd = new Random(1984);
        Node<String> t = PatriciaTrie.empty();
        for (int i = 0; i < 2000; i++) {
            t = PatriciaTrie.insert(t, rnd.nextInt(), "x", (old, v) -> v);
        }
        validate(t);
    }

    @Test
    public void shape_is_valid_after_removes() {
        Node<String> t = build(5, 3, 11, 2, 17, 4, 12, 14, -1, Integer.MIN_VALUE);
        for (int k : new int[]{11, -1, 4}) {
            t = PatriciaTrie.remove(t, k);
            validate(t);
            assertNull(PatriciaTrie.lookup(t, k));
        }
        assertEquals(7, PatriciaTrie.count(t));
    }

    @Test
    public void branch_collapses_to_surviving_child() {
        Node<String> t = build(1, 2);
        assertThat(t, instanceOf(Branch.class));
        Node<String> r = PatriciaTrie.remove(t, 1);
        assertThat(r, instanceOf(Leaf.class));
        assertEquals(2, ((Leaf<String>)r).key);
        assertTrue(PatriciaTrie.remove(r, 2).isEmpty());
    }

    @Test
    public void unchanged_update_returns_same_node() {
        Node<String> t = build(5, 3, 11, 2, 17);
        assertSame(t, PatriciaTrie.remove(t, 99));
        assertSame(t, PatriciaTrie.insert(t, 3, "other", (old, v) -> old));
        assertSame(t, PatriciaTrie.alter(t, 11, p -> p));
        assertSame(t, PatriciaTrie.alter(t, 99, p -> "new"));
    }

    @Test
    public void update_shares_untouched_subtrees() {
        Node<String> t = build(0, 1, 0x100, 0x101);
        Branch<String> b = (Branch<String>)t;
        Node<String> u = PatriciaTrie.insert(t, 0x102, "x", (old, v) -> v);
        Branch<String> c = (Branch<String>)u;
        assertSame(b.left, c.left);
        assertNotSame(b.right, c.right);
    }

    @Test
    public void alter_with_null_removes_key() {
        Node<String> t = build(1, 2, 3);
        Node<String> u = PatriciaTrie.alter(t, 2, p -> null);
        assertEquals(2, PatriciaTrie.count(u));
        assertNull(PatriciaTrie.lookup(u, 2));
        validate(u);
    }

    @Test
    public void traversal_is_unsigned_ascending() {
        Node<String> t = build(-1, 0, Integer.MIN_VALUE, Integer.MAX_VALUE, 7, -7);
        assertEquals(Arrays.asList(0, 7, Integer.MAX_VALUE, Integer.MIN_VALUE, -7, -1), keysOf(t));
        assertEquals(0, PatriciaTrie.first(t).key);
        assertEquals(-1, PatriciaTrie.last(t).key);

        List<Integer> desc = new ArrayList<>();
        Iterator<Leaf<String>> it = PatriciaTrie.iterator(t, true);
        while (it.hasNext()) {
            desc.add(it.next().key);
        }
        assertEquals(Arrays.asList(-1, -7, Integer.MIN_VALUE, Integer.MAX_VALUE, 7, 0), desc);
    }

    @Test
    public void folds_visit_in_key_order() {
        Node<String> t = build(3, 1, 2);
        String left = PatriciaTrie.foldLeft(t, "", (s, e) -> s + e.key);
        String right = PatriciaTrie.foldRight(t, "", (e, s) -> s + e.key);
        assertEquals("123", left);
        assertEquals("321", right);
    }

    @Test
    public void skewed_trie_traversal() {
        // one key per bit position yields a trie as deep as the key width
        Node<String> t = PatriciaTrie.empty();
        for (int i = 0; i < 32; i++) {
            t = PatriciaTrie.insert(t, 1 << i, "b" + i, (old, v) -> v);
        }
        t = PatriciaTrie.insert(t, 0, "zero", (old, v) -> v);
        validate(t);
        assertEquals(33, PatriciaTrie.count(t));
        assertEquals(33, keysOf(t).size());
        assertEquals(Integer.MIN_VALUE, PatriciaTrie.last(t).key);
    }

    @Test
    public void large_trie_count_and_traversal() {
        Node<Integer> t = PatriciaTrie.empty();
        for (int i = 0; i < 100_000; i++) {
            t = PatriciaTrie.insert(t, i * 7919, i, (old, v) -> v);
        }
        assertEquals(100_000, PatriciaTrie.count(t));
        int n = PatriciaTrie.foldLeft(t, 0, (c, e) -> c + 1);
        assertEquals(100_000, n);
    }

    @Test
    public void find_stops_at_first_match() {
        Node<String> t = build(5, 3, 11, 2);
        assertEquals(3, PatriciaTrie.find(t, (k, v) -> k > 2).key);
        assertNull(PatriciaTrie.find(t, (k, v) -> k > 100));
    }

    @Test
    public void union_prefers_merger_result() {
        Node<String> s = build(1, 2, 3);
        Node<String> t = PatriciaTrie.insert(build(3, 4), 3, "t3", (old, v) -> v);
        Node<String> u = PatriciaTrie.union(s, t, (a, b) -> b);
        validate(u);
        assertEquals(Arrays.asList(1, 2, 3, 4), keysOf(u));
        assertEquals("t3", PatriciaTrie.lookup(u, 3).payload);
        assertSame(s, PatriciaTrie.union(s, PatriciaTrie.empty(), (a, b) -> b));
        assertSame(s, PatriciaTrie.union(s, s, (a, b) -> b));
    }

    @Test
    public void union_of_disjoint_prefixes_joins() {
        Node<String> s = build(0x10, 0x11);
        Node<String> t = build(-0x10, -0x11);
        Node<String> u = PatriciaTrie.union(s, t, (a, b) -> b);
        validate(u);
        assertEquals(Arrays.asList(0x10, 0x11, -0x11, -0x10), keysOf(u));
    }

    @Test
    public void intersect_and_difference() {
        Node<String> s = build(1, 2, 3, 4, 100, -5);
        Node<String> t = build(2, 4, 6, -5);

        Node<String> i = PatriciaTrie.intersect(s, t, (a, b) -> a);
        validate(i);
        assertEquals(Arrays.asList(2, 4, -5), keysOf(i));

        Node<String> d = PatriciaTrie.difference(s, t, (a, b) -> null);
        validate(d);
        assertEquals(Arrays.asList(1, 3, 100), keysOf(d));

        assertTrue(PatriciaTrie.intersect(s, build(7, 8), (a, b) -> a).isEmpty());
        assertSame(s, PatriciaTrie.difference(s, build(7, 8), (a, b) -> null));
    }

    @Test
    public void test_isSubset() {
        Node<String> s = build(2, 4);
        Node<String> t = build(1, 2, 3, 4);
        assertTrue(PatriciaTrie.isSubset(s, t, (a, b) -> true));
        assertFalse(PatriciaTrie.isSubset(t, s, (a, b) -> true));
        assertTrue(PatriciaTrie.isSubset(PatriciaTrie.empty(), s, (a, b) -> true));
        assertFalse(PatriciaTrie.isSubset(s, t, (a, b) -> false));
    }

    @Test
    public void filter_and_map() {
        Node<String> t = build(1, 2, 3, 4, 5);
        Node<String> f = PatriciaTrie.filter(t, (k, v) -> k % 2 == 1 ? v : null);
        validate(f);
        assertEquals(Arrays.asList(1, 3, 5), keysOf(f));
        assertSame(t, PatriciaTrie.filter(t, (k, v) -> v));

        Node<Integer> m = PatriciaTrie.map(t, (k, v) -> v.length() + k);
        assertEquals(Integer.valueOf(7), PatriciaTrie.lookup(m, 5).payload);
    }

    @Test
    public void leaf_is_an_immutable_entry() {
        Leaf<String> leaf = (Leaf<String>)build(7);
        assertEquals(Integer.valueOf(7), leaf.getKey());
        assertEquals("v7", leaf.getValue());
        assertEquals(new java.util.AbstractMap.SimpleImmutableEntry<>(7, "v7"), leaf);
        assertEquals(new java.util.AbstractMap.SimpleImmutableEntry<>(7, "v7").hashCode(), leaf.hashCode());
        try {
            leaf.setValue("x");
            fail("Leaf must be immutable");
        } catch (UnsupportedOperationException ex) {
            // ok
        }
    }
}
