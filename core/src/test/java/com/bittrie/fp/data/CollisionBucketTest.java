/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.bittrie.fp.data;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class CollisionBucketTest {
    private static final Comparator<String> CMP = Comparator.naturalOrder();

    private static CollisionBucket<String> bucket(String... values) {
        CollisionBucket<String> b = CollisionBucket.of(values[0]);
        for (int i = 1; i < values.length; i++) {
            b = b.add(values[i], CMP);
        }
        return b;
    }

    @Test
    public void elements_are_kept_sorted() {
        CollisionBucket<String> b = bucket("m", "c", "x", "a");
        assertEquals("[a,c,m,x]", b.toString());
        assertEquals(4, b.size());
        assertEquals("a", b.first());
        assertEquals("x", b.last());
    }

    @Test
    public void adding_present_value_returns_same_bucket() {
        CollisionBucket<String> b = bucket("a", "b", "c");
        assertSame(b, b.add("b", CMP));
        assertSame(b, b.add(new String("c"), CMP));
    }

    @Test
    public void test_contains() {
        CollisionBucket<String> b = bucket("b", "d", "f");
        assertTrue(b.contains("d", CMP));
        assertFalse(b.contains("c", CMP));
        assertFalse(b.contains("z", CMP));
    }

    @Test
    public void test_remove() {
        CollisionBucket<String> b = bucket("b", "d", "f");
        assertEquals("[b,f]", b.remove("d", CMP).toString());
        assertSame(b, b.remove("e", CMP));
        assertNull(CollisionBucket.of("x").remove("x", CMP));
    }

    @Test
    public void remove_shares_tail() {
        CollisionBucket<String> b = bucket("a", "b", "c", "d");
        CollisionBucket<String> r = b.remove("b", CMP);
        assertSame(b.next.next, r.next);
    }

    @Test
    public void test_traversals() {
        CollisionBucket<String> b = bucket("b", "a", "c");
        List<String> asc = new ArrayList<>();
        b.forEach(asc::add);
        assertEquals("[a, b, c]", asc.toString());

        List<String> desc = new ArrayList<>();
        b.descendingIterator().forEachRemaining(desc::add);
        assertEquals("[c, b, a]", desc.toString());

        assertEquals("abc", b.foldLeft("", (r, s) -> r + s));
        assertEquals("cba", b.foldRight("", (s, r) -> r + s));
    }

    @Test
    public void test_set_operations() {
        CollisionBucket<String> x = bucket("a", "b", "c");
        CollisionBucket<String> y = bucket("b", "c", "d");

        assertEquals("[a,b,c,d]", CollisionBucket.union(x, y, CMP).toString());
        assertEquals("[b,c]", CollisionBucket.intersect(x, y, CMP).toString());
        assertEquals("[a]", CollisionBucket.difference(x, y, CMP).toString());

        assertSame(x, CollisionBucket.union(x, bucket("a"), CMP));
        assertNull(CollisionBucket.intersect(x, bucket("z"), CMP));
        assertNull(CollisionBucket.difference(x, x, CMP));
        assertSame(x, CollisionBucket.difference(x, bucket("z"), CMP));
    }

    @Test
    public void test_isSubset() {
        CollisionBucket<String> x = bucket("a", "c");
        CollisionBucket<String> y = bucket("a", "b", "c");
        assertTrue(CollisionBucket.isSubset(x, y, CMP));
        assertFalse(CollisionBucket.isSubset(y, x, CMP));
        assertFalse(CollisionBucket.isSubset(bucket("d"), y, CMP));
    }

    @Test
    public void test_filter() {
        CollisionBucket<String> b = bucket("a", "b", "c");
        assertEquals("[a,c]", b.filter(s -> !s.equals("b")).toString());
        assertSame(b, b.filter(s -> true));
        assertNull(b.filter(s -> false));
    }
}
