/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.bittrie.fp.data;

import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.stream.IntStream;

import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

public abstract class HashTrieMapTestBase {
    interface Key {
        int hashCode();
        boolean equals(Object obj);
    }

    private HashTrieMap<Key, Integer> hm;
    private Integer[] data;
    private Key key;

    protected abstract Key newKey(int value);

    @Before
    public void initialize() {
        data = shuffle(200);
        hm = HashTrieMap.empty();
        key = newKey(42);
        for (Integer x : data) {
            put(newKey(x), x);
        }
    }

    static Integer[] shuffle(int len) {
        Random rnd = new Random();
        return IntStream.generate(() -> rnd.nextInt(len))
                        .distinct().limit(len)
                        .boxed().toArray(Integer[]::new);
    }

    private void assertGetFail(Key key) {
        try {
            hm.get(key);
            fail("Removed mapping still exist");
        } catch (NoSuchElementException ex) {
            // ok
        }
    }

    private void put(Key key, Integer value) {
        hm = hm.put(key, value);
    }

    private void remove(Key key) {
        hm = hm.remove(key);
    }

    @Test
    public void test_empty() {
        HashTrieMap<String, Integer> m = HashTrieMap.empty();
        assertTrue(m.isEmpty());
        assertEquals(0, m.size());
        assertFalse(m.containsKey("XXX"));
        assertFalse(m.iterator().hasNext());
    }

    @Test
    public void test_containsKey() {
        assertTrue(hm.containsKey(key));
        assertFalse(hm.containsKey(newKey(-1)));
    }

    @Test
    public void test_get() {
        assertSame(data[42], hm.get(newKey(data[42])));
        assertEquals(Integer.valueOf(-5), hm.getOrDefault(newKey(-1), -5));
        assertGetFail(newKey(-1));
    }

    @Test
    public void test_get_same_value() {
        HashTrieMap<Integer, Object> m = HashTrieMap.empty();
        Integer k1 = 1, k2 = 2;
        Object o = new Object();
        m = m.put(k1, o).put(k2, o);
        assertSame(o, m.get(k1));
        assertSame(o, m.get(k2));
    }

    @Test
    public void test_put() {
        Key k1 = newKey(42);
        Integer o1 = 1984;
        put(k1, o1);
        assertEquals(data.length, hm.size());
        assertSame(o1, hm.get(k1));

        Key k2 = newKey(1984);
        Integer o2 = 2046;
        put(k2, o2);
        assertEquals(data.length + 1, hm.size());
        assertEquals(o2, hm.get(k2));
    }

    @Test
    public void put_same_value_returns_same_map() {
        Integer v = hm.get(key);
        assertSame(hm, hm.put(newKey(42), v));
    }

    @Test
    public void test_remove() {
        remove(key);
        assertEquals(data.length - 1, hm.size());
        assertTrue(!hm.containsKey(key));
        assertTrue(!hm.lookup(key).isPresent());
        assertGetFail(key);
    }

    @Test
    public void validate_remove() {
        for (int i = 0; i < data.length; i++) {
            remove(newKey(i));
        }
        assertTrue(hm.isEmpty());
        assertEquals(0, hm.size());
    }

    @Test
    public void test_remove_not_exists() {
        HashTrieMap<Key, Integer> before = hm;
        remove(newKey(-1));
        assertSame(before, hm);
        assertEquals(data.length, hm.size());
    }

    @Test
    public void test_putIfAbsent_positive() {
        Integer o = hm.get(key);
        HashTrieMap<Key, Integer> before = hm;
        hm = hm.putIfAbsent(key, 1984);
        assertSame(before, hm);
        assertSame(o, hm.get(key));
    }

    @Test
    public void test_putIfAbsent_negative() {
        Key k = newKey(1984);
        Integer o = 1984;

        assertTrue(!hm.containsKey(k));
        hm = hm.putIfAbsent(k, o);
        assertEquals(data.length + 1, hm.size());
        assertSame(o, hm.get(k));
    }

    @Test
    public void test_putAll() {
        HashTrieMap<Key, Integer> other = HashTrieMap.<Key, Integer>empty()
            .put(newKey(42), -42).put(newKey(1984), 1984);
        HashTrieMap<Key, Integer> m = hm.putAll(other);
        assertEquals(data.length + 1, m.size());
        assertEquals(Integer.valueOf(-42), m.get(newKey(42)));
        assertEquals(Integer.valueOf(1984), m.get(newKey(1984)));
        assertEquals(Integer.valueOf(42), hm.get(newKey(42)));
    }

    @Test
    public void test_keys() {
        ImmutableList<Key> ks = hm.keys();
        assertEquals(data.length, ks.size());
        ks.forEach(k -> assertTrue(hm.containsKey(k)));
    }

    @Test
    public void test_entries() {
        int n = 0;
        for (Map.Entry<Key, Integer> e : hm) {
            assertSame(hm.get(e.getKey()), e.getValue());
            n++;
        }
        assertEquals(data.length, n);
        assertEquals(data.length, hm.stream().count());
    }

    @Test
    public void test_fold_and_forEach() {
        int sum = hm.foldLeft(0, (r, k, v) -> r + v);
        assertEquals(199 * 200 / 2, sum);

        int[] total = new int[1];
        hm.forEach((k, v) -> total[0] += v);
        assertEquals(sum, total[0]);
    }

    @Test
    public void test_toMap() {
        Map<Key, Integer> map = hm.toMap();
        assertEquals(data.length, map.size());
        for (int i = 0; i < data.length; i++) {
            assertEquals(Integer.valueOf(i), map.get(newKey(i)));
        }
        assertEquals(hm, HashTrieMap.fromMap(map));
        assertEquals(hm, HashTrieMap.fromIterable(hm));
        assertEquals(hm.hashCode(), HashTrieMap.fromMap(map).hashCode());
    }

    @Test
    public void test_equals() {
        HashTrieMap<Key, Integer> other = HashTrieMap.empty();
        for (int i = data.length - 1; i >= 0; i--) {
            other = other.put(newKey(i), i);
        }
        assertEquals(hm, other);
        assertNotEquals(hm, other.put(newKey(0), -1));
        assertNotEquals(hm, other.remove(newKey(0)));
    }

    @Test
    public void agrees_with_java_util_HashMap() {
        HashMap<Character, Integer> expected = new HashMap<>();
        HashTrieMap<Character, Integer> actual = HashTrieMap.empty();
        for (char c = 'a'; c <= 'z'; c++) {
            expected.put(c, (int)c);
            actual = actual.put(c, (int)c);
        }
        for (char c : "aeiou".toCharArray()) {
            expected.remove(c);
            actual = actual.remove(c);
        }

        assertEquals(expected.size(), actual.size());
        HashTrieMap<Character, Integer> result = actual;
        expected.forEach((k, v) -> {
            assertTrue(result.containsKey(k));
            assertEquals(v, result.get(k));
        });
    }
}
