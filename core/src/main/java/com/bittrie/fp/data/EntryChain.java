/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.bittrie.fp.data;

import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;

/**
 * An immutable list of key-value pairs whose keys share one hash code.
 * Keys are compared with {@code equals}; the chain has no ordering.
 * A chain is never empty, so removing its last entry yields {@code null}.
 */
final class EntryChain<K, V> implements Map.Entry<K, V> {
    final K key;
    final V value;
    final EntryChain<K, V> next;
    private final int size;

    EntryChain(K key, V value, EntryChain<K, V> next) {
        this.key = key;
        this.value = value;
        this.next = next;
        this.size = next == null ? 1 : next.size + 1;
    }

    static <K, V> EntryChain<K, V> of(K key, V value) {
        return new EntryChain<>(key, value, null);
    }

    int size() {
        return size;
    }

    EntryChain<K, V> find(BiPredicate<? super K, ? super V> pred) {
        EntryChain<K, V> p = this;
        while (p != null) {
            if (pred.test(p.key, p.value))
                return p;
            p = p.next;
        }
        return null;
    }

    EntryChain<K, V> lookup(Object key) {
        EntryChain<K, V> p = this;
        while (p != null) {
            if (p.key.equals(key))
                return p;
            p = p.next;
        }
        return null;
    }

    /**
     * Copies the entries from this one up to, but excluding, {@code end}
     * onto {@code tail}, keeping their order.
     */
    private EntryChain<K, V> copyTo(EntryChain<K, V> end, EntryChain<K, V> tail) {
        if (this == end)
            return tail;
        return new EntryChain<>(key, value, next.copyTo(end, tail));
    }

    /**
     * Binds the key to the value. An existing binding is kept when
     * {@code onlyIfAbsent} is set or when it already holds the same value.
     */
    EntryChain<K, V> put(K key, V value, boolean onlyIfAbsent) {
        EntryChain<K, V> t = lookup(key);
        if (t == null) {
            return new EntryChain<>(key, value, this);
        } else if (onlyIfAbsent || t.value == value) {
            return this;
        } else {
            return copyTo(t, new EntryChain<>(t.key, value, t.next));
        }
    }

    EntryChain<K, V> remove(Object key) {
        EntryChain<K, V> t = lookup(key);
        return t == null ? this : copyTo(t, t.next);
    }

    /**
     * Adds the entries of {@code that}, replacing the values of keys bound
     * in both.
     */
    EntryChain<K, V> putAll(EntryChain<K, V> that) {
        EntryChain<K, V> res = this;
        for (EntryChain<K, V> p = that; p != null; p = p.next) {
            res = res.put(p.key, p.value, false);
        }
        return res;
    }

    <R> R foldLeft(R z, BiFunction<R, EntryChain<K, V>, R> f) {
        R r = z;
        for (EntryChain<K, V> p = this; p != null; p = p.next) {
            r = f.apply(r, p);
        }
        return r;
    }

    @Override
    public K getKey() {
        return key;
    }

    @Override
    public V getValue() {
        return value;
    }

    @Override
    public V setValue(V value) {
        throw new UnsupportedOperationException();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Map.Entry))
            return false;
        Map.Entry<?,?> e = (Map.Entry<?,?>)obj;
        return key.equals(e.getKey()) && Objects.equals(value, e.getValue());
    }

    @Override
    public int hashCode() {
        return key.hashCode() ^ Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return key + "=" + value;
    }
}
