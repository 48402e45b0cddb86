/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.bittrie.fp.data;

import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import com.bittrie.fp.function.TriFunction;

/**
 * A persistent map with non-null keys and values, keyed by the hash codes
 * of its keys. Keys sharing a hash code are told apart with {@code equals}.
 *
 * @param <K> the type of keys
 * @param <V> the type of mapped values
 */
public interface HashTrieMap<K, V> extends Iterable<Map.Entry<K, V>> {
    static <K, V> HashTrieMap<K, V> empty() {
        return HashTrieMapImpl.empty();
    }

    static <K, V> HashTrieMap<K, V> singleton(K key, V value) {
        return HashTrieMap.<K, V>empty().put(key, value);
    }

    static <K, V> HashTrieMap<K, V> fromMap(Map<? extends K, ? extends V> map) {
        Objects.requireNonNull(map, "map");
        HashTrieMap<K, V> res = empty();
        for (Map.Entry<? extends K, ? extends V> e : map.entrySet()) {
            res = res.put(e.getKey(), e.getValue());
        }
        return res;
    }

    static <K, V> HashTrieMap<K, V> fromIterable(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
        Objects.requireNonNull(entries, "entries");
        HashTrieMap<K, V> res = empty();
        for (Map.Entry<? extends K, ? extends V> e : entries) {
            res = res.put(e.getKey(), e.getValue());
        }
        return res;
    }

    boolean isEmpty();

    int size();

    boolean containsKey(K key);

    Maybe<V> lookup(K key);

    /**
     * Returns the value to which the specified key is mapped.
     *
     * @throws NoSuchElementException if this map contains no mapping for the key
     */
    default V get(K key) {
        return lookup(key).orElseThrow(() -> new NoSuchElementException("Key not found: " + key));
    }

    default V getOrDefault(K key, V def) {
        return lookup(key).orElse(def);
    }

    HashTrieMap<K, V> put(K key, V value);

    HashTrieMap<K, V> putIfAbsent(K key, V value);

    /**
     * Removes the mapping for a key. Returns this map if the key is absent.
     */
    HashTrieMap<K, V> remove(K key);

    /**
     * Copies all of the mappings from the specified map to this map,
     * replacing the values of keys bound in both.
     */
    HashTrieMap<K, V> putAll(HashTrieMap<K, V> that);

    @Override
    Iterator<Map.Entry<K, V>> iterator();

    default Stream<Map.Entry<K, V>> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    void forEach(BiConsumer<? super K, ? super V> action);

    <R> R foldLeft(R z, TriFunction<R, ? super K, ? super V, R> f);

    ImmutableList<K> keys();

    ImmutableMap<K, V> toMap();
}
