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
import java.util.function.BiPredicate;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import static com.google.common.base.Preconditions.checkArgument;

import com.bittrie.fp.function.TriFunction;

/**
 * A persistent map from {@code int} keys to non-null values, implemented as
 * a big-endian Patricia trie.
 *
 * <p>Keys are ordered as unsigned 32-bit integers: iteration visits
 * {@code 0, 1, ..., Integer.MAX_VALUE} and then the negative keys from
 * {@code Integer.MIN_VALUE} up to {@code -1}.
 *
 * <p>Every modification returns a new map and leaves the receiver
 * untouched; a modification that changes nothing returns the receiver
 * itself.
 *
 * @param <V> the type of mapped values
 */
public interface IntMap<V> extends Iterable<Map.Entry<Integer, V>> {
    /**
     * Construct an empty map.
     */
    static <V> IntMap<V> empty() {
        return IntMapImpl.empty();
    }

    /**
     * Construct a map with a single mapping.
     */
    static <V> IntMap<V> singleton(int key, V value) {
        return IntMapImpl.<V>empty().put(key, value);
    }

    static <V> IntMap<V> of(int k1, V v1) {
        return singleton(k1, v1);
    }

    static <V> IntMap<V> of(int k1, V v1, int k2, V v2) {
        return IntMap.<V>empty().put(k1, v1).put(k2, v2);
    }

    static <V> IntMap<V> of(int k1, V v1, int k2, V v2, int k3, V v3) {
        return IntMap.<V>empty().put(k1, v1).put(k2, v2).put(k3, v3);
    }

    /**
     * Construct a map holding the mappings of the given map.
     */
    static <V> IntMap<V> fromMap(Map<Integer, ? extends V> map) {
        Objects.requireNonNull(map, "map");
        IntMap<V> res = empty();
        for (Map.Entry<Integer, ? extends V> e : map.entrySet()) {
            res = res.put(e.getKey(), e.getValue());
        }
        return res;
    }

    /**
     * Construct a map by inserting the given entries in order. Later entries
     * replace earlier ones with the same key.
     */
    static <V> IntMap<V> fromIterable(Iterable<? extends Map.Entry<Integer, ? extends V>> entries) {
        Objects.requireNonNull(entries, "entries");
        IntMap<V> res = empty();
        for (Map.Entry<Integer, ? extends V> e : entries) {
            res = res.put(e.getKey(), e.getValue());
        }
        return res;
    }

    /**
     * Construct a map pairing {@code keys[i]} with {@code values[i]}.
     *
     * @throws IllegalArgumentException if the arrays differ in length
     */
    static <V> IntMap<V> fromArrays(int[] keys, V[] values) {
        Objects.requireNonNull(keys, "keys");
        Objects.requireNonNull(values, "values");
        checkArgument(keys.length == values.length,
                      "keys and values differ in length: %s != %s", keys.length, values.length);
        IntMap<V> res = empty();
        for (int i = 0; i < keys.length; i++) {
            res = res.put(keys[i], values[i]);
        }
        return res;
    }

    // Query Operations

    /**
     * Returns {@code true} if this map contains no key-value mappings.
     */
    boolean isEmpty();

    /**
     * Returns the number of key-value mappings in this map. The count is
     * computed by walking the trie.
     */
    int size();

    /**
     * Returns {@code true} if this map contains a mapping for the specified
     * key.
     */
    boolean containsKey(int key);

    /**
     * Lookup the value to which the specified key is mapped.
     *
     * @return the mapped value, or an empty {@code Maybe} if this map contains
     *         no mapping for the key
     */
    Maybe<V> lookup(int key);

    /**
     * Returns the value to which the specified key is mapped.
     *
     * @throws NoSuchElementException if this map contains no mapping for the key
     */
    default V get(int key) {
        return lookup(key).orElseThrow(() -> new NoSuchElementException("Key not found: " + key));
    }

    /**
     * Returns the value to which the specified key is mapped, or the given
     * default if this map contains no mapping for the key.
     */
    default V getOrDefault(int key, V def) {
        return lookup(key).orElse(def);
    }

    /**
     * Returns the mapping with the smallest unsigned key.
     */
    Maybe<Map.Entry<Integer, V>> firstEntry();

    /**
     * Returns the mapping with the largest unsigned key.
     */
    Maybe<Map.Entry<Integer, V>> lastEntry();

    /**
     * Returns the first key, in iteration order, whose mapping satisfies the
     * predicate.
     */
    Maybe<Integer> tryFindKey(BiPredicate<Integer, ? super V> predicate);

    /**
     * Returns the first key, in iteration order, whose mapping satisfies the
     * predicate.
     *
     * @throws NoSuchElementException if no mapping satisfies the predicate
     */
    default int findKey(BiPredicate<Integer, ? super V> predicate) {
        return tryFindKey(predicate).orElseThrow(() ->
            new NoSuchElementException("No mapping satisfies the predicate"));
    }

    default boolean anyMatch(BiPredicate<Integer, ? super V> predicate) {
        return tryFindKey(predicate).isPresent();
    }

    default boolean allMatch(BiPredicate<Integer, ? super V> predicate) {
        return !anyMatch(predicate.negate());
    }

    // Modification Operations

    /**
     * Insert a new key and value in the map. If the key is already present
     * in the map, the associated value is replaced with the supplied value.
     */
    IntMap<V> put(int key, V value);

    /**
     * Insert a new key and value in the map if it is not already present,
     * otherwise return this map.
     */
    IntMap<V> putIfAbsent(int key, V value);

    /**
     * Insert a new key and value in the map. If the key is already present
     * the stored value becomes {@code f(oldValue, value)}.
     */
    IntMap<V> merge(int key, V value, BinaryOperator<V> f);

    /**
     * Removes the mapping for a key from this map if it is present,
     * otherwise return this map.
     */
    IntMap<V> remove(int key);

    // Bulk Operations

    /**
     * Returns a map holding the mappings of both maps. Where both maps bind a
     * key, the value from {@code that} wins.
     */
    IntMap<V> union(IntMap<V> that);

    /**
     * Copies all of the mappings from the specified map to this map.
     */
    default IntMap<V> putAll(IntMap<V> that) {
        return union(that);
    }

    /**
     * Returns the mappings of this map whose keys are also bound in
     * {@code that}.
     */
    IntMap<V> intersection(IntMap<?> that);

    /**
     * Returns the mappings of this map whose keys are not bound in
     * {@code that}.
     */
    IntMap<V> difference(IntMap<?> that);

    /**
     * Returns the mappings that satisfy the predicate.
     */
    IntMap<V> filter(BiPredicate<Integer, ? super V> predicate);

    /**
     * Returns a map with the same keys whose values are transformed by the
     * given function.
     */
    <U> IntMap<U> mapValues(Function<? super V, ? extends U> f);

    // Traversals

    /**
     * Returns an iterator over the mappings in ascending unsigned key order.
     */
    @Override
    Iterator<Map.Entry<Integer, V>> iterator();

    /**
     * Returns an iterator over the mappings in descending unsigned key order.
     */
    Iterator<Map.Entry<Integer, V>> descendingIterator();

    default Stream<Map.Entry<Integer, V>> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    void forEach(BiConsumer<Integer, ? super V> action);

    /**
     * Folds the mappings in ascending key order.
     */
    <R> R foldLeft(R z, TriFunction<R, Integer, ? super V, R> f);

    /**
     * Folds the mappings in descending key order, so the largest key is
     * combined first.
     */
    <R> R foldRight(R z, TriFunction<Integer, ? super V, R, R> f);

    // Conversions

    /**
     * Returns the keys in ascending unsigned order.
     */
    int[] keys();

    /**
     * Returns the values in ascending key order.
     */
    ImmutableList<V> values();

    ImmutableList<Map.Entry<Integer, V>> toList();

    Map.Entry<Integer, V>[] toArray();

    /**
     * Returns an immutable {@code java.util.Map} whose iteration order is the
     * ascending unsigned key order of this map.
     */
    ImmutableMap<Integer, V> toMap();
}
