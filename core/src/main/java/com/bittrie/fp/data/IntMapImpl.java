/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.bittrie.fp.data;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.BiConsumer;
import java.util.function.BiPredicate;
import java.util.function.BinaryOperator;
import java.util.function.Function;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import com.bittrie.fp.function.TriFunction;
import com.bittrie.fp.data.PatriciaTrie.Leaf;
import com.bittrie.fp.data.PatriciaTrie.Node;

final class IntMapImpl<V> implements IntMap<V> {
    private static final IntMapImpl<?> EMPTY = new IntMapImpl<>(PatriciaTrie.empty());

    @SuppressWarnings("unchecked")
    static <V> IntMap<V> empty() {
        return (IntMap<V>)EMPTY;
    }

    final Node<V> root;

    IntMapImpl(Node<V> root) {
        this.root = root;
    }

    private IntMap<V> wrap(Node<V> t) {
        if (t == root) {
            return this;
        } else if (t.isEmpty()) {
            return empty();
        } else {
            return new IntMapImpl<>(t);
        }
    }

    @SuppressWarnings("unchecked")
    private static <V> Node<V> rootOf(IntMap<V> map) {
        Objects.requireNonNull(map, "map");
        return ((IntMapImpl<V>)map).root;
    }

    @Override
    public boolean isEmpty() {
        return root.isEmpty();
    }

    @Override
    public int size() {
        return PatriciaTrie.count(root);
    }

    @Override
    public boolean containsKey(int key) {
        return PatriciaTrie.lookup(root, key) != null;
    }

    @Override
    public Maybe<V> lookup(int key) {
        Leaf<V> leaf = PatriciaTrie.lookup(root, key);
        return leaf != null ? Maybe.of(leaf.payload) : Maybe.empty();
    }

    @Override
    public Maybe<Map.Entry<Integer, V>> firstEntry() {
        return Maybe.ofNullable(PatriciaTrie.first(root));
    }

    @Override
    public Maybe<Map.Entry<Integer, V>> lastEntry() {
        return Maybe.ofNullable(PatriciaTrie.last(root));
    }

    @Override
    public Maybe<Integer> tryFindKey(BiPredicate<Integer, ? super V> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        Leaf<V> leaf = PatriciaTrie.find(root, predicate);
        return leaf != null ? Maybe.of(leaf.key) : Maybe.empty();
    }

    @Override
    public IntMap<V> put(int key, V value) {
        Objects.requireNonNull(value, "value");
        return wrap(PatriciaTrie.insert(root, key, value, (old, v) -> v));
    }

    @Override
    public IntMap<V> putIfAbsent(int key, V value) {
        Objects.requireNonNull(value, "value");
        return wrap(PatriciaTrie.insert(root, key, value, (old, v) -> old));
    }

    @Override
    public IntMap<V> merge(int key, V value, BinaryOperator<V> f) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(f, "f");
        return wrap(PatriciaTrie.insert(root, key, value, (old, v) -> Objects.requireNonNull(f.apply(old, v))));
    }

    @Override
    public IntMap<V> remove(int key) {
        return wrap(PatriciaTrie.remove(root, key));
    }

    @Override
    public IntMap<V> union(IntMap<V> that) {
        return wrap(PatriciaTrie.union(root, rootOf(that), (a, b) -> b));
    }

    @Override
    @SuppressWarnings("unchecked")
    public IntMap<V> intersection(IntMap<?> that) {
        Node<Object> other = rootOf((IntMap<Object>)that);
        return wrap(PatriciaTrie.intersect(root, other, (a, b) -> a));
    }

    @Override
    @SuppressWarnings("unchecked")
    public IntMap<V> difference(IntMap<?> that) {
        Node<Object> other = rootOf((IntMap<Object>)that);
        return wrap(PatriciaTrie.difference(root, other, (a, b) -> null));
    }

    @Override
    public IntMap<V> filter(BiPredicate<Integer, ? super V> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return wrap(PatriciaTrie.filter(root, (k, v) -> predicate.test(k, v) ? v : null));
    }

    @Override
    public <U> IntMap<U> mapValues(Function<? super V, ? extends U> f) {
        Objects.requireNonNull(f, "f");
        if (root.isEmpty())
            return empty();
        return new IntMapImpl<U>(PatriciaTrie.map(root, (k, v) -> Objects.requireNonNull(f.apply(v))));
    }

    @Override
    @SuppressWarnings("unchecked")
    public Iterator<Map.Entry<Integer, V>> iterator() {
        return (Iterator<Map.Entry<Integer, V>>)(Iterator<?>)PatriciaTrie.iterator(root, false);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Iterator<Map.Entry<Integer, V>> descendingIterator() {
        return (Iterator<Map.Entry<Integer, V>>)(Iterator<?>)PatriciaTrie.iterator(root, true);
    }

    @Override
    public void forEach(BiConsumer<Integer, ? super V> action) {
        Objects.requireNonNull(action, "action");
        Iterator<Leaf<V>> it = PatriciaTrie.iterator(root, false);
        while (it.hasNext()) {
            Leaf<V> e = it.next();
            action.accept(e.key, e.payload);
        }
    }

    @Override
    public <R> R foldLeft(R z, TriFunction<R, Integer, ? super V, R> f) {
        Objects.requireNonNull(f, "f");
        return PatriciaTrie.foldLeft(root, z, (r, e) -> f.apply(r, e.key, e.payload));
    }

    @Override
    public <R> R foldRight(R z, TriFunction<Integer, ? super V, R, R> f) {
        Objects.requireNonNull(f, "f");
        return PatriciaTrie.foldRight(root, z, (e, r) -> f.apply(e.key, e.payload, r));
    }

    @Override
    public int[] keys() {
        int[] keys = new int[size()];
        PatriciaTrie.foldLeft(root, 0, (i, e) -> { keys[i] = e.key; return i + 1; });
        return keys;
    }

    @Override
    public ImmutableList<V> values() {
        return PatriciaTrie.foldLeft(root, ImmutableList.<V>builder(), (b, e) -> b.add(e.payload)).build();
    }

    @Override
    public ImmutableList<Map.Entry<Integer, V>> toList() {
        return ImmutableList.copyOf(iterator());
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map.Entry<Integer, V>[] toArray() {
        return toList().toArray(new Map.Entry[0]);
    }

    @Override
    public ImmutableMap<Integer, V> toMap() {
        return PatriciaTrie.foldLeft(root, ImmutableMap.<Integer, V>builder(),
                                     (b, e) -> b.put(e.key, e.payload)).build();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof IntMapImpl))
            return false;
        IntMapImpl<?> that = (IntMapImpl<?>)obj;
        return size() == that.size()
            && PatriciaTrie.isSubset(root, that.root, Objects::equals);
    }

    @Override
    public int hashCode() {
        return PatriciaTrie.foldLeft(root, 0, (h, e) -> h + e.hashCode());
    }

    @Override
    public String toString() {
        return PatriciaTrie.foldLeft(root, new StringJoiner(",", "{", "}"),
                                     (sj, e) -> sj.add(e.key + ":" + e.payload))
                           .toString();
    }
}
