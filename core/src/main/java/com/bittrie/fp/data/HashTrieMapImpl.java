/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.bittrie.fp.data;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterators;

import com.bittrie.fp.function.TriFunction;
import com.bittrie.fp.data.PatriciaTrie.Leaf;
import com.bittrie.fp.data.PatriciaTrie.Node;
import static com.bittrie.fp.data.PatriciaTrie.hash;

final class HashTrieMapImpl<K, V> implements HashTrieMap<K, V> {
    private static final HashTrieMapImpl<?,?> EMPTY = new HashTrieMapImpl<>(PatriciaTrie.empty());

    @SuppressWarnings("unchecked")
    static <K, V> HashTrieMap<K, V> empty() {
        return (HashTrieMap<K, V>)EMPTY;
    }

    final Node<EntryChain<K, V>> root;

    private HashTrieMapImpl(Node<EntryChain<K, V>> root) {
        this.root = root;
    }

    private HashTrieMap<K, V> wrap(Node<EntryChain<K, V>> t) {
        if (t == root) {
            return this;
        } else if (t.isEmpty()) {
            return empty();
        } else {
            return new HashTrieMapImpl<>(t);
        }
    }

    private EntryChain<K, V> entry(K key) {
        Objects.requireNonNull(key, "key");
        Leaf<EntryChain<K, V>> leaf = PatriciaTrie.lookup(root, hash(key));
        return leaf == null ? null : leaf.payload.lookup(key);
    }

    @Override
    public boolean isEmpty() {
        return root.isEmpty();
    }

    @Override
    public int size() {
        return PatriciaTrie.weigh(root, EntryChain::size);
    }

    @Override
    public boolean containsKey(K key) {
        return entry(key) != null;
    }

    @Override
    public Maybe<V> lookup(K key) {
        EntryChain<K, V> e = entry(key);
        return e == null ? Maybe.empty() : Maybe.of(e.value);
    }

    @Override
    public HashTrieMap<K, V> put(K key, V value) {
        return put(key, value, false);
    }

    @Override
    public HashTrieMap<K, V> putIfAbsent(K key, V value) {
        return put(key, value, true);
    }

    private HashTrieMap<K, V> put(K key, V value, boolean onlyIfAbsent) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        return wrap(PatriciaTrie.insert(root, hash(key), EntryChain.of(key, value),
                                        (old, e) -> old.put(key, value, onlyIfAbsent)));
    }

    @Override
    public HashTrieMap<K, V> remove(K key) {
        Objects.requireNonNull(key, "key");
        return wrap(PatriciaTrie.alter(root, hash(key), chain -> chain.remove(key)));
    }

    @Override
    public HashTrieMap<K, V> putAll(HashTrieMap<K, V> that) {
        Objects.requireNonNull(that, "that");
        HashTrieMapImpl<K, V> other = (HashTrieMapImpl<K, V>)that;
        return wrap(PatriciaTrie.union(root, other.root, EntryChain::putAll));
    }

    @Override
    public Iterator<Map.Entry<K, V>> iterator() {
        return Iterators.concat(Iterators.transform(PatriciaTrie.iterator(root, false),
                                                    leaf -> chainIterator(leaf.payload)));
    }

    private static <K, V> Iterator<Map.Entry<K, V>> chainIterator(EntryChain<K, V> chain) {
        return chain.foldLeft(ImmutableList.<Map.Entry<K, V>>builder(), (b, e) -> b.add(e))
                    .build().iterator();
    }

    @Override
    public void forEach(BiConsumer<? super K, ? super V> action) {
        Objects.requireNonNull(action, "action");
        Iterator<Leaf<EntryChain<K, V>>> it = PatriciaTrie.iterator(root, false);
        while (it.hasNext()) {
            for (EntryChain<K, V> e = it.next().payload; e != null; e = e.next) {
                action.accept(e.key, e.value);
            }
        }
    }

    @Override
    public <R> R foldLeft(R z, TriFunction<R, ? super K, ? super V, R> f) {
        Objects.requireNonNull(f, "f");
        return PatriciaTrie.foldLeft(root, z, (r, leaf) ->
            leaf.payload.foldLeft(r, (s, e) -> f.apply(s, e.key, e.value)));
    }

    @Override
    public ImmutableList<K> keys() {
        return foldLeft(ImmutableList.<K>builder(), (b, k, v) -> b.add(k)).build();
    }

    @Override
    public ImmutableMap<K, V> toMap() {
        return foldLeft(ImmutableMap.<K, V>builder(), (b, k, v) -> b.put(k, v)).build();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof HashTrieMapImpl))
            return false;
        HashTrieMapImpl<?,?> that = (HashTrieMapImpl<?,?>)obj;
        return size() == that.size()
            && PatriciaTrie.isSubset(root, that.root, HashTrieMapImpl::chainIncluded);
    }

    private static boolean chainIncluded(EntryChain<?,?> a, EntryChain<?,?> b) {
        for (EntryChain<?,?> p = a; p != null; p = p.next) {
            EntryChain<?,?> q = b.lookup(p.key);
            if (q == null || !p.value.equals(q.value))
                return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return foldLeft(0, (h, k, v) -> h + (k.hashCode() ^ v.hashCode()));
    }

    @Override
    public String toString() {
        return toMap().toString();
    }
}
