/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.bittrie.fp.data;

import java.util.Comparator;
import java.util.Iterator;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Predicate;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;

import com.bittrie.fp.data.PatriciaTrie.Leaf;
import com.bittrie.fp.data.PatriciaTrie.Node;
import static com.bittrie.fp.data.PatriciaTrie.hash;

final class HashTrieSetImpl<E> implements HashTrieSet<E> {
    final Node<CollisionBucket<E>> root;
    final Comparator<? super E> cmp;

    private HashTrieSetImpl(Node<CollisionBucket<E>> root, Comparator<? super E> cmp) {
        this.root = root;
        this.cmp = cmp;
    }

    static <E> HashTrieSet<E> empty(Comparator<? super E> cmp) {
        return new HashTrieSetImpl<>(PatriciaTrie.empty(), cmp);
    }

    private HashTrieSet<E> wrap(Node<CollisionBucket<E>> t) {
        return t == root ? this : new HashTrieSetImpl<>(t, cmp);
    }

    private static <E> Node<CollisionBucket<E>> rootOf(HashTrieSet<E> set) {
        return ((HashTrieSetImpl<E>)set).root;
    }

    /**
     * Bucket merges walk both chains in one pass, which is only valid when
     * both sets sort their buckets the same way. Otherwise merges go element
     * by element.
     */
    private boolean sameOrder(HashTrieSet<E> that) {
        Objects.requireNonNull(that, "set");
        return cmp.equals(((HashTrieSetImpl<E>)that).cmp);
    }

    @Override
    public boolean isEmpty() {
        return root.isEmpty();
    }

    @Override
    public int size() {
        return PatriciaTrie.weigh(root, CollisionBucket::size);
    }

    @Override
    public boolean contains(E e) {
        Objects.requireNonNull(e, "element");
        Leaf<CollisionBucket<E>> leaf = PatriciaTrie.lookup(root, hash(e));
        return leaf != null && leaf.payload.contains(e, cmp);
    }

    @Override
    public Maybe<E> tryFind(Predicate<? super E> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        Iterator<E> it = iterator();
        while (it.hasNext()) {
            E e = it.next();
            if (predicate.test(e))
                return Maybe.of(e);
        }
        return Maybe.empty();
    }

    @Override
    public boolean isSubsetOf(HashTrieSet<E> that) {
        if (!sameOrder(that))
            return allMatch(that::contains);
        return PatriciaTrie.isSubset(root, rootOf(that), (a, b) -> CollisionBucket.isSubset(a, b, cmp));
    }

    @Override
    public HashTrieSet<E> add(E e) {
        Objects.requireNonNull(e, "element");
        return wrap(PatriciaTrie.insert(root, hash(e), CollisionBucket.of(e),
                                        (old, b) -> old.add(e, cmp)));
    }

    @Override
    public HashTrieSet<E> remove(E e) {
        Objects.requireNonNull(e, "element");
        return wrap(PatriciaTrie.alter(root, hash(e), b -> b.remove(e, cmp)));
    }

    @Override
    public HashTrieSet<E> union(HashTrieSet<E> that) {
        if (!sameOrder(that))
            return that.foldLeft((HashTrieSet<E>)this, (s, e) -> s.add(e));
        return wrap(PatriciaTrie.union(root, rootOf(that), (a, b) -> CollisionBucket.union(a, b, cmp)));
    }

    @Override
    public HashTrieSet<E> intersection(HashTrieSet<E> that) {
        if (!sameOrder(that))
            return filter(that::contains);
        return wrap(PatriciaTrie.intersect(root, rootOf(that), (a, b) -> CollisionBucket.intersect(a, b, cmp)));
    }

    @Override
    public HashTrieSet<E> difference(HashTrieSet<E> that) {
        if (!sameOrder(that))
            return filter(e -> !that.contains(e));
        return wrap(PatriciaTrie.difference(root, rootOf(that), (a, b) -> CollisionBucket.difference(a, b, cmp)));
    }

    @Override
    public HashTrieSet<E> filter(Predicate<? super E> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return wrap(PatriciaTrie.filter(root, (k, b) -> b.filter(predicate)));
    }

    @Override
    public Iterator<E> iterator() {
        return Iterators.concat(Iterators.transform(PatriciaTrie.iterator(root, false),
                                                    leaf -> leaf.payload.iterator()));
    }

    @Override
    public Iterator<E> descendingIterator() {
        return Iterators.concat(Iterators.transform(PatriciaTrie.iterator(root, true),
                                                    leaf -> leaf.payload.descendingIterator()));
    }

    @Override
    public void forEach(Consumer<? super E> action) {
        Objects.requireNonNull(action, "action");
        Iterator<E> it = iterator();
        while (it.hasNext()) {
            action.accept(it.next());
        }
    }

    @Override
    public <R> R foldLeft(R z, BiFunction<R, ? super E, R> f) {
        Objects.requireNonNull(f, "f");
        return PatriciaTrie.foldLeft(root, z, (r, leaf) -> leaf.payload.foldLeft(r, f));
    }

    @Override
    public <R> R foldRight(R z, BiFunction<? super E, R, R> f) {
        Objects.requireNonNull(f, "f");
        return PatriciaTrie.foldRight(root, z, (leaf, r) -> leaf.payload.foldRight(r, f));
    }

    @Override
    public ImmutableList<E> toList() {
        return ImmutableList.copyOf(iterator());
    }

    @Override
    public Object[] toArray() {
        return toList().toArray();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof HashTrieSetImpl))
            return false;
        @SuppressWarnings("unchecked")
        HashTrieSetImpl<E> that = (HashTrieSetImpl<E>)obj;
        return size() == that.size() && isSubsetOf(that);
    }

    @Override
    public int hashCode() {
        return foldLeft(0, (h, e) -> h + e.hashCode());
    }

    @Override
    public String toString() {
        return toList().toString();
    }
}
