/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.bittrie.fp.data;

import java.util.Comparator;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import com.google.common.collect.ImmutableList;

/**
 * A persistent set of non-null elements keyed by their hash codes.
 *
 * <p>Elements with the same hash code are kept together, ordered by the
 * comparator the set was created with. The comparator must be consistent
 * with {@code equals}: it returns zero exactly for equal elements.
 *
 * @param <E> the type of elements
 */
public interface HashTrieSet<E> extends Iterable<E> {
    /**
     * Construct an empty set of naturally ordered elements.
     */
    static <E extends Comparable<? super E>> HashTrieSet<E> empty() {
        return HashTrieSetImpl.empty(Comparator.<E>naturalOrder());
    }

    /**
     * Construct an empty set that orders colliding elements with the given
     * comparator.
     */
    static <E> HashTrieSet<E> empty(Comparator<? super E> comparator) {
        return HashTrieSetImpl.empty(Objects.requireNonNull(comparator, "comparator"));
    }

    static <E extends Comparable<? super E>> HashTrieSet<E> singleton(E e) {
        return HashTrieSet.<E>empty().add(e);
    }

    @SafeVarargs
    static <E extends Comparable<? super E>> HashTrieSet<E> of(E... elements) {
        HashTrieSet<E> res = empty();
        for (E e : elements) {
            res = res.add(e);
        }
        return res;
    }

    static <E extends Comparable<? super E>> HashTrieSet<E> fromIterable(Iterable<? extends E> elements) {
        return fromIterable(Comparator.<E>naturalOrder(), elements);
    }

    static <E> HashTrieSet<E> fromIterable(Comparator<? super E> comparator, Iterable<? extends E> elements) {
        Objects.requireNonNull(elements, "elements");
        HashTrieSet<E> res = empty(comparator);
        for (E e : elements) {
            res = res.add(e);
        }
        return res;
    }

    boolean isEmpty();

    int size();

    boolean contains(E e);

    /**
     * Returns the first element, in iteration order, that satisfies the
     * predicate.
     */
    Maybe<E> tryFind(Predicate<? super E> predicate);

    /**
     * Returns the first element, in iteration order, that satisfies the
     * predicate.
     *
     * @throws NoSuchElementException if no element satisfies the predicate
     */
    default E find(Predicate<? super E> predicate) {
        return tryFind(predicate).orElseThrow(() ->
            new NoSuchElementException("No element satisfies the predicate"));
    }

    default boolean anyMatch(Predicate<? super E> predicate) {
        return tryFind(predicate).isPresent();
    }

    default boolean allMatch(Predicate<? super E> predicate) {
        return !anyMatch(predicate.negate());
    }

    boolean isSubsetOf(HashTrieSet<E> that);

    default boolean isProperSubsetOf(HashTrieSet<E> that) {
        return size() < that.size() && isSubsetOf(that);
    }

    /**
     * Adds an element. Returns this set if the element is already present.
     */
    HashTrieSet<E> add(E e);

    /**
     * Removes an element. Returns this set if the element is absent.
     */
    HashTrieSet<E> remove(E e);

    HashTrieSet<E> union(HashTrieSet<E> that);

    HashTrieSet<E> intersection(HashTrieSet<E> that);

    HashTrieSet<E> difference(HashTrieSet<E> that);

    HashTrieSet<E> filter(Predicate<? super E> predicate);

    /**
     * Returns an iterator over the elements in ascending order of their
     * unsigned hash, then comparator order within a hash.
     */
    @Override
    Iterator<E> iterator();

    Iterator<E> descendingIterator();

    default Stream<E> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    @Override
    void forEach(Consumer<? super E> action);

    <R> R foldLeft(R z, BiFunction<R, ? super E, R> f);

    <R> R foldRight(R z, BiFunction<? super E, R, R> f);

    ImmutableList<E> toList();

    Object[] toArray();
}
