/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.bittrie.fp.cache;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterators;
import com.google.common.collect.Maps;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Verify.verify;

import com.bittrie.common.Config;
import com.bittrie.fp.data.HashTrieMap;
import com.bittrie.fp.data.IntMap;
import com.bittrie.fp.data.Maybe;
import com.bittrie.fp.data.Tuple;

/**
 * A persistent, bounded key-value cache that evicts the least recently
 * used entry.
 *
 * <p>The cache is made of two tries: the primary index maps each key to
 * its recency index and value, and the recency index maps each recency
 * index back to its key. Both adding and successfully finding an entry
 * count as a use. Every operation returns a new cache and leaves the
 * receiver untouched.
 *
 * <p>Recency indexes are unsigned 32-bit numbers. When they run out the
 * live entries are renumbered from zero, oldest first.
 *
 * @param <K> the type of keys
 * @param <V> the type of cached values
 */
public final class LruCache<K, V> implements Iterable<Map.Entry<K, V>> {
    private static final Logger logger = Logger.getLogger(LruCache.class.getName());

    static final long MAX_INDEX = 0xFFFFFFFFL;

    private static final class Slot<V> {
        final int index;
        final V value;

        Slot(int index, V value) {
            this.index = index;
            this.value = value;
        }
    }

    private final HashTrieMap<K, Slot<V>> primary;
    private final IntMap<K> recencyIndex;
    private final int capacity;
    private final long nextIndex;
    private final int count;

    private LruCache(HashTrieMap<K, Slot<V>> primary, IntMap<K> recencyIndex,
                     int capacity, long nextIndex, int count) {
        this.primary = primary;
        this.recencyIndex = recencyIndex;
        this.capacity = capacity;
        this.nextIndex = nextIndex;
        this.count = count;
    }

    /**
     * Creates an empty cache bounded by the configured default capacity.
     */
    public static <K, V> LruCache<K, V> create() {
        return create(Config.getDefault().getInt(Config.CACHE_CAPACITY_KEY, Config.DEFAULT_CACHE_CAPACITY));
    }

    /**
     * Creates an empty cache holding at most {@code capacity} entries. A
     * zero capacity yields a cache that never retains anything.
     *
     * @throws IllegalArgumentException if the capacity is negative
     */
    public static <K, V> LruCache<K, V> create(int capacity) {
        return startingAt(capacity, 0);
    }

    static <K, V> LruCache<K, V> startingAt(int capacity, long nextIndex) {
        checkArgument(capacity >= 0, "negative capacity: %s", capacity);
        checkArgument(nextIndex >= 0 && nextIndex <= MAX_INDEX + 1, "recency index out of range: %s", nextIndex);
        return new LruCache<>(HashTrieMap.empty(), IntMap.empty(), capacity, nextIndex, 0);
    }

    /**
     * Creates a cache by adding the given entries in order. With more
     * entries than the capacity only the last ones added are retained.
     */
    public static <K, V> LruCache<K, V> fromIterable(int capacity, Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
        Objects.requireNonNull(entries, "entries");
        LruCache<K, V> cache = create(capacity);
        for (Map.Entry<? extends K, ? extends V> e : entries) {
            cache = cache.add(e.getKey(), e.getValue());
        }
        return cache;
    }

    public static <K, V> LruCache<K, V> fromMap(int capacity, Map<? extends K, ? extends V> map) {
        Objects.requireNonNull(map, "map");
        return fromIterable(capacity, map.entrySet());
    }

    public int capacity() {
        return capacity;
    }

    public int count() {
        return count;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public boolean containsKey(K key) {
        return primary.containsKey(key);
    }

    /**
     * Looks up a key. On a hit the entry becomes the most recently used
     * one in the returned cache; on a miss the returned cache is this one.
     */
    public Tuple<Maybe<V>, LruCache<K, V>> tryFind(K key) {
        Maybe<Slot<V>> slot = primary.lookup(key);
        if (slot.isAbsent()) {
            return Tuple.of(Maybe.empty(), this);
        }
        V value = slot.get().value;
        return Tuple.of(Maybe.of(value), add(key, value));
    }

    /**
     * Adds or replaces an entry, making it the most recently used one. If
     * the cache grows beyond its capacity the least recently used entry is
     * evicted.
     */
    public LruCache<K, V> add(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (capacity == 0)
            return this;

        LruCache<K, V> cache = nextIndex > MAX_INDEX ? rebase() : this;
        return cache.touch(key, value);
    }

    private LruCache<K, V> touch(K key, V value) {
        int index = (int)nextIndex;
        IntMap<K> recency = recencyIndex;
        int n = count;

        Maybe<Slot<V>> old = primary.lookup(key);
        if (old.isPresent()) {
            recency = recency.remove(old.get().index);
        } else {
            n++;
        }

        LruCache<K, V> cache = new LruCache<>(
            primary.put(key, new Slot<>(index, value)),
            recency.put(index, key),
            capacity, nextIndex + 1, n);
        return n > capacity ? cache.evictOldest() : cache;
    }

    private LruCache<K, V> evictOldest() {
        Map.Entry<Integer, K> oldest = recencyIndex.firstEntry().get();
        K key = oldest.getValue();
        logger.fine("Evict the least recently used entry " + key);
        return new LruCache<>(primary.remove(key), recencyIndex.remove(oldest.getKey()),
                              capacity, nextIndex, count - 1);
    }

    /**
     * Removes an entry. Returns this cache if the key is absent.
     */
    public LruCache<K, V> remove(K key) {
        Maybe<Slot<V>> slot = primary.lookup(key);
        if (slot.isAbsent())
            return this;
        return new LruCache<>(primary.remove(key), recencyIndex.remove(slot.get().index),
                              capacity, nextIndex, count - 1);
    }

    /**
     * Changes the capacity of the cache. When shrinking below the current
     * count the least recently used entries are evicted until the count
     * fits.
     *
     * @throws IllegalArgumentException if the capacity is negative
     */
    public LruCache<K, V> changeCapacity(int newCapacity) {
        checkArgument(newCapacity >= 0, "negative capacity: %s", newCapacity);
        if (newCapacity == capacity)
            return this;

        LruCache<K, V> cache = new LruCache<>(primary, recencyIndex, newCapacity, nextIndex, count);
        if (count > newCapacity) {
            logger.fine("Shrink cache capacity from " + capacity + " to " + newCapacity +
                        ", evicting " + (count - newCapacity) + " entries");
            while (cache.count > newCapacity) {
                cache = cache.evictOldest();
            }
        }
        return cache;
    }

    /**
     * Renumbers the live entries {@code 0..count-1}, oldest first.
     */
    LruCache<K, V> rebase() {
        logger.fine("Renumber " + count + " cache entries after exhausting recency indexes");
        HashTrieMap<K, Slot<V>> p = HashTrieMap.empty();
        IntMap<K> r = IntMap.empty();
        int index = 0;
        for (Map.Entry<Integer, K> e : recencyIndex) {
            K key = e.getValue();
            p = p.put(key, new Slot<>(index, primary.get(key).value));
            r = r.put(index, key);
            index++;
        }
        return new LruCache<>(p, r, capacity, index, count);
    }

    long nextIndex() {
        return nextIndex;
    }

    /**
     * Checks that the two indexes describe the same set of entries.
     *
     * @throws com.google.common.base.VerifyException if they do not
     */
    void verifyInvariants() {
        verify(count <= capacity, "count %s exceeds capacity %s", count, capacity);
        verify(primary.size() == count, "primary index holds %s entries, expected %s", primary.size(), count);
        verify(recencyIndex.size() == count, "recency index holds %s entries, expected %s", recencyIndex.size(), count);
        for (Map.Entry<Integer, K> e : recencyIndex) {
            Maybe<Slot<V>> slot = primary.lookup(e.getValue());
            verify(slot.isPresent(), "key %s missing from primary index", e.getValue());
            verify(slot.get().index == e.getKey(), "recency index of %s out of sync", e.getValue());
            verify(Integer.toUnsignedLong(e.getKey()) < nextIndex, "recency index %s not yet minted", e.getKey());
        }
    }

    /**
     * Returns the entries from the least to the most recently used.
     */
    @Override
    public Iterator<Map.Entry<K, V>> iterator() {
        return Iterators.transform(recencyIndex.iterator(), e ->
            Maps.immutableEntry(e.getValue(), primary.get(e.getValue()).value));
    }

    public Stream<Map.Entry<K, V>> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    public ImmutableList<Map.Entry<K, V>> toList() {
        return ImmutableList.copyOf(iterator());
    }

    @SuppressWarnings("unchecked")
    public Map.Entry<K, V>[] toArray() {
        return toList().toArray(new Map.Entry[0]);
    }

    /**
     * Returns the entries as an immutable map iterating from the least to
     * the most recently used.
     */
    public ImmutableMap<K, V> toMap() {
        return ImmutableMap.copyOf(toList());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof LruCache))
            return false;
        LruCache<?,?> that = (LruCache<?,?>)obj;
        return capacity == that.capacity && toList().equals(that.toList());
    }

    @Override
    public int hashCode() {
        return 31 * capacity + toList().hashCode();
    }

    @Override
    public String toString() {
        return "LruCache(" + capacity + ")" + toMap();
    }
}
