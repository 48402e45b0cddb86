/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.bittrie.fp.data;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.BinaryOperator;
import java.util.function.ToIntFunction;
import java.util.function.UnaryOperator;

import com.google.common.base.VerifyException;
import com.google.common.collect.AbstractIterator;

import com.bittrie.common.Config;
import static com.bittrie.fp.data.BitOps.*;

/**
 * A big-endian Patricia trie over 32-bit keys. Nodes are immutable; every
 * update returns a new root that shares all untouched subtrees with the
 * old one, and an update that changes nothing returns the original node.
 *
 * <p>The payload type is left to the flavor built on top: a bare value for
 * {@link IntMap}, a {@link CollisionBucket} for {@link HashTrieSet} and an
 * entry chain for {@link HashTrieMap}.
 */
final class PatriciaTrie {
    private PatriciaTrie() {}

    static final int STACK_SIZE = Math.max(4,
        Config.getDefault().getInt(Config.TRIE_STACK_SIZE_KEY, Config.DEFAULT_TRIE_STACK_SIZE));

    private static final Empty<?> EMPTY = new Empty<>();

    @SuppressWarnings("unchecked")
    static <P> Node<P> empty() {
        return (Node<P>)EMPTY;
    }

    /**
     * Spreads the higher bits of an object's hash code into the lower ones.
     */
    static int hash(Object key) {
        int h = key.hashCode();
        return h ^ (h >>> 16);
    }

    static <P> Node<P> leaf(int key, P payload) {
        return new Leaf<>(key, payload);
    }

    /**
     * A function over a leaf's key and payload.
     */
    @FunctionalInterface
    interface KeyedFunction<P, Q> {
        Q apply(int key, P payload);
    }

    static abstract class Node<P> {
        abstract boolean isEmpty();

        /**
         * Inserts a payload. When the key is already bound the stored payload
         * and the new one are combined with {@code merger(existing, payload)}.
         */
        abstract Node<P> insert0(int key, P payload, BinaryOperator<P> merger);

        /**
         * Replaces the payload bound to the key with {@code f(existing)}, or
         * removes the key when {@code f} returns null.
         */
        abstract Node<P> alter0(int key, UnaryOperator<P> f);

        abstract Node<P> remove0(int key);

        abstract Node<P> filter0(KeyedFunction<P, P> f);

        abstract <Q> Node<Q> map0(KeyedFunction<? super P, ? extends Q> f);
    }

    static final class Empty<P> extends Node<P> {
        @Override
        boolean isEmpty() {
            return true;
        }

        @Override
        Node<P> insert0(int key, P payload, BinaryOperator<P> merger) {
            return new Leaf<>(key, payload);
        }

        @Override
        Node<P> alter0(int key, UnaryOperator<P> f) {
            return this;
        }

        @Override
        Node<P> remove0(int key) {
            return this;
        }

        @Override
        Node<P> filter0(KeyedFunction<P, P> f) {
            return this;
        }

        @Override
        <Q> Node<Q> map0(KeyedFunction<? super P, ? extends Q> f) {
            return empty();
        }

        @Override
        public String toString() {
            return "Empty";
        }
    }

    static final class Leaf<P> extends Node<P> implements Map.Entry<Integer, P> {
        final int key;
        final P payload;

        Leaf(int key, P payload) {
            this.key = key;
            this.payload = payload;
        }

        @Override
        boolean isEmpty() {
            return false;
        }

        @Override
        Node<P> insert0(int key, P payload, BinaryOperator<P> merger) {
            if (key == this.key) {
                P merged = merger.apply(this.payload, payload);
                return merged == this.payload ? this : new Leaf<>(key, merged);
            } else {
                return join(key, new Leaf<>(key, payload), this.key, this);
            }
        }

        @Override
        Node<P> alter0(int key, UnaryOperator<P> f) {
            if (key != this.key)
                return this;
            P altered = f.apply(payload);
            if (altered == null) {
                return empty();
            } else if (altered == payload) {
                return this;
            } else {
                return new Leaf<>(key, altered);
            }
        }

        @Override
        Node<P> remove0(int key) {
            return key == this.key ? empty() : this;
        }

        @Override
        Node<P> filter0(KeyedFunction<P, P> f) {
            return alter0(key, p -> f.apply(key, p));
        }

        @Override
        <Q> Node<Q> map0(KeyedFunction<? super P, ? extends Q> f) {
            return new Leaf<>(key, f.apply(key, payload));
        }

        @Override
        public Integer getKey() {
            return key;
        }

        @Override
        public P getValue() {
            return payload;
        }

        @Override
        public P setValue(P value) {
            throw new UnsupportedOperationException();
        }

        @Override
        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof Map.Entry))
                return false;
            Map.Entry<?,?> e = (Map.Entry<?,?>)obj;
            return Integer.valueOf(key).equals(e.getKey())
                && Objects.equals(payload, e.getValue());
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(key) ^ Objects.hashCode(payload);
        }

        @Override
        public String toString() {
            return key + ":" + payload;
        }
    }

    static final class Branch<P> extends Node<P> {
        final int prefix;
        final int mask;
        final Node<P> left;
        final Node<P> right;

        Branch(int prefix, int mask, Node<P> left, Node<P> right) {
            this.prefix = prefix;
            this.mask = mask;
            this.left = left;
            this.right = right;
        }

        @Override
        boolean isEmpty() {
            return false;
        }

        Node<P> rebuild(Node<P> l, Node<P> r) {
            if (l == left && r == right) {
                return this;
            } else {
                return branch(prefix, mask, l, r);
            }
        }

        @Override
        Node<P> insert0(int key, P payload, BinaryOperator<P> merger) {
            if (matchPrefix(key, prefix, mask)) {
                if (zeroBit(key, mask)) {
                    return rebuild(left.insert0(key, payload, merger), right);
                } else {
                    return rebuild(left, right.insert0(key, payload, merger));
                }
            } else {
                return join(key, new Leaf<>(key, payload), prefix, this);
            }
        }

        @Override
        Node<P> alter0(int key, UnaryOperator<P> f) {
            if (!matchPrefix(key, prefix, mask)) {
                return this;
            } else if (zeroBit(key, mask)) {
                return rebuild(left.alter0(key, f), right);
            } else {
                return rebuild(left, right.alter0(key, f));
            }
        }

        @Override
        Node<P> remove0(int key) {
            if (!matchPrefix(key, prefix, mask)) {
                return this;
            } else if (zeroBit(key, mask)) {
                return rebuild(left.remove0(key), right);
            } else {
                return rebuild(left, right.remove0(key));
            }
        }

        @Override
        Node<P> filter0(KeyedFunction<P, P> f) {
            return rebuild(left.filter0(f), right.filter0(f));
        }

        @Override
        <Q> Node<Q> map0(KeyedFunction<? super P, ? extends Q> f) {
            return new Branch<>(prefix, mask, left.map0(f), right.map0(f));
        }

        @Override
        public String toString() {
            return "Branch(" + Integer.toHexString(prefix) + ", "
                + Integer.toHexString(mask) + ", " + left + ", " + right + ")";
        }
    }

    /**
     * Builds a branch, collapsing into the surviving child when the other
     * one is empty.
     */
    static <P> Node<P> branch(int prefix, int mask, Node<P> left, Node<P> right) {
        if (left.isEmpty()) {
            return right;
        } else if (right.isEmpty()) {
            return left;
        } else {
            return new Branch<>(prefix, mask, left, right);
        }
    }

    /**
     * Unites two non-empty subtrees whose prefixes disagree.
     */
    static <P> Node<P> join(int p0, Node<P> t0, int p1, Node<P> t1) {
        int m = branchingBit(p0, p1);
        int p = mask(p0, m);
        if (zeroBit(p0, m)) {
            return new Branch<>(p, m, t0, t1);
        } else {
            return new Branch<>(p, m, t1, t0);
        }
    }

    // Point operations

    static <P> Leaf<P> lookup(Node<P> t, int key) {
        while (t instanceof Branch) {
            Branch<P> b = (Branch<P>)t;
            t = zeroBit(key, b.mask) ? b.left : b.right;
        }
        if (t instanceof Leaf) {
            Leaf<P> leaf = (Leaf<P>)t;
            if (leaf.key == key)
                return leaf;
        }
        return null;
    }

    static <P> Node<P> insert(Node<P> root, int key, P payload, BinaryOperator<P> merger) {
        return root.insert0(key, payload, merger);
    }

    static <P> Node<P> alter(Node<P> root, int key, UnaryOperator<P> f) {
        return root.alter0(key, f);
    }

    static <P> Node<P> remove(Node<P> root, int key) {
        return root.remove0(key);
    }

    /**
     * Returns the leaf with the smallest unsigned key, or null.
     */
    static <P> Leaf<P> first(Node<P> t) {
        while (t instanceof Branch) {
            t = ((Branch<P>)t).left;
        }
        return t instanceof Leaf ? (Leaf<P>)t : null;
    }

    /**
     * Returns the leaf with the largest unsigned key, or null.
     */
    static <P> Leaf<P> last(Node<P> t) {
        while (t instanceof Branch) {
            t = ((Branch<P>)t).right;
        }
        return t instanceof Leaf ? (Leaf<P>)t : null;
    }

    // Traversals

    private static VerifyException unexpected(Node<?> t) {
        return new VerifyException("Unexpected trie node below a branch: " + t);
    }

    static <P> int count(Node<P> root) {
        return weigh(root, p -> 1);
    }

    /**
     * Sums the weight of every payload in the trie.
     */
    static <P> int weigh(Node<P> root, ToIntFunction<? super P> weight) {
        if (root.isEmpty()) {
            return 0;
        } else if (root instanceof Leaf) {
            return weight.applyAsInt(((Leaf<P>)root).payload);
        }

        Deque<Node<P>> stack = new ArrayDeque<>(STACK_SIZE);
        stack.push(root);

        int count = 0;
        while (!stack.isEmpty()) {
            Node<P> t = stack.pop();
            if (t instanceof Leaf) {
                count += weight.applyAsInt(((Leaf<P>)t).payload);
            } else if (t instanceof Branch) {
                Branch<P> b = (Branch<P>)t;
                if (b.left instanceof Leaf && b.right instanceof Leaf) {
                    count += weight.applyAsInt(((Leaf<P>)b.left).payload);
                    count += weight.applyAsInt(((Leaf<P>)b.right).payload);
                } else if (b.left instanceof Leaf) {
                    count += weight.applyAsInt(((Leaf<P>)b.left).payload);
                    stack.push(b.right);
                } else if (b.right instanceof Leaf) {
                    count += weight.applyAsInt(((Leaf<P>)b.right).payload);
                    stack.push(b.left);
                } else {
                    stack.push(b.right);
                    stack.push(b.left);
                }
            } else {
                throw unexpected(t);
            }
        }
        return count;
    }

    /**
     * Folds leaves in ascending unsigned key order.
     */
    static <P, R> R foldLeft(Node<P> root, R z, BiFunction<R, Leaf<P>, R> f) {
        if (root.isEmpty()) {
            return z;
        } else if (root instanceof Leaf) {
            return f.apply(z, (Leaf<P>)root);
        }

        Deque<Node<P>> stack = new ArrayDeque<>(STACK_SIZE);
        stack.push(root);

        R state = z;
        while (!stack.isEmpty()) {
            Node<P> t = stack.pop();
            if (t instanceof Leaf) {
                state = f.apply(state, (Leaf<P>)t);
            } else if (t instanceof Branch) {
                Branch<P> b = (Branch<P>)t;
                if (b.left instanceof Leaf && b.right instanceof Leaf) {
                    state = f.apply(state, (Leaf<P>)b.left);
                    state = f.apply(state, (Leaf<P>)b.right);
                } else if (b.left instanceof Leaf) {
                    // only the left-leaf case keeps the visiting order
                    state = f.apply(state, (Leaf<P>)b.left);
                    stack.push(b.right);
                } else {
                    stack.push(b.right);
                    stack.push(b.left);
                }
            } else {
                throw unexpected(t);
            }
        }
        return state;
    }

    /**
     * Folds leaves in descending unsigned key order, so the last key is
     * combined first.
     */
    static <P, R> R foldRight(Node<P> root, R z, BiFunction<Leaf<P>, R, R> f) {
        if (root.isEmpty()) {
            return z;
        } else if (root instanceof Leaf) {
            return f.apply((Leaf<P>)root, z);
        }

        Deque<Node<P>> stack = new ArrayDeque<>(STACK_SIZE);
        stack.push(root);

        R state = z;
        while (!stack.isEmpty()) {
            Node<P> t = stack.pop();
            if (t instanceof Leaf) {
                state = f.apply((Leaf<P>)t, state);
            } else if (t instanceof Branch) {
                Branch<P> b = (Branch<P>)t;
                if (b.left instanceof Leaf && b.right instanceof Leaf) {
                    state = f.apply((Leaf<P>)b.right, state);
                    state = f.apply((Leaf<P>)b.left, state);
                } else if (b.right instanceof Leaf) {
                    state = f.apply((Leaf<P>)b.right, state);
                    stack.push(b.left);
                } else {
                    stack.push(b.left);
                    stack.push(b.right);
                }
            } else {
                throw unexpected(t);
            }
        }
        return state;
    }

    /**
     * Finds the first leaf, in ascending key order, that satisfies the
     * predicate. Stops as soon as a match is found.
     */
    static <P> Leaf<P> find(Node<P> root, BiPredicate<Integer, ? super P> p) {
        Iterator<Leaf<P>> it = iterator(root, false);
        while (it.hasNext()) {
            Leaf<P> leaf = it.next();
            if (p.test(leaf.key, leaf.payload))
                return leaf;
        }
        return null;
    }

    static <P> Iterator<Leaf<P>> iterator(Node<P> root, boolean descending) {
        return new TrieIterator<>(root, descending);
    }

    /**
     * A lazy leaf iterator driven by an explicit stack of pending subtrees.
     */
    static final class TrieIterator<P> extends AbstractIterator<Leaf<P>> {
        private final Deque<Node<P>> stack = new ArrayDeque<>(STACK_SIZE);
        private final boolean descending;

        TrieIterator(Node<P> root, boolean descending) {
            this.descending = descending;
            if (!root.isEmpty()) {
                stack.push(root);
            }
        }

        @Override
        protected Leaf<P> computeNext() {
            while (!stack.isEmpty()) {
                Node<P> t = stack.pop();
                if (t instanceof Leaf) {
                    return (Leaf<P>)t;
                } else if (t instanceof Branch) {
                    Branch<P> b = (Branch<P>)t;
                    Node<P> near = descending ? b.right : b.left;
                    Node<P> far  = descending ? b.left : b.right;
                    stack.push(far);
                    if (near instanceof Leaf) {
                        return (Leaf<P>)near;
                    }
                    stack.push(near);
                } else {
                    throw unexpected(t);
                }
            }
            return endOfData();
        }
    }

    // Structural bulk operations. Recursion depth is bounded by the key width.

    static <P> Node<P> filter(Node<P> root, KeyedFunction<P, P> f) {
        return root.filter0(f);
    }

    static <P, Q> Node<Q> map(Node<P> root, KeyedFunction<? super P, ? extends Q> f) {
        return root.map0(f);
    }

    /**
     * Computes the union of two tries. Payloads bound to the same key in
     * both are combined with {@code merger(s payload, t payload)}.
     */
    static <P> Node<P> union(Node<P> s, Node<P> t, BinaryOperator<P> merger) {
        if (s == t || t.isEmpty()) {
            return s;
        } else if (s.isEmpty()) {
            return t;
        } else if (s instanceof Leaf) {
            Leaf<P> x = (Leaf<P>)s;
            return t.insert0(x.key, x.payload, (tp, sp) -> merger.apply(sp, tp));
        } else if (t instanceof Leaf) {
            Leaf<P> y = (Leaf<P>)t;
            return s.insert0(y.key, y.payload, merger);
        }

        Branch<P> bs = (Branch<P>)s, bt = (Branch<P>)t;
        int p = bs.prefix, m = bs.mask;
        int q = bt.prefix, n = bt.mask;

        if (m == n && p == q) {
            Node<P> left = union(bs.left, bt.left, merger);
            Node<P> right = union(bs.right, bt.right, merger);
            if (left == bt.left && right == bt.right) {
                return bt;
            } else {
                return bs.rebuild(left, right);
            }
        } else if (shorter(m, n) && matchPrefix(q, p, m)) {
            // t lies below one of s's children
            if (zeroBit(q, m)) {
                return bs.rebuild(union(bs.left, t, merger), bs.right);
            } else {
                return bs.rebuild(bs.left, union(bs.right, t, merger));
            }
        } else if (shorter(n, m) && matchPrefix(p, q, n)) {
            // s lies below one of t's children
            if (zeroBit(p, n)) {
                return bt.rebuild(union(s, bt.left, merger), bt.right);
            } else {
                return bt.rebuild(bt.left, union(s, bt.right, merger));
            }
        } else {
            return join(p, s, q, t);
        }
    }

    /**
     * Computes the intersection of two tries. For keys bound in both, the
     * result payload is {@code combiner(s payload, t payload)}; a null
     * result drops the key.
     */
    static <P, Q> Node<P> intersect(Node<P> s, Node<Q> t, BiFunction<P, Q, P> combiner) {
        if (s.isEmpty() || t.isEmpty()) {
            return empty();
        } else if (s instanceof Leaf) {
            Leaf<P> x = (Leaf<P>)s;
            Leaf<Q> y = lookup(t, x.key);
            return y == null ? empty() : s.alter0(x.key, sp -> combiner.apply(sp, y.payload));
        } else if (t instanceof Leaf) {
            Leaf<Q> y = (Leaf<Q>)t;
            Leaf<P> x = lookup(s, y.key);
            if (x == null)
                return empty();
            P r = combiner.apply(x.payload, y.payload);
            if (r == null) {
                return empty();
            } else if (r == x.payload) {
                return x;
            } else {
                return new Leaf<>(y.key, r);
            }
        }

        Branch<P> bs = (Branch<P>)s;
        Branch<Q> bt = (Branch<Q>)t;
        int p = bs.prefix, m = bs.mask;
        int q = bt.prefix, n = bt.mask;

        if (m == n) {
            if (p != q)
                return empty();
            return bs.rebuild(intersect(bs.left, bt.left, combiner),
                              intersect(bs.right, bt.right, combiner));
        } else if (shorter(m, n)) {
            if (!matchPrefix(q, p, m))
                return empty();
            return intersect(zeroBit(q, m) ? bs.left : bs.right, t, combiner);
        } else {
            if (!matchPrefix(p, q, n))
                return empty();
            return intersect(s, zeroBit(p, n) ? bt.left : bt.right, combiner);
        }
    }

    /**
     * Removes from {@code s} the keys bound in {@code t}. For keys bound in
     * both, {@code remainder(s payload, t payload)} gives what is left of the
     * payload in {@code s}; null removes the key.
     */
    static <P, Q> Node<P> difference(Node<P> s, Node<Q> t, BiFunction<P, Q, P> remainder) {
        if (s.isEmpty() || t.isEmpty()) {
            return s;
        } else if (s instanceof Leaf) {
            Leaf<P> x = (Leaf<P>)s;
            Leaf<Q> y = lookup(t, x.key);
            return y == null ? s : s.alter0(x.key, sp -> remainder.apply(sp, y.payload));
        } else if (t instanceof Leaf) {
            Leaf<Q> y = (Leaf<Q>)t;
            return s.alter0(y.key, sp -> remainder.apply(sp, y.payload));
        }

        Branch<P> bs = (Branch<P>)s;
        Branch<Q> bt = (Branch<Q>)t;
        int p = bs.prefix, m = bs.mask;
        int q = bt.prefix, n = bt.mask;

        if (m == n) {
            if (p != q)
                return s;
            return bs.rebuild(difference(bs.left, bt.left, remainder),
                              difference(bs.right, bt.right, remainder));
        } else if (shorter(m, n)) {
            if (!matchPrefix(q, p, m)) {
                return s;
            } else if (zeroBit(q, m)) {
                return bs.rebuild(difference(bs.left, t, remainder), bs.right);
            } else {
                return bs.rebuild(bs.left, difference(bs.right, t, remainder));
            }
        } else {
            if (!matchPrefix(p, q, n))
                return s;
            return difference(s, zeroBit(p, n) ? bt.left : bt.right, remainder);
        }
    }

    /**
     * Returns {@code true} if every key of {@code s} is bound in {@code t}
     * and each pair of payloads satisfies {@code included(s payload, t payload)}.
     */
    static <P, Q> boolean isSubset(Node<P> s, Node<Q> t, BiPredicate<P, Q> included) {
        if (s.isEmpty()) {
            return true;
        } else if (t.isEmpty()) {
            return false;
        } else if (s instanceof Leaf) {
            Leaf<P> x = (Leaf<P>)s;
            Leaf<Q> y = lookup(t, x.key);
            return y != null && included.test(x.payload, y.payload);
        } else if (t instanceof Leaf) {
            // a branch binds at least two keys
            return false;
        }

        Branch<P> bs = (Branch<P>)s;
        Branch<Q> bt = (Branch<Q>)t;
        int p = bs.prefix, m = bs.mask;
        int q = bt.prefix, n = bt.mask;

        if (shorter(m, n)) {
            return false;
        } else if (shorter(n, m)) {
            return matchPrefix(p, q, n)
                && isSubset(s, zeroBit(p, n) ? bt.left : bt.right, included);
        } else {
            return p == q
                && isSubset(bs.left, bt.left, included)
                && isSubset(bs.right, bt.right, included);
        }
    }
}
