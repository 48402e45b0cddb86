/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.bittrie.fp.data;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.BiFunction;
import java.util.function.Predicate;

/**
 * An immutable chain of distinct elements sharing one hash code, kept in
 * ascending order of a comparator. The comparator must report two elements
 * as equal exactly when {@code equals} does, otherwise duplicates are not
 * detected reliably.
 *
 * <p>A bucket is never empty; operations that would leave nothing behind
 * return {@code null} so the enclosing trie leaf can be dropped. Operations
 * that change nothing return the original bucket.
 */
final class CollisionBucket<E> implements Iterable<E> {
    final E head;
    final CollisionBucket<E> next;
    private final int size;

    CollisionBucket(E head, CollisionBucket<E> next) {
        this.head = head;
        this.next = next;
        this.size = next == null ? 1 : next.size + 1;
    }

    static <E> CollisionBucket<E> of(E e) {
        return new CollisionBucket<>(e, null);
    }

    int size() {
        return size;
    }

    E first() {
        return head;
    }

    E last() {
        CollisionBucket<E> p = this;
        while (p.next != null) {
            p = p.next;
        }
        return p.head;
    }

    boolean contains(E value, Comparator<? super E> cmp) {
        for (CollisionBucket<E> p = this; p != null; p = p.next) {
            int c = cmp.compare(value, p.head);
            if (c < 0) {
                return false;
            } else if (c == 0) {
                return value.equals(p.head);
            }
        }
        return false;
    }

    CollisionBucket<E> add(E value, Comparator<? super E> cmp) {
        Object[] path = new Object[size];
        int n = 0;
        for (CollisionBucket<E> p = this; p != null; p = p.next) {
            if (p.head == value)
                return this;
            int c = cmp.compare(value, p.head);
            if (c == 0) {
                return this;
            } else if (c < 0) {
                return rebuild(path, n, new CollisionBucket<>(value, p));
            }
            path[n++] = p.head;
        }
        return rebuild(path, n, new CollisionBucket<>(value, null));
    }

    CollisionBucket<E> remove(E value, Comparator<? super E> cmp) {
        Object[] path = new Object[size];
        int n = 0;
        for (CollisionBucket<E> p = this; p != null; p = p.next) {
            int c = cmp.compare(value, p.head);
            if (c < 0) {
                break;
            } else if (c == 0 && value.equals(p.head)) {
                return rebuild(path, n, p.next);
            }
            path[n++] = p.head;
        }
        return this;
    }

    /**
     * Conses the first {@code n} elements of {@code path}, in order, onto
     * {@code tail}.
     */
    @SuppressWarnings("unchecked")
    private static <E> CollisionBucket<E> rebuild(Object[] path, int n, CollisionBucket<E> tail) {
        CollisionBucket<E> res = tail;
        for (int i = n - 1; i >= 0; i--) {
            res = new CollisionBucket<>((E)path[i], res);
        }
        return res;
    }

    private static <E> CollisionBucket<E> fromList(List<E> elems) {
        CollisionBucket<E> res = null;
        for (int i = elems.size() - 1; i >= 0; i--) {
            res = new CollisionBucket<>(elems.get(i), res);
        }
        return res;
    }

    static <E> CollisionBucket<E> union(CollisionBucket<E> a, CollisionBucket<E> b, Comparator<? super E> cmp) {
        if (a == b)
            return a;

        List<E> res = new ArrayList<>(a.size + b.size);
        CollisionBucket<E> x = a, y = b;
        while (x != null && y != null) {
            int c = cmp.compare(x.head, y.head);
            if (c == 0) {
                res.add(x.head);
                x = x.next;
                y = y.next;
            } else if (c < 0) {
                res.add(x.head);
                x = x.next;
            } else {
                res.add(y.head);
                y = y.next;
            }
        }
        for (; x != null; x = x.next)
            res.add(x.head);
        for (; y != null; y = y.next)
            res.add(y.head);

        if (res.size() == a.size) {
            return a;
        } else if (res.size() == b.size) {
            return b;
        } else {
            return fromList(res);
        }
    }

    static <E> CollisionBucket<E> intersect(CollisionBucket<E> a, CollisionBucket<E> b, Comparator<? super E> cmp) {
        if (a == b)
            return a;

        List<E> res = new ArrayList<>(Math.min(a.size, b.size));
        CollisionBucket<E> x = a, y = b;
        while (x != null && y != null) {
            int c = cmp.compare(x.head, y.head);
            if (c == 0) {
                res.add(x.head);
                x = x.next;
                y = y.next;
            } else if (c < 0) {
                x = x.next;
            } else {
                y = y.next;
            }
        }

        if (res.isEmpty()) {
            return null;
        } else if (res.size() == a.size) {
            return a;
        } else if (res.size() == b.size) {
            return b;
        } else {
            return fromList(res);
        }
    }

    static <E> CollisionBucket<E> difference(CollisionBucket<E> a, CollisionBucket<E> b, Comparator<? super E> cmp) {
        if (a == b)
            return null;

        List<E> res = new ArrayList<>(a.size);
        CollisionBucket<E> x = a, y = b;
        while (x != null && y != null) {
            int c = cmp.compare(x.head, y.head);
            if (c == 0) {
                x = x.next;
                y = y.next;
            } else if (c < 0) {
                res.add(x.head);
                x = x.next;
            } else {
                y = y.next;
            }
        }
        for (; x != null; x = x.next)
            res.add(x.head);

        if (res.isEmpty()) {
            return null;
        } else if (res.size() == a.size) {
            return a;
        } else {
            return fromList(res);
        }
    }

    static <E> boolean isSubset(CollisionBucket<E> a, CollisionBucket<E> b, Comparator<? super E> cmp) {
        if (a.size > b.size)
            return false;

        CollisionBucket<E> x = a, y = b;
        while (x != null) {
            if (y == null)
                return false;
            int c = cmp.compare(x.head, y.head);
            if (c == 0) {
                x = x.next;
                y = y.next;
            } else if (c < 0) {
                return false;
            } else {
                y = y.next;
            }
        }
        return true;
    }

    CollisionBucket<E> filter(Predicate<? super E> p) {
        List<E> res = new ArrayList<>(size);
        for (CollisionBucket<E> q = this; q != null; q = q.next) {
            if (p.test(q.head))
                res.add(q.head);
        }
        if (res.isEmpty()) {
            return null;
        } else if (res.size() == size) {
            return this;
        } else {
            return fromList(res);
        }
    }

    <R> R foldLeft(R z, BiFunction<R, ? super E, R> f) {
        R r = z;
        for (CollisionBucket<E> p = this; p != null; p = p.next) {
            r = f.apply(r, p.head);
        }
        return r;
    }

    <R> R foldRight(R z, BiFunction<? super E, R, R> f) {
        Object[] elems = toArray();
        R r = z;
        for (int i = elems.length - 1; i >= 0; i--) {
            @SuppressWarnings("unchecked")
            E e = (E)elems[i];
            r = f.apply(e, r);
        }
        return r;
    }

    Object[] toArray() {
        Object[] elems = new Object[size];
        int i = 0;
        for (CollisionBucket<E> p = this; p != null; p = p.next) {
            elems[i++] = p.head;
        }
        return elems;
    }

    @Override
    public Iterator<E> iterator() {
        return new Iterator<E>() {
            private CollisionBucket<E> current = CollisionBucket.this;

            @Override
            public boolean hasNext() {
                return current != null;
            }

            @Override
            public E next() {
                if (current == null)
                    throw new NoSuchElementException();
                E result = current.head;
                current = current.next;
                return result;
            }
        };
    }

    Iterator<E> descendingIterator() {
        Object[] elems = toArray();
        return new Iterator<E>() {
            private int index = elems.length;

            @Override
            public boolean hasNext() {
                return index > 0;
            }

            @Override
            @SuppressWarnings("unchecked")
            public E next() {
                if (index == 0)
                    throw new NoSuchElementException();
                return (E)elems[--index];
            }
        };
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder("[");
        for (CollisionBucket<E> p = this; p != null; p = p.next) {
            buf.append(p.head);
            if (p.next != null)
                buf.append(",");
        }
        return buf.append("]").toString();
    }
}
