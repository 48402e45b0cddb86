/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.bittrie.fp.data;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The answer of a lookup on a persistent collection. An absent result is
 * distinct from any stored value, so collections never answer with
 * {@code null}.
 */
public final class Maybe<A> {
    private static final Maybe<?> NOTHING = new Maybe<>(null);

    // null means absent
    private final A value;

    private Maybe(A value) {
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    public static <A> Maybe<A> empty() {
        return (Maybe<A>)NOTHING;
    }

    /**
     * Wraps a present value.
     *
     * @throws NullPointerException if value is null
     */
    public static <A> Maybe<A> of(A value) {
        return new Maybe<>(checkNotNull(value));
    }

    public static <A> Maybe<A> ofNullable(A value) {
        return value == null ? empty() : new Maybe<>(value);
    }

    public boolean isPresent() {
        return value != null;
    }

    public boolean isAbsent() {
        return value == null;
    }

    /**
     * Returns the present value.
     *
     * @throws NoSuchElementException if nothing is present
     */
    public A get() {
        if (value == null)
            throw new NoSuchElementException("Nothing");
        return value;
    }

    public A orElse(A other) {
        return value == null ? other : value;
    }

    public <X extends Throwable> A orElseThrow(Supplier<? extends X> error) throws X {
        if (value == null)
            throw error.get();
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this
            || (obj instanceof Maybe && Objects.equals(value, ((Maybe<?>)obj).value));
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value == null ? "Nothing" : "Just " + value;
    }
}
