// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.common;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of an exchange operation: the value it produced, or the {@link DomainError} (or other
 * error type) that rejected it. A result holding an error never holds a value.
 */
public final class Result<T, E> {

    private final T value;
    private final E error;

    private Result(final T value, final E error) {
        this.value = value;
        this.error = error;
    }

    public static <T, E> Result<T, E> ok(final T value) {
        return new Result<>(value, null);
    }

    public static <T, E> Result<T, E> err(final E error) {
        return new Result<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isErr() {
        return error != null;
    }

    public Optional<T> toOptional() {
        return isOk() ? Optional.ofNullable(value) : Optional.empty();
    }

    public <U> Result<U, E> map(final Function<? super T, ? extends U> mapper) {
        return isOk() ? ok(mapper.apply(value)) : err(error);
    }

    /**
     * Chain a dependent step; the first error short-circuits the rest.
     */
    public <U> Result<U, E> flatMap(final Function<? super T, Result<U, E>> next) {
        return isOk() ? Objects.requireNonNull(next.apply(value), "next step result") : err(error);
    }

    public T orElseThrow(final Function<? super E, ? extends RuntimeException> toException) {
        if (isErr()) {
            throw toException.apply(error);
        }
        return value;
    }

    /** Value of an ok result, {@code null} for an error. */
    public T getValueUnsafe() {
        return value;
    }

    /** Error of a failed result, {@code null} for an ok one. */
    public E getErrorUnsafe() {
        return error;
    }

    @Override
    public String toString() {
        return isOk() ? "Ok(" + value + ")" : "Err(" + error + ")";
    }
}
