/*
 *  Copyright (c) 2025 Think-it GmbH
 *
 *  This program and the accompanying materials are made available under the
 *  terms of the Apache License, Version 2.0 which is available at
 *  https://www.apache.org/licenses/LICENSE-2.0
 *
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Contributors:
 *       Think-it GmbH - initial API and implementation
 *
 */

package org.eclipse.dataspace.domain;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of an operation: either a successful content (possibly {@code null} for {@code Void} results)
 * or a failure carrying the cause.
 *
 * @param <T> the content type
 */
public final class Result<T> {

    private final T content;
    private final Throwable cause;

    private Result(T content, Throwable cause) {
        this.content = content;
        this.cause = cause;
    }

    public static <T> Result<T> success(T content) {
        return new Result<>(content, null);
    }

    public static <T> Result<T> success() {
        return new Result<>(null, null);
    }

    public static <T> Result<T> failure(Throwable cause) {
        return new Result<>(null, Objects.requireNonNull(cause, "failure cause"));
    }

    /**
     * Run the supplier, capturing any thrown exception as failure.
     */
    public static <T> Result<T> attempt(ThrowingSupplier<T> supplier) {
        try {
            return success(supplier.get());
        } catch (Exception e) {
            return failure(e);
        }
    }

    public boolean succeeded() {
        return cause == null;
    }

    public boolean failed() {
        return !succeeded();
    }

    public T getContent() {
        return content;
    }

    public Throwable getCause() {
        return cause;
    }

    public <U> Result<U> map(ThrowingFunction<? super T, ? extends U> mapper) {
        if (failed()) {
            return failure(cause);
        }
        try {
            return success(mapper.apply(content));
        } catch (Exception e) {
            return failure(e);
        }
    }

    public <U> Result<U> compose(ThrowingFunction<? super T, Result<U>> mapper) {
        if (failed()) {
            return failure(cause);
        }
        try {
            return mapper.apply(content);
        } catch (Exception e) {
            return failure(e);
        }
    }

    /**
     * Replace a failure with the result of the recovery function, successes are returned untouched.
     */
    public Result<T> recover(Function<Throwable, Result<T>> recovery) {
        return failed() ? recovery.apply(cause) : this;
    }

    public Result<T> onSuccess(Consumer<T> consumer) {
        if (succeeded()) {
            consumer.accept(content);
        }
        return this;
    }

    public Result<T> onFailure(Consumer<Throwable> consumer) {
        if (failed()) {
            consumer.accept(cause);
        }
        return this;
    }

    /**
     * Return the content or rethrow the original failure cause as it is, checked exceptions included.
     */
    public T orElseThrow() {
        if (failed()) {
            throw Result.<RuntimeException>sneaky(cause);
        }
        return content;
    }

    public <X extends Throwable> T orElseThrow(Function<Throwable, X> exceptionSupplier) throws X {
        if (failed()) {
            throw exceptionSupplier.apply(cause);
        }
        return content;
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> E sneaky(Throwable throwable) throws E {
        throw (E) throwable;
    }

    @Override
    public String toString() {
        return succeeded() ? "Success[" + content + "]" : "Failure[" + cause + "]";
    }

    @FunctionalInterface
    public interface ThrowingFunction<T, R> {
        R apply(T input) throws Exception;
    }

    @FunctionalInterface
    public interface ThrowingSupplier<T> {
        T get() throws Exception;
    }
}
