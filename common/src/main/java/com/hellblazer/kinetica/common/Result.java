/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Kinetica.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.kinetica.common;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Explicit outcome of a routine operation that may legitimately not happen: firing with an empty pool, despawning a
 * handle that is already gone. Expected conditions are values, not exceptions.
 * <p>
 * Usage:
 * <pre>
 * var fired = projectiles.fireProjectile("p1", origin, angle, now, 10.0f, 120.0f);
 * if (fired.isSuccess()) {
 *     var handle = fired.value();
 * } else {
 *     log.debug("Fire skipped: {}", fired.failure().message());
 * }
 * </pre>
 *
 * @param <T> type of the success value
 * @author hal.hildebrand
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    /**
     * Categories of routine failure.
     */
    enum Kind {
        /**
         * Pool empty or cooldown not yet elapsed. The caller skips the action.
         */
        RESOURCE_EXHAUSTED,
        /**
         * No backing entity for the given id. The caller logs and continues.
         */
        UNKNOWN_ENTITY
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(Kind kind, String message) {
        return new Failure<>(kind, message);
    }

    static <T> Result<T> exhausted(String message) {
        return new Failure<>(Kind.RESOURCE_EXHAUSTED, message);
    }

    static <T> Result<T> unknown(Object id) {
        return new Failure<>(Kind.UNKNOWN_ENTITY, "No entity: " + id);
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * @return the success value
     * @throws NoSuchElementException if this is a failure
     */
    T value();

    /**
     * @return the failure
     * @throws IllegalStateException if this is a success
     */
    Failure<T> failure();

    default Optional<T> toOptional() {
        return isSuccess() ? Optional.ofNullable(value()) : Optional.empty();
    }

    default <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (isSuccess()) {
            return success(mapper.apply(value()));
        }
        var f = failure();
        return failure(f.kind(), f.message());
    }

    default Result<T> ifSuccess(Consumer<? super T> action) {
        if (isSuccess()) {
            action.accept(value());
        }
        return this;
    }

    /**
     * @param value the produced value, may be null for operations with nothing to return
     */
    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Failure<T> failure() {
            throw new IllegalStateException("Result is a success");
        }
    }

    /**
     * @param kind    failure category
     * @param message human-readable reason, for logs only
     */
    record Failure<T>(Kind kind, String message) implements Result<T> {
        public Failure {
            Objects.requireNonNull(kind, "kind cannot be null");
            Objects.requireNonNull(message, "message cannot be null");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T value() {
            throw new NoSuchElementException("Result is a failure: " + kind + " (" + message + ")");
        }

        @Override
        public Failure<T> failure() {
            return this;
        }
    }
}
