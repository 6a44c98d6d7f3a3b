package com.yerin.jobclient.client;

import com.yerin.jobclient.global.exception.code.JobErrorCode;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a client operation: either {@link Ok} with a value or {@link Err}
 * with a reason code and a human-readable message. Operational failures are
 * always returned this way, never thrown.
 *
 * @param <T> type of the success value
 */
public sealed interface Result<T> permits Result.Ok, Result.Err {

    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> err(JobErrorCode code, String message) {
        return new Err<>(code, message);
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    default boolean isErr() {
        return this instanceof Err;
    }

    default <X extends RuntimeException> T orElseThrow(Function<Err<T>, X> toException) {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        throw toException.apply((Err<T>) this);
    }

    /** Success. {@code value} is {@code null} for operations without a payload (cancel). */
    record Ok<T>(T value) implements Result<T> {
    }

    record Err<T>(JobErrorCode code, String message) implements Result<T> {
        public Err {
            Objects.requireNonNull(code, "code");
            Objects.requireNonNull(message, "message");
        }
    }
}
