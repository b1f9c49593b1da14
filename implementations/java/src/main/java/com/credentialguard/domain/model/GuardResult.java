package com.credentialguard.domain.model;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Discriminated success/error result of a guard operation.
 *
 * @param <T> Success value type ({@link Void} for operations without a value)
 */
public final class GuardResult<T> {

    private static final GuardResult<Void> OK = new GuardResult<>(null, null);

    private final T value;
    private final GuardError error;

    private GuardResult(T value, GuardError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> GuardResult<T> success(T value) {
        return new GuardResult<>(Objects.requireNonNull(value, "Value must not be null"), null);
    }

    public static GuardResult<Void> ok() {
        return OK;
    }

    public static <T> GuardResult<T> failure(GuardError error) {
        return new GuardResult<>(null, Objects.requireNonNull(error, "Error must not be null"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * Success value.
     *
     * @throws IllegalStateException if this is a failure
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value present, failed with " + error);
        }
        return value;
    }

    public Optional<GuardError> getError() {
        return Optional.ofNullable(error);
    }

    public boolean failedWith(GuardError.Kind kind) {
        return error != null && error.is(kind);
    }

    public <U> GuardResult<U> map(Function<? super T, ? extends U> mapper) {
        if (error != null) {
            return failure(error);
        }
        return new GuardResult<>(mapper.apply(value), null);
    }

    public <X extends Throwable> T orElseThrow(Function<GuardError, ? extends X> exceptionMapper) throws X {
        if (error != null) {
            throw exceptionMapper.apply(error);
        }
        return value;
    }

    @Override
    public String toString() {
        return error == null ? "GuardResult[success]" : "GuardResult[failure=" + error + "]";
    }
}
