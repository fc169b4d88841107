package org.tamodel.diagnostics;

import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Function;

/**
 * The outcome of a builder operation that may be rejected: either the created
 * value or the {@link TypeError} that prevented its creation.
 *
 * @param <T> The type of the value.
 */
public final class Result<T> {

    private final T value;
    private final TypeError error;

    private Result(T value, TypeError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Result<T> ok(T value) {
        if (value == null) throw new IllegalArgumentException("value must not be null");
        return new Result<>(value, null);
    }

    public static <T> Result<T> error(TypeError error) {
        if (error == null) throw new IllegalArgumentException("error must not be null");
        return new Result<>(null, error);
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isError() {
        return error != null;
    }

    /**
     * @return The value.
     * @throws NoSuchElementException if this result is an error.
     */
    public T get() {
        if (error != null) {
            throw new NoSuchElementException("No value present: " + error.message());
        }
        return value;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public Optional<TypeError> error() {
        return Optional.ofNullable(error);
    }

    /**
     * Transforms the value of a successful result; errors pass through unchanged.
     * @param mapper The transformation.
     * @param <U> The new value type.
     * @return The transformed result.
     */
    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        return error == null ? Result.ok(mapper.apply(value)) : Result.error(error);
    }

    @Override
    public String toString() {
        return error == null ? "Ok[" + value + "]" : "Error[" + error.message() + "]";
    }
}
