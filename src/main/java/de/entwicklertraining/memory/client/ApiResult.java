package de.entwicklertraining.memory.client;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a client call: either a value or exactly one {@link ClientError}.
 *
 * @param <T> the type of the success value
 */
public final class ApiResult<T> {

    private final T value;
    private final ClientError error;

    private ApiResult(T value, ClientError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> ApiResult<T> success(T value) {
        return new ApiResult<>(value, null);
    }

    public static <T> ApiResult<T> failure(ClientError error) {
        return new ApiResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * Gets the success value.
     *
     * @return the value, possibly null for calls without a body
     * @throws IllegalStateException if this result is a failure
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("Result is a failure: " + error.kind(), error);
        }
        return value;
    }

    /**
     * Gets the error.
     *
     * @return the error
     * @throws IllegalStateException if this result is a success
     */
    public ClientError getError() {
        if (error == null) {
            throw new IllegalStateException("Result is a success");
        }
        return error;
    }

    public Optional<ClientError> error() {
        return Optional.ofNullable(error);
    }

    public <U> ApiResult<U> map(Function<? super T, ? extends U> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    public <U> ApiResult<U> flatMap(Function<? super T, ApiResult<U>> mapper) {
        if (error != null) {
            return failure(error);
        }
        return Objects.requireNonNull(mapper.apply(value), "mapper result");
    }

    /**
     * Returns the value or throws the contained error unchanged.
     *
     * @return the value
     * @throws ClientError if this result is a failure
     */
    public T orElseThrow() {
        if (error != null) {
            throw error;
        }
        return value;
    }

    @Override
    public String toString() {
        return error == null
                ? "ApiResult.success(" + value + ")"
                : "ApiResult.failure(" + error.kind() + ": " + error.getMessage() + ")";
    }
}
