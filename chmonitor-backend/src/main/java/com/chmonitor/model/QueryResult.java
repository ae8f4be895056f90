package com.chmonitor.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;
import java.util.function.Function;

/**
 * Uniform envelope returned by the query executor.
 *
 * <p>Exactly one of {@link #getData()} and {@link #getError()} is non-null. Instances are only
 * created through {@link #success(Object, QueryMetadata)} and {@link #failure(FetchError, QueryMetadata)}.
 *
 * @param <T> payload type
 */
@JsonPropertyOrder({"data", "metadata", "error"})
public final class QueryResult<T> {
    private final T data;
    private final QueryMetadata metadata;
    private final FetchError error;

    private QueryResult(T data, QueryMetadata metadata, FetchError error) {
        this.data = data;
        this.metadata = metadata;
        this.error = error;
    }

    public static <T> QueryResult<T> success(T data, QueryMetadata metadata) {
        Objects.requireNonNull(data, "data");
        return new QueryResult<>(data, metadata, null);
    }

    public static <T> QueryResult<T> failure(FetchError error, QueryMetadata metadata) {
        Objects.requireNonNull(error, "error");
        return new QueryResult<>(null, metadata, error);
    }

    public T getData() {
        return data;
    }

    public QueryMetadata getMetadata() {
        return metadata;
    }

    public FetchError getError() {
        return error;
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Collapses both arms into a single value.
     *
     * @param onSuccess applied to the payload of a successful result
     * @param onFailure applied to the error of a failed result
     * @param <R> result type
     * @return mapped value
     */
    public <R> R fold(Function<? super T, ? extends R> onSuccess, Function<FetchError, ? extends R> onFailure) {
        return isSuccess() ? onSuccess.apply(data) : onFailure.apply(error);
    }

    /**
     * Maps the payload of a successful result, keeping failures untouched.
     *
     * @param mapper payload mapper
     * @param <R> new payload type
     * @return mapped result
     */
    public <R> QueryResult<R> map(Function<? super T, ? extends R> mapper) {
        if (!isSuccess()) {
            return new QueryResult<>(null, metadata, error);
        }
        return success(mapper.apply(data), metadata);
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "QueryResult{success, metadata=" + metadata + "}"
                : "QueryResult{error=" + error + ", metadata=" + metadata + "}";
    }
}
