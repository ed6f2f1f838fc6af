package com.preciousledger.domain.model;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Result of a fail-soft computation: either a value or the reason it could not
 * be computed. Keeps a real zero distinguishable from a failure.
 */
public final class ReconciliationOutcome<T> {

    private final T value;
    private final ReconciliationError error;
    private final String detail;

    private ReconciliationOutcome(T value, ReconciliationError error, String detail) {
        this.value = value;
        this.error = error;
        this.detail = detail;
    }

    public static <T> ReconciliationOutcome<T> success(T value) {
        return new ReconciliationOutcome<>(Objects.requireNonNull(value), null, null);
    }

    public static <T> ReconciliationOutcome<T> failure(ReconciliationError error, String detail) {
        return new ReconciliationOutcome<>(null, Objects.requireNonNull(error), detail);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public T orElse(T fallback) {
        return isSuccess() ? value : fallback;
    }

    public <R> ReconciliationOutcome<R> map(Function<T, R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failure(error, detail);
    }

    public ReconciliationError getError() {
        return error;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success[" + value + "]" : "Failure[" + error + ": " + detail + "]";
    }
}
