package io.akuity.namespaceclass.operator.store;

import io.akuity.namespaceclass.operator.error.ConditionReason;
import io.akuity.namespaceclass.operator.error.ErrorKind;
import io.akuity.namespaceclass.operator.error.ReconcileException;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outcome of a single store call: either the returned object or a classified failure.
 * Stores never throw for API errors, so callers can branch on the failure kind.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class StoreResult<T> {
    private final T object;
    private final ErrorKind errorKind;
    private final int code;
    private final String message;

    public static <T> StoreResult<T> ok(T object) {
        return new StoreResult<>(object, null, 200, null);
    }

    public static <T> StoreResult<T> ok() {
        return ok(null);
    }

    public static <T> StoreResult<T> failure(ErrorKind kind, int code, String message) {
        return new StoreResult<>(null, kind, code, message);
    }

    public static <T> StoreResult<T> failure(ErrorKind kind, String message) {
        return failure(kind, 0, message);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public boolean isNotFound() {
        return errorKind == ErrorKind.NOT_FOUND;
    }

    public boolean is(ErrorKind kind) {
        return errorKind == kind;
    }

    /**
     * Re-types a failed result. Only valid on failures.
     */
    public <U> StoreResult<U> asFailure() {
        if (isSuccess()) {
            throw new IllegalStateException("Cannot convert a successful result into a failure");
        }
        return failure(errorKind, code, message);
    }

    /**
     * Returns the object, or raises a {@link ReconcileException} describing the failure.
     */
    public T orElseThrow(ConditionReason reason, String action) {
        if (!isSuccess()) {
            throw toException(reason, action);
        }
        return object;
    }

    public ReconcileException toException(ConditionReason reason, String action) {
        return new ReconcileException(errorKind, reason, action + ": " + message);
    }

    @Override
    public String toString() {
        return isSuccess() ? "StoreResult[ok]" : "StoreResult[" + errorKind + " " + code + ": " + message + "]";
    }
}
