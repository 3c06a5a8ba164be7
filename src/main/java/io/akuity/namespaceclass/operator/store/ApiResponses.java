package io.akuity.namespaceclass.operator.store;

import io.akuity.namespaceclass.operator.error.ErrorKind;
import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.models.V1Status;
import io.kubernetes.client.util.generic.KubernetesApiResponse;

import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Translates client-java responses and exceptions into {@link StoreResult}s.
 */
public final class ApiResponses {

    private ApiResponses() {
    }

    /**
     * Runs a {@code GenericKubernetesApi} call and maps its outcome.
     * Transport failures surface as {@code RuntimeException}s from client-java and are classified too.
     */
    public static <T extends KubernetesObject, R> StoreResult<R> execute(Supplier<KubernetesApiResponse<T>> call,
                                                                     Function<T, R> mapper) {
        if (Thread.currentThread().isInterrupted()) {
            return StoreResult.failure(ErrorKind.CANCELLED, "worker interrupted before API call");
        }
        KubernetesApiResponse<T> response;
        try {
            response = call.get();
        } catch (RuntimeException e) {
            return fromThrowable(e);
        }
        if (response.isSuccess()) {
            T object = response.getObject();
            return StoreResult.ok(object == null ? null : mapper.apply(object));
        }
        V1Status status = response.getStatus();
        String reason = status == null ? null : status.getReason();
        String message = status == null || status.getMessage() == null
                ? "HTTP " + response.getHttpStatusCode()
                : status.getMessage();
        return StoreResult.failure(classify(response.getHttpStatusCode(), reason, message),
                response.getHttpStatusCode(), message);
    }

    public static <T> StoreResult<T> fromApiException(ApiException e) {
        if (e.getCode() == 0) {
            return fromThrowable(e);
        }
        String message = e.getResponseBody() != null && !e.getResponseBody().isEmpty()
                ? e.getResponseBody()
                : e.getMessage();
        return StoreResult.failure(classify(e.getCode(), null, message), e.getCode(), message);
    }

    static <T> StoreResult<T> fromThrowable(Throwable e) {
        if (hasCause(e, SocketTimeoutException.class)) {
            return StoreResult.failure(ErrorKind.TIMEOUT, "call timed out: " + e.getMessage());
        }
        if (hasCause(e, InterruptedException.class) || hasCause(e, InterruptedIOException.class)) {
            Thread.currentThread().interrupt();
            return StoreResult.failure(ErrorKind.CANCELLED, "call interrupted: " + e.getMessage());
        }
        return StoreResult.failure(ErrorKind.UNKNOWN, e.getClass().getSimpleName() + ": " + e.getMessage());
    }

    /**
     * Maps an HTTP failure to an {@link ErrorKind}.
     */
    public static ErrorKind classify(int code, String reason, String message) {
        String text = message == null ? "" : message.toLowerCase(Locale.ROOT);
        switch (code) {
            case 404:
                return ErrorKind.NOT_FOUND;
            case 409:
                if (text.contains("apply failed") || text.contains("conflict with")
                        || text.contains("field manager")) {
                    return ErrorKind.FIELD_MANAGER_CONFLICT;
                }
                return ErrorKind.CONFLICT;
            case 400:
            case 422:
                if (isImmutableMessage(text)) {
                    return ErrorKind.IMMUTABLE_FIELD;
                }
                return ErrorKind.PERMANENT;
            case 401:
            case 403:
            case 405:
            case 413:
            case 415:
                return ErrorKind.PERMANENT;
            case 408:
            case 504:
                return ErrorKind.TIMEOUT;
            default:
                if ("Forbidden".equals(reason) || "Invalid".equals(reason)) {
                    return isImmutableMessage(text) ? ErrorKind.IMMUTABLE_FIELD : ErrorKind.PERMANENT;
                }
                return ErrorKind.UNKNOWN;
        }
    }

    private static boolean isImmutableMessage(String text) {
        return text.contains("field is immutable")
                || text.contains("immutable")
                || text.contains("cannot be modified");
    }

    private static boolean hasCause(Throwable e, Class<? extends Throwable> type) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (type.isInstance(cause)) {
                return true;
            }
            if (cause.getCause() == cause) {
                break;
            }
        }
        return false;
    }
}
