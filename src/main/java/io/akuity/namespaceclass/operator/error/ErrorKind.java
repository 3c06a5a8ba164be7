package io.akuity.namespaceclass.operator.error;

/**
 * Classification of failures returned by the API server.
 * The category decides whether a failure is recovered locally, retried by the
 * controller's rate limiter, or treated as an interruption.
 */
public enum ErrorKind {

    NOT_FOUND(Category.EXPECTED),

    /**
     * Optimistic-concurrency failure: the object changed since it was read.
     */
    CONFLICT(Category.TRANSIENT),

    /**
     * Another field manager owns a field this apply tries to set.
     */
    FIELD_MANAGER_CONFLICT(Category.TRANSIENT),

    /**
     * The server refused to change a field that can only be set at creation.
     */
    IMMUTABLE_FIELD(Category.TRANSIENT),

    /**
     * Forbidden, invalid, over quota or otherwise refused until someone fixes it.
     */
    PERMANENT(Category.PERMANENT),

    /**
     * The worker thread was interrupted while waiting on the API server.
     */
    CANCELLED(Category.INTERRUPTED),

    /**
     * A call or a bounded wait ran out of time. Retried like any other transient failure.
     */
    TIMEOUT(Category.TRANSIENT),

    UNKNOWN(Category.TRANSIENT);

    private final Category category;

    ErrorKind(Category category) {
        this.category = category;
    }

    public boolean isInterruption() {
        return category == Category.INTERRUPTED;
    }

    private enum Category {
        EXPECTED,
        TRANSIENT,
        PERMANENT,
        INTERRUPTED
    }
}
