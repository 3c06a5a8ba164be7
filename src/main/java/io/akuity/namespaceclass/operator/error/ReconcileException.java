package io.akuity.namespaceclass.operator.error;

/**
 * Aborts a reconciliation pass. Carries the failure classification and, where the
 * failure belongs to a pass step, the reason code to surface on the Ready condition.
 */
public class ReconcileException extends RuntimeException {

    private final ErrorKind kind;
    private final ConditionReason reason;

    public ReconcileException(ErrorKind kind, String message) {
        this(kind, null, message, null);
    }

    public ReconcileException(ErrorKind kind, ConditionReason reason, String message) {
        this(kind, reason, message, null);
    }

    public ReconcileException(ErrorKind kind, ConditionReason reason, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.reason = reason;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Reason code for the Ready condition, or {@code null} when the failure happened
     * outside a step that owns a reason (fetching the binding, writing status).
     */
    public ConditionReason getReason() {
        return reason;
    }

    public boolean isInterruption() {
        return kind.isInterruption();
    }
}
