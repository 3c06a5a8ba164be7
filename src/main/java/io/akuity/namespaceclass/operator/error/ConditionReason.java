package io.akuity.namespaceclass.operator.error;

/**
 * Stable reason codes written to the binding's Ready condition.
 */
public enum ConditionReason {
    RECONCILE_SUCCESS("ReconcileSuccess"),
    CLASS_NOT_FOUND("ClassNotFound"),
    PRUNE_FAILED("PruneFailed"),
    APPLY_FAILED("ApplyFailed");

    private final String code;

    ConditionReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
