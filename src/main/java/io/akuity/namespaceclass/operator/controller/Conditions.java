package io.akuity.namespaceclass.operator.controller;

import io.kubernetes.client.openapi.models.V1Condition;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Helpers for the standard Kubernetes condition list.
 */
public final class Conditions {
    public static final String READY = "Ready";
    public static final String TRUE = "True";
    public static final String FALSE = "False";

    private Conditions() {
    }

    public static Optional<V1Condition> find(List<V1Condition> conditions, String type) {
        if (conditions == null) {
            return Optional.empty();
        }
        return conditions.stream().filter(c -> type.equals(c.getType())).findFirst();
    }

    /**
     * Sets a condition in place.
     * An identical condition (type, status, reason, message) is left alone, including its
     * transition time. The transition time only moves when the status flips.
     *
     * @return whether the list changed
     */
    public static boolean set(List<V1Condition> conditions, String type, boolean status,
                              String reason, String message, OffsetDateTime now) {
        String statusValue = status ? TRUE : FALSE;
        Optional<V1Condition> existing = find(conditions, type);

        if (existing.isEmpty()) {
            conditions.add(new V1Condition()
                    .type(type)
                    .status(statusValue)
                    .reason(reason)
                    .message(message)
                    .lastTransitionTime(now));
            return true;
        }

        V1Condition condition = existing.get();
        if (statusValue.equals(condition.getStatus())
                && Objects.equals(reason, condition.getReason())
                && Objects.equals(message, condition.getMessage())) {
            return false;
        }

        if (!statusValue.equals(condition.getStatus()) || condition.getLastTransitionTime() == null) {
            condition.setLastTransitionTime(now);
        }
        condition.setStatus(statusValue);
        condition.setReason(reason);
        condition.setMessage(message);
        return true;
    }
}
