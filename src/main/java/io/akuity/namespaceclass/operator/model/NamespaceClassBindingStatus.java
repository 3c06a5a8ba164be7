package io.akuity.namespaceclass.operator.model;

import io.kubernetes.client.openapi.models.V1Condition;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Status for a NamespaceClassBinding.
 * This is a cache of what was last applied; an empty status is rebuilt by a single pass.
 */
@Data
public class NamespaceClassBindingStatus {
    private String observedClassName;
    private Long observedClassGeneration;
    private List<AppliedResource> appliedResources = new ArrayList<>();
    private List<V1Condition> conditions = new ArrayList<>();

    public String observedClassNameOrEmpty() {
        return observedClassName == null ? "" : observedClassName;
    }

    public long observedGeneration() {
        return observedClassGeneration == null ? 0L : observedClassGeneration;
    }

    public List<AppliedResource> appliedOrEmpty() {
        return appliedResources == null ? List.of() : appliedResources;
    }

    public static NamespaceClassBindingStatus copyOf(NamespaceClassBindingStatus source) {
        NamespaceClassBindingStatus copy = new NamespaceClassBindingStatus();
        if (source == null) {
            return copy;
        }
        copy.setObservedClassName(source.getObservedClassName());
        copy.setObservedClassGeneration(source.getObservedClassGeneration());
        for (AppliedResource resource : source.appliedOrEmpty()) {
            copy.getAppliedResources().add(
                    new AppliedResource(resource.getApiVersion(), resource.getKind(), resource.getName()));
        }
        if (source.getConditions() != null) {
            for (V1Condition condition : source.getConditions()) {
                copy.getConditions().add(new V1Condition()
                        .type(condition.getType())
                        .status(condition.getStatus())
                        .reason(condition.getReason())
                        .message(condition.getMessage())
                        .observedGeneration(condition.getObservedGeneration())
                        .lastTransitionTime(condition.getLastTransitionTime()));
            }
        }
        return copy;
    }
}
