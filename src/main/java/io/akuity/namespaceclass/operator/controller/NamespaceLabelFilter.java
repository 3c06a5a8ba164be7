package io.akuity.namespaceclass.operator.controller;

import io.kubernetes.client.openapi.models.V1Namespace;
import lombok.RequiredArgsConstructor;

import java.util.Map;
import java.util.Objects;

/**
 * Decides which namespace events reach the namespace work queue.
 * Deletion is left to garbage collection through the binding's owner reference.
 */
@RequiredArgsConstructor
public class NamespaceLabelFilter {
    private final String classLabel;

    public boolean onAdd(V1Namespace namespace) {
        return labelValue(namespace) != null;
    }

    public boolean onUpdate(V1Namespace oldNamespace, V1Namespace newNamespace) {
        return !Objects.equals(labelValue(oldNamespace), labelValue(newNamespace));
    }

    public boolean onDelete(V1Namespace namespace, Boolean deletedFinalStateUnknown) {
        return false;
    }

    private String labelValue(V1Namespace namespace) {
        if (namespace == null || namespace.getMetadata() == null) {
            return null;
        }
        Map<String, String> labels = namespace.getMetadata().getLabels();
        return labels == null ? null : labels.get(classLabel);
    }
}
