package io.akuity.namespaceclass.operator.controller;

import io.akuity.namespaceclass.operator.model.NamespaceClassBinding;
import io.kubernetes.client.extended.event.EventType;
import io.kubernetes.client.extended.event.legacy.EventRecorder;
import io.kubernetes.client.openapi.models.V1Namespace;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Publishes {@link BindingEvents} as Kubernetes Events on the affected object.
 */
@Component
@RequiredArgsConstructor
public class RecordedBindingEvents implements BindingEvents {
    private final EventRecorder recorder;

    @Override
    public void bindingCreated(V1Namespace namespace, String className) {
        recorder.event(namespace, EventType.Normal, "BindingCreated",
                "Created NamespaceClassBinding for class %s", className);
    }

    @Override
    public void bindingUpdated(V1Namespace namespace, String previousClassName, String className) {
        recorder.event(namespace, EventType.Normal, "BindingUpdated",
                "Updated NamespaceClassBinding from class %s to class %s", previousClassName, className);
    }

    @Override
    public void bindingRemoved(V1Namespace namespace, String className) {
        recorder.event(namespace, EventType.Normal, "BindingRemoved",
                "Removed NamespaceClassBinding for class %s", className);
    }

    @Override
    public void cleanedUp(NamespaceClassBinding binding, String className) {
        recorder.event(binding, EventType.Normal, "CleanedUp",
                "Cleaned up resources and deleted binding for missing NamespaceClass %s", className);
    }

    @Override
    public void reconcileSucceeded(NamespaceClassBinding binding, int appliedCount, String className) {
        recorder.event(binding, EventType.Normal, "ReconcileSucceeded",
                "Successfully applied %s resources from class %s", String.valueOf(appliedCount), className);
    }
}
