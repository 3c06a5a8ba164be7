package io.akuity.namespaceclass.operator.controller;

import io.akuity.namespaceclass.operator.model.NamespaceClassBinding;
import io.kubernetes.client.openapi.models.V1Namespace;

/**
 * Signals emitted by the two controllers when they change something.
 */
public interface BindingEvents {

    void bindingCreated(V1Namespace namespace, String className);

    void bindingUpdated(V1Namespace namespace, String previousClassName, String className);

    void bindingRemoved(V1Namespace namespace, String className);

    void cleanedUp(NamespaceClassBinding binding, String className);

    void reconcileSucceeded(NamespaceClassBinding binding, int appliedCount, String className);
}
