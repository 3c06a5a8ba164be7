package io.akuity.namespaceclass.operator.store;

import io.akuity.namespaceclass.operator.model.NamespaceClassBinding;

public interface NamespaceClassBindingStore {

    StoreResult<NamespaceClassBinding> get(String namespace, String name);

    StoreResult<NamespaceClassBinding> create(NamespaceClassBinding binding);

    /**
     * Replaces the binding's spec. Fails with a conflict when the resourceVersion is stale.
     */
    StoreResult<NamespaceClassBinding> update(NamespaceClassBinding binding);

    /**
     * Replaces the status subresource. Fails with a conflict when the resourceVersion is stale.
     */
    StoreResult<NamespaceClassBinding> updateStatus(NamespaceClassBinding binding);

    StoreResult<Void> delete(String namespace, String name, boolean ignoreNotFound);
}
