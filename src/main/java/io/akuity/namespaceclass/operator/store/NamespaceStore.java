package io.akuity.namespaceclass.operator.store;

import io.kubernetes.client.openapi.models.V1Namespace;

public interface NamespaceStore {

    StoreResult<V1Namespace> get(String name);
}
