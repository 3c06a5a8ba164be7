package io.akuity.namespaceclass.operator.store;

import io.kubernetes.client.openapi.models.V1Namespace;
import io.kubernetes.client.openapi.models.V1NamespaceList;
import io.kubernetes.client.util.generic.GenericKubernetesApi;
import lombok.RequiredArgsConstructor;

import java.util.function.Function;

@RequiredArgsConstructor
public class KubernetesNamespaceStore implements NamespaceStore {
    private final GenericKubernetesApi<V1Namespace, V1NamespaceList> namespaceApi;

    @Override
    public StoreResult<V1Namespace> get(String name) {
        return ApiResponses.execute(() -> namespaceApi.get(name), Function.identity());
    }
}
