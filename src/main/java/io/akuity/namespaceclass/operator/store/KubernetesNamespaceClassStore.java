package io.akuity.namespaceclass.operator.store;

import io.akuity.namespaceclass.operator.model.NamespaceClass;
import io.akuity.namespaceclass.operator.model.NamespaceClassList;
import io.kubernetes.client.util.generic.GenericKubernetesApi;
import lombok.RequiredArgsConstructor;

import java.util.function.Function;

@RequiredArgsConstructor
public class KubernetesNamespaceClassStore implements NamespaceClassStore {
    private final GenericKubernetesApi<NamespaceClass, NamespaceClassList> classApi;

    @Override
    public StoreResult<NamespaceClass> get(String name) {
        return ApiResponses.execute(() -> classApi.get(name), Function.identity());
    }
}
