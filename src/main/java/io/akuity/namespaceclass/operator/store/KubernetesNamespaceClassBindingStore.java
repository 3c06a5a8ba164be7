package io.akuity.namespaceclass.operator.store;

import io.akuity.namespaceclass.operator.model.NamespaceClassBinding;
import io.akuity.namespaceclass.operator.model.NamespaceClassBindingList;
import io.kubernetes.client.util.generic.GenericKubernetesApi;
import lombok.RequiredArgsConstructor;

import java.util.function.Function;

@RequiredArgsConstructor
public class KubernetesNamespaceClassBindingStore implements NamespaceClassBindingStore {
    private final GenericKubernetesApi<NamespaceClassBinding, NamespaceClassBindingList> bindingApi;

    @Override
    public StoreResult<NamespaceClassBinding> get(String namespace, String name) {
        return ApiResponses.execute(() -> bindingApi.get(namespace, name), Function.identity());
    }

    @Override
    public StoreResult<NamespaceClassBinding> create(NamespaceClassBinding binding) {
        return ApiResponses.execute(() -> bindingApi.create(binding), Function.identity());
    }

    @Override
    public StoreResult<NamespaceClassBinding> update(NamespaceClassBinding binding) {
        return ApiResponses.execute(() -> bindingApi.update(binding), Function.identity());
    }

    @Override
    public StoreResult<NamespaceClassBinding> updateStatus(NamespaceClassBinding binding) {
        return ApiResponses.execute(
                () -> bindingApi.updateStatus(binding, NamespaceClassBinding::getStatus),
                Function.identity());
    }

    @Override
    public StoreResult<Void> delete(String namespace, String name, boolean ignoreNotFound) {
        StoreResult<Void> result = ApiResponses.<NamespaceClassBinding, Void>execute(
                () -> bindingApi.delete(namespace, name), binding -> null);
        if (ignoreNotFound && result.isNotFound()) {
            return StoreResult.ok();
        }
        return result;
    }
}
