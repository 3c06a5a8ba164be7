package io.akuity.namespaceclass.operator.config;

import io.akuity.namespaceclass.operator.model.NamespaceClass;
import io.akuity.namespaceclass.operator.model.NamespaceClassBinding;
import io.akuity.namespaceclass.operator.model.NamespaceClassBindingList;
import io.akuity.namespaceclass.operator.model.NamespaceClassList;
import io.akuity.namespaceclass.operator.store.KindResolver;
import io.akuity.namespaceclass.operator.store.KubernetesManagedResourceStore;
import io.akuity.namespaceclass.operator.store.KubernetesNamespaceClassBindingStore;
import io.akuity.namespaceclass.operator.store.KubernetesNamespaceClassStore;
import io.akuity.namespaceclass.operator.store.KubernetesNamespaceStore;
import io.akuity.namespaceclass.operator.store.ManagedResourceStore;
import io.akuity.namespaceclass.operator.store.NamespaceClassBindingStore;
import io.akuity.namespaceclass.operator.store.NamespaceClassStore;
import io.akuity.namespaceclass.operator.store.NamespaceStore;
import io.kubernetes.client.Discovery;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.models.V1Namespace;
import io.kubernetes.client.openapi.models.V1NamespaceList;
import io.kubernetes.client.util.generic.GenericKubernetesApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Typed API handles and the stores built on them.
 */
@Configuration
public class StoreConfig {

    @Bean
    public GenericKubernetesApi<NamespaceClassBinding, NamespaceClassBindingList> bindingApi(ApiClient apiClient) {
        return new GenericKubernetesApi<>(
                NamespaceClassBinding.class,
                NamespaceClassBindingList.class,
                NamespaceClassBinding.GROUP,
                NamespaceClassBinding.VERSION,
                NamespaceClassBinding.PLURAL,
                apiClient);
    }

    @Bean
    public GenericKubernetesApi<NamespaceClass, NamespaceClassList> namespaceClassApi(ApiClient apiClient) {
        return new GenericKubernetesApi<>(
                NamespaceClass.class,
                NamespaceClassList.class,
                NamespaceClass.GROUP,
                NamespaceClass.VERSION,
                NamespaceClass.PLURAL,
                apiClient);
    }

    @Bean
    public GenericKubernetesApi<V1Namespace, V1NamespaceList> namespaceApi(ApiClient apiClient) {
        return new GenericKubernetesApi<>(V1Namespace.class, V1NamespaceList.class, "", "v1", "namespaces", apiClient);
    }

    @Bean
    public NamespaceClassBindingStore bindingStore(
            GenericKubernetesApi<NamespaceClassBinding, NamespaceClassBindingList> bindingApi) {
        return new KubernetesNamespaceClassBindingStore(bindingApi);
    }

    @Bean
    public NamespaceClassStore namespaceClassStore(
            GenericKubernetesApi<NamespaceClass, NamespaceClassList> namespaceClassApi) {
        return new KubernetesNamespaceClassStore(namespaceClassApi);
    }

    @Bean
    public NamespaceStore namespaceStore(GenericKubernetesApi<V1Namespace, V1NamespaceList> namespaceApi) {
        return new KubernetesNamespaceStore(namespaceApi);
    }

    @Bean
    public KindResolver kindResolver(ApiClient apiClient) {
        return new KindResolver(new Discovery(apiClient));
    }

    @Bean
    public ManagedResourceStore managedResourceStore(ApiClient apiClient, KindResolver kindResolver) {
        return new KubernetesManagedResourceStore(apiClient, kindResolver);
    }
}
