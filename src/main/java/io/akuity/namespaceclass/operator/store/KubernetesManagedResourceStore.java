package io.akuity.namespaceclass.operator.store;

import io.akuity.namespaceclass.operator.error.ErrorKind;
import io.akuity.namespaceclass.operator.model.Manifest;
import io.akuity.namespaceclass.operator.model.ResourceKey;
import io.kubernetes.client.custom.V1Patch;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.util.generic.dynamic.DynamicKubernetesApi;
import io.kubernetes.client.util.generic.dynamic.DynamicKubernetesObject;
import io.kubernetes.client.util.generic.options.PatchOptions;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * {@link ManagedResourceStore} over the dynamic client, one {@link DynamicKubernetesApi} per kind.
 */
@Slf4j
public class KubernetesManagedResourceStore implements ManagedResourceStore {
    private final KindResolver kindResolver;
    private final Function<ResourceKind, DynamicKubernetesApi> apiFactory;
    private final Map<ResourceKind, DynamicKubernetesApi> apis = new ConcurrentHashMap<>();

    public KubernetesManagedResourceStore(ApiClient apiClient, KindResolver kindResolver) {
        this(kindResolver, kind ->
                new DynamicKubernetesApi(kind.getGroup(), kind.getVersion(), kind.getPlural(), apiClient));
    }

    KubernetesManagedResourceStore(KindResolver kindResolver,
                                   Function<ResourceKind, DynamicKubernetesApi> apiFactory) {
        this.kindResolver = kindResolver;
        this.apiFactory = apiFactory;
    }

    @Override
    public StoreResult<Manifest> get(ResourceKey key, String namespace) {
        return withApi(key, api -> ApiResponses.execute(
                () -> api.get(namespace, key.getName()),
                object -> Manifest.of(object.getRaw())));
    }

    @Override
    public StoreResult<Manifest> apply(Manifest manifest, String fieldManager, boolean force) {
        PatchOptions options = new PatchOptions();
        options.setFieldManager(fieldManager);
        options.setForce(force);
        V1Patch body = new V1Patch(manifest.toJson().toString());

        return withApi(manifest.key(), api -> ApiResponses.execute(
                () -> api.patch(manifest.getNamespace(), manifest.getName(),
                        V1Patch.PATCH_FORMAT_APPLY_YAML, body, options),
                object -> Manifest.of(object.getRaw())));
    }

    @Override
    public StoreResult<Void> delete(ResourceKey key, String namespace, boolean ignoreNotFound) {
        StoreResult<ResourceKind> kind = kindResolver.resolve(key.group(), key.version(), key.getKind());
        if (ignoreNotFound && kind.isNotFound()) {
            // no longer served, so no object of this kind can exist
            log.debug("Skipping delete of {} in {}: {}", key, namespace, kind.getMessage());
            return StoreResult.ok();
        }
        StoreResult<Void> result = withApi(key, kind, api -> ApiResponses.<DynamicKubernetesObject, Void>execute(
                () -> api.delete(namespace, key.getName()),
                object -> null));
        if (ignoreNotFound && result.isNotFound()) {
            return StoreResult.ok();
        }
        return result;
    }

    private <T> StoreResult<T> withApi(ResourceKey key, Function<DynamicKubernetesApi, StoreResult<T>> call) {
        return withApi(key, kindResolver.resolve(key.group(), key.version(), key.getKind()), call);
    }

    private <T> StoreResult<T> withApi(ResourceKey key, StoreResult<ResourceKind> kind,
                                       Function<DynamicKubernetesApi, StoreResult<T>> call) {
        if (kind.isNotFound()) {
            // an unserved kind is a broken class entry, not a missing object
            return StoreResult.failure(ErrorKind.PERMANENT, kind.getMessage());
        }
        if (!kind.isSuccess()) {
            return kind.asFailure();
        }
        if (!kind.getObject().isNamespaced()) {
            return StoreResult.failure(ErrorKind.PERMANENT,
                    key.getKind() + " is cluster scoped and cannot be placed in a namespace");
        }
        return call.apply(apis.computeIfAbsent(kind.getObject(), apiFactory));
    }
}
