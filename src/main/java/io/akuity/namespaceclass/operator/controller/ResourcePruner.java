package io.akuity.namespaceclass.operator.controller;

import io.akuity.namespaceclass.operator.error.ConditionReason;
import io.akuity.namespaceclass.operator.error.ReconcileException;
import io.akuity.namespaceclass.operator.model.AppliedResource;
import io.akuity.namespaceclass.operator.model.Manifest;
import io.akuity.namespaceclass.operator.model.ResourceKey;
import io.akuity.namespaceclass.operator.store.ManagedResourceStore;
import io.akuity.namespaceclass.operator.store.StoreResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Deletes managed resources that a binding no longer wants.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ResourcePruner {
    private final ManagedResourceStore resourceStore;

    /**
     * Keys of all entries that carry a full identity, in template order.
     */
    public static Set<ResourceKey> desiredKeys(List<Manifest> manifests) {
        Set<ResourceKey> keys = new LinkedHashSet<>();
        for (Manifest manifest : manifests) {
            if (manifest.hasIdentity()) {
                keys.add(manifest.key());
            }
        }
        return keys;
    }

    /**
     * Previously applied resources whose key is no longer desired.
     */
    public static List<ResourceKey> staleKeys(List<AppliedResource> applied, Set<ResourceKey> desired) {
        List<ResourceKey> stale = new ArrayList<>();
        for (AppliedResource resource : applied) {
            ResourceKey key = resource.key();
            if (!desired.contains(key)) {
                stale.add(key);
            }
        }
        return stale;
    }

    public static List<ResourceKey> keys(List<AppliedResource> applied) {
        return staleKeys(applied, Set.of());
    }

    /**
     * Deletes every key from the namespace. Resources that are already gone count as deleted.
     *
     * @throws ReconcileException on the first deletion that fails for any other reason
     */
    public void deleteAll(String namespace, Collection<ResourceKey> keys, ConditionReason reason) {
        for (ResourceKey key : keys) {
            log.info("Deleting {} from namespace {}", key, namespace);
            StoreResult<Void> result = resourceStore.delete(key, namespace, true);
            if (!result.isSuccess()) {
                throw result.toException(reason, "failed to delete " + key);
            }
        }
    }
}
