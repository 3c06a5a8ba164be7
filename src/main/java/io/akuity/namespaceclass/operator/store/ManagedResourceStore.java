package io.akuity.namespaceclass.operator.store;

import io.akuity.namespaceclass.operator.model.Manifest;
import io.akuity.namespaceclass.operator.model.ResourceKey;

/**
 * Access to arbitrary namespaced resources materialized from NamespaceClass entries.
 */
public interface ManagedResourceStore {

    StoreResult<Manifest> get(ResourceKey key, String namespace);

    /**
     * Server-side applies the manifest into its {@code metadata.namespace}.
     *
     * @param fieldManager field owner recorded for the applied fields
     * @param force        take ownership of fields held by other managers
     */
    StoreResult<Manifest> apply(Manifest manifest, String fieldManager, boolean force);

    /**
     * Deletes the resource. With {@code ignoreNotFound} an absent resource counts as deleted.
     */
    StoreResult<Void> delete(ResourceKey key, String namespace, boolean ignoreNotFound);
}
