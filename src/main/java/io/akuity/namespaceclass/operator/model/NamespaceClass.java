package io.akuity.namespaceclass.operator.model;

import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import lombok.Data;

/**
 * Cluster-scoped NamespaceClass custom resource: a named, versioned list of manifests
 * to materialize into every namespace that selects it.
 */
@Data
public class NamespaceClass implements KubernetesObject {
    public static final String GROUP = "akuity.io";
    public static final String VERSION = "v1alpha1";
    public static final String PLURAL = "namespaceclasses";
    public static final String KIND = "NamespaceClass";

    private String apiVersion = GROUP + "/" + VERSION;
    private String kind = KIND;
    private V1ObjectMeta metadata;
    private NamespaceClassSpec spec;

    public long generation() {
        if (metadata == null || metadata.getGeneration() == null) {
            return 0L;
        }
        return metadata.getGeneration();
    }
}
