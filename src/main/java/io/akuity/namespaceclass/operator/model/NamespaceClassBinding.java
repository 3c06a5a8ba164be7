package io.akuity.namespaceclass.operator.model;

import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import lombok.Data;

/**
 * Represents a NamespaceClassBinding custom resource.
 * There is at most one per namespace and it is always named after the namespace.
 */
@Data
public class NamespaceClassBinding implements KubernetesObject {
    public static final String GROUP = "akuity.io";
    public static final String VERSION = "v1alpha1";
    public static final String API_VERSION = GROUP + "/" + VERSION;
    public static final String PLURAL = "namespaceclassbindings";
    public static final String KIND = "NamespaceClassBinding";

    private String apiVersion = API_VERSION;
    private String kind = KIND;
    private V1ObjectMeta metadata;
    private NamespaceClassBindingSpec spec;
    private NamespaceClassBindingStatus status;

    public String namespace() {
        return metadata.getNamespace();
    }

    public String name() {
        return metadata.getName();
    }

    public String className() {
        return spec == null ? "" : nullToEmpty(spec.getClassName());
    }

    /**
     * Returns the status block, creating an empty one if the binding has never been reconciled.
     */
    public NamespaceClassBindingStatus statusOrEmpty() {
        if (status == null) {
            status = new NamespaceClassBindingStatus();
        }
        return status;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
