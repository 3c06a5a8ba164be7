package io.akuity.namespaceclass.operator.model;

import lombok.Value;

/**
 * Identity of a managed resource inside a namespace.
 */
@Value
public class ResourceKey {
    String apiVersion;
    String kind;
    String name;

    /**
     * API group of {@link #apiVersion}, empty for the core group.
     */
    public String group() {
        int slash = apiVersion.indexOf('/');
        return slash < 0 ? "" : apiVersion.substring(0, slash);
    }

    public String version() {
        int slash = apiVersion.indexOf('/');
        return slash < 0 ? apiVersion : apiVersion.substring(slash + 1);
    }

    @Override
    public String toString() {
        return apiVersion + " " + kind + "/" + name;
    }
}
