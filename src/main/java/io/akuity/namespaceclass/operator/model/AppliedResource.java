package io.akuity.namespaceclass.operator.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A resource that was applied into the binding's namespace.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AppliedResource {
    private String apiVersion;
    private String kind;
    private String name;

    public static AppliedResource of(ResourceKey key) {
        return new AppliedResource(key.getApiVersion(), key.getKind(), key.getName());
    }

    public ResourceKey key() {
        return new ResourceKey(apiVersion, kind, name);
    }
}
