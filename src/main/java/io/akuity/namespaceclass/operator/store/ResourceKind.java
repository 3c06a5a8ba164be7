package io.akuity.namespaceclass.operator.store;

import lombok.Value;

/**
 * REST coordinates of a kind as reported by API discovery.
 */
@Value
public class ResourceKind {
    String group;
    String version;
    String plural;
    boolean namespaced;
}
