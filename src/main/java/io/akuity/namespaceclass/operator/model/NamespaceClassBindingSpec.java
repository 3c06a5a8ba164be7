package io.akuity.namespaceclass.operator.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Desired state of a NamespaceClassBinding.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NamespaceClassBindingSpec {
    private String className;
}
