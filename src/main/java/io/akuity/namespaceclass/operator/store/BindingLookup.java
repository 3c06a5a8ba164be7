package io.akuity.namespaceclass.operator.store;

import io.kubernetes.client.extended.controller.reconciler.Request;

import java.util.List;

/**
 * Finds the bindings that select a given NamespaceClass.
 */
@FunctionalInterface
public interface BindingLookup {

    List<Request> bindingsReferencing(String className);
}
