package io.akuity.namespaceclass.operator.store;

import io.akuity.namespaceclass.operator.model.NamespaceClass;

public interface NamespaceClassStore {

    StoreResult<NamespaceClass> get(String name);
}
