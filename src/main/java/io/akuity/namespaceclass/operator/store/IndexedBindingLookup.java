package io.akuity.namespaceclass.operator.store;

import io.akuity.namespaceclass.operator.model.NamespaceClassBinding;
import io.kubernetes.client.extended.controller.reconciler.Request;
import io.kubernetes.client.informer.SharedIndexInformer;
import lombok.RequiredArgsConstructor;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * {@link BindingLookup} backed by the binding informer's {@code spec.className} index.
 */
@RequiredArgsConstructor
public class IndexedBindingLookup implements BindingLookup {
    public static final String CLASS_NAME_INDEX = "spec.className";

    private final SharedIndexInformer<NamespaceClassBinding> bindingInformer;

    /**
     * Indexers to register on the binding informer before it starts.
     */
    public static Map<String, Function<NamespaceClassBinding, List<String>>> indexers() {
        return Map.of(CLASS_NAME_INDEX, binding -> binding.className().isEmpty()
                ? Collections.emptyList()
                : List.of(binding.className()));
    }

    @Override
    public List<Request> bindingsReferencing(String className) {
        return bindingInformer.getIndexer().byIndex(CLASS_NAME_INDEX, className).stream()
                .map(binding -> new Request(binding.namespace(), binding.name()))
                .collect(Collectors.toList());
    }
}
