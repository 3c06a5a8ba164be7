package io.akuity.namespaceclass.operator.store;

import io.akuity.namespaceclass.operator.model.NamespaceClassBinding;
import io.akuity.namespaceclass.operator.model.NamespaceClassBindingSpec;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class IndexedBindingLookupTest {

    private static NamespaceClassBinding binding(String className) {
        NamespaceClassBinding binding = new NamespaceClassBinding();
        binding.setSpec(className == null ? null : new NamespaceClassBindingSpec(className));
        return binding;
    }

    @Test
    void indexesBindingsByClassName() {
        Function<NamespaceClassBinding, List<String>> indexer =
                IndexedBindingLookup.indexers().get(IndexedBindingLookup.CLASS_NAME_INDEX);

        assertEquals(List.of("web"), indexer.apply(binding("web")));
    }

    @Test
    void bindingsWithoutClassAreNotIndexed() {
        Function<NamespaceClassBinding, List<String>> indexer =
                IndexedBindingLookup.indexers().get(IndexedBindingLookup.CLASS_NAME_INDEX);

        assertTrue(indexer.apply(binding(null)).isEmpty());
        assertTrue(indexer.apply(binding("")).isEmpty());
    }
}
