package io.akuity.namespaceclass.operator.controller;

import io.akuity.namespaceclass.operator.testing.Fixtures;
import io.kubernetes.client.openapi.models.V1Namespace;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NamespaceLabelFilterTest {
    private final NamespaceLabelFilter filter = new NamespaceLabelFilter(Fixtures.CLASS_LABEL);

    private static V1Namespace namespace(Map<String, String> labels) {
        return new V1Namespace().metadata(new V1ObjectMeta().name("team-a").labels(labels));
    }

    @Test
    void addPassesOnlyLabelledNamespaces() {
        assertTrue(filter.onAdd(namespace(Fixtures.classLabel("web"))));
        assertFalse(filter.onAdd(namespace(Map.of("team", "a"))));
        assertFalse(filter.onAdd(namespace(null)));
    }

    @Test
    void updatePassesOnlyLabelValueChanges() {
        assertTrue(filter.onUpdate(namespace(null), namespace(Fixtures.classLabel("web"))));
        assertTrue(filter.onUpdate(namespace(Fixtures.classLabel("web")), namespace(Fixtures.classLabel("db"))));
        assertTrue(filter.onUpdate(namespace(Fixtures.classLabel("web")), namespace(Map.of())));
        assertFalse(filter.onUpdate(namespace(Fixtures.classLabel("web")), namespace(Fixtures.classLabel("web"))));
        assertFalse(filter.onUpdate(namespace(Map.of("team", "a")), namespace(Map.of("team", "b"))));
    }

    @Test
    void deleteNeverPasses() {
        assertFalse(filter.onDelete(namespace(Fixtures.classLabel("web")), false));
        assertFalse(filter.onDelete(namespace(Fixtures.classLabel("web")), true));
    }
}
