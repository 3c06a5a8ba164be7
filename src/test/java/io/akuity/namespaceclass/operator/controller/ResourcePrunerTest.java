package io.akuity.namespaceclass.operator.controller;

import com.google.gson.JsonObject;
import io.akuity.namespaceclass.operator.error.ConditionReason;
import io.akuity.namespaceclass.operator.error.ErrorKind;
import io.akuity.namespaceclass.operator.error.ReconcileException;
import io.akuity.namespaceclass.operator.model.AppliedResource;
import io.akuity.namespaceclass.operator.model.Manifest;
import io.akuity.namespaceclass.operator.model.ResourceKey;
import io.akuity.namespaceclass.operator.testing.FakeCluster;
import io.akuity.namespaceclass.operator.testing.FakeCluster.Op;
import io.akuity.namespaceclass.operator.testing.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static io.akuity.namespaceclass.operator.testing.Fixtures.configMap;
import static io.akuity.namespaceclass.operator.testing.Fixtures.configMapKey;
import static org.junit.jupiter.api.Assertions.*;

class ResourcePrunerTest {

    @Test
    void desiredKeysSkipEntriesWithoutIdentityAndKeepOrder() {
        JsonObject unnamed = configMap("x");
        unnamed.getAsJsonObject("metadata").remove("name");

        Set<ResourceKey> keys = ResourcePruner.desiredKeys(List.of(
                Manifest.of(configMap("b")), Manifest.of(unnamed), Manifest.of(configMap("a")), Manifest.of(configMap("b"))));

        assertEquals(List.of(configMapKey("b"), configMapKey("a")), List.copyOf(keys));
    }

    @Test
    void staleKeysAreThoseNoLongerDesired() {
        List<AppliedResource> applied = List.of(
                AppliedResource.of(configMapKey("a")),
                AppliedResource.of(configMapKey("b")),
                AppliedResource.of(Fixtures.serviceKey("a")));

        List<ResourceKey> stale = ResourcePruner.staleKeys(applied, Set.of(configMapKey("b")));

        assertEquals(List.of(configMapKey("a"), Fixtures.serviceKey("a")), stale);
    }

    @Test
    void deleteAllTreatsMissingResourcesAsDeleted() {
        FakeCluster cluster = new FakeCluster();
        cluster.seedResource("team-a", configMap("a"), Fixtures.FIELD_MANAGER);
        ResourcePruner pruner = new ResourcePruner(cluster.resources());

        pruner.deleteAll("team-a", List.of(configMapKey("a"), configMapKey("missing")), ConditionReason.PRUNE_FAILED);

        assertTrue(cluster.resourceKeys("team-a").isEmpty());
        assertEquals(2, cluster.calls(Op.DELETE_RESOURCE));
    }

    @Test
    void deleteAllStopsAtFirstFailure() {
        FakeCluster cluster = new FakeCluster();
        cluster.seedResource("team-a", configMap("a"), Fixtures.FIELD_MANAGER);
        cluster.seedResource("team-a", configMap("b"), Fixtures.FIELD_MANAGER);
        cluster.fail(Op.DELETE_RESOURCE).named("a").with(ErrorKind.PERMANENT, 403, "forbidden");
        ResourcePruner pruner = new ResourcePruner(cluster.resources());

        ReconcileException e = assertThrows(ReconcileException.class, () -> pruner.deleteAll(
                "team-a", List.of(configMapKey("a"), configMapKey("b")), ConditionReason.PRUNE_FAILED));

        assertEquals(ConditionReason.PRUNE_FAILED, e.getReason());
        assertEquals(ErrorKind.PERMANENT, e.getKind());
        assertEquals("failed to delete v1 ConfigMap/a: forbidden", e.getMessage());
        assertEquals(Set.of(configMapKey("a"), configMapKey("b")), cluster.resourceKeys("team-a"));
    }
}
