package io.akuity.namespaceclass.operator.store;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.akuity.namespaceclass.operator.error.ErrorKind;
import io.akuity.namespaceclass.operator.model.Manifest;
import io.akuity.namespaceclass.operator.model.ResourceKey;
import io.kubernetes.client.Discovery;
import io.kubernetes.client.custom.V1Patch;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.models.V1Status;
import io.kubernetes.client.util.generic.KubernetesApiResponse;
import io.kubernetes.client.util.generic.dynamic.DynamicKubernetesApi;
import io.kubernetes.client.util.generic.dynamic.DynamicKubernetesObject;
import io.kubernetes.client.util.generic.options.PatchOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static io.akuity.namespaceclass.operator.store.KindResolverTest.apiResource;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class KubernetesManagedResourceStoreTest {
    private static final String NS = "team-a";
    private static final ResourceKey CONFIG_MAP = new ResourceKey("v1", "ConfigMap", "settings");
    private static final ResourceKey WIDGET = new ResourceKey("example.com/v1", "Widget", "w");

    private Discovery discovery;
    private DynamicKubernetesApi api;
    private List<ResourceKind> created;
    private KubernetesManagedResourceStore store;

    @BeforeEach
    void setUp() throws ApiException {
        discovery = mock(Discovery.class);
        Set<Discovery.APIResource> served = Set.of(
                apiResource("", "ConfigMap", "configmaps", true, "v1"),
                apiResource("rbac.authorization.k8s.io", "ClusterRole", "clusterroles", false, "v1"));
        when(discovery.findAll()).thenReturn(served);
        api = mock(DynamicKubernetesApi.class);
        created = new ArrayList<>();
        store = new KubernetesManagedResourceStore(new KindResolver(discovery), kind -> {
            created.add(kind);
            return api;
        });
    }

    private static DynamicKubernetesObject object(String json) {
        return new DynamicKubernetesObject(JsonParser.parseString(json).getAsJsonObject());
    }

    private static KubernetesApiResponse<DynamicKubernetesObject> status(int code, String reason, String message) {
        return new KubernetesApiResponse<>(new V1Status().code(code).reason(reason).message(message), code);
    }

    @Test
    void getReturnsTheDocument() {
        when(api.get(NS, "settings")).thenReturn(new KubernetesApiResponse<>(object(
                "{\"apiVersion\":\"v1\",\"kind\":\"ConfigMap\",\"metadata\":{\"name\":\"settings\",\"namespace\":\"team-a\"}}")));

        StoreResult<Manifest> result = store.get(CONFIG_MAP, NS);

        assertTrue(result.isSuccess());
        assertEquals(CONFIG_MAP, result.getObject().key());
        assertEquals(NS, result.getObject().getNamespace());
    }

    @Test
    void apiIsBuiltOncePerKind() {
        when(api.get(eq(NS), any(String.class))).thenReturn(status(404, "NotFound", "not found"));

        store.get(CONFIG_MAP, NS);
        store.get(new ResourceKey("v1", "ConfigMap", "other"), NS);

        assertEquals(List.of(new ResourceKind("", "v1", "configmaps", true)), created);
    }

    @Test
    void applySendsServerSideApplyWithFieldManager() {
        JsonObject document = JsonParser.parseString(
                "{\"apiVersion\":\"v1\",\"kind\":\"ConfigMap\",\"metadata\":{\"name\":\"settings\",\"namespace\":\"team-a\"},"
                        + "\"data\":{\"k\":\"v\"}}").getAsJsonObject();
        when(api.patch(eq(NS), eq("settings"), eq(V1Patch.PATCH_FORMAT_APPLY_YAML), any(V1Patch.class),
                any(PatchOptions.class))).thenReturn(new KubernetesApiResponse<>(new DynamicKubernetesObject(document)));

        StoreResult<Manifest> result = store.apply(Manifest.of(document), "namespaceclassbinding-controller", true);

        assertTrue(result.isSuccess());
        ArgumentCaptor<PatchOptions> options = ArgumentCaptor.forClass(PatchOptions.class);
        ArgumentCaptor<V1Patch> body = ArgumentCaptor.forClass(V1Patch.class);
        verify(api).patch(eq(NS), eq("settings"), eq(V1Patch.PATCH_FORMAT_APPLY_YAML), body.capture(), options.capture());
        assertEquals("namespaceclassbinding-controller", options.getValue().getFieldManager());
        assertTrue(options.getValue().getForce());
        assertEquals(document, JsonParser.parseString(body.getValue().getValue()));
    }

    @Test
    void applyConflictIsClassified() {
        JsonObject document = JsonParser.parseString(
                "{\"apiVersion\":\"v1\",\"kind\":\"ConfigMap\",\"metadata\":{\"name\":\"settings\",\"namespace\":\"team-a\"}}")
                .getAsJsonObject();
        when(api.patch(any(), any(), any(), any(V1Patch.class), any(PatchOptions.class)))
                .thenReturn(status(409, "Conflict", "Apply failed with 1 conflict: conflict with \"helm\""));

        StoreResult<Manifest> result = store.apply(Manifest.of(document), "namespaceclassbinding-controller", false);

        assertTrue(result.is(ErrorKind.FIELD_MANAGER_CONFLICT));
    }

    @Test
    void deleteOfMissingObjectIsOkWhenIgnored() {
        when(api.delete(NS, "settings")).thenReturn(status(404, "NotFound", "configmaps \"settings\" not found"));

        assertTrue(store.delete(CONFIG_MAP, NS, true).isSuccess());
        assertTrue(store.delete(CONFIG_MAP, NS, false).isNotFound());
    }

    @Test
    void deleteFailureIsReturned() {
        when(api.delete(NS, "settings")).thenReturn(status(403, "Forbidden", "forbidden"));

        StoreResult<Void> result = store.delete(CONFIG_MAP, NS, true);

        assertTrue(result.is(ErrorKind.PERMANENT));
        assertEquals(403, result.getCode());
    }

    @Test
    void deleteOfUnservedKindCountsAsDeleted() {
        StoreResult<Void> result = store.delete(WIDGET, NS, true);

        assertTrue(result.isSuccess());
        assertTrue(created.isEmpty());
        verifyNoInteractions(api);
    }

    @Test
    void deleteOfUnservedKindFailsWhenNotIgnored() {
        assertTrue(store.delete(WIDGET, NS, false).is(ErrorKind.PERMANENT));
    }

    @Test
    void getAndApplyOfUnservedKindFail() {
        JsonObject document = JsonParser.parseString(
                "{\"apiVersion\":\"example.com/v1\",\"kind\":\"Widget\",\"metadata\":{\"name\":\"w\",\"namespace\":\"team-a\"}}")
                .getAsJsonObject();

        StoreResult<Manifest> get = store.get(WIDGET, NS);
        StoreResult<Manifest> apply = store.apply(Manifest.of(document), "namespaceclassbinding-controller", false);

        assertTrue(get.is(ErrorKind.PERMANENT));
        assertTrue(apply.is(ErrorKind.PERMANENT));
        assertEquals("no API resource serves kind Widget in example.com/v1", get.getMessage());
        verifyNoInteractions(api);
    }

    @Test
    void clusterScopedKindsAreRejected() {
        StoreResult<Manifest> result = store.get(new ResourceKey("rbac.authorization.k8s.io/v1", "ClusterRole", "admin"), NS);

        assertTrue(result.is(ErrorKind.PERMANENT));
        assertTrue(result.getMessage().contains("cluster scoped"));
        verifyNoInteractions(api);
    }
}
