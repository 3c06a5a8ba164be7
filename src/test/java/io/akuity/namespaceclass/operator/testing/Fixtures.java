package io.akuity.namespaceclass.operator.testing;

import com.google.gson.JsonObject;
import io.akuity.namespaceclass.operator.config.OperatorProperties;
import io.akuity.namespaceclass.operator.model.ResourceKey;

import java.time.Duration;
import java.util.Map;

/**
 * Shared builders for test documents and settings.
 */
public final class Fixtures {
    public static final String CLASS_LABEL = "namespaceclass.akuity.io/name";
    public static final String FIELD_MANAGER = "namespaceclassbinding-controller";

    private Fixtures() {
    }

    /**
     * Default settings with waits shortened so that tests run in milliseconds.
     */
    public static OperatorProperties properties() {
        OperatorProperties properties = new OperatorProperties();
        properties.setDeletionTimeout(Duration.ofMillis(200));
        properties.setDeletionPollInterval(Duration.ofMillis(1));
        properties.setStatusRetryBackoff(Duration.ofMillis(1));
        return properties;
    }

    public static Map<String, String> classLabel(String className) {
        return Map.of(CLASS_LABEL, className);
    }

    public static JsonObject document(String apiVersion, String kind, String name) {
        JsonObject document = new JsonObject();
        document.addProperty("apiVersion", apiVersion);
        document.addProperty("kind", kind);
        JsonObject metadata = new JsonObject();
        metadata.addProperty("name", name);
        document.add("metadata", metadata);
        return document;
    }

    /**
     * A ConfigMap document; {@code entries} alternate keys and values.
     */
    public static JsonObject configMap(String name, String... entries) {
        JsonObject document = document("v1", "ConfigMap", name);
        JsonObject data = new JsonObject();
        for (int i = 0; i + 1 < entries.length; i += 2) {
            data.addProperty(entries[i], entries[i + 1]);
        }
        document.add("data", data);
        return document;
    }

    public static JsonObject service(String name, String selectorApp) {
        JsonObject document = document("v1", "Service", name);
        JsonObject selector = new JsonObject();
        selector.addProperty("app", selectorApp);
        JsonObject spec = new JsonObject();
        spec.add("selector", selector);
        document.add("spec", spec);
        return document;
    }

    public static ResourceKey configMapKey(String name) {
        return new ResourceKey("v1", "ConfigMap", name);
    }

    public static ResourceKey serviceKey(String name) {
        return new ResourceKey("v1", "Service", name);
    }
}
