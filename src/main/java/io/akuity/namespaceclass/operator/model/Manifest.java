package io.akuity.namespaceclass.operator.model;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An opaque resource document taken from a NamespaceClass entry.
 * <p>
 * Only the identity fields ({@code apiVersion}, {@code kind}, {@code metadata.name}) and the
 * placement fields ({@code metadata.namespace}, {@code metadata.ownerReferences}) are interpreted.
 * Everything else is handed to the store as-is.
 */
public final class Manifest {
    private final JsonObject raw;

    private Manifest(JsonObject raw) {
        this.raw = raw;
    }

    /**
     * Wraps a copy of the given document. A {@code null} document yields an empty manifest.
     */
    public static Manifest of(JsonObject document) {
        return new Manifest(document == null ? new JsonObject() : document.deepCopy());
    }

    public Manifest copy() {
        return new Manifest(raw.deepCopy());
    }

    public String getApiVersion() {
        return string(raw, "apiVersion");
    }

    public String getKind() {
        return string(raw, "kind");
    }

    public String getName() {
        return string(metadata(false), "name");
    }

    public String getNamespace() {
        return string(metadata(false), "namespace");
    }

    public boolean isEmpty() {
        return raw.size() == 0;
    }

    /**
     * True when apiVersion, kind and name are all present.
     */
    public boolean hasIdentity() {
        return !getApiVersion().isEmpty() && !getKind().isEmpty() && !getName().isEmpty();
    }

    public ResourceKey key() {
        return new ResourceKey(getApiVersion(), getKind(), getName());
    }

    public Manifest withNamespace(String namespace) {
        metadata(true).addProperty("namespace", namespace);
        return this;
    }

    /**
     * Makes the given binding the sole controller owner of this document.
     * Non-controller owner references present in the template are kept.
     */
    public Manifest withControllerOwner(NamespaceClassBinding owner) {
        JsonObject metadata = metadata(true);
        JsonArray kept = new JsonArray();
        for (JsonObject reference : ownerReferences()) {
            if (!isController(reference)) {
                kept.add(reference);
            }
        }
        JsonObject controller = new JsonObject();
        controller.addProperty("apiVersion", NamespaceClassBinding.API_VERSION);
        controller.addProperty("kind", NamespaceClassBinding.KIND);
        controller.addProperty("name", owner.name());
        if (owner.getMetadata().getUid() != null) {
            controller.addProperty("uid", owner.getMetadata().getUid());
        }
        controller.addProperty("controller", true);
        controller.addProperty("blockOwnerDeletion", true);
        kept.add(controller);
        metadata.add("ownerReferences", kept);
        return this;
    }

    public List<JsonObject> ownerReferences() {
        List<JsonObject> references = new ArrayList<>();
        JsonElement element = metadata(false).get("ownerReferences");
        if (element != null && element.isJsonArray()) {
            for (JsonElement reference : element.getAsJsonArray()) {
                if (reference.isJsonObject()) {
                    references.add(reference.getAsJsonObject());
                }
            }
        }
        return references;
    }

    /**
     * True when this document names a NamespaceClassBinding called {@code bindingName} as its
     * controller. When both sides carry a uid they must match as well.
     */
    public boolean isControlledBy(String bindingName, String bindingUid) {
        for (JsonObject reference : ownerReferences()) {
            if (!isController(reference)) {
                continue;
            }
            boolean sameType = NamespaceClassBinding.API_VERSION.equals(string(reference, "apiVersion"))
                    && NamespaceClassBinding.KIND.equals(string(reference, "kind"));
            boolean sameName = Objects.equals(bindingName, string(reference, "name"));
            String uid = string(reference, "uid");
            boolean sameUid = bindingUid == null || uid.isEmpty() || bindingUid.equals(uid);
            if (sameType && sameName && sameUid) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns a copy of the underlying document.
     */
    public JsonObject toJson() {
        return raw.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Manifest)) {
            return false;
        }
        return raw.equals(((Manifest) o).raw);
    }

    @Override
    public int hashCode() {
        return raw.hashCode();
    }

    @Override
    public String toString() {
        return raw.toString();
    }

    private JsonObject metadata(boolean create) {
        JsonElement element = raw.get("metadata");
        if (element != null && element.isJsonObject()) {
            return element.getAsJsonObject();
        }
        JsonObject metadata = new JsonObject();
        if (create) {
            raw.add("metadata", metadata);
        }
        return metadata;
    }

    private static boolean isController(JsonObject reference) {
        JsonElement controller = reference.get("controller");
        return controller != null && controller.isJsonPrimitive() && controller.getAsBoolean();
    }

    private static String string(JsonObject object, String field) {
        JsonElement element = object.get(field);
        if (element == null || !element.isJsonPrimitive()) {
            return "";
        }
        return element.getAsString();
    }
}
