package io.akuity.namespaceclass.operator.model;

import com.google.gson.JsonObject;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Desired state of a NamespaceClass.
 * Each entry is kept as raw JSON so that arbitrary resource kinds pass through untouched.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NamespaceClassSpec {
    private List<JsonObject> resources = new ArrayList<>();
}
