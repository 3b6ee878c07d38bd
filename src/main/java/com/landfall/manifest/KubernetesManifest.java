package com.landfall.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.landfall.core.model.ResourceObject;

import java.util.Objects;

/**
 * A Kubernetes object held as its parsed manifest tree.
 *
 * <p>Kind comes from {@code kind}; name and namespace from {@code metadata}.
 * The tree is the body written into the manifest archive.
 */
public record KubernetesManifest(JsonNode body) implements ResourceObject {

    public KubernetesManifest {
        Objects.requireNonNull(body, "body");
    }

    /**
     * Builds a bare manifest with just apiVersion, kind and metadata.
     */
    public static KubernetesManifest of(String apiVersion, String kind, String name, String namespace) {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put("apiVersion", apiVersion);
        root.put("kind", kind);
        ObjectNode metadata = root.putObject("metadata");
        metadata.put("name", name);
        if (namespace != null && !namespace.isBlank()) {
            metadata.put("namespace", namespace);
        }
        return new KubernetesManifest(root);
    }

    @Override
    public String kind() {
        return body.path("kind").asText("");
    }

    @Override
    public String name() {
        return body.path("metadata").path("name").asText("");
    }

    @Override
    public String namespace() {
        return body.path("metadata").path("namespace").asText("");
    }

    @Override
    public String toString() {
        return kind() + "/" + name();
    }
}
