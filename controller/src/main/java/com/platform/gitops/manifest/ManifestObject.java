package com.platform.gitops.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.gitops.model.ObjectIdentifier;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An unstructured cluster object, backed by a Jackson tree.
 */
public final class ManifestObject {

    private final ObjectNode content;

    public ManifestObject(ObjectNode content) {
        this.content = Objects.requireNonNull(content, "content");
    }

    public ObjectNode content() {
        return content;
    }

    public ManifestObject deepCopy() {
        return new ManifestObject(content.deepCopy());
    }

    public String apiVersion() {
        return content.path("apiVersion").asText("");
    }

    public String kind() {
        return content.path("kind").asText("");
    }

    public String name() {
        return content.path("metadata").path("name").asText("");
    }

    public String namespace() {
        return content.path("metadata").path("namespace").asText("");
    }

    public long generation() {
        return content.path("metadata").path("generation").asLong(0);
    }

    public ObjectIdentifier identifier() {
        return ObjectIdentifier.of(apiVersion(), kind(), namespace(), name());
    }

    public void setNamespace(String namespace) {
        metadata().put("namespace", namespace);
    }

    public Map<String, String> labels() {
        return stringMap(content.path("metadata").path("labels"));
    }

    public Map<String, String> annotations() {
        return stringMap(content.path("metadata").path("annotations"));
    }

    public String annotation(String key) {
        return annotations().get(key);
    }

    public void setLabel(String key, String value) {
        ObjectNode metadata = metadata();
        JsonNode labels = metadata.get("labels");
        ObjectNode target = labels instanceof ObjectNode obj ? obj : metadata.putObject("labels");
        target.put(key, value);
    }

    /**
     * Navigates nested fields, returning a missing node when any segment is absent.
     */
    public JsonNode at(String... path) {
        JsonNode node = content;
        for (String segment : path) {
            node = node.path(segment);
        }
        return node;
    }

    private ObjectNode metadata() {
        JsonNode metadata = content.get("metadata");
        if (metadata instanceof ObjectNode obj) {
            return obj;
        }
        return content.putObject("metadata");
    }

    private static Map<String, String> stringMap(JsonNode node) {
        Map<String, String> result = new LinkedHashMap<>();
        if (node != null && node.isObject()) {
            node.fields().forEachRemaining(e -> result.put(e.getKey(), e.getValue().asText()));
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ManifestObject other && content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return content.hashCode();
    }

    @Override
    public String toString() {
        return identifier().displayName();
    }
}
