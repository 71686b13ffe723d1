package com.platform.gitops.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.platform.gitops.error.ErrorCode;
import com.platform.gitops.error.ReconciliationException;
import com.platform.gitops.model.ObjectIdentifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits multi-document YAML and decodes documents into {@link ManifestObject}s.
 */
@Component
public class ManifestParser {

    private static final Pattern DOCUMENT_SEPARATOR = Pattern.compile("(?m)^---[ \\t]*(?:#.*)?$");

    private final ObjectMapper yamlMapper;
    private final TypeRegistry typeRegistry;

    public ManifestParser(TypeRegistry typeRegistry) {
        this.typeRegistry = typeRegistry;
        this.yamlMapper = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));
    }

    /**
     * Splits a rendered stream into its YAML documents, dropping documents that are blank or
     * only contain comments.
     */
    public List<String> splitDocuments(byte[] manifests) {
        String text = new String(manifests, StandardCharsets.UTF_8);
        List<String> documents = new ArrayList<>();
        for (String doc : DOCUMENT_SEPARATOR.split(text)) {
            if (hasContent(doc)) {
                documents.add(doc.strip() + "\n");
            }
        }
        return documents;
    }

    public JsonNode readTree(String document) {
        try {
            return yamlMapper.readTree(document);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public String writeYaml(JsonNode node) {
        try {
            return yamlMapper.writeValueAsString(node);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public ManifestObject parseObject(String document) {
        JsonNode node = readTree(document);
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("document is not a YAML mapping");
        }
        return new ManifestObject((ObjectNode) node);
    }

    /**
     * Decodes the final documents of a render.
     * Namespaced objects without a namespace get {@code defaultNamespace}.
     *
     * @throws ReconciliationException with {@link ErrorCode#BUILD_FAILED} for undecodable,
     *         incomplete or duplicated objects
     */
    public List<ManifestObject> parse(List<String> documents, String defaultNamespace) {
        List<ManifestObject> objects = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int index = 0;
        for (String document : documents) {
            index++;
            ManifestObject object;
            try {
                JsonNode node = readTree(document);
                if (node == null || node.isNull() || node.isMissingNode()) {
                    continue;
                }
                if (!node.isObject()) {
                    throw new IllegalArgumentException("document is not a YAML mapping");
                }
                object = new ManifestObject((ObjectNode) node);
            } catch (UncheckedIOException | IllegalArgumentException e) {
                throw new ReconciliationException(ErrorCode.BUILD_FAILED,
                    String.format("failed to decode document %d: %s", index, rootMessage(e)), e);
            }
            if (object.apiVersion().isEmpty() || object.kind().isEmpty() || object.name().isEmpty()) {
                throw new ReconciliationException(ErrorCode.BUILD_FAILED,
                    String.format("document %d is missing apiVersion, kind or metadata.name", index));
            }
            ObjectIdentifier id = object.identifier();
            if (typeRegistry.isNamespaced(id.group(), id.kind())) {
                if (object.namespace().isEmpty()) {
                    object.setNamespace(defaultNamespace);
                }
            } else if (!object.namespace().isEmpty()) {
                ((ObjectNode) object.content().get("metadata")).remove("namespace");
            }
            if (!seen.add(object.identifier().inventoryId())) {
                throw new ReconciliationException(ErrorCode.BUILD_FAILED,
                    "duplicate object in render: " + object.identifier().displayName());
            }
            objects.add(object);
        }
        return objects;
    }

    private static boolean hasContent(String doc) {
        for (String line : doc.split("\n")) {
            String trimmed = line.strip();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                return true;
            }
        }
        return false;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
