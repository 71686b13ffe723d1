package com.platform.gitops.manifest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.gitops.config.TypeRegistryConfig;
import com.platform.gitops.error.ErrorCode;
import com.platform.gitops.error.ReconciliationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ManifestParserTest {

    private ManifestParser parser;

    @BeforeEach
    void setUp() {
        parser = new ManifestParser(new TypeRegistryConfig().typeRegistry(new ObjectMapper(), List.of("example.com/Tenant")));
    }

    @Test
    void splitsOnSeparatorsAndDropsEmptyDocuments() {
        String stream = """
            ---
            # just a comment
            ---
            apiVersion: v1
            kind: ConfigMap
            metadata:
              name: a
            --- # trailing comment
            apiVersion: v1
            kind: ConfigMap
            metadata:
              name: b
            """;

        List<String> documents = parser.splitDocuments(stream.getBytes(StandardCharsets.UTF_8));

        assertEquals(2, documents.size());
        assertTrue(documents.get(1).contains("name: b"));
    }

    @Test
    void defaultsNamespaceOfNamespacedObjectsOnly() {
        List<ManifestObject> objects = parser.parse(List.of(
            "apiVersion: v1\nkind: ConfigMap\nmetadata:\n  name: a\n",
            "apiVersion: v1\nkind: Namespace\nmetadata:\n  name: apps\n  namespace: wrong\n",
            "apiVersion: example.com/v1\nkind: Tenant\nmetadata:\n  name: t\n"), "apps");

        assertEquals("apps", objects.get(0).namespace());
        assertEquals("", objects.get(1).namespace());
        assertTrue(objects.get(1).identifier().isClusterScoped());
        assertEquals("", objects.get(2).namespace());
    }

    @Test
    void rejectsIncompleteObjects() {
        ReconciliationException e = assertThrows(ReconciliationException.class,
            () -> parser.parse(List.of("apiVersion: v1\nkind: ConfigMap\nmetadata: {}\n"), "apps"));

        assertEquals(ErrorCode.BUILD_FAILED, e.getErrorCode());
        assertTrue(e.getMessage().contains("document 1"));
    }

    @Test
    void rejectsDuplicates() {
        String doc = "apiVersion: v1\nkind: ConfigMap\nmetadata:\n  name: a\n  namespace: apps\n";

        ReconciliationException e = assertThrows(ReconciliationException.class,
            () -> parser.parse(List.of(doc, doc.replace("v1", "v2")), "apps"));
        assertTrue(e.getMessage().contains("duplicate object in render: ConfigMap/apps/a"));
    }

    @Test
    void rejectsNonMappingDocuments() {
        ReconciliationException e = assertThrows(ReconciliationException.class,
            () -> parser.parse(List.of("- just\n- a list\n"), "apps"));
        assertTrue(e.getMessage().startsWith("failed to decode document 1"));
    }
}
