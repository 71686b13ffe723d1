package com.platform.gitops.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.gitops.cluster.ClusterClient;
import com.platform.gitops.cluster.ClusterCredential;
import com.platform.gitops.manifest.ManifestObject;
import com.platform.gitops.model.ObjectIdentifier;
import com.platform.gitops.model.SubstituteReference;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the data of Secrets and ConfigMaps referenced by a unit. Secret values are returned
 * base64-decoded; {@code stringData} entries override {@code data} entries.
 */
@Component
public class ReferencedDataReader {
    
    private final ClusterClient clusterClient;
    
    public ReferencedDataReader(ClusterClient clusterClient) {
        this.clusterClient = clusterClient;
    }
    
    public Optional<Map<String, String>> secretData(String namespace, String name, ClusterCredential credential) {
        return clusterClient.get(ObjectIdentifier.of("v1", SubstituteReference.SECRET, namespace, name), credential)
            .map(ReferencedDataReader::decodeSecret);
    }
    
    public Optional<Map<String, String>> configMapData(String namespace, String name, ClusterCredential credential) {
        return clusterClient.get(ObjectIdentifier.of("v1", SubstituteReference.CONFIG_MAP, namespace, name), credential)
            .map(object -> plain(object.at("data")));
    }
    
    private static Map<String, String> decodeSecret(ManifestObject secret) {
        Map<String, String> result = new LinkedHashMap<>();
        secret.at("data").fields().forEachRemaining(entry -> {
            try {
                byte[] decoded = Base64.getMimeDecoder().decode(entry.getValue().asText(""));
                result.put(entry.getKey(), new String(decoded, StandardCharsets.UTF_8));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                    "secret " + secret.identifier().displayName() + " key '" + entry.getKey() + "' is not valid base64", e);
            }
        });
        result.putAll(plain(secret.at("stringData")));
        return result;
    }
    
    private static Map<String, String> plain(JsonNode node) {
        Map<String, String> result = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> result.put(entry.getKey(), entry.getValue().asText("")));
        return result;
    }
}
