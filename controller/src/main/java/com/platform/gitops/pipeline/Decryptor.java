package com.platform.gitops.pipeline;

import java.util.List;
import java.util.Map;

/**
 * Decrypts encrypted values inside rendered manifest documents.
 */
public interface Decryptor {
    
    /**
     * Provider name as written in {@code spec.decryption.provider}.
     */
    String getProvider();
    
    /**
     * @param documents YAML documents in render order
     * @param keyMaterial decoded entries of the decryption secret
     * @return the documents with every encrypted value replaced by its plaintext
     * @throws com.platform.gitops.error.ReconciliationException with DECRYPTION_FAILED
     */
    List<String> decrypt(List<String> documents, Map<String, String> keyMaterial);
}
