package com.platform.gitops.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.gitops.cluster.ClusterCredential;
import com.platform.gitops.cluster.CredentialResolver;
import com.platform.gitops.error.ErrorCode;
import com.platform.gitops.error.ReconciliationException;
import com.platform.gitops.manifest.ManifestParser;
import com.platform.gitops.model.Decryption;
import com.platform.gitops.model.Kustomization;
import com.platform.gitops.model.PostBuild;
import com.platform.gitops.model.SubstituteReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Transforms rendered documents before they are parsed: decrypt first, then substitute.
 * Reads Secrets and ConfigMaps only; never writes to the cluster.
 */
@Slf4j
@Component
public class PostBuildPipeline {
    
    public static final String SUBSTITUTE_ANNOTATION = "gitops.platform.com/substitute";
    public static final String DISABLED = "disabled";
    
    private final DecryptorRegistry decryptors;
    private final VariableSubstitutor substitutor;
    private final ReferencedDataReader dataReader;
    private final CredentialResolver credentialResolver;
    private final ManifestParser parser;
    private final boolean strict;
    
    public PostBuildPipeline(DecryptorRegistry decryptors,
                             VariableSubstitutor substitutor,
                             ReferencedDataReader dataReader,
                             CredentialResolver credentialResolver,
                             ManifestParser parser,
                             @Value("${gitops.substitution.strict:false}") boolean strict) {
        this.decryptors = decryptors;
        this.substitutor = substitutor;
        this.dataReader = dataReader;
        this.credentialResolver = credentialResolver;
        this.parser = parser;
        this.strict = strict;
    }
    
    /**
     * Decrypts the documents when the unit configures decryption. Key material is read with
     * the controller's own identity.
     *
     * @throws ReconciliationException with DECRYPTION_FAILED
     */
    public List<String> decrypt(Kustomization unit, List<String> documents) {
        Decryption decryption = unit.getSpec().getDecryption();
        if (decryption == null) {
            return documents;
        }
        Decryptor decryptor = decryptors.forProvider(decryption.provider())
            .orElseThrow(() -> new ReconciliationException(ErrorCode.DECRYPTION_FAILED,
                "unsupported decryption provider: " + decryption.provider()));
        Map<String, String> keyMaterial = Map.of();
        if (decryption.secretRef() != null) {
            String secretName = decryption.secretRef().name();
            try {
                keyMaterial = dataReader.secretData(unit.getNamespace(), secretName, credentialResolver.controllerDefault())
                    .orElseThrow(() -> new ReconciliationException(ErrorCode.DECRYPTION_FAILED,
                        String.format("decryption secret '%s/%s' not found", unit.getNamespace(), secretName)));
            } catch (IllegalArgumentException e) {
                throw new ReconciliationException(ErrorCode.DECRYPTION_FAILED, e.getMessage(), e);
            }
        }
        try {
            return decryptor.decrypt(documents, keyMaterial);
        } catch (UncheckedIOException e) {
            throw new ReconciliationException(ErrorCode.DECRYPTION_FAILED,
                "failed to read document for decryption: " + e.getMessage(), e);
        }
    }
    
    /**
     * Substitutes variables when the unit configures post-build. Referenced objects are read
     * with the unit's credential.
     *
     * @throws ReconciliationException with SUBSTITUTION_FAILED
     */
    public List<String> substitute(Kustomization unit, List<String> documents, ClusterCredential credential) {
        PostBuild postBuild = unit.getSpec().getPostBuild();
        if (postBuild == null) {
            return documents;
        }
        Map<String, String> variables = gatherVariables(unit, postBuild, credential);
        substitutor.validateNames(variables);
        
        List<String> result = new ArrayList<>(documents.size());
        for (String document : documents) {
            if (document.contains("${") && !isSubstitutionDisabled(document)) {
                result.add(substitutor.substitute(document, variables, strict));
            } else {
                result.add(document);
            }
        }
        log.debug("Substituted {} variables into {} documents", variables.size(), documents.size());
        return result;
    }
    
    /**
     * Later references overwrite earlier ones; the inline map overwrites them all.
     */
    private Map<String, String> gatherVariables(Kustomization unit, PostBuild postBuild, ClusterCredential credential) {
        Map<String, String> variables = new LinkedHashMap<>();
        for (SubstituteReference ref : postBuild.substituteFrom()) {
            Map<String, String> data;
            try {
                data = switch (ref.kind()) {
                    case SubstituteReference.SECRET -> dataReader.secretData(unit.getNamespace(), ref.name(), credential)
                        .orElseThrow(() -> notFound(unit, ref));
                    case SubstituteReference.CONFIG_MAP -> dataReader.configMapData(unit.getNamespace(), ref.name(), credential)
                        .orElseThrow(() -> notFound(unit, ref));
                    default -> throw new ReconciliationException(ErrorCode.SUBSTITUTION_FAILED,
                        "unsupported substituteFrom kind: " + ref.kind());
                };
            } catch (IllegalArgumentException e) {
                throw new ReconciliationException(ErrorCode.SUBSTITUTION_FAILED, e.getMessage(), e);
            }
            variables.putAll(data);
        }
        variables.putAll(postBuild.substitute());
        return variables;
    }
    
    private boolean isSubstitutionDisabled(String document) {
        try {
            JsonNode annotation = parser.readTree(document).path("metadata").path("annotations").path(SUBSTITUTE_ANNOTATION);
            return DISABLED.equals(annotation.asText());
        } catch (UncheckedIOException e) {
            // unparseable before substitution; the parse phase reports it
            return false;
        }
    }
    
    private static ReconciliationException notFound(Kustomization unit, SubstituteReference ref) {
        return new ReconciliationException(ErrorCode.SUBSTITUTION_FAILED,
            String.format("substitute from '%s/%s/%s' failed: not found", ref.kind(), unit.getNamespace(), ref.name()));
    }
}
