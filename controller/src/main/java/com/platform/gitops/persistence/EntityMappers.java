package com.platform.gitops.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.gitops.model.Kustomization;
import com.platform.gitops.model.KustomizationSpec;
import com.platform.gitops.model.KustomizationStatus;
import com.platform.gitops.model.UnitKey;
import com.platform.gitops.persistence.entity.KustomizationEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Bidirectional mappers between Kustomization units and JPA entities.
 */
@Slf4j
@Component
public class EntityMappers {
    
    private final ObjectMapper objectMapper;
    
    public EntityMappers(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    public static String id(UnitKey key) {
        return key.namespace() + "/" + key.name();
    }
    
    public KustomizationEntity toEntity(Kustomization domain) {
        return KustomizationEntity.builder()
            .id(id(domain.getKey()))
            .namespace(domain.getNamespace())
            .name(domain.getName())
            .generation(domain.getGeneration())
            .deletionTimestamp(domain.getDeletionTimestamp())
            .reconcileRequestedAt(domain.getReconcileRequestedAt())
            .specJson(writeSpec(domain.getSpec()))
            .statusJson(writeStatus(domain.getStatus()))
            .build();
    }
    
    public Kustomization toDomain(KustomizationEntity entity) {
        return Kustomization.builder()
            .namespace(entity.getNamespace())
            .name(entity.getName())
            .generation(entity.getGeneration())
            .deletionTimestamp(entity.getDeletionTimestamp())
            .reconcileRequestedAt(entity.getReconcileRequestedAt())
            .spec(readSpec(entity.getSpecJson()))
            .status(readStatus(entity.getStatusJson()))
            .build();
    }
    
    public String writeSpec(KustomizationSpec spec) {
        return write(spec, "spec");
    }
    
    public String writeStatus(KustomizationStatus status) {
        return write(status == null ? KustomizationStatus.initial() : status, "status");
    }
    
    public KustomizationSpec readSpec(String json) {
        return read(json, KustomizationSpec.class);
    }
    
    public KustomizationStatus readStatus(String json) {
        if (json == null || json.isBlank()) {
            return KustomizationStatus.initial();
        }
        return read(json, KustomizationStatus.class);
    }
    
    private String write(Object value, String what) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize Kustomization {}", what, e);
            throw new IllegalStateException("Failed to serialize Kustomization " + what, e);
        }
    }
    
    private <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize {}", type.getSimpleName(), e);
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
