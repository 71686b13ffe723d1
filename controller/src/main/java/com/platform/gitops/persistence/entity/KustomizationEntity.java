package com.platform.gitops.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for Kustomization units.
 * Spec and status are stored as JSON so that the schema does not follow every spec field.
 */
@Entity
@Table(name = "kustomizations", 
    uniqueConstraints = @UniqueConstraint(name = "uk_kustomization_key", columnNames = {"namespace", "name"}),
    indexes = @Index(name = "idx_kustomization_namespace", columnList = "namespace"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KustomizationEntity {
    
    /**
     * {@code namespace/name}.
     */
    @Id
    @Column(length = 317)
    private String id;
    
    @Column(length = 63, nullable = false)
    private String namespace;
    
    @Column(length = 253, nullable = false)
    private String name;
    
    @Column(nullable = false)
    private long generation;
    
    @Column(name = "deletion_timestamp")
    private Instant deletionTimestamp;
    
    @Column(name = "reconcile_requested_at")
    private Instant reconcileRequestedAt;
    
    @Lob
    @Column(name = "spec_json", nullable = false)
    private String specJson;
    
    @Lob
    @Column(name = "status_json", nullable = false)
    private String statusJson;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    /**
     * Optimistic locking version; spec writes and status writes race on the same row.
     */
    @Version
    @Column(nullable = false)
    private Long version;
    
    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }
    
    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
