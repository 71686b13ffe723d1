package com.platform.gitops.persistence.repository;

import com.platform.gitops.persistence.entity.KustomizationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for Kustomization units.
 */
@Repository
public interface KustomizationJpaRepository extends JpaRepository<KustomizationEntity, String> {
    
    List<KustomizationEntity> findAllByOrderByNamespaceAscNameAsc();
}
