package com.platform.gitops;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * GitOps Kustomization Controller
 * 
 * Continuously converges a cluster's live objects to the overlay declared by each
 * Kustomization unit:
 * - Dependency gating between units
 * - Decryption and variable substitution of rendered manifests
 * - Server-side apply with inventory based garbage collection
 * - Health assessment of applied workloads
 * - Condition based status that survives restarts
 */
@SpringBootApplication
@EnableScheduling
public class GitOpsControllerApplication {

    public static void main(String[] args) {
        SpringApplication.run(GitOpsControllerApplication.class, args);
    }
}
