package com.platform.gitops.api;

import com.platform.gitops.model.Kustomization;
import com.platform.gitops.model.KustomizationSpec;
import com.platform.gitops.model.UnitKey;
import com.platform.gitops.reconciliation.KustomizationService;
import com.platform.gitops.status.ConditionTransition;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for Kustomization units.
 */
@RestController
@RequestMapping("/api/kustomizations")
public class KustomizationController {
    
    static final String ACTOR_HEADER = "X-Actor";
    static final String APPLICATION_YAML = "application/yaml";
    
    private final KustomizationService kustomizationService;
    
    public KustomizationController(KustomizationService kustomizationService) {
        this.kustomizationService = kustomizationService;
    }
    
    /**
     * List units, optionally in one namespace.
     */
    @GetMapping
    public List<Kustomization> list(@RequestParam(required = false) String namespace) {
        return kustomizationService.list(namespace);
    }
    
    @GetMapping("/{namespace}/{name}")
    public Kustomization get(@PathVariable String namespace, @PathVariable String name) {
        return kustomizationService.get(UnitKey.of(namespace, name));
    }
    
    /**
     * Create the unit or replace its spec.
     */
    @PutMapping("/{namespace}/{name}")
    public Kustomization applySpec(
            @PathVariable String namespace,
            @PathVariable String name,
            @Valid @RequestBody KustomizationSpec spec,
            @RequestHeader(value = ACTOR_HEADER, defaultValue = "api") String actor) {
        return kustomizationService.apply(UnitKey.of(namespace, name), spec, actor);
    }
    
    /**
     * Apply a Kustomization YAML manifest.
     */
    @PostMapping(consumes = APPLICATION_YAML)
    public Kustomization applyManifest(
            @RequestBody String manifest,
            @RequestHeader(value = ACTOR_HEADER, defaultValue = "api") String actor) {
        return kustomizationService.applyManifest(manifest, actor);
    }
    
    @PostMapping("/{namespace}/{name}/reconcile")
    public ResponseEntity<Kustomization> reconcile(@PathVariable String namespace, @PathVariable String name) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(kustomizationService.requestReconcile(UnitKey.of(namespace, name)));
    }
    
    @PostMapping("/{namespace}/{name}/suspend")
    public Kustomization suspend(
            @PathVariable String namespace,
            @PathVariable String name,
            @RequestHeader(value = ACTOR_HEADER, defaultValue = "api") String actor) {
        return kustomizationService.suspend(UnitKey.of(namespace, name), actor);
    }
    
    @PostMapping("/{namespace}/{name}/resume")
    public Kustomization resume(
            @PathVariable String namespace,
            @PathVariable String name,
            @RequestHeader(value = ACTOR_HEADER, defaultValue = "api") String actor) {
        return kustomizationService.resume(UnitKey.of(namespace, name), actor);
    }
    
    /**
     * Request deletion. The unit stays visible until its finalizing pass has pruned its objects.
     */
    @DeleteMapping("/{namespace}/{name}")
    public ResponseEntity<Kustomization> delete(
            @PathVariable String namespace,
            @PathVariable String name,
            @RequestHeader(value = ACTOR_HEADER, defaultValue = "api") String actor) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(kustomizationService.delete(UnitKey.of(namespace, name), actor));
    }
    
    /**
     * Condition transitions recorded since startup, oldest first.
     */
    @GetMapping("/{namespace}/{name}/history")
    public List<ConditionTransition> history(@PathVariable String namespace, @PathVariable String name) {
        return kustomizationService.history(UnitKey.of(namespace, name));
    }
}
