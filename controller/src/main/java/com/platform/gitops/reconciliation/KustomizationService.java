package com.platform.gitops.reconciliation;

import com.platform.gitops.error.ErrorCode;
import com.platform.gitops.error.ReconciliationException;
import com.platform.gitops.error.ResourceNotFoundException;
import com.platform.gitops.error.ValidationException;
import com.platform.gitops.manifest.ManifestObject;
import com.platform.gitops.manifest.ManifestParser;
import com.platform.gitops.manifest.TypeRegistry;
import com.platform.gitops.model.Kustomization;
import com.platform.gitops.model.KustomizationManifest;
import com.platform.gitops.model.KustomizationSpec;
import com.platform.gitops.model.UnitKey;
import com.platform.gitops.observability.StructuredLogger;
import com.platform.gitops.pipeline.VariableSubstitutor;
import com.platform.gitops.status.ConditionStateMachine;
import com.platform.gitops.status.ConditionTransition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * User facing operations on units. Writes the spec side of the store and wakes the scheduler;
 * the status side belongs to the reconciler.
 */
@Slf4j
@Service
public class KustomizationService {
    
    private static final int MAX_NAME_LENGTH = 253;
    
    private final KustomizationStore store;
    private final ReconciliationScheduler scheduler;
    private final ConditionStateMachine stateMachine;
    private final ManifestParser manifestParser;
    private final TypeRegistry typeRegistry;
    private final VariableSubstitutor variableSubstitutor;
    private final StructuredLogger structuredLogger;
    private final Clock clock;
    
    public KustomizationService(KustomizationStore store,
                                ReconciliationScheduler scheduler,
                                ConditionStateMachine stateMachine,
                                ManifestParser manifestParser,
                                TypeRegistry typeRegistry,
                                VariableSubstitutor variableSubstitutor,
                                StructuredLogger structuredLogger,
                                Clock clock) {
        this.store = store;
        this.scheduler = scheduler;
        this.stateMachine = stateMachine;
        this.manifestParser = manifestParser;
        this.typeRegistry = typeRegistry;
        this.variableSubstitutor = variableSubstitutor;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }
    
    public List<Kustomization> list(String namespace) {
        List<Kustomization> all = store.findAll();
        if (namespace == null || namespace.isBlank()) {
            return all;
        }
        return all.stream().filter(k -> namespace.equals(k.getNamespace())).toList();
    }
    
    public Kustomization get(UnitKey key) {
        return store.find(key).orElseThrow(() -> notFound(key));
    }
    
    /**
     * Creates the unit, or replaces its spec. A spec change schedules an attempt.
     */
    public Kustomization apply(UnitKey key, KustomizationSpec spec, String actor) {
        validateKey(key);
        validateSpec(spec);
        
        Optional<Kustomization> existing = store.find(key);
        if (existing.isEmpty()) {
            Kustomization created = store.create(Kustomization.builder()
                .namespace(key.namespace())
                .name(key.name())
                .spec(spec)
                .build());
            structuredLogger.unit().created(key.toString(), actor);
            scheduler.trigger(key);
            return created;
        }
        if (existing.get().isBeingDeleted()) {
            throw new ValidationException(ErrorCode.RESOURCE_CONFLICT,
                "Kustomization " + key + " is being deleted");
        }
        
        Kustomization updated = store.updateSpec(key, spec);
        if (updated.getGeneration() != existing.get().getGeneration()) {
            structuredLogger.unit().updated(key.toString(), updated.getGeneration(), actor);
            scheduler.trigger(key);
        }
        return updated;
    }
    
    /**
     * Decodes a Kustomization YAML manifest and applies it.
     */
    public Kustomization applyManifest(String yaml, String actor) {
        ManifestObject object;
        try {
            object = manifestParser.parseObject(yaml);
        } catch (UncheckedIOException | IllegalArgumentException e) {
            throw new ValidationException(ErrorCode.INVALID_MANIFEST, "Invalid manifest: " + rootMessage(e));
        }
        if (!Kustomization.KIND.equals(object.kind())) {
            throw new ValidationException(ErrorCode.INVALID_MANIFEST,
                "Expected kind " + Kustomization.KIND + ", got '" + object.kind() + "'");
        }
        
        KustomizationManifest manifest;
        try {
            manifest = typeRegistry.decode(object, KustomizationManifest.class);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(ErrorCode.INVALID_MANIFEST, "Invalid manifest: " + rootMessage(e));
        }
        if (manifest.getMetadata() == null || manifest.getMetadata().getName() == null) {
            throw new ValidationException("metadata.name", "must not be blank");
        }
        if (manifest.getSpec() == null) {
            throw new ValidationException("spec", "must not be null");
        }
        return apply(manifest.key(), manifest.getSpec(), actor);
    }
    
    /**
     * Records a reconcile request and runs an attempt now, or right after the one in flight.
     */
    public Kustomization requestReconcile(UnitKey key) {
        Kustomization unit = store.requestReconcile(key, clock.instant());
        scheduler.trigger(key);
        log.info("Reconcile requested for {}", key);
        return unit;
    }
    
    public Kustomization suspend(UnitKey key, String actor) {
        return setSuspended(key, true, actor);
    }
    
    public Kustomization resume(UnitKey key, String actor) {
        return setSuspended(key, false, actor);
    }
    
    /**
     * Marks the unit for deletion. The finalizing attempt prunes its objects and removes it.
     */
    public Kustomization delete(UnitKey key, String actor) {
        Kustomization unit = store.markForDeletion(key, clock.instant());
        structuredLogger.unit().deletionRequested(key.toString(), actor);
        scheduler.trigger(key);
        return unit;
    }
    
    public List<ConditionTransition> history(UnitKey key) {
        get(key);
        return stateMachine.history(key);
    }
    
    private Kustomization setSuspended(UnitKey key, boolean suspend, String actor) {
        Kustomization unit = get(key);
        if (unit.getSpec().isSuspend() == suspend) {
            if (!suspend) {
                scheduler.trigger(key);
            }
            return unit;
        }
        KustomizationSpec spec = unit.getSpec().toBuilder().suspend(suspend).build();
        Kustomization updated = store.updateSpec(key, spec);
        structuredLogger.unit().updated(key.toString(), updated.getGeneration(), actor);
        // A suspended unit parks on its next run; a resumed one needs waking.
        scheduler.trigger(key);
        return updated;
    }
    
    void validateKey(UnitKey key) {
        if (key.name().length() > MAX_NAME_LENGTH) {
            throw new ValidationException("name", "must be at most " + MAX_NAME_LENGTH + " characters");
        }
    }
    
    void validateSpec(KustomizationSpec spec) {
        if (spec == null) {
            throw new ValidationException("spec", "must not be null");
        }
        requirePositive("interval", spec.getInterval());
        if (spec.getRetryInterval() != null) {
            requirePositive("retryInterval", spec.getRetryInterval());
        }
        if (spec.getTimeout() != null) {
            requirePositive("timeout", spec.getTimeout());
        }
        if (spec.getSourceRef() == null) {
            throw new ValidationException("sourceRef", "must not be null");
        }
        if (spec.getTargetNamespace() != null
                && (spec.getTargetNamespace().isEmpty() || spec.getTargetNamespace().length() > 63)) {
            throw new ValidationException("targetNamespace", "must be between 1 and 63 characters");
        }
        if (spec.getPostBuild() != null) {
            try {
                variableSubstitutor.validateNames(spec.getPostBuild().substitute());
            } catch (ReconciliationException e) {
                throw new ValidationException("postBuild.substitute", e.getMessage());
            }
        }
    }
    
    private static void requirePositive(String field, Duration value) {
        if (value == null) {
            throw new ValidationException(field, "must not be null");
        }
        if (value.isNegative() || value.isZero()) {
            throw new ValidationException(field, "must be positive");
        }
    }
    
    private static ResourceNotFoundException notFound(UnitKey key) {
        return ResourceNotFoundException.unit(key);
    }
    
    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
