package com.platform.gitops.reconciliation;

import com.platform.gitops.apply.ApplyPruneEngine;
import com.platform.gitops.apply.ApplyResult;
import com.platform.gitops.apply.Deadline;
import com.platform.gitops.cluster.ClusterCredential;
import com.platform.gitops.cluster.CredentialResolver;
import com.platform.gitops.dependency.DependencyGate;
import com.platform.gitops.error.ErrorCode;
import com.platform.gitops.error.ReconciliationException;
import com.platform.gitops.health.HealthAssessor;
import com.platform.gitops.health.HealthResult;
import com.platform.gitops.inventory.ResourceInventory;
import com.platform.gitops.manifest.ManifestObject;
import com.platform.gitops.manifest.ManifestParser;
import com.platform.gitops.model.ConditionReasons;
import com.platform.gitops.model.DurationFormat;
import com.platform.gitops.model.Kustomization;
import com.platform.gitops.model.KustomizationSpec;
import com.platform.gitops.model.KustomizationStatus;
import com.platform.gitops.model.UnitKey;
import com.platform.gitops.observability.LoggingConfig;
import com.platform.gitops.observability.MetricsRegistry;
import com.platform.gitops.observability.StructuredLogger;
import com.platform.gitops.pipeline.PostBuildPipeline;
import com.platform.gitops.source.OverlayBuildException;
import com.platform.gitops.source.OverlayRenderer;
import com.platform.gitops.source.SecurePaths;
import com.platform.gitops.source.SourceArtifact;
import com.platform.gitops.source.SourceProvider;
import com.platform.gitops.source.SourceUnavailableException;
import com.platform.gitops.status.ConditionStateMachine;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one reconciliation attempt of one unit: source, dependency gate, render, decrypt,
 * substitute, parse, apply/prune and health, then writes the resulting status.
 *
 * <p>The attempt body runs on the attempt executor and is bounded by the unit's timeout. When the
 * budget is exhausted the body is interrupted and the failure is reported with the reason of the
 * phase in flight. Only the calling thread writes the final status; the body persists nothing
 * but the Progressing mark.
 */
@Slf4j
@Component
public class KustomizationReconciler {
    
    private static final Duration WAIT_SLICE = Duration.ofMillis(250);
    
    private final KustomizationStore store;
    private final SourceProvider sourceProvider;
    private final OverlayRenderer overlayRenderer;
    private final ManifestParser manifestParser;
    private final PostBuildPipeline postBuildPipeline;
    private final ApplyPruneEngine applyPruneEngine;
    private final HealthAssessor healthAssessor;
    private final DependencyGate dependencyGate;
    private final CredentialResolver credentialResolver;
    private final ConditionStateMachine stateMachine;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final Tracer tracer;
    private final Clock clock;
    private final ExecutorService attemptExecutor;
    private final Duration cancelGrace;
    
    private record AttemptResult(String revision, ApplyResult applyResult, HealthResult health) {
    }
    
    public KustomizationReconciler(KustomizationStore store,
                                   SourceProvider sourceProvider,
                                   OverlayRenderer overlayRenderer,
                                   ManifestParser manifestParser,
                                   PostBuildPipeline postBuildPipeline,
                                   ApplyPruneEngine applyPruneEngine,
                                   HealthAssessor healthAssessor,
                                   DependencyGate dependencyGate,
                                   CredentialResolver credentialResolver,
                                   ConditionStateMachine stateMachine,
                                   MetricsRegistry metricsRegistry,
                                   StructuredLogger structuredLogger,
                                   Tracer tracer,
                                   Clock clock,
                                   @Qualifier("attemptExecutor") ExecutorService attemptExecutor,
                                   @Value("${gitops.reconcile.cancel-grace:5s}") Duration cancelGrace) {
        this.store = store;
        this.sourceProvider = sourceProvider;
        this.overlayRenderer = overlayRenderer;
        this.manifestParser = manifestParser;
        this.postBuildPipeline = postBuildPipeline;
        this.applyPruneEngine = applyPruneEngine;
        this.healthAssessor = healthAssessor;
        this.dependencyGate = dependencyGate;
        this.credentialResolver = credentialResolver;
        this.stateMachine = stateMachine;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.tracer = tracer;
        this.clock = clock;
        this.attemptExecutor = attemptExecutor;
        this.cancelGrace = cancelGrace;
    }
    
    /**
     * Runs one attempt for the unit as currently stored.
     */
    public AttemptOutcome reconcile(UnitKey key) {
        Kustomization unit = store.find(key).orElse(null);
        if (unit == null) {
            log.debug("Unit {} no longer exists", key);
            return AttemptOutcome.of(key, AttemptOutcome.Result.NOT_FOUND);
        }
        if (unit.isBeingDeleted()) {
            return finalizeUnit(unit);
        }
        if (unit.getSpec().isSuspend()) {
            log.info("Reconciliation of {} is suspended", key);
            return AttemptOutcome.of(key, AttemptOutcome.Result.SUSPENDED);
        }
        
        Instant start = clock.instant();
        Span span = tracer.spanBuilder("reconcile " + key)
            .setAttribute("kustomization", key.toString())
            .setAttribute("generation", unit.getGeneration())
            .startSpan();
        MDC.put(LoggingConfig.MDC_TRACE_ID, span.getSpanContext().getTraceId());
        LoggingConfig.setAttemptContext(key.toString(), null);
        metricsRegistry.attemptStarted();
        try {
            structuredLogger.reconcile().started(key.toString(), unit.getGeneration());
            AttemptOutcome outcome = runAttempt(unit, start);
            if (outcome.result() == AttemptOutcome.Result.FAILED) {
                span.setStatus(StatusCode.ERROR, String.valueOf(outcome.error()));
            }
            return outcome;
        } finally {
            metricsRegistry.attemptFinished();
            span.end();
            LoggingConfig.clearAttemptContext();
        }
    }
    
    private AttemptOutcome runAttempt(Kustomization unit, Instant start) {
        UnitKey key = unit.getKey();
        KustomizationStatus status = unit.getStatus().copy();
        if (unit.getReconcileRequestedAt() != null) {
            status.setLastHandledReconcileAt(unit.getReconcileRequestedAt());
        }
        AttemptProgress progress = new AttemptProgress();
        Deadline deadline = Deadline.after(unit.getTimeout(), clock);
        
        AttemptResult result;
        try {
            result = runBounded(() -> attemptBody(unit, status, progress, deadline), deadline, progress);
        } catch (ReconciliationException e) {
            return recordFailure(unit, status, progress, e, start);
        }
        
        status.setInventory(result.applyResult().inventory());
        ApplyResult applied = result.applyResult();
        if (applied.failure().isPresent()) {
            return recordFailure(unit, status, progress, applied.failure().get(), start);
        }
        
        String message = "Applied revision: " + result.revision();
        stateMachine.succeeded(unit, status, result.revision(), message);
        HealthResult health = result.health();
        if (health != null && health.healthy()) {
            stateMachine.healthy(unit, status, health.message());
        } else if (health != null) {
            stateMachine.unhealthy(unit, status, health.message());
        }
        stateMachine.completeAttempt(unit, status, result.revision());
        store.updateStatus(key, status);
        
        Duration elapsed = Duration.between(start, clock.instant());
        if (health != null && !health.healthy()) {
            log.warn("Reconciliation of {} applied {} but health check failed: {}", key, result.revision(), health.message());
            metricsRegistry.recordAttempt(key.toString(), ErrorCode.UNHEALTHY.getConditionReason(), false, elapsed);
            structuredLogger.reconcile().failed(key.toString(), ErrorCode.UNHEALTHY.getConditionReason(),
                ErrorCode.UNHEALTHY.getCode(), health.message(), elapsed.toMillis());
            return AttemptOutcome.failed(key, ErrorCode.UNHEALTHY, health.message());
        }
        log.info("Reconciliation of {} finished in {}, next run in {}", key, DurationFormat.format(elapsed),
            DurationFormat.format(unit.getSpec().getInterval()));
        metricsRegistry.recordAttempt(key.toString(), ConditionReasons.RECONCILIATION_SUCCEEDED, true, elapsed);
        structuredLogger.reconcile().succeeded(key.toString(), result.revision(), applied.summary(), elapsed.toMillis());
        return AttemptOutcome.succeeded(key, message);
    }
    
    private AttemptResult attemptBody(Kustomization unit, KustomizationStatus status, AttemptProgress progress,
                                      Deadline deadline) {
        LoggingConfig.setAttemptContext(unit.getKey().toString(), null);
        try {
            KustomizationSpec spec = unit.getSpec();
            
            progress.enter(ErrorCode.ARTIFACT_FAILED);
            SourceArtifact artifact = fetchSource(unit);
            String revision = artifact.revision();
            progress.revision(revision);
            LoggingConfig.setRevision(revision);
            deadline.check(ErrorCode.ARTIFACT_FAILED, "fetching source " + unit.getResolvedSourceRef());
            
            progress.enter(ErrorCode.DEPENDENCY_NOT_READY);
            dependencyGate.check(unit, revision);
            
            markProgressing(unit, status, progress, "Reconciling revision " + revision);
            
            Instant buildStart = clock.instant();
            progress.enter(ErrorCode.BUILD_FAILED);
            byte[] rendered = render(artifact, spec);
            List<String> documents = manifestParser.splitDocuments(rendered);
            deadline.check(ErrorCode.BUILD_FAILED, "building manifests");
            
            progress.enter(ErrorCode.DECRYPTION_FAILED);
            documents = postBuildPipeline.decrypt(unit, documents);
            deadline.check(ErrorCode.DECRYPTION_FAILED, "decrypting manifests");
            
            ClusterCredential credential = credentialResolver.resolve(unit);
            progress.enter(ErrorCode.SUBSTITUTION_FAILED);
            documents = postBuildPipeline.substitute(unit, documents, credential);
            deadline.check(ErrorCode.SUBSTITUTION_FAILED, "substituting variables");
            
            progress.enter(ErrorCode.BUILD_FAILED);
            String defaultNamespace = spec.getTargetNamespace() != null ? spec.getTargetNamespace() : unit.getNamespace();
            List<ManifestObject> objects = manifestParser.parse(documents, defaultNamespace);
            metricsRegistry.recordPhase("build", Duration.between(buildStart, clock.instant()));
            
            Instant applyStart = clock.instant();
            progress.enter(ErrorCode.APPLY_FAILED);
            ApplyResult applied = applyPruneEngine.reconcile(unit, objects, credential, deadline, progress);
            metricsRegistry.recordPhase("apply", Duration.between(applyStart, clock.instant()));
            if (applied.failure().isPresent() || !unit.isHealthCheckRequired()) {
                return new AttemptResult(revision, applied, null);
            }
            
            Instant healthStart = clock.instant();
            progress.enter(ErrorCode.UNHEALTHY);
            HealthResult health = healthAssessor.assess(
                healthAssessor.trackedObjects(unit, applied.inventory()), credential, deadline);
            metricsRegistry.recordPhase("health", Duration.between(healthStart, clock.instant()));
            return new AttemptResult(revision, applied, health);
        } finally {
            LoggingConfig.clearAttemptContext();
        }
    }
    
    private SourceArtifact fetchSource(Kustomization unit) {
        try {
            return sourceProvider.fetchSource(unit.getResolvedSourceRef());
        } catch (SourceUnavailableException e) {
            throw new ReconciliationException(ErrorCode.ARTIFACT_FAILED, e.getMessage(), e);
        }
    }
    
    private byte[] render(SourceArtifact artifact, KustomizationSpec spec) {
        try {
            Path buildPath = SecurePaths.join(artifact.artifactPath(), spec.getPath());
            return overlayRenderer.renderOverlay(buildPath, spec.getPatches(), spec.getImages(), spec.getTargetNamespace());
        } catch (OverlayBuildException e) {
            throw new ReconciliationException(ErrorCode.BUILD_FAILED, e.getMessage(), e);
        }
    }
    
    /**
     * Persists Ready=Unknown unless the waiting caller already gave up on this attempt.
     */
    private void markProgressing(Kustomization unit, KustomizationStatus status, AttemptProgress progress,
                                 String message) {
        synchronized (progress) {
            if (progress.isCancelled()) {
                return;
            }
            stateMachine.progressing(unit, status, message);
            store.updateStatus(unit.getKey(), status.copy());
        }
    }
    
    /**
     * Deletion requested: prune the inventory when the unit prunes, then remove the unit.
     */
    private AttemptOutcome finalizeUnit(Kustomization unit) {
        UnitKey key = unit.getKey();
        ResourceInventory inventory = unit.getStatus().getInventory();
        KustomizationStatus status = unit.getStatus().copy();
        AttemptProgress progress = new AttemptProgress();
        progress.enter(ErrorCode.PRUNE_FAILED);
        Instant start = clock.instant();
        
        int pruned = 0;
        if (unit.getSpec().isPrune() && inventory != null && !inventory.isEmpty() && !unit.getSpec().isSuspend()) {
            Deadline deadline = Deadline.after(unit.getTimeout(), clock);
            ApplyResult result;
            try {
                result = runBounded(() -> applyPruneEngine.deleteInventory(inventory,
                    credentialResolver.resolve(unit), deadline), deadline, progress);
            } catch (ReconciliationException e) {
                return recordFailure(unit, status, progress, e, start);
            }
            if (result.failure().isPresent()) {
                status.setInventory(result.inventory());
                return recordFailure(unit, status, progress, result.failure().get(), start);
            }
            pruned = result.pruned().size();
        }
        store.remove(key);
        stateMachine.forget(key);
        log.info("Finalized {} ({} objects deleted)", key, pruned);
        structuredLogger.reconcile().finalized(key.toString(), pruned);
        return AttemptOutcome.of(key, AttemptOutcome.Result.REMOVED);
    }
    
    /**
     * Runs {@code body} on the attempt executor, waiting until the deadline plus the cancel grace
     * has passed on the controller clock. On expiry the body is interrupted and the phase in
     * flight is reported.
     */
    private <T> T runBounded(Callable<T> body, Deadline deadline, AttemptProgress progress) {
        Future<T> future = attemptExecutor.submit(body);
        Instant giveUpAt = deadline.expiresAt().plus(cancelGrace);
        try {
            while (!awaitSlice(future, giveUpAt)) {
                if (!clock.instant().isBefore(giveUpAt)) {
                    cancel(future, progress);
                    throw new ReconciliationException(progress.phase(), String.format("timeout of %s exceeded during %s",
                        DurationFormat.format(deadline.timeout()), phaseName(progress.phase())));
                }
            }
            return future.get();
        } catch (InterruptedException e) {
            cancel(future, progress);
            Thread.currentThread().interrupt();
            throw new ReconciliationException(progress.phase(), "attempt interrupted during " + phaseName(progress.phase()));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ReconciliationException reconciliation) {
                throw reconciliation;
            }
            log.error("Unexpected failure during {}", phaseName(progress.phase()), cause);
            throw new ReconciliationException(progress.phase(), String.valueOf(cause.getMessage()), cause);
        }
    }
    
    /**
     * Waits for at most one wait slice, never past {@code giveUpAt}.
     *
     * @return true when the body has finished
     */
    private boolean awaitSlice(Future<?> future, Instant giveUpAt) throws InterruptedException, ExecutionException {
        long remaining = Duration.between(clock.instant(), giveUpAt).toMillis();
        long slice = Math.max(1L, Math.min(WAIT_SLICE.toMillis(), remaining));
        try {
            future.get(slice, TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        }
    }
    
    private static void cancel(Future<?> future, AttemptProgress progress) {
        synchronized (progress) {
            progress.cancel();
        }
        future.cancel(true);
    }
    
    private AttemptOutcome recordFailure(Kustomization unit, KustomizationStatus status, AttemptProgress progress,
                                         ReconciliationException failure, Instant start) {
        UnitKey key = unit.getKey();
        ErrorCode code = failure.getErrorCode();
        String reason = code.getConditionReason() != null ? code.getConditionReason() : progress.phase().getConditionReason();
        
        if (progress.appliedInventory() != null) {
            status.setInventory(progress.appliedInventory());
        }
        stateMachine.failed(unit, status, reason, failure.getMessage());
        stateMachine.completeAttempt(unit, status, progress.revision());
        store.updateStatus(key, status);
        
        Duration elapsed = Duration.between(start, clock.instant());
        if (code == ErrorCode.DEPENDENCY_NOT_READY) {
            log.info("Reconciliation of {} waiting: {}", key, failure.getMessage());
        } else {
            log.error("Reconciliation of {} failed ({}): {}", key, reason, failure.getMessage());
        }
        if (code == ErrorCode.DEPENDENCY_CYCLE) {
            metricsRegistry.recordDependencyCycle(key.toString());
        }
        metricsRegistry.recordAttempt(key.toString(), reason, false, elapsed);
        structuredLogger.reconcile().failed(key.toString(), reason, code.getCode(), failure.getMessage(), elapsed.toMillis());
        return AttemptOutcome.failed(key, code, failure.getMessage());
    }
    
    private static String phaseName(ErrorCode phase) {
        return switch (phase) {
            case ARTIFACT_FAILED -> "source fetch";
            case DEPENDENCY_NOT_READY, DEPENDENCY_CYCLE -> "dependency check";
            case BUILD_FAILED -> "build";
            case DECRYPTION_FAILED -> "decryption";
            case SUBSTITUTION_FAILED -> "substitution";
            case APPLY_FAILED -> "apply";
            case PRUNE_FAILED -> "prune";
            case UNHEALTHY -> "health assessment";
            default -> phase.name().toLowerCase();
        };
    }
}
