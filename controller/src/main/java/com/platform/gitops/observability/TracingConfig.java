package com.platform.gitops.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.samplers.Sampler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tracing of reconciliation attempts. Each attempt is one root span named after its unit;
 * with tracing off the reconciler gets a no-op tracer.
 */
@Slf4j
@Configuration
public class TracingConfig {
    
    static final String INSTRUMENTATION_SCOPE = "com.platform.gitops.reconcile";
    
    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> RECONCILED_KIND = AttributeKey.stringKey("gitops.reconciled.kind");
    
    @Bean
    @ConditionalOnMissingBean
    public OpenTelemetry openTelemetry(
            @Value("${otel.traces.enabled:false}") boolean enabled,
            @Value("${spring.application.name:gitops-controller}") String serviceName,
            @Value("${otel.exporter.otlp.endpoint:http://localhost:4317}") String endpoint,
            @Value("${otel.traces.sample-ratio:1.0}") double sampleRatio) {
        if (!enabled) {
            log.info("Attempt tracing disabled");
            return OpenTelemetry.noop();
        }
        
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
            .setResource(Resource.getDefault().merge(Resource.create(Attributes.of(
                SERVICE_NAME, serviceName,
                RECONCILED_KIND, "Kustomization"))))
            .setSampler(Sampler.parentBased(Sampler.traceIdRatioBased(sampleRatio)))
            .addSpanProcessor(BatchSpanProcessor.builder(
                OtlpGrpcSpanExporter.builder().setEndpoint(endpoint).build()).build())
            .build();
        
        log.info("Attempt spans exported to {} (sample ratio {})", endpoint, sampleRatio);
        // Closed with the context, which flushes the batch processor.
        return OpenTelemetrySdk.builder()
            .setTracerProvider(tracerProvider)
            .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
            .build();
    }
    
    @Bean
    @ConditionalOnMissingBean
    public Tracer reconcileTracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(INSTRUMENTATION_SCOPE);
    }
}
