package com.platform.gitops.observability;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.Map;

/**
 * One audit line of the controller, written as snake_case JSON.
 * 
 * Always present: timestamp, level, service, environment, event_type, actor.
 * Attempt context ({@code kustomization}, {@code revision}, {@code trace_id}) is copied from
 * the MDC when the event is logged inside an attempt.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StructuredLogEvent {
    
    private static final ObjectMapper MAPPER = new ObjectMapper();
    
    private String timestamp;
    private String level;
    private String service;
    private String environment;
    private LogEventType eventType;
    private String actor;
    
    private String traceId;
    private String kustomization;
    private String revision;
    
    /**
     * Unit the event is about, as {@code namespace/name}.
     */
    private String unit;
    
    /**
     * Cluster object the event is about, as {@code Kind/namespace/name}.
     */
    private String object;
    
    private String reason;
    private Boolean success;
    private Long durationMs;
    private String errorCode;
    private String message;
    private String detail;
    
    private Map<String, Object> attributes;
    
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            return String.format("{\"event_type\":\"%s\",\"unit\":\"%s\",\"error\":\"serialization_failed\"}",
                eventType, unit);
        }
    }
    
    /**
     * Starts an event stamped with the current time and the attempt context of this thread.
     */
    static StructuredLogEventBuilder fromContext(String service, String environment,
                                                 LogEventType eventType, String level) {
        return StructuredLogEvent.builder()
            .timestamp(Instant.now().toString())
            .level(level)
            .service(service)
            .environment(environment)
            .eventType(eventType)
            .traceId(MDC.get(LoggingConfig.MDC_TRACE_ID))
            .kustomization(MDC.get(LoggingConfig.MDC_KUSTOMIZATION))
            .revision(MDC.get(LoggingConfig.MDC_REVISION));
    }
}
