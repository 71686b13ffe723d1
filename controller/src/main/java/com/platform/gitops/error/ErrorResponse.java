package com.platform.gitops.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Body of every failed API call.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    
    /**
     * Stable error code, e.g. {@code GO-301}.
     */
    private String code;
    
    private String message;
    
    private String detail;
    
    /**
     * True when retrying the same request cannot succeed without operator intervention.
     */
    private boolean fatal;
    
    private int status;
    
    private Instant timestamp;
    
    private String path;
    
    /**
     * Matches the {@code X-Correlation-ID} response header and the log lines of the request.
     */
    private String correlationId;
    
    private List<FieldError> fieldErrors;
    
    private Map<String, Object> metadata;
    
    @Data
    @Builder
    public static class FieldError {
        private String field;
        private String message;
        private Object rejectedValue;
    }
}
