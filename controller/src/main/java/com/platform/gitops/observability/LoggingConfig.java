package com.platform.gitops.observability;

import ch.qos.logback.classic.LoggerContext;
import jakarta.annotation.PostConstruct;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * MDC keys of the controller. API requests carry a correlation id and the acting user;
 * reconciliation attempts carry the unit, its revision and the attempt's trace id.
 */
@Slf4j
@Configuration
public class LoggingConfig {
    
    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_ACTOR = "actor";
    public static final String MDC_KUSTOMIZATION = "kustomization";
    public static final String MDC_REVISION = "revision";
    public static final String MDC_TRACE_ID = "trace_id";
    
    static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    static final String ACTOR_HEADER = "X-Actor";
    
    @Value("${spring.application.name:gitops-controller}")
    private String applicationName;
    
    @PostConstruct
    public void init() {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.putProperty("application", applicationName);
        }
        log.debug("Log context property 'application' set to {}", applicationName);
    }
    
    @Bean
    public RequestContextFilter requestContextFilter() {
        return new RequestContextFilter();
    }
    
    /**
     * Puts the correlation id (echoed back in the response) and the acting user into the MDC.
     */
    public static class RequestContextFilter extends OncePerRequestFilter {
        
        @Override
        protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                        FilterChain filterChain) throws ServletException, IOException {
            String correlationId = request.getHeader(CORRELATION_ID_HEADER);
            if (correlationId == null || correlationId.isBlank()) {
                correlationId = UUID.randomUUID().toString();
            }
            String actor = request.getHeader(ACTOR_HEADER);
            MDC.put(MDC_CORRELATION_ID, correlationId);
            MDC.put(MDC_ACTOR, actor == null || actor.isBlank() ? "api" : actor);
            response.setHeader(CORRELATION_ID_HEADER, correlationId);
            try {
                filterChain.doFilter(request, response);
            } finally {
                MDC.remove(MDC_CORRELATION_ID);
                MDC.remove(MDC_ACTOR);
            }
        }
    }
    
    public static void setAttemptContext(String kustomization, String revision) {
        MDC.put(MDC_KUSTOMIZATION, kustomization);
        if (revision != null) {
            MDC.put(MDC_REVISION, revision);
        }
    }
    
    public static void setRevision(String revision) {
        MDC.put(MDC_REVISION, revision);
    }
    
    public static void clearAttemptContext() {
        MDC.remove(MDC_KUSTOMIZATION);
        MDC.remove(MDC_REVISION);
        MDC.remove(MDC_TRACE_ID);
    }
}
