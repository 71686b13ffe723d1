package com.platform.gitops.config;

import com.platform.gitops.cluster.ClusterClient;
import com.platform.gitops.cluster.CredentialResolver;
import com.platform.gitops.cluster.DefaultCredentialResolver;
import com.platform.gitops.cluster.InMemoryClusterClient;
import com.platform.gitops.source.DirectorySourceProvider;
import com.platform.gitops.source.OverlayRenderer;
import com.platform.gitops.source.PlainManifestRenderer;
import com.platform.gitops.source.SourceProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Default external collaborators, so that the service boots without a source controller or a
 * cluster transport. Any of them is replaced by declaring a bean of the same type.
 */
@Slf4j
@Configuration
public class CollaboratorConfig {
    
    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
    
    @Bean
    @ConditionalOnMissingBean
    public SourceProvider sourceProvider(@Value("${gitops.source.root:./sources}") Path root) {
        log.info("Serving source artifacts from {}", root.toAbsolutePath());
        return new DirectorySourceProvider(root);
    }
    
    @Bean
    @ConditionalOnMissingBean
    public OverlayRenderer overlayRenderer() {
        return new PlainManifestRenderer();
    }
    
    @Bean
    @ConditionalOnMissingBean
    public ClusterClient clusterClient() {
        log.warn("No cluster transport configured, applying to an in-memory cluster");
        return new InMemoryClusterClient();
    }
    
    @Bean
    @ConditionalOnMissingBean
    public CredentialResolver credentialResolver() {
        return new DefaultCredentialResolver();
    }
}
