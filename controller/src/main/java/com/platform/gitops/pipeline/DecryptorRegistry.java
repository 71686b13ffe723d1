package com.platform.gitops.pipeline;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Lookup of the registered decryptors by provider name.
 */
@Component
public class DecryptorRegistry {
    
    private final Map<String, Decryptor> byProvider;
    
    public DecryptorRegistry(List<Decryptor> decryptors) {
        this.byProvider = decryptors.stream()
            .collect(Collectors.toMap(
                Decryptor::getProvider,
                Function.identity()
            ));
    }
    
    public Optional<Decryptor> forProvider(String provider) {
        return Optional.ofNullable(byProvider.get(provider));
    }
}
