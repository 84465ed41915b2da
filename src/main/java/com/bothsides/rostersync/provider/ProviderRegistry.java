package com.bothsides.rostersync.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Resolves the provider that serves an integration for a given capability
 */
@Component
public class ProviderRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, List<RosterProvider>> providers;

    @Autowired
    public ProviderRegistry(ObjectProvider<RosterProvider> providerBeans) {
        this(providerBeans.orderedStream().collect(Collectors.toList()));
    }

    public ProviderRegistry(List<RosterProvider> providerList) {
        this.providers = providerList.stream()
                .collect(Collectors.groupingBy(RosterProvider::getIntegrationId));

        logger.info("Initialized provider registry with integrations: {}", providers.keySet());
    }

    /**
     * Find the first provider registered for the integration that supports the capability
     */
    public Mono<RosterProvider> resolveCapableProvider(String integrationId, String capability) {
        return Mono.fromSupplier(() -> providers.getOrDefault(integrationId, List.of()).stream()
                .filter(provider -> provider.supports(capability))
                .findFirst()
                .orElse(null));
    }
}
