package com.menuassist.chat.service.generation.provider;

import com.menuassist.chat.config.AssistantProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Selects the provider a restaurant's configuration names. Unknown names fall back to the
 * configured default, and an unconfigured provider (for example one without an API key) is
 * replaced by the offline provider.
 */
@Component
public class AiProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(AiProviderRegistry.class);

    private final Map<String, AiProvider> providers = new LinkedHashMap<>();
    private final String defaultName;

    public AiProviderRegistry(List<AiProvider> providers, AssistantProperties properties) {
        for (AiProvider provider : providers) {
            this.providers.put(key(provider.name()), provider);
        }
        this.defaultName = key(properties.getProvider().getDefaultName());
        if (!this.providers.containsKey(OfflineAiProvider.NAME)) {
            throw new IllegalStateException("Offline provider must be registered");
        }
        log.info("Registered AI providers {} (default {})", this.providers.keySet(), defaultName);
    }

    public AiProvider resolve(String requestedName) {
        AiProvider provider = requestedName == null ? null : providers.get(key(requestedName));
        if (provider == null) {
            provider = providers.get(defaultName);
        }
        if (provider == null || !provider.isConfigured()) {
            return providers.get(OfflineAiProvider.NAME);
        }
        return provider;
    }

    private static String key(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
