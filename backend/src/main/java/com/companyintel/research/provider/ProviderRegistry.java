package com.companyintel.research.provider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ProviderRegistry {
    private final Map<String, AiProvider> providers = new LinkedHashMap<>();

    public ProviderRegistry(List<AiProvider> providers) {
        if (providers != null) {
            for (AiProvider provider : providers) {
                this.providers.put(provider.providerName(), provider);
            }
        }
    }

    public Optional<AiProvider> find(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(providers.get(name.trim()));
    }

    public List<String> names() {
        return List.copyOf(providers.keySet());
    }

    public boolean isEmpty() {
        return providers.isEmpty();
    }
}
