package com.purchasingpower.tutor.client;

import com.purchasingpower.tutor.model.provider.ProviderType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatch table from backend to adapter. A new backend is one more {@link ProviderAdapter} bean.
 */
@Slf4j
@Component
public class ProviderAdapterRegistry {

    private final Map<ProviderType, ProviderAdapter> adapters = new EnumMap<>(ProviderType.class);

    public ProviderAdapterRegistry(List<ProviderAdapter> adapters) {
        for (ProviderAdapter adapter : adapters) {
            ProviderAdapter previous = this.adapters.put(adapter.getType(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two adapters registered for " + adapter.getType()
                        + ": " + previous.getClass().getSimpleName() + ", " + adapter.getClass().getSimpleName());
            }
        }
        log.info("LLM provider adapters registered: {}", this.adapters.keySet());
    }

    public ProviderAdapter forProvider(ProviderType type) {
        ProviderAdapter adapter = adapters.get(type);
        if (adapter == null) {
            throw new IllegalStateException("No adapter registered for provider " + type);
        }
        return adapter;
    }
}
