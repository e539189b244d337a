package com.purchasingpower.tutor.service;

import com.purchasingpower.tutor.configuration.AppProperties;
import com.purchasingpower.tutor.model.provider.ApiConfiguration;
import com.purchasingpower.tutor.model.provider.ProviderSelection;
import com.purchasingpower.tutor.model.provider.ProviderType;
import com.purchasingpower.tutor.repository.ApiConfigurationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Picks the backend, key and default model for a call.
 *
 * <p>Priority, first match wins:
 * <ol>
 *   <li>active API_CONFIGURATIONS row for openai</li>
 *   <li>active API_CONFIGURATIONS row for gemini</li>
 *   <li>{@code app.llm.openai.api-key} (OPENAI_API_KEY)</li>
 *   <li>{@code app.llm.gemini.api-key} (GEMINI_API_KEY)</li>
 * </ol>
 * A row or property without a key does not count. A missing model falls back to
 * {@link ProviderType#getDefaultModel()}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderConfigResolver {

    private final ApiConfigurationRepository apiConfigurationRepository;
    private final AppProperties props;

    public Optional<ProviderSelection> resolve() {
        for (ProviderType type : ProviderType.values()) {
            Optional<ProviderSelection> stored = fromDatabase(type);
            if (stored.isPresent()) {
                return stored;
            }
        }
        for (ProviderType type : ProviderType.values()) {
            Optional<ProviderSelection> env = fromEnvironment(type);
            if (env.isPresent()) {
                return env;
            }
        }
        log.warn("No LLM provider configured: no active API configuration and no API key in the environment");
        return Optional.empty();
    }

    private Optional<ProviderSelection> fromDatabase(ProviderType type) {
        return apiConfigurationRepository.findByServiceNameAndActiveTrue(type.getServiceName())
                .filter(config -> hasText(config.getApiKey()))
                .map(config -> selection(type, config.getApiKey(), config.getDefaultModel(),
                        ProviderSelection.Source.DATABASE));
    }

    private Optional<ProviderSelection> fromEnvironment(ProviderType type) {
        String apiKey;
        String model;
        switch (type) {
            case OPENAI -> {
                apiKey = props.getLlm().getOpenai().getApiKey();
                model = props.getLlm().getOpenai().getModel();
            }
            case GEMINI -> {
                apiKey = props.getLlm().getGemini().getApiKey();
                model = props.getLlm().getGemini().getModel();
            }
            default -> throw new IllegalStateException("Unhandled provider " + type);
        }
        if (!hasText(apiKey)) {
            return Optional.empty();
        }
        return Optional.of(selection(type, apiKey, model, ProviderSelection.Source.ENVIRONMENT));
    }

    private ProviderSelection selection(ProviderType type, String apiKey, String model, ProviderSelection.Source source) {
        ProviderSelection selection = ProviderSelection.builder()
                .provider(type)
                .apiKey(apiKey)
                .model(hasText(model) ? model : type.getDefaultModel())
                .source(source)
                .build();
        log.debug("Resolved LLM provider: {}", selection);
        return selection;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
