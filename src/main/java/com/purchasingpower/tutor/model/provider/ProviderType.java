package com.purchasingpower.tutor.model.provider;

import java.util.regex.Pattern;

/**
 * Supported LLM backends, in resolution priority order.
 */
public enum ProviderType {

    OPENAI("openai", "gpt-4o-mini", "^(gpt-|chatgpt-|o\\d).*"),
    GEMINI("gemini", "gemini-pro", "^gemini-.*");

    private final String serviceName;
    private final String defaultModel;
    private final Pattern modelNames;

    ProviderType(String serviceName, String defaultModel, String modelNames) {
        this.serviceName = serviceName;
        this.defaultModel = defaultModel;
        this.modelNames = Pattern.compile(modelNames);
    }

    /**
     * Key used in API_CONFIGURATIONS.service_name and on stored messages.
     */
    public String getServiceName() {
        return serviceName;
    }

    /**
     * Model used when the selected config does not name one.
     */
    public String getDefaultModel() {
        return defaultModel;
    }

    /**
     * Whether this backend serves a model of that name.
     */
    public boolean servesModel(String model) {
        return model != null && modelNames.matcher(model).matches();
    }
}
