package com.purchasingpower.tutor.model.provider;

import lombok.Builder;
import lombok.Value;

/**
 * Backend, credential and default model chosen for one call.
 */
@Value
@Builder
public class ProviderSelection {

    ProviderType provider;

    String apiKey;

    String model;

    Source source;

    public enum Source {
        DATABASE,
        ENVIRONMENT
    }

    /**
     * The agent's preferred model when this backend serves it, otherwise the selected model.
     */
    public String modelFor(String preferredModel) {
        return provider.servesModel(preferredModel) ? preferredModel : model;
    }

    @Override
    public String toString() {
        return "ProviderSelection(provider=" + provider + ", model=" + model + ", source=" + source + ")";
    }
}
