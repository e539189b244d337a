package com.purchasingpower.tutor.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

@Data
public class LlmProperties {

    /**
     * Model names matching this pattern reject temperature and take max_completion_tokens.
     */
    @NotBlank
    private String reasoningModelPattern = "^o\\d.*";

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private OpenAiProperties openai = new OpenAiProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GeminiProperties gemini = new GeminiProperties();
}
