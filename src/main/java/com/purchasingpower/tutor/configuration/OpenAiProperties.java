package com.purchasingpower.tutor.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class OpenAiProperties {

    private String apiKey;

    private String model;

    @NotBlank
    private String baseUrl = "https://api.openai.com";

    @Min(1)
    private int maxTokens = 2000;
}
