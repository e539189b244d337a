package com.purchasingpower.tutor.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class GeminiProperties {

    private String apiKey;

    private String model;

    @NotBlank
    private String baseUrl = "https://generativelanguage.googleapis.com";

    @NotBlank
    private String apiVersion = "v1beta";

    @Min(1)
    private int maxTokens = 2000;
}
