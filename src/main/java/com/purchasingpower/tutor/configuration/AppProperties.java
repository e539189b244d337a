package com.purchasingpower.tutor.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

/**
 * Root of the {@code app.*} configuration tree.
 *
 * <p>Provider credentials under {@code app.llm} are the environment fallback used by
 * {@link com.purchasingpower.tutor.service.ProviderConfigResolver} when no active row exists
 * in the API_CONFIGURATIONS table.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private TutorProperties tutor = new TutorProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private LlmProperties llm = new LlmProperties();
}
