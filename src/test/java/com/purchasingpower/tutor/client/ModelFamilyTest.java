package com.purchasingpower.tutor.client;

import com.purchasingpower.tutor.configuration.AppProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class ModelFamilyTest {

    private final ModelFamily modelFamily = new ModelFamily(new AppProperties());

    @ParameterizedTest
    @ValueSource(strings = {"o1", "o1-mini", "o1-preview", "o3-mini"})
    void isReasoning_ReasoningModels(String model) {
        assertThat(modelFamily.isReasoning(model)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"gpt-4o", "gpt-4o-mini", "gemini-pro", "omni-moderation"})
    void isReasoning_StandardModels(String model) {
        assertThat(modelFamily.isReasoning(model)).isFalse();
    }

    @Test
    void isReasoning_ShouldFollowConfiguredPattern() {
        AppProperties props = new AppProperties();
        props.getLlm().setReasoningModelPattern("^deep-think.*");

        ModelFamily custom = new ModelFamily(props);

        assertThat(custom.isReasoning("deep-think-2")).isTrue();
        assertThat(custom.isReasoning("o1")).isFalse();
    }
}
