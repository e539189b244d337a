package com.purchasingpower.tutor.client;

import com.purchasingpower.tutor.configuration.AppProperties;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Recognizes reasoning-optimized models, which reject temperature and take
 * a different token budget parameter.
 */
@Component
public class ModelFamily {

    private final Pattern reasoningPattern;

    public ModelFamily(AppProperties props) {
        this.reasoningPattern = Pattern.compile(props.getLlm().getReasoningModelPattern());
    }

    public boolean isReasoning(String model) {
        return model != null && reasoningPattern.matcher(model).matches();
    }
}
