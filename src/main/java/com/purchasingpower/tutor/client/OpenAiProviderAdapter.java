package com.purchasingpower.tutor.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.tutor.configuration.AppProperties;
import com.purchasingpower.tutor.configuration.OpenAiProperties;
import com.purchasingpower.tutor.exception.ProviderException;
import com.purchasingpower.tutor.model.provider.ProviderSelection;
import com.purchasingpower.tutor.model.provider.ProviderType;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat completions backend.
 */
@Slf4j
@Component
public class OpenAiProviderAdapter implements ProviderAdapter {

    private static final String COMPLETIONS_PATH = "/v1/chat/completions";

    private final WebClient.Builder webClientBuilder;
    private final AppProperties props;
    private final ModelFamily modelFamily;
    private final ObjectMapper objectMapper;

    private WebClient webClient;

    public OpenAiProviderAdapter(WebClient.Builder webClientBuilder,
                                 AppProperties props,
                                 ModelFamily modelFamily,
                                 ObjectMapper objectMapper) {
        this.webClientBuilder = webClientBuilder;
        this.props = props;
        this.modelFamily = modelFamily;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        this.webClient = webClientBuilder.clone()
                .baseUrl(props.getLlm().getOpenai().getBaseUrl())
                .build();
    }

    @Override
    public ProviderType getType() {
        return ProviderType.OPENAI;
    }

    @Override
    public ProviderReply send(ProviderSelection selection, ProviderRequest request) {
        String model = effectiveModel(selection, request);
        Map<String, Object> body = buildBody(model, request);

        log.info("[LLM REQUEST] provider=openai model={} messages={}",
                model, ((List<?>) body.get("messages")).size());
        log.debug("[LLM REQUEST] prompt preview: {}", preview(request.getMessage()));

        long startTime = System.currentTimeMillis();
        try {
            JsonNode response = webClient.post()
                    .uri(COMPLETIONS_PATH)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + selection.getApiKey())
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();

            String reply = extractReply(response);
            long latency = System.currentTimeMillis() - startTime;

            log.info("[LLM RESPONSE] provider=openai model={} {}ms, {} chars", model, latency, reply.length());

            return ProviderReply.builder()
                    .reply(reply)
                    .model(model)
                    .provider(ProviderType.OPENAI)
                    .responseTimeMs(latency)
                    .build();
        } catch (Exception e) {
            long latency = System.currentTimeMillis() - startTime;
            ProviderException wrapped = UpstreamErrors.wrap(ProviderType.OPENAI, e, objectMapper);
            log.error("[LLM ERROR] provider=openai model={} after {}ms: {}", model, latency, wrapped.getMessage());
            throw wrapped;
        }
    }

    /**
     * Reasoning models get max_completion_tokens and never a temperature; all others get
     * max_tokens and a temperature only when the caller supplied one.
     */
    Map<String, Object> buildBody(String model, ProviderRequest request) {
        OpenAiProperties config = props.getLlm().getOpenai();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", buildMessages(request));

        if (modelFamily.isReasoning(model)) {
            body.put("max_completion_tokens", config.getMaxTokens());
        } else {
            body.put("max_tokens", config.getMaxTokens());
            if (request.getTemperature() != null) {
                body.put("temperature", request.getTemperature());
            }
        }
        return body;
    }

    List<Map<String, String>> buildMessages(ProviderRequest request) {
        List<Map<String, String>> messages = new ArrayList<>();

        if (hasText(request.getSystemPrompt())) {
            messages.add(Map.of("role", "system", "content", request.getSystemPrompt()));
        }
        for (PromptMessage entry : request.getHistory()) {
            messages.add(Map.of("role", entry.role().getValue(), "content", entry.content()));
        }
        if (hasText(request.getContextNote())) {
            messages.add(Map.of("role", "system", "content", "Context: " + request.getContextNote()));
        }
        messages.add(Map.of("role", "user", "content", request.getMessage()));

        return messages;
    }

    private String effectiveModel(ProviderSelection selection, ProviderRequest request) {
        String model = selection.modelFor(request.getModelOverride());
        if (hasText(request.getModelOverride()) && !model.equals(request.getModelOverride())) {
            log.debug("Preferred model {} is not served by openai, using {}", request.getModelOverride(), model);
        }
        return model;
    }

    private String extractReply(JsonNode response) {
        JsonNode content = response == null ? null
                : response.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual()) {
            throw new ProviderException(ProviderType.OPENAI.getServiceName(),
                    "openai returned a response without message content");
        }
        return content.asText();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String preview(String text) {
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
