package com.purchasingpower.tutor.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.tutor.configuration.AppProperties;
import com.purchasingpower.tutor.configuration.GeminiProperties;
import com.purchasingpower.tutor.exception.ProviderException;
import com.purchasingpower.tutor.model.conversation.MessageRole;
import com.purchasingpower.tutor.model.provider.ProviderSelection;
import com.purchasingpower.tutor.model.provider.ProviderType;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gemini {@code generateContent} backend. The key travels in the x-goog-api-key header, never in the URL.
 */
@Slf4j
@Component
public class GeminiProviderAdapter implements ProviderAdapter {

    private final WebClient.Builder webClientBuilder;
    private final AppProperties props;
    private final ModelFamily modelFamily;
    private final ObjectMapper objectMapper;

    private WebClient webClient;

    public GeminiProviderAdapter(WebClient.Builder webClientBuilder,
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
                .baseUrl(props.getLlm().getGemini().getBaseUrl())
                .build();
    }

    @Override
    public ProviderType getType() {
        return ProviderType.GEMINI;
    }

    @Override
    public ProviderReply send(ProviderSelection selection, ProviderRequest request) {
        String model = selection.modelFor(request.getModelOverride());
        if (request.getModelOverride() != null && !model.equals(request.getModelOverride())) {
            log.debug("Preferred model {} is not served by gemini, using {}", request.getModelOverride(), model);
        }
        String url = String.format("/%s/models/%s:generateContent",
                props.getLlm().getGemini().getApiVersion(), model);
        Map<String, Object> body = buildBody(model, request);

        log.info("[LLM REQUEST] provider=gemini model={} contents={}",
                model, ((List<?>) body.get("contents")).size());

        long startTime = System.currentTimeMillis();
        try {
            JsonNode response = webClient.post()
                    .uri(url)
                    .header("x-goog-api-key", selection.getApiKey())
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();

            String reply = extractReply(response);
            long latency = System.currentTimeMillis() - startTime;

            log.info("[LLM RESPONSE] provider=gemini model={} {}ms, {} chars", model, latency, reply.length());

            return ProviderReply.builder()
                    .reply(reply)
                    .model(model)
                    .provider(ProviderType.GEMINI)
                    .responseTimeMs(latency)
                    .build();
        } catch (Exception e) {
            long latency = System.currentTimeMillis() - startTime;
            ProviderException wrapped = UpstreamErrors.wrap(ProviderType.GEMINI, e, objectMapper);
            log.error("[LLM ERROR] provider=gemini model={} after {}ms: {}", model, latency, wrapped.getMessage());
            throw wrapped;
        }
    }

    Map<String, Object> buildBody(String model, ProviderRequest request) {
        GeminiProperties config = props.getLlm().getGemini();

        Map<String, Object> body = new LinkedHashMap<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            body.put("systemInstruction", Map.of("parts", List.of(Map.of("text", request.getSystemPrompt()))));
        }
        body.put("contents", buildContents(request));

        Map<String, Object> generationConfig = new LinkedHashMap<>();
        generationConfig.put("maxOutputTokens", config.getMaxTokens());
        if (request.getTemperature() != null && !modelFamily.isReasoning(model)) {
            generationConfig.put("temperature", request.getTemperature());
        }
        body.put("generationConfig", generationConfig);
        return body;
    }

    /**
     * Gemini calls the assistant role "model". The context note rides in the final user turn,
     * ahead of the message itself.
     */
    List<Map<String, Object>> buildContents(ProviderRequest request) {
        List<Map<String, Object>> contents = new ArrayList<>();
        for (PromptMessage entry : request.getHistory()) {
            String role = entry.role() == MessageRole.ASSISTANT ? "model" : "user";
            contents.add(Map.of("role", role, "parts", List.of(Map.of("text", entry.content()))));
        }

        List<Map<String, String>> userParts = new ArrayList<>();
        if (request.getContextNote() != null && !request.getContextNote().isBlank()) {
            userParts.add(Map.of("text", "Context: " + request.getContextNote()));
        }
        userParts.add(Map.of("text", request.getMessage()));
        contents.add(Map.of("role", "user", "parts", userParts));

        return contents;
    }

    private String extractReply(JsonNode response) {
        JsonNode parts = response == null ? null
                : response.path("candidates").path(0).path("content").path("parts");
        if (parts == null || !parts.isArray() || parts.isEmpty()) {
            throw new ProviderException(ProviderType.GEMINI.getServiceName(),
                    "gemini returned a response without candidates");
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            text.append(part.path("text").asText(""));
        }
        return text.toString();
    }
}
