package com.purchasingpower.tutor.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.tutor.configuration.AppProperties;
import com.purchasingpower.tutor.exception.ProviderException;
import com.purchasingpower.tutor.model.conversation.MessageRole;
import com.purchasingpower.tutor.model.provider.ProviderSelection;
import com.purchasingpower.tutor.model.provider.ProviderType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Gemini adapter")
class GeminiProviderAdapterTest {

    private static final ProviderSelection SELECTION = ProviderSelection.builder()
            .provider(ProviderType.GEMINI)
            .apiKey("g-test")
            .model("gemini-pro")
            .source(ProviderSelection.Source.DATABASE)
            .build();

    private final AppProperties props = new AppProperties();

    @Test
    @DisplayName("History maps assistant to model and the context note leads the final user turn")
    @SuppressWarnings("unchecked")
    void buildContents_ShouldMapRolesAndContext() {
        // Given
        GeminiProviderAdapter adapter = adapter(new StubExchange(HttpStatus.OK, "{}"));
        ProviderRequest request = ProviderRequest.builder()
                .historyEntry(new PromptMessage(MessageRole.USER, "q1"))
                .historyEntry(new PromptMessage(MessageRole.ASSISTANT, "a1"))
                .contextNote("lesson 2")
                .message("q2")
                .build();

        // When
        List<Map<String, Object>> contents = adapter.buildContents(request);

        // Then
        assertThat(contents).extracting(c -> c.get("role")).containsExactly("user", "model", "user");
        List<Map<String, String>> lastParts = (List<Map<String, String>>) contents.get(2).get("parts");
        assertThat(lastParts).extracting(p -> p.get("text")).containsExactly("Context: lesson 2", "q2");
    }

    @Test
    @DisplayName("System prompt becomes systemInstruction; temperature only when supplied")
    @SuppressWarnings("unchecked")
    void buildBody_ShouldCarrySystemInstructionAndOptionalTemperature() {
        GeminiProviderAdapter adapter = adapter(new StubExchange(HttpStatus.OK, "{}"));

        Map<String, Object> body = adapter.buildBody("gemini-pro",
                ProviderRequest.builder().systemPrompt("Be kind").message("hi").build());
        Map<String, Object> withTemperature = adapter.buildBody("gemini-pro",
                ProviderRequest.builder().message("hi").temperature(0.4).build());

        assertThat(body).containsKey("systemInstruction");
        assertThat((Map<String, Object>) body.get("generationConfig"))
                .containsEntry("maxOutputTokens", 2000)
                .doesNotContainKey("temperature");
        assertThat(withTemperature).doesNotContainKey("systemInstruction");
        assertThat((Map<String, Object>) withTemperature.get("generationConfig")).containsEntry("temperature", 0.4);
    }

    @Test
    @DisplayName("Successful call joins candidate parts and authenticates by header")
    void send_Success_ShouldReturnReply() {
        // Given
        StubExchange exchange = new StubExchange(HttpStatus.OK,
                "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"Hello \"},{\"text\":\"learner\"}]}}]}");
        GeminiProviderAdapter adapter = adapter(exchange);

        // When
        ProviderReply reply = adapter.send(SELECTION, ProviderRequest.builder().message("hi").build());

        // Then
        assertThat(reply.getReply()).isEqualTo("Hello learner");
        assertThat(reply.getModel()).isEqualTo("gemini-pro");
        assertThat(reply.getProvider()).isEqualTo(ProviderType.GEMINI);
        assertThat(exchange.lastRequest().url().getPath()).isEqualTo("/v1beta/models/gemini-pro:generateContent");
        assertThat(exchange.lastRequest().url().getQuery()).isNull();
        assertThat(exchange.lastRequest().headers().getFirst("x-goog-api-key")).isEqualTo("g-test");
    }

    @Test
    @DisplayName("Agent preference for another backend's model falls back to the selected model")
    void send_ForeignModelPreference_ShouldUseSelectedModel() {
        // Given
        StubExchange exchange = new StubExchange(HttpStatus.OK,
                "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"ok\"}]}}]}");
        GeminiProviderAdapter adapter = adapter(exchange);

        // When
        ProviderReply reply = adapter.send(SELECTION, ProviderRequest.builder()
                .message("hi")
                .modelOverride("gpt-4o")
                .build());

        // Then
        assertThat(reply.getModel()).isEqualTo("gemini-pro");
        assertThat(exchange.lastRequest().url().getPath()).isEqualTo("/v1beta/models/gemini-pro:generateContent");
    }

    @Test
    @DisplayName("Agent preference for a Gemini model is honoured")
    void send_OwnModelPreference_ShouldUseIt() {
        StubExchange exchange = new StubExchange(HttpStatus.OK,
                "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"ok\"}]}}]}");
        GeminiProviderAdapter adapter = adapter(exchange);

        ProviderReply reply = adapter.send(SELECTION, ProviderRequest.builder()
                .message("hi")
                .modelOverride("gemini-1.5-pro")
                .build());

        assertThat(reply.getModel()).isEqualTo("gemini-1.5-pro");
        assertThat(exchange.lastRequest().url().getPath()).isEqualTo("/v1beta/models/gemini-1.5-pro:generateContent");
    }

    @Test
    @DisplayName("Upstream failure is wrapped with its message")
    void send_ServerError_ShouldWrap() {
        GeminiProviderAdapter adapter = adapter(new StubExchange(HttpStatus.SERVICE_UNAVAILABLE,
                "{\"error\":{\"message\":\"The model is overloaded\"}}"));

        assertThatThrownBy(() -> adapter.send(SELECTION, ProviderRequest.builder().message("hi").build()))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("The model is overloaded");
    }

    private GeminiProviderAdapter adapter(StubExchange exchange) {
        GeminiProviderAdapter adapter = new GeminiProviderAdapter(
                WebClient.builder().exchangeFunction(exchange),
                props,
                new ModelFamily(props),
                new ObjectMapper());
        adapter.init();
        return adapter;
    }
}
