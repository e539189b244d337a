package com.purchasingpower.tutor.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.tutor.configuration.AppProperties;
import com.purchasingpower.tutor.exception.ProviderException;
import com.purchasingpower.tutor.model.conversation.MessageRole;
import com.purchasingpower.tutor.model.provider.ProviderSelection;
import com.purchasingpower.tutor.model.provider.ProviderType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OpenAI adapter")
class OpenAiProviderAdapterTest {

    private static final ProviderSelection SELECTION = ProviderSelection.builder()
            .provider(ProviderType.OPENAI)
            .apiKey("sk-test")
            .model("gpt-4o-mini")
            .source(ProviderSelection.Source.ENVIRONMENT)
            .build();

    private final AppProperties props = new AppProperties();

    @Test
    @DisplayName("Messages go system, history oldest first, context, user")
    void buildMessages_ShouldKeepPromptOrder() {
        // Given
        OpenAiProviderAdapter adapter = adapter(new StubExchange(HttpStatus.OK, "{}"));
        ProviderRequest request = ProviderRequest.builder()
                .systemPrompt("You are a tutor")
                .historyEntry(new PromptMessage(MessageRole.USER, "first question"))
                .historyEntry(new PromptMessage(MessageRole.ASSISTANT, "first answer"))
                .contextNote("chapter 3")
                .message("second question")
                .build();

        // When
        List<Map<String, String>> messages = adapter.buildMessages(request);

        // Then
        assertThat(messages).extracting(m -> m.get("role"))
                .containsExactly("system", "user", "assistant", "system", "user");
        assertThat(messages).extracting(m -> m.get("content"))
                .containsExactly("You are a tutor", "first question", "first answer", "Context: chapter 3",
                        "second question");
    }

    @Test
    @DisplayName("Standard model carries temperature only when supplied")
    void buildBody_StandardModel_ShouldSendTemperatureOnlyWhenGiven() {
        OpenAiProviderAdapter adapter = adapter(new StubExchange(HttpStatus.OK, "{}"));

        Map<String, Object> withTemperature = adapter.buildBody("gpt-4o-mini",
                ProviderRequest.builder().message("hi").temperature(0.3).build());
        Map<String, Object> withoutTemperature = adapter.buildBody("gpt-4o-mini",
                ProviderRequest.builder().message("hi").build());

        assertThat(withTemperature).containsEntry("temperature", 0.3).containsEntry("max_tokens", 2000);
        assertThat(withoutTemperature).doesNotContainKey("temperature").containsKey("max_tokens");
    }

    @Test
    @DisplayName("Reasoning model never carries temperature and uses max_completion_tokens")
    void buildBody_ReasoningModel_ShouldDropTemperature() {
        OpenAiProviderAdapter adapter = adapter(new StubExchange(HttpStatus.OK, "{}"));

        Map<String, Object> body = adapter.buildBody("o1-mini",
                ProviderRequest.builder().message("hi").temperature(0.9).build());

        assertThat(body)
                .doesNotContainKey("temperature")
                .doesNotContainKey("max_tokens")
                .containsEntry("max_completion_tokens", 2000);
    }

    @Test
    @DisplayName("Reply, model and latency come back from a successful call")
    void send_Success_ShouldReturnReply() {
        // Given
        StubExchange exchange = new StubExchange(HttpStatus.OK,
                "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"Recursion is a function calling itself.\"}}]}");
        OpenAiProviderAdapter adapter = adapter(exchange);

        // When
        ProviderReply reply = adapter.send(SELECTION, ProviderRequest.builder()
                .message("Explain recursion")
                .modelOverride("gpt-4o")
                .build());

        // Then
        assertThat(reply.getReply()).isEqualTo("Recursion is a function calling itself.");
        assertThat(reply.getModel()).isEqualTo("gpt-4o");
        assertThat(reply.getProvider()).isEqualTo(ProviderType.OPENAI);
        assertThat(reply.getResponseTimeMs()).isGreaterThanOrEqualTo(0);
        assertThat(exchange.lastRequest().url().getPath()).isEqualTo("/v1/chat/completions");
        assertThat(exchange.lastRequest().headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer sk-test");
    }

    @Test
    @DisplayName("Agent preference for a Gemini model falls back to the selected model")
    void send_ForeignModelPreference_ShouldUseSelectedModel() {
        StubExchange exchange = new StubExchange(HttpStatus.OK,
                "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"ok\"}}]}");
        OpenAiProviderAdapter adapter = adapter(exchange);

        ProviderReply reply = adapter.send(SELECTION, ProviderRequest.builder()
                .message("hi")
                .modelOverride("gemini-pro")
                .build());

        assertThat(reply.getModel()).isEqualTo("gpt-4o-mini");
    }

    @Test
    @DisplayName("Upstream error status becomes a provider error with the upstream message")
    void send_RateLimited_ShouldWrapUpstreamMessage() {
        OpenAiProviderAdapter adapter = adapter(new StubExchange(HttpStatus.TOO_MANY_REQUESTS,
                "{\"error\":{\"message\":\"Rate limit reached for gpt-4o-mini\"}}"));

        assertThatThrownBy(() -> adapter.send(SELECTION, ProviderRequest.builder().message("hi").build()))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("Rate limit reached for gpt-4o-mini")
                .satisfies(e -> assertThat(((ProviderException) e).getUpstreamStatus()).isEqualTo(429));
    }

    @Test
    @DisplayName("Response without content is a provider error")
    void send_MalformedResponse_ShouldFail() {
        OpenAiProviderAdapter adapter = adapter(new StubExchange(HttpStatus.OK, "{\"choices\":[]}"));

        assertThatThrownBy(() -> adapter.send(SELECTION, ProviderRequest.builder().message("hi").build()))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("without message content");
    }

    private OpenAiProviderAdapter adapter(StubExchange exchange) {
        OpenAiProviderAdapter adapter = new OpenAiProviderAdapter(
                WebClient.builder().exchangeFunction(exchange),
                props,
                new ModelFamily(props),
                new ObjectMapper());
        adapter.init();
        return adapter;
    }
}
