package com.purchasingpower.tutor.client;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Backend-neutral completion request.
 *
 * <p>Backends receive, in order: the system prompt, the history oldest first,
 * the context note and finally {@link #message}.
 */
@Value
@Builder
public class ProviderRequest {

    String message;

    String systemPrompt;

    String contextNote;

    @Singular("historyEntry")
    List<PromptMessage> history;

    /**
     * Agent preference. Used instead of the selected model only when the selected backend serves it.
     */
    String modelOverride;

    /**
     * Sent only when non-null and the model accepts it.
     */
    Double temperature;
}
