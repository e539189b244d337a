package com.purchasingpower.tutor.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.tutor.client.PromptMessage;
import com.purchasingpower.tutor.client.ProviderRequest;
import com.purchasingpower.tutor.model.agent.Agent;
import com.purchasingpower.tutor.model.conversation.TutorMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the backend request for one agent: persona prompt, identity reminder, DO / DON'T rules.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TutorPromptBuilder {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ProviderRequest build(Agent agent, String message, String contextNote, List<TutorMessage> history) {
        return request(agent, systemPrompt(agent, false), message, contextNote, history);
    }

    /**
     * Same as {@link #build} with the persona told it is one voice among several.
     */
    public ProviderRequest buildCollaborative(Agent agent, String message, String contextNote,
                                              List<TutorMessage> history) {
        String note = "\n\n[Note: Provide a brief, focused response from your perspective as "
                + agent.getDisplayName() + ".]";
        return request(agent, systemPrompt(agent, true), message + note, contextNote, history);
    }

    String systemPrompt(Agent agent, boolean collaborative) {
        StringBuilder prompt = new StringBuilder(agent.getSystemPrompt());

        if (collaborative) {
            prompt.append("\n\nIMPORTANT: You are ").append(agent.getDisplayName())
                    .append(" participating in a collaborative tutoring session. ")
                    .append("Provide a focused response from your unique perspective. ")
                    .append("Be aware of what has been discussed previously.");
        } else {
            prompt.append("\n\nIMPORTANT: You are ").append(agent.getDisplayName())
                    .append(". Stay in character throughout the conversation. ")
                    .append("Remember what the user has told you and refer back to previous messages when relevant.");
        }

        appendRules(prompt, "DO", agent.getDosRules(), agent.getName());
        appendRules(prompt, "DON'T", agent.getDontsRules(), agent.getName());
        return prompt.toString();
    }

    private ProviderRequest request(Agent agent, String systemPrompt, String message, String contextNote,
                                    List<TutorMessage> history) {
        return ProviderRequest.builder()
                .systemPrompt(systemPrompt)
                .message(message)
                .contextNote(contextNote)
                .history(history.stream()
                        .map(entry -> new PromptMessage(entry.getRole(), entry.getContent()))
                        .toList())
                .modelOverride(agent.getModelPreference())
                .temperature(agent.getTemperature())
                .build();
    }

    private void appendRules(StringBuilder prompt, String heading, String rulesJson, String agentName) {
        if (rulesJson == null || rulesJson.isBlank()) {
            return;
        }
        List<String> rules;
        try {
            rules = objectMapper.readValue(rulesJson, STRING_LIST);
        } catch (Exception e) {
            log.warn("Ignoring malformed {} rules for agent {}: {}", heading, agentName, e.getMessage());
            return;
        }
        if (rules == null || rules.isEmpty()) {
            return;
        }
        prompt.append("\n\n").append(heading).append(":");
        rules.forEach(rule -> prompt.append("\n- ").append(rule));
    }
}
