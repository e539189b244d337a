package com.purchasingpower.tutor.service;

import com.purchasingpower.tutor.model.conversation.MessageRole;
import com.purchasingpower.tutor.model.conversation.TutorConversation;
import com.purchasingpower.tutor.model.conversation.TutorMessage;

import java.util.List;
import java.util.Optional;

/**
 * Per (user, agent) message history.
 *
 * <p>Messages are append-only and totally ordered by (createdAt, id). The history window
 * only bounds what is sent to a backend; it never trims what is stored.
 */
public interface ConversationStore {

    /**
     * Returns the conversation for the pair, creating an empty one on first access.
     */
    TutorConversation getOrCreate(Long userId, Long agentId);

    Optional<TutorConversation> find(Long userId, Long agentId);

    List<TutorConversation> listForUser(Long userId);

    /**
     * Appends {@code draft} (its conversationId must be set) and updates the
     * conversation's message count and last activity.
     */
    TutorMessage append(TutorMessage draft);

    default TutorMessage appendMessage(Long conversationId, MessageRole role, String content, String model) {
        return append(TutorMessage.builder()
                .conversationId(conversationId)
                .role(role)
                .content(content)
                .model(model)
                .build());
    }

    /**
     * At most {@code windowSize} most recent messages, oldest first.
     */
    List<TutorMessage> recentHistory(Long conversationId, int windowSize);

    /**
     * {@link #recentHistory(Long, int)} with the configured window.
     */
    List<TutorMessage> recentHistory(Long conversationId);

    List<TutorMessage> allMessages(Long conversationId);

    Optional<TutorMessage> lastMessage(Long conversationId);

    /**
     * Deletes every message of the conversation and keeps the conversation row.
     *
     * @return number of messages deleted
     */
    int clear(Long conversationId);
}
