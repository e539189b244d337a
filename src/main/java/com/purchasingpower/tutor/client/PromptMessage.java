package com.purchasingpower.tutor.client;

import com.purchasingpower.tutor.model.conversation.MessageRole;

/**
 * One prior exchange entry sent to a backend as context.
 */
public record PromptMessage(MessageRole role, String content) {
}
