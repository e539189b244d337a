package com.purchasingpower.tutor.service.impl;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.purchasingpower.tutor.configuration.AppProperties;
import com.purchasingpower.tutor.exception.ResourceNotFoundException;
import com.purchasingpower.tutor.model.conversation.TutorConversation;
import com.purchasingpower.tutor.model.conversation.TutorMessage;
import com.purchasingpower.tutor.repository.TutorConversationRepository;
import com.purchasingpower.tutor.repository.TutorMessageRepository;
import com.purchasingpower.tutor.service.ConversationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaConversationStore implements ConversationStore {

    private final TutorConversationRepository conversationRepository;
    private final TutorMessageRepository messageRepository;
    private final AppProperties props;

    /**
     * Must run outside a transaction: a concurrent insert of the same pair fails on the
     * unique key and the existing row is read back.
     */
    @Override
    public TutorConversation getOrCreate(Long userId, Long agentId) {
        Optional<TutorConversation> existing = conversationRepository.findByUserIdAndAgentId(userId, agentId);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            TutorConversation created = conversationRepository.saveAndFlush(TutorConversation.builder()
                    .userId(userId)
                    .agentId(agentId)
                    .messageCount(0)
                    .build());
            log.info("Created conversation {} for user {} with agent {}", created.getId(), userId, agentId);
            return created;
        } catch (DataIntegrityViolationException e) {
            log.debug("Conversation for user {} / agent {} created concurrently, reloading", userId, agentId);
            return conversationRepository.findByUserIdAndAgentId(userId, agentId)
                    .orElseThrow(() -> e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TutorConversation> find(Long userId, Long agentId) {
        return conversationRepository.findByUserIdAndAgentId(userId, agentId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<TutorConversation> listForUser(Long userId) {
        return conversationRepository.findByUserIdOrderByLastMessageAtDescIdDesc(userId);
    }

    @Override
    @Transactional
    public TutorMessage append(TutorMessage draft) {
        Preconditions.checkNotNull(draft.getConversationId(), "conversationId is required");
        Preconditions.checkNotNull(draft.getRole(), "role is required");

        TutorConversation conversation = conversationRepository.findById(draft.getConversationId())
                .orElseThrow(() -> new ResourceNotFoundException("Conversation not found: " + draft.getConversationId()));

        if (draft.getCreatedAt() == null) {
            draft.setCreatedAt(LocalDateTime.now());
        }
        TutorMessage saved = messageRepository.save(draft);

        conversation.recordMessage(saved.getCreatedAt());
        conversationRepository.save(conversation);

        log.debug("Appended {} message {} to conversation {}", saved.getRole().getValue(), saved.getId(),
                conversation.getId());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public List<TutorMessage> recentHistory(Long conversationId, int windowSize) {
        Preconditions.checkArgument(windowSize > 0, "windowSize must be positive");
        List<TutorMessage> newestFirst = messageRepository.findLatest(conversationId, PageRequest.of(0, windowSize));
        return new ArrayList<>(Lists.reverse(newestFirst));
    }

    @Override
    public List<TutorMessage> recentHistory(Long conversationId) {
        return recentHistory(conversationId, props.getTutor().getHistoryWindow());
    }

    @Override
    @Transactional(readOnly = true)
    public List<TutorMessage> allMessages(Long conversationId) {
        return messageRepository.findByConversationIdOrderByCreatedAtAscIdAsc(conversationId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TutorMessage> lastMessage(Long conversationId) {
        return messageRepository.findFirstByConversationIdOrderByCreatedAtDescIdDesc(conversationId);
    }

    @Override
    @Transactional
    public int clear(Long conversationId) {
        TutorConversation conversation = conversationRepository.findById(conversationId)
                .orElseThrow(() -> new ResourceNotFoundException("Conversation not found: " + conversationId));

        int deleted = messageRepository.deleteByConversation(conversationId);
        conversation.reset();
        conversationRepository.save(conversation);

        log.info("Cleared conversation {}: {} messages deleted", conversationId, deleted);
        return deleted;
    }
}
