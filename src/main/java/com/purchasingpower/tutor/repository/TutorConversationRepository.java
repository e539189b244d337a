package com.purchasingpower.tutor.repository;

import com.purchasingpower.tutor.model.conversation.TutorConversation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TutorConversationRepository extends JpaRepository<TutorConversation, Long> {

    Optional<TutorConversation> findByUserIdAndAgentId(Long userId, Long agentId);

    /**
     * Conversations of a user, most recent activity first, never-used ones last.
     */
    List<TutorConversation> findByUserIdOrderByLastMessageAtDescIdDesc(Long userId);
}
