package com.purchasingpower.tutor.repository;

import com.purchasingpower.tutor.model.conversation.TutorMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TutorMessageRepository extends JpaRepository<TutorMessage, Long> {

    List<TutorMessage> findByConversationIdOrderByCreatedAtAscIdAsc(Long conversationId);

    /**
     * Newest messages first; callers reverse the page to get chronological order.
     */
    @Query("SELECT m FROM TutorMessage m WHERE m.conversationId = :conversationId ORDER BY m.createdAt DESC, m.id DESC")
    List<TutorMessage> findLatest(@Param("conversationId") Long conversationId, Pageable page);

    Optional<TutorMessage> findFirstByConversationIdOrderByCreatedAtDescIdDesc(Long conversationId);

    long countByConversationId(Long conversationId);

    @Modifying
    @Query("DELETE FROM TutorMessage m WHERE m.conversationId = :conversationId")
    int deleteByConversation(@Param("conversationId") Long conversationId);
}
