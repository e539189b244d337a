package com.purchasingpower.tutor.repository;

import com.purchasingpower.tutor.model.session.TutorSession;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TutorSessionRepository extends JpaRepository<TutorSession, Long> {

    Optional<TutorSession> findByUserId(Long userId);

    /**
     * Locks the session row for the rest of the transaction. Used to serialize
     * turn-number allocation between concurrent sends of the same user.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM TutorSession s WHERE s.id = :id")
    Optional<TutorSession> lockById(@Param("id") Long id);
}
