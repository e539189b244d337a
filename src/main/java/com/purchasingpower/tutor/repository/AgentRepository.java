package com.purchasingpower.tutor.repository;

import com.purchasingpower.tutor.model.agent.Agent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read access to tutor personas.
 */
@Repository
public interface AgentRepository extends JpaRepository<Agent, Long> {

    List<Agent> findByActiveTrueOrderByNameAsc();

    Optional<Agent> findByIdAndActiveTrue(Long id);

    Optional<Agent> findByNameAndActiveTrue(String name);

    List<Agent> findByIdInAndActiveTrue(Collection<Long> ids);
}
