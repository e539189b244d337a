package com.purchasingpower.tutor.repository;

import com.purchasingpower.tutor.model.provider.ApiConfiguration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ApiConfigurationRepository extends JpaRepository<ApiConfiguration, Long> {

    Optional<ApiConfiguration> findByServiceNameAndActiveTrue(String serviceName);
}
