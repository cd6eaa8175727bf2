package com.talent.match.repo;

import com.talent.match.models.MatchEngineConfiguration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface MatchEngineConfigurationRepository extends JpaRepository<MatchEngineConfiguration, UUID> {
    Optional<MatchEngineConfiguration> findByTenantId(UUID tenantId);
}
