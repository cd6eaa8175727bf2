package com.talent.match.service;

import com.talent.match.models.MatchEngineConfiguration;
import com.talent.match.repo.MatchEngineConfigurationRepository;
import com.talent.match.utils.basic.Constant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class EngineConfigService {

    private final MatchEngineConfigurationRepository configurationRepository;

    /**
     * Tenant settings, or the defaults when the tenant never configured the engine.
     */
    @Cacheable(value = Constant.ENGINE_CONFIG_CACHE, key = "#tenantId", condition = "#tenantId != null")
    public MatchEngineConfiguration getConfiguration(UUID tenantId) {
        if (tenantId == null) {
            return MatchEngineConfiguration.defaults(null);
        }
        return configurationRepository.findByTenantId(tenantId).orElseGet(() -> {
            log.debug("No engine configuration for tenantId={}, using defaults", tenantId);
            return MatchEngineConfiguration.defaults(tenantId);
        });
    }
}
