package com.talent.match.service;

import com.talent.match.dto.SkillMappingRequest;
import com.talent.match.exceptions.BadRequestException;
import com.talent.match.models.AthleticSkillMapping;
import com.talent.match.repo.AthleticSkillMappingRepository;
import com.talent.match.repo.MarketplaceSnapshotRepository;
import com.talent.match.repo.MatchScoreRepository;
import com.talent.match.utils.basic.Constant;
import com.talent.match.utils.basic.DefaultValuesPopulator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.RoundingMode;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Backing store of the athletic skill-transfer table. Reads are cached; every write evicts the cache
 * and marks the scores of athletic tenants stale so they pick up the new strengths.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SkillMappingService {

    private final AthleticSkillMappingRepository mappingRepository;
    private final MatchScoreRepository matchScoreRepository;
    private final MarketplaceSnapshotRepository snapshotRepository;
    private final Clock clock;

    @Cacheable(value = Constant.SKILL_MAPPING_CACHE, key = "#sportName.trim().toLowerCase()")
    public List<AthleticSkillMapping> findBySport(String sportName) {
        return mappingRepository.findBySportNameIgnoreCase(sportName.trim());
    }

    public List<AthleticSkillMapping> list(String sportName) {
        if (StringUtils.isBlank(sportName)) {
            return mappingRepository.findAllByOrderBySportNameAscPositionAscProfessionalSkillAsc();
        }
        return mappingRepository.findBySportNameIgnoreCase(sportName.trim());
    }

    @Transactional
    @CacheEvict(value = Constant.SKILL_MAPPING_CACHE, allEntries = true)
    public AthleticSkillMapping create(SkillMappingRequest request) {
        ensureUnique(request, null);
        OffsetDateTime now = DefaultValuesPopulator.now(clock);
        AthleticSkillMapping mapping = AthleticSkillMapping.builder()
                .createdAt(now)
                .build();
        apply(mapping, request, now);
        AthleticSkillMapping saved = mappingRepository.save(mapping);
        log.info("Created skill mapping id={}, sport={}, position={}, skill={}",
                saved.getId(), saved.getSportName(), saved.getPosition(), saved.getProfessionalSkill());
        invalidateAthleticScores(now);
        return saved;
    }

    @Transactional
    @CacheEvict(value = Constant.SKILL_MAPPING_CACHE, allEntries = true)
    public AthleticSkillMapping update(UUID mappingId, SkillMappingRequest request) {
        AthleticSkillMapping mapping = mappingRepository.findById(mappingId).orElseThrow(
                () -> new BadRequestException("Skill mapping " + mappingId + " does not exist")
        );
        ensureUnique(request, mappingId);
        OffsetDateTime now = DefaultValuesPopulator.now(clock);
        apply(mapping, request, now);
        AthleticSkillMapping saved = mappingRepository.save(mapping);
        log.info("Updated skill mapping id={}, sport={}, position={}, skill={}",
                saved.getId(), saved.getSportName(), saved.getPosition(), saved.getProfessionalSkill());
        invalidateAthleticScores(now);
        return saved;
    }

    private void apply(AthleticSkillMapping mapping, SkillMappingRequest request, OffsetDateTime now) {
        mapping.setSportName(request.getSportName().trim());
        mapping.setPosition(StringUtils.trimToNull(request.getPosition()));
        mapping.setProfessionalSkill(request.getProfessionalSkill().trim());
        mapping.setTransferStrength(request.getTransferStrength().setScale(2, RoundingMode.HALF_UP));
        mapping.setSkillCategory(StringUtils.trimToNull(request.getSkillCategory()));
        mapping.setDescription(StringUtils.trimToNull(request.getDescription()));
        mapping.setUpdatedAt(now);
    }

    private void ensureUnique(SkillMappingRequest request, UUID selfId) {
        String position = normalized(request.getPosition());
        String skill = normalized(request.getProfessionalSkill());
        boolean duplicate = mappingRepository.findBySportNameIgnoreCase(request.getSportName().trim()).stream()
                .filter(existing -> !existing.getId().equals(selfId))
                .anyMatch(existing -> Objects.equals(normalized(existing.getPosition()), position)
                        && Objects.equals(normalized(existing.getProfessionalSkill()), skill));
        if (duplicate) {
            throw new BadRequestException("A mapping for sport '" + request.getSportName() + "', position '"
                    + StringUtils.defaultString(request.getPosition()) + "' and skill '"
                    + request.getProfessionalSkill() + "' already exists");
        }
    }

    private void invalidateAthleticScores(OffsetDateTime now) {
        List<UUID> tenantIds = snapshotRepository.findAthleticTenantIds();
        if (tenantIds.isEmpty()) {
            return;
        }
        long version = matchScoreRepository.nextEventVersion();
        int marked = matchScoreRepository.markStaleByTenants(tenantIds, version, now);
        log.info("Skill mapping change marked {} scores stale across {} athletic tenants", marked, tenantIds.size());
    }

    private static String normalized(String value) {
        return StringUtils.trimToEmpty(value).toLowerCase(Locale.ROOT);
    }
}
