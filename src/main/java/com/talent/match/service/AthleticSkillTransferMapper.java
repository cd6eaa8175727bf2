package com.talent.match.service;

import com.talent.match.dto.enums.MarketplaceType;
import com.talent.match.models.AthleticSkillMapping;
import com.talent.match.models.MatchEngineConfiguration;
import com.talent.match.service.MarketplaceRecords.SkillTransfer;
import com.talent.match.service.MarketplaceRecords.StudentProfile;
import com.talent.match.utils.basic.BasicUtility;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


@Slf4j
@Component
@RequiredArgsConstructor
public class AthleticSkillTransferMapper implements SkillTransferMapper {

    private final SkillMappingService skillMappingService;

    @Override
    public List<SkillTransfer> resolve(StudentProfile student, MatchEngineConfiguration configuration) {
        if (student.getMarketplaceType() != MarketplaceType.ATHLETIC
                || configuration == null || !configuration.isEnableAthleticTransfer()) {
            return List.of();
        }
        if (StringUtils.isBlank(student.getSport())) {
            log.debug("Athletic studentId={} has no sport on record, no skill transfer", student.getId());
            return List.of();
        }
        return lookup(student.getSport(), student.getPosition());
    }

    @Override
    public List<SkillTransfer> lookup(String sport, String position) {
        if (StringUtils.isBlank(sport)) {
            return List.of();
        }
        List<AthleticSkillMapping> rows = skillMappingService.findBySport(sport);
        String wantedPosition = StringUtils.trimToNull(position);

        Map<String, SkillTransfer> bySkill = new LinkedHashMap<>();
        // sport-wide rows first so that position rows overwrite them
        rows.stream()
                .filter(row -> StringUtils.isBlank(row.getPosition()))
                .forEach(row -> bySkill.put(BasicUtility.normalizeSkill(row.getProfessionalSkill()), toTransfer(row)));
        if (wantedPosition != null) {
            rows.stream()
                    .filter(row -> StringUtils.equalsIgnoreCase(StringUtils.trimToNull(row.getPosition()), wantedPosition))
                    .forEach(row -> bySkill.put(BasicUtility.normalizeSkill(row.getProfessionalSkill()), toTransfer(row)));
        }

        List<SkillTransfer> transfers = new ArrayList<>(bySkill.values());
        transfers.sort(Comparator.comparing(SkillTransfer::getProfessionalSkill));
        return transfers;
    }

    private static SkillTransfer toTransfer(AthleticSkillMapping row) {
        double strength = row.getTransferStrength() == null ? 0.0 : row.getTransferStrength().doubleValue();
        return SkillTransfer.builder()
                .professionalSkill(BasicUtility.normalizeSkill(row.getProfessionalSkill()))
                .transferStrength(Math.max(0.0, Math.min(strength, 1.0)))
                .skillCategory(row.getSkillCategory())
                .sport(row.getSportName())
                .position(row.getPosition())
                .build();
    }
}
