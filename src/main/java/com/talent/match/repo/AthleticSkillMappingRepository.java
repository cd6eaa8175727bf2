package com.talent.match.repo;

import com.talent.match.models.AthleticSkillMapping;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AthleticSkillMappingRepository extends JpaRepository<AthleticSkillMapping, UUID> {
    List<AthleticSkillMapping> findBySportNameIgnoreCase(String sportName);
    List<AthleticSkillMapping> findAllByOrderBySportNameAscPositionAscProfessionalSkillAsc();
}
